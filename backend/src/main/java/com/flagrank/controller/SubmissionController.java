package com.flagrank.controller;

import com.flagrank.dto.ScoringRequests;
import com.flagrank.dto.ScoringResponses;
import com.flagrank.model.Capability;
import com.flagrank.service.CapabilityGuard;
import com.flagrank.service.SubmissionService;
import com.flagrank.web.CallerContext;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/challenges")
public class SubmissionController {

    private final SubmissionService submissionService;
    private final CapabilityGuard capabilityGuard;

    public SubmissionController(SubmissionService submissionService, CapabilityGuard capabilityGuard) {
        this.submissionService = submissionService;
        this.capabilityGuard = capabilityGuard;
    }

    @PostMapping("/{challengeId}/submissions")
    public ResponseEntity<ScoringResponses.SubmissionResult> submitFlag(
            CallerContext caller,
            @PathVariable UUID challengeId,
            @Valid @RequestBody ScoringRequests.SubmitFlagRequest request
    ) {
        UUID teamId = capabilityGuard.requireTeam(caller, Capability.SUBMIT_FLAG);
        return ResponseEntity.ok(submissionService.submit(teamId, caller.memberId(), challengeId, request.flag()));
    }

    @GetMapping("/{challengeId}/stats")
    public ResponseEntity<ScoringResponses.ChallengeStats> challengeStats(
            CallerContext caller,
            @PathVariable UUID challengeId
    ) {
        capabilityGuard.require(caller, Capability.VIEW_SCOREBOARD);
        return ResponseEntity.ok(submissionService.challengeStats(challengeId));
    }
}
