package com.flagrank.controller;

import com.flagrank.dto.KothResponses;
import com.flagrank.dto.ScoringRequests;
import com.flagrank.model.Capability;
import com.flagrank.service.CapabilityGuard;
import com.flagrank.service.KothArbiterService;
import com.flagrank.web.CallerContext;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api")
@ConditionalOnProperty(prefix = "flagrank.koth", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KothController {

    private final KothArbiterService kothArbiterService;
    private final CapabilityGuard capabilityGuard;

    public KothController(KothArbiterService kothArbiterService, CapabilityGuard capabilityGuard) {
        this.kothArbiterService = kothArbiterService;
        this.capabilityGuard = capabilityGuard;
    }

    @PostMapping("/koth/targets/{targetId}/claim")
    public ResponseEntity<KothResponses.ClaimResult> claimTarget(
            CallerContext caller,
            @PathVariable UUID targetId,
            @Valid @RequestBody ScoringRequests.ClaimTargetRequest request
    ) {
        UUID teamId = capabilityGuard.requireTeam(caller, Capability.CLAIM_KOTH);
        return ResponseEntity.ok(kothArbiterService.claim(teamId, caller.memberId(), targetId, request.proof()));
    }

    @GetMapping("/koth/targets/{targetId}")
    public ResponseEntity<KothResponses.TargetState> getTarget(
            CallerContext caller,
            @PathVariable UUID targetId
    ) {
        capabilityGuard.require(caller, Capability.VIEW_SCOREBOARD);
        return ResponseEntity.ok(kothArbiterService.targetState(targetId));
    }

    @PutMapping("/admin/koth/targets/{targetId}/capture-token")
    public ResponseEntity<KothResponses.TargetState> rotateCaptureToken(
            CallerContext caller,
            @PathVariable UUID targetId,
            @Valid @RequestBody ScoringRequests.RotateCaptureTokenRequest request
    ) {
        capabilityGuard.require(caller, Capability.MANAGE_COMPETITION);
        return ResponseEntity.ok(kothArbiterService.rotateCaptureToken(targetId, request.captureToken()));
    }
}
