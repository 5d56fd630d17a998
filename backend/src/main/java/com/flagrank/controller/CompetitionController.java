package com.flagrank.controller;

import com.flagrank.dto.CompetitionRequests;
import com.flagrank.dto.CompetitionResponse;
import com.flagrank.mapper.FlagrankResponseMapper;
import com.flagrank.model.Capability;
import com.flagrank.model.CompetitionSettings;
import com.flagrank.service.CapabilityGuard;
import com.flagrank.service.CompetitionClock;
import com.flagrank.service.CompetitionService;
import com.flagrank.web.CallerContext;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class CompetitionController {

    private final CompetitionService competitionService;
    private final CompetitionClock competitionClock;
    private final CapabilityGuard capabilityGuard;
    private final FlagrankResponseMapper flagrankResponseMapper;

    public CompetitionController(
            CompetitionService competitionService,
            CompetitionClock competitionClock,
            CapabilityGuard capabilityGuard,
            FlagrankResponseMapper flagrankResponseMapper
    ) {
        this.competitionService = competitionService;
        this.competitionClock = competitionClock;
        this.capabilityGuard = capabilityGuard;
        this.flagrankResponseMapper = flagrankResponseMapper;
    }

    @GetMapping("/competition")
    public ResponseEntity<CompetitionResponse> getCompetition() {
        return ResponseEntity.ok(toResponse(competitionService.settings()));
    }

    @PutMapping("/admin/competition")
    public ResponseEntity<CompetitionResponse> updateWindow(
            CallerContext caller,
            @Valid @RequestBody CompetitionRequests.UpdateWindowRequest request
    ) {
        capabilityGuard.require(caller, Capability.MANAGE_COMPETITION);
        CompetitionSettings settings = competitionService.updateWindow(
                request.startTime(),
                request.endTime(),
                request.freezeTime()
        );
        return ResponseEntity.ok(toResponse(settings));
    }

    @PostMapping("/admin/competition/close")
    public ResponseEntity<CompetitionResponse> closeCompetition(CallerContext caller) {
        capabilityGuard.require(caller, Capability.CLOSE_COMPETITION);
        return ResponseEntity.ok(toResponse(competitionService.close()));
    }

    private CompetitionResponse toResponse(CompetitionSettings settings) {
        return flagrankResponseMapper.toCompetitionResponse(settings, competitionClock.now());
    }
}
