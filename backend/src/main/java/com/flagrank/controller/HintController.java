package com.flagrank.controller;

import com.flagrank.dto.ScoringResponses;
import com.flagrank.model.Capability;
import com.flagrank.service.CapabilityGuard;
import com.flagrank.service.HintUnlockService;
import com.flagrank.web.CallerContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/hints")
public class HintController {

    private final HintUnlockService hintUnlockService;
    private final CapabilityGuard capabilityGuard;

    public HintController(HintUnlockService hintUnlockService, CapabilityGuard capabilityGuard) {
        this.hintUnlockService = hintUnlockService;
        this.capabilityGuard = capabilityGuard;
    }

    @PostMapping("/{hintId}/unlock")
    public ResponseEntity<ScoringResponses.HintUnlockResult> unlockHint(
            CallerContext caller,
            @PathVariable UUID hintId
    ) {
        UUID teamId = capabilityGuard.requireTeam(caller, Capability.UNLOCK_HINT);
        return ResponseEntity.ok(hintUnlockService.unlock(teamId, caller.memberId(), hintId));
    }
}
