package com.flagrank.service;

import com.flagrank.model.Capability;
import com.flagrank.repository.TeamRepository;
import com.flagrank.web.CallerContext;
import com.flagrank.web.CapabilityDeniedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Checks caller capabilities before any scoring operation runs.
 */
@Component
@RequiredArgsConstructor
public class CapabilityGuard {

    private final TeamRepository teamRepository;

    public boolean allows(CallerContext caller, Capability capability) {
        return caller != null && caller.role().allows(capability);
    }

    public void require(CallerContext caller, Capability capability) {
        if (!allows(caller, capability)) {
            throw CapabilityDeniedException.missingCapability(capability);
        }
    }

    /**
     * Requires the capability and a registered caller team, and returns that team id.
     */
    public UUID requireTeam(CallerContext caller, Capability capability) {
        require(caller, capability);
        UUID teamId = caller.teamId();
        if (teamId == null) {
            throw CapabilityDeniedException.teamRequired();
        }
        if (!teamRepository.existsById(teamId)) {
            throw CapabilityDeniedException.unknownTeam(teamId);
        }
        return teamId;
    }
}
