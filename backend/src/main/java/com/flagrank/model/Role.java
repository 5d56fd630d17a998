package com.flagrank.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum Role {
    PLAYER(EnumSet.of(
            Capability.SUBMIT_FLAG,
            Capability.UNLOCK_HINT,
            Capability.CLAIM_KOTH,
            Capability.VIEW_TEAM_SCORE,
            Capability.VIEW_SCOREBOARD
    )),
    JUDGE(EnumSet.of(
            Capability.VIEW_TEAM_SCORE,
            Capability.VIEW_SCOREBOARD,
            Capability.VIEW_LIVE_SCOREBOARD,
            Capability.RECONCILE_SCORES
    )),
    EDITOR(EnumSet.of(
            Capability.VIEW_TEAM_SCORE,
            Capability.VIEW_SCOREBOARD,
            Capability.VIEW_LIVE_SCOREBOARD
    )),
    SUPERADMIN(EnumSet.allOf(Capability.class));

    private final Set<Capability> capabilities;

    Role(EnumSet<Capability> capabilities) {
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public Set<Capability> capabilities() {
        return capabilities;
    }

    public boolean allows(Capability capability) {
        return capabilities.contains(capability);
    }
}
