package com.flagrank.dto;

import com.flagrank.model.KothClaimStatus;
import com.flagrank.model.KothTargetStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class KothResponses {

    private KothResponses() {
    }

    public record ClaimResult(
            UUID targetId,
            KothClaimStatus status,
            UUID ownerTeamId,
            OffsetDateTime ownerSince,
            long pointsCreditedToPreviousOwner
    ) {
    }

    public record TargetState(
            UUID targetId,
            String name,
            UUID challengeId,
            KothTargetStatus status,
            UUID ownerTeamId,
            OffsetDateTime ownerSince,
            OffsetDateTime accruedUntil,
            int pointsPerPeriod,
            int accrualPeriodSeconds,
            OffsetDateTime closedAt
    ) {
    }
}
