package com.flagrank.service;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RankedTeam(
        int rank,
        UUID teamId,
        String teamName,
        long score,
        OffsetDateTime lastSolveAt
) {
}
