package com.flagrank.service;

import java.time.OffsetDateTime;
import java.util.UUID;

public record TeamStanding(
        UUID teamId,
        String teamName,
        long score,
        OffsetDateTime lastSolveAt
) {
}
