package com.flagrank.dto;

import com.flagrank.model.CompetitionPhase;

import java.time.OffsetDateTime;

public record CompetitionResponse(
        String name,
        CompetitionPhase phase,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        OffsetDateTime freezeTime,
        OffsetDateTime closedAt,
        boolean frozen
) {
}
