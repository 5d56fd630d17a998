package com.flagrank.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class ScoreboardResponses {

    private ScoreboardResponses() {
    }

    public record Scoreboard(
            List<ScoreboardEntry> entries,
            OffsetDateTime generatedAt,
            boolean frozen,
            OffsetDateTime frozenAt
    ) {
    }

    public record ScoreboardEntry(
            int rank,
            UUID teamId,
            String teamName,
            long score,
            OffsetDateTime lastSolveAt
    ) {
    }

    public record TeamScore(
            UUID teamId,
            long score,
            OffsetDateTime lastSolveAt
    ) {
    }

    public record ReconciliationSummary(
            int teamsChecked,
            int mismatches,
            OffsetDateTime reconciledAt
    ) {
    }
}
