package com.flagrank.service;

import java.time.OffsetDateTime;
import java.util.List;

public record LeaderboardSnapshot(
        List<RankedTeam> entries,
        OffsetDateTime generatedAt,
        long builtAtNanos,
        boolean frozen,
        OffsetDateTime frozenAt
) {
    public LeaderboardSnapshot {
        entries = List.copyOf(entries);
    }

    public long ageMillis() {
        return (System.nanoTime() - builtAtNanos) / 1_000_000L;
    }
}
