package com.flagrank.service;

import com.flagrank.model.HintUnlock;
import com.flagrank.model.KothAccrual;
import com.flagrank.model.ScoreEntryKind;
import com.flagrank.model.Submission;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Score-changed notification published after a ledger row commits.
 */
public record ScoreEvent(
        UUID teamId,
        String entryKey,
        ScoreEntryKind kind,
        long delta,
        OffsetDateTime occurredAt
) {
    public ScoreEvent {
        Objects.requireNonNull(teamId, "teamId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(occurredAt, "occurredAt is required");
        if (entryKey == null || entryKey.isBlank()) {
            throw new IllegalArgumentException("entryKey is required");
        }
    }

    public static ScoreEvent solved(Submission solve) {
        return fromEntry(solve.getTeamId(), TallyEntry.of(solve));
    }

    public static ScoreEvent hintUnlocked(HintUnlock unlock) {
        return fromEntry(unlock.getTeamId(), TallyEntry.of(unlock));
    }

    public static ScoreEvent accrued(KothAccrual accrual) {
        return fromEntry(accrual.getTeamId(), TallyEntry.of(accrual));
    }

    public TallyEntry toTallyEntry() {
        return new TallyEntry(entryKey, kind, delta, occurredAt);
    }

    private static ScoreEvent fromEntry(UUID teamId, TallyEntry entry) {
        return new ScoreEvent(teamId, entry.key(), entry.kind(), entry.delta(), entry.occurredAt());
    }
}
