package com.flagrank.service;

import com.flagrank.model.HintUnlock;
import com.flagrank.model.KothAccrual;
import com.flagrank.model.ScoreEntryKind;
import com.flagrank.model.Submission;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * One scoring ledger row as seen by the aggregator. The key is derived from the row id, so the same row
 * always produces the same entry whether it arrives as an event or from a ledger read.
 */
public record TallyEntry(
        String key,
        ScoreEntryKind kind,
        long delta,
        OffsetDateTime occurredAt
) {
    public TallyEntry {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(occurredAt, "occurredAt is required");
    }

    public static TallyEntry of(Submission solve) {
        return new TallyEntry(
                solveKey(solve.getSubmissionId()),
                ScoreEntryKind.SOLVE,
                solve.getAwardedValue(),
                solve.getSubmittedAt()
        );
    }

    public static TallyEntry of(HintUnlock unlock) {
        return new TallyEntry(
                hintKey(unlock.getUnlockId()),
                ScoreEntryKind.HINT_UNLOCK,
                -unlock.getCostCharged(),
                unlock.getUnlockedAt()
        );
    }

    public static TallyEntry of(KothAccrual accrual) {
        return new TallyEntry(
                accrualKey(accrual.getAccrualId()),
                ScoreEntryKind.KOTH_ACCRUAL,
                accrual.getPoints(),
                accrual.getCreditedAt()
        );
    }

    static String solveKey(UUID submissionId) {
        return "solve:" + submissionId;
    }

    static String hintKey(UUID unlockId) {
        return "hint:" + unlockId;
    }

    static String accrualKey(UUID accrualId) {
        return "koth:" + accrualId;
    }

    public boolean isSolve() {
        return kind == ScoreEntryKind.SOLVE;
    }
}
