package com.flagrank.dto;

import com.flagrank.model.HintUnlockStatus;
import com.flagrank.model.SubmissionStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class ScoringResponses {

    private ScoringResponses() {
    }

    public record SubmissionResult(
            UUID submissionId,
            UUID challengeId,
            UUID teamId,
            SubmissionStatus status,
            Integer awardedValue,
            OffsetDateTime submittedAt
    ) {
    }

    public record HintUnlockResult(
            UUID hintId,
            UUID challengeId,
            UUID teamId,
            Integer hintRank,
            HintUnlockStatus status,
            int cost,
            String body
    ) {
    }

    public record ChallengeStats(
            UUID challengeId,
            long solveCount,
            long attemptCount,
            int nextSolveValue
    ) {
    }
}
