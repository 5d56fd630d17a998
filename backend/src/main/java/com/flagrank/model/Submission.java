package com.flagrank.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only record of one flag attempt.
 * <p>
 * {@code solveKey} is set only on the first correct attempt of a team for a challenge and is
 * unique in the table, so the database decides which of two concurrent correct attempts wins.
 */
@Getter
@Setter
@Entity
@Table(name = "submissions")
public class Submission {

    @Id
    @Column(name = "submission_id", nullable = false, updatable = false)
    private UUID submissionId;

    @Column(name = "team_id", nullable = false, updatable = false)
    private UUID teamId;

    @Column(name = "challenge_id", nullable = false, updatable = false)
    private UUID challengeId;

    @Column(name = "member_id", length = 150, updatable = false)
    private String memberId;

    @Column(name = "submitted_text", nullable = false, length = 255, updatable = false)
    private String submittedText;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16, updatable = false)
    private SubmissionOutcome outcome;

    @Column(name = "awarded_value", updatable = false)
    private Integer awardedValue;

    @Column(name = "solve_key", length = 80, updatable = false)
    private String solveKey;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private OffsetDateTime submittedAt;

    public static String solveKeyFor(UUID teamId, UUID challengeId) {
        return teamId + ":" + challengeId;
    }
}
