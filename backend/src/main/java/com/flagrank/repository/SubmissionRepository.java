package com.flagrank.repository;

import com.flagrank.model.Submission;
import com.flagrank.model.SubmissionOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface SubmissionRepository extends JpaRepository<Submission, UUID> {
    boolean existsBySolveKey(String solveKey);

    long countByChallengeId(UUID challengeId);

    long countByChallengeIdAndOutcome(UUID challengeId, SubmissionOutcome outcome);

    long countByTeamIdAndChallengeIdAndOutcome(UUID teamId, UUID challengeId, SubmissionOutcome outcome);

    List<Submission> findByTeamIdAndOutcome(UUID teamId, SubmissionOutcome outcome);

    List<Submission> findByOutcome(SubmissionOutcome outcome);

    List<Submission> findByOutcomeAndSubmittedAtLessThanEqual(SubmissionOutcome outcome, OffsetDateTime cutoff);

    List<Submission> findByTeamIdAndChallengeIdOrderBySubmittedAtAsc(UUID teamId, UUID challengeId);
}
