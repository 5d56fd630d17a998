package com.flagrank.service;

import com.flagrank.model.Challenge;
import com.flagrank.model.Submission;
import com.flagrank.model.SubmissionOutcome;
import com.flagrank.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Transactional writes of submission rows. Each method is one ledger transaction.
 */
@Service
@RequiredArgsConstructor
public class SubmissionLedger {

    private final SubmissionRepository submissionRepository;
    private final ChallengeValuePolicy challengeValuePolicy;
    private final ScoreEventPublisher scoreEventPublisher;

    /**
     * Inserts the team's solve for the challenge. Throws {@link LedgerConflictException} when another
     * request already holds the solve key; the transaction then rolls back.
     */
    @Transactional
    public Submission recordSolve(
            Challenge challenge,
            UUID teamId,
            String memberId,
            String submittedText,
            OffsetDateTime submittedAt
    ) {
        long priorSolves = submissionRepository.countByChallengeIdAndOutcome(
                challenge.getChallengeId(),
                SubmissionOutcome.CORRECT
        );
        Submission solve = newSubmission(challenge.getChallengeId(), teamId, memberId, submittedText, submittedAt);
        solve.setOutcome(SubmissionOutcome.CORRECT);
        solve.setAwardedValue(challengeValuePolicy.valueForNextSolve(challenge, priorSolves));
        solve.setSolveKey(Submission.solveKeyFor(teamId, challenge.getChallengeId()));

        Submission saved;
        try {
            saved = submissionRepository.saveAndFlush(solve);
        } catch (DataIntegrityViolationException ex) {
            throw new LedgerConflictException(
                    "Team " + teamId + " already solved challenge " + challenge.getChallengeId(),
                    ex
            );
        }
        scoreEventPublisher.publish(ScoreEvent.solved(saved));
        return saved;
    }

    @Transactional
    public Submission recordAttempt(
            UUID challengeId,
            UUID teamId,
            String memberId,
            String submittedText,
            SubmissionOutcome outcome,
            OffsetDateTime submittedAt
    ) {
        if (outcome == SubmissionOutcome.CORRECT) {
            throw new IllegalArgumentException("Correct submissions must go through recordSolve");
        }
        Submission attempt = newSubmission(challengeId, teamId, memberId, submittedText, submittedAt);
        attempt.setOutcome(outcome);
        return submissionRepository.save(attempt);
    }

    private static Submission newSubmission(
            UUID challengeId,
            UUID teamId,
            String memberId,
            String submittedText,
            OffsetDateTime submittedAt
    ) {
        Submission submission = new Submission();
        submission.setSubmissionId(UUID.randomUUID());
        submission.setChallengeId(challengeId);
        submission.setTeamId(teamId);
        submission.setMemberId(memberId);
        submission.setSubmittedText(submittedText);
        submission.setSubmittedAt(submittedAt);
        return submission;
    }
}
