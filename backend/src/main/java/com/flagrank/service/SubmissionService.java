package com.flagrank.service;

import com.flagrank.dto.ScoringResponses;
import com.flagrank.mapper.FlagrankResponseMapper;
import com.flagrank.model.Challenge;
import com.flagrank.model.Submission;
import com.flagrank.model.SubmissionOutcome;
import com.flagrank.model.SubmissionStatus;
import com.flagrank.repository.ChallengeRepository;
import com.flagrank.repository.SubmissionRepository;
import com.flagrank.web.ScoringValidationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Validates flag submissions and records them.
 * <p>
 * Not transactional itself: a correct attempt first tries to insert the team's solve in its own
 * transaction. If the solve key is already taken the insert rolls back and the attempt is written as
 * {@code ALREADY_SOLVED} in a second transaction.
 */
@Service
@RequiredArgsConstructor
public class SubmissionService {

    static final int MAX_SUBMISSION_LENGTH = 255;

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final ChallengeRepository challengeRepository;
    private final SubmissionRepository submissionRepository;
    private final SubmissionLedger submissionLedger;
    private final CompetitionService competitionService;
    private final ChallengeValuePolicy challengeValuePolicy;
    private final CompetitionClock competitionClock;
    private final FlagrankResponseMapper flagrankResponseMapper;

    public ScoringResponses.SubmissionResult submit(UUID teamId, String memberId, UUID challengeId, String flag) {
        if (flag == null || flag.isBlank()) {
            throw ScoringValidationException.invalidSubmission("Submitted flag must not be blank");
        }
        if (flag.length() > MAX_SUBMISSION_LENGTH) {
            throw ScoringValidationException.invalidSubmission(
                    "Submitted flag must be at most " + MAX_SUBMISSION_LENGTH + " characters"
            );
        }

        return LedgerCalls.guarded("Flag submission", () -> {
            competitionService.requireActive();
            Challenge challenge = challengeRepository.findById(challengeId)
                    .filter(Challenge::isOpenForPlay)
                    .orElseThrow(() -> ScoringValidationException.challengeUnavailable(
                            "Challenge is not open for submissions: " + challengeId
                    ));

            OffsetDateTime now = competitionClock.now();
            boolean correct = FlagMatcher.matches(flag, challenge.getFlag(), Boolean.TRUE.equals(challenge.getCaseSensitive()));
            if (!correct) {
                Submission attempt = submissionLedger.recordAttempt(
                        challengeId, teamId, memberId, flag, SubmissionOutcome.INCORRECT, now
                );
                return flagrankResponseMapper.toSubmissionResult(attempt, SubmissionStatus.INCORRECT);
            }

            if (submissionRepository.existsBySolveKey(Submission.solveKeyFor(teamId, challengeId))) {
                return recordAlreadySolved(challengeId, teamId, memberId, flag, now);
            }

            try {
                Submission solve = submissionLedger.recordSolve(challenge, teamId, memberId, flag, now);
                log.info(
                        "Team {} solved challenge {} for {} points",
                        teamId,
                        challengeId,
                        solve.getAwardedValue()
                );
                return flagrankResponseMapper.toSubmissionResult(solve, SubmissionStatus.ACCEPTED);
            } catch (LedgerConflictException ex) {
                log.debug("Concurrent solve lost the race: {}", ex.getMessage());
                return recordAlreadySolved(challengeId, teamId, memberId, flag, now);
            }
        });
    }

    public ScoringResponses.ChallengeStats challengeStats(UUID challengeId) {
        Challenge challenge = challengeRepository.findById(challengeId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Challenge not found: " + challengeId
                ));
        return LedgerCalls.guarded("Challenge stats", () -> {
            long solveCount = submissionRepository.countByChallengeIdAndOutcome(challengeId, SubmissionOutcome.CORRECT);
            long attemptCount = submissionRepository.countByChallengeId(challengeId);
            return new ScoringResponses.ChallengeStats(
                    challengeId,
                    solveCount,
                    attemptCount,
                    challengeValuePolicy.valueForNextSolve(challenge, solveCount)
            );
        });
    }

    private ScoringResponses.SubmissionResult recordAlreadySolved(
            UUID challengeId,
            UUID teamId,
            String memberId,
            String flag,
            OffsetDateTime now
    ) {
        Submission attempt = submissionLedger.recordAttempt(
                challengeId, teamId, memberId, flag, SubmissionOutcome.ALREADY_SOLVED, now
        );
        return flagrankResponseMapper.toSubmissionResult(attempt, SubmissionStatus.ALREADY_SOLVED);
    }
}
