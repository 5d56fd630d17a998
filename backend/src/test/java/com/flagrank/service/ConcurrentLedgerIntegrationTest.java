package com.flagrank.service;

import com.flagrank.dto.ScoringResponses;
import com.flagrank.model.Challenge;
import com.flagrank.model.Hint;
import com.flagrank.model.HintUnlockStatus;
import com.flagrank.model.SubmissionOutcome;
import com.flagrank.model.SubmissionStatus;
import com.flagrank.model.Team;
import com.flagrank.repository.ChallengeRepository;
import com.flagrank.repository.HintRepository;
import com.flagrank.repository.HintUnlockRepository;
import com.flagrank.repository.KothTargetRepository;
import com.flagrank.repository.SubmissionRepository;
import com.flagrank.repository.TeamRepository;
import com.flagrank.support.ScoringFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class ConcurrentLedgerIntegrationTest {

    private static final int CALLERS = 8;

    @Autowired
    private SubmissionService submissionService;

    @Autowired
    private HintUnlockService hintUnlockService;

    @Autowired
    private ScoreAggregator scoreAggregator;

    @Autowired
    private SubmissionRepository submissionRepository;

    @Autowired
    private HintUnlockRepository hintUnlockRepository;

    @Autowired
    private TeamRepository teamRepository;

    @Autowired
    private ChallengeRepository challengeRepository;

    @Autowired
    private HintRepository hintRepository;

    @Autowired
    private KothTargetRepository kothTargetRepository;

    private ScoringFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new ScoringFixtures(teamRepository, challengeRepository, hintRepository, kothTargetRepository);
    }

    @Test
    void concurrentCorrectSubmissionsScoreExactlyOnce() throws Exception {
        Team team = fixtures.team("race");
        Challenge challenge = fixtures.challenge("flag{race}", 250);

        List<ScoringResponses.SubmissionResult> results = runConcurrently(() ->
                submissionService.submit(team.getTeamId(), "racer", challenge.getChallengeId(), "flag{race}"));

        long accepted = results.stream().filter(result -> result.status() == SubmissionStatus.ACCEPTED).count();
        long alreadySolved = results.stream().filter(result -> result.status() == SubmissionStatus.ALREADY_SOLVED).count();
        assertEquals(1, accepted);
        assertEquals(CALLERS - 1, alreadySolved);
        assertEquals(1, submissionRepository.countByTeamIdAndChallengeIdAndOutcome(
                team.getTeamId(), challenge.getChallengeId(), SubmissionOutcome.CORRECT));
        assertEquals(250, scoreAggregator.scoreOf(team.getTeamId()));
    }

    @Test
    void concurrentHintUnlocksChargeExactlyOnce() throws Exception {
        Team team = fixtures.team("hinter");
        Challenge challenge = fixtures.challenge("flag{hint}", 100);
        Hint hint = fixtures.hintFor(challenge, 1, 30);

        List<ScoringResponses.HintUnlockResult> results = runConcurrently(() ->
                hintUnlockService.unlock(team.getTeamId(), "hinter", hint.getHintId()));

        long unlocked = results.stream().filter(result -> result.status() == HintUnlockStatus.UNLOCKED).count();
        assertEquals(1, unlocked);
        assertEquals(1, hintUnlockRepository.countByTeamIdAndHintId(team.getTeamId(), hint.getHintId()));
        assertEquals(-30, scoreAggregator.scoreOf(team.getTeamId()));
    }

    private static <T> List<T> runConcurrently(Callable<T> call) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(CALLERS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < CALLERS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return call.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
