package com.flagrank.service;

import com.flagrank.dto.ScoringResponses;
import com.flagrank.mapper.FlagrankResponseMapper;
import com.flagrank.model.Challenge;
import com.flagrank.model.Hint;
import com.flagrank.model.HintUnlock;
import com.flagrank.model.HintUnlockStatus;
import com.flagrank.repository.ChallengeRepository;
import com.flagrank.repository.HintRepository;
import com.flagrank.repository.HintUnlockRepository;
import com.flagrank.support.ScoringFixtures;
import com.flagrank.web.ScoringValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HintUnlockServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 14, 12, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private HintRepository hintRepository;

    @Mock
    private HintUnlockRepository hintUnlockRepository;

    @Mock
    private ChallengeRepository challengeRepository;

    @Mock
    private HintUnlockLedger hintUnlockLedger;

    @Mock
    private CompetitionService competitionService;

    @Mock
    private CompetitionClock competitionClock;

    @Spy
    private FlagrankResponseMapper flagrankResponseMapper = new FlagrankResponseMapper();

    @InjectMocks
    private HintUnlockService hintUnlockService;

    private final UUID teamId = UUID.randomUUID();
    private Challenge challenge;
    private Hint firstHint;
    private Hint secondHint;

    @BeforeEach
    void setUp() {
        challenge = ScoringFixtures.staticChallenge("flag{h}", 100);
        firstHint = ScoringFixtures.hint(challenge.getChallengeId(), 1, 20);
        secondHint = ScoringFixtures.hint(challenge.getChallengeId(), 2, 30);
    }

    @Test
    void firstRankHintUnlocksAndChargesItsCost() {
        when(hintRepository.findById(firstHint.getHintId())).thenReturn(Optional.of(firstHint));
        when(challengeRepository.findById(challenge.getChallengeId())).thenReturn(Optional.of(challenge));
        when(hintUnlockRepository.existsByTeamIdAndHintId(teamId, firstHint.getHintId())).thenReturn(false);
        when(hintRepository.findByChallengeIdAndHintRankLessThanOrderByHintRankAsc(challenge.getChallengeId(), 1))
                .thenReturn(List.of());
        when(competitionClock.now()).thenReturn(NOW);
        when(hintUnlockLedger.recordUnlock(firstHint, teamId, "alice", NOW)).thenReturn(unlockOf(firstHint));

        ScoringResponses.HintUnlockResult result = hintUnlockService.unlock(teamId, "alice", firstHint.getHintId());

        assertEquals(HintUnlockStatus.UNLOCKED, result.status());
        assertEquals(20, result.cost());
        assertEquals("hint 1", result.body());
    }

    @Test
    void secondRankBeforeFirstIsOutOfOrderAndWritesNothing() {
        when(hintRepository.findById(secondHint.getHintId())).thenReturn(Optional.of(secondHint));
        when(challengeRepository.findById(challenge.getChallengeId())).thenReturn(Optional.of(challenge));
        when(hintUnlockRepository.existsByTeamIdAndHintId(teamId, secondHint.getHintId())).thenReturn(false);
        when(hintRepository.findByChallengeIdAndHintRankLessThanOrderByHintRankAsc(challenge.getChallengeId(), 2))
                .thenReturn(List.of(firstHint));
        when(hintUnlockRepository.countByTeamIdAndHintIdIn(teamId, List.of(firstHint.getHintId()))).thenReturn(0L);

        ScoringResponses.HintUnlockResult result = hintUnlockService.unlock(teamId, "alice", secondHint.getHintId());

        assertEquals(HintUnlockStatus.OUT_OF_ORDER, result.status());
        assertEquals(0, result.cost());
        assertNull(result.body());
        verify(hintUnlockLedger, never()).recordUnlock(any(), any(), any(), any());
    }

    @Test
    void secondRankAfterFirstUnlocks() {
        when(hintRepository.findById(secondHint.getHintId())).thenReturn(Optional.of(secondHint));
        when(challengeRepository.findById(challenge.getChallengeId())).thenReturn(Optional.of(challenge));
        when(hintUnlockRepository.existsByTeamIdAndHintId(teamId, secondHint.getHintId())).thenReturn(false);
        when(hintRepository.findByChallengeIdAndHintRankLessThanOrderByHintRankAsc(challenge.getChallengeId(), 2))
                .thenReturn(List.of(firstHint));
        when(hintUnlockRepository.countByTeamIdAndHintIdIn(teamId, List.of(firstHint.getHintId()))).thenReturn(1L);
        when(competitionClock.now()).thenReturn(NOW);
        when(hintUnlockLedger.recordUnlock(eq(secondHint), eq(teamId), any(), eq(NOW))).thenReturn(unlockOf(secondHint));

        ScoringResponses.HintUnlockResult result = hintUnlockService.unlock(teamId, null, secondHint.getHintId());

        assertEquals(HintUnlockStatus.UNLOCKED, result.status());
        assertEquals(30, result.cost());
    }

    @Test
    void repeatedUnlockIsNotChargedAgain() {
        when(hintRepository.findById(firstHint.getHintId())).thenReturn(Optional.of(firstHint));
        when(challengeRepository.findById(challenge.getChallengeId())).thenReturn(Optional.of(challenge));
        when(hintUnlockRepository.existsByTeamIdAndHintId(teamId, firstHint.getHintId())).thenReturn(true);

        ScoringResponses.HintUnlockResult result = hintUnlockService.unlock(teamId, "alice", firstHint.getHintId());

        assertEquals(HintUnlockStatus.ALREADY_UNLOCKED, result.status());
        assertEquals(0, result.cost());
        verify(hintUnlockLedger, never()).recordUnlock(any(), any(), any(), any());
    }

    @Test
    void losingTheUnlockRaceReportsAlreadyUnlocked() {
        when(hintRepository.findById(firstHint.getHintId())).thenReturn(Optional.of(firstHint));
        when(challengeRepository.findById(challenge.getChallengeId())).thenReturn(Optional.of(challenge));
        when(hintUnlockRepository.existsByTeamIdAndHintId(teamId, firstHint.getHintId())).thenReturn(false);
        when(hintRepository.findByChallengeIdAndHintRankLessThanOrderByHintRankAsc(challenge.getChallengeId(), 1))
                .thenReturn(List.of());
        when(competitionClock.now()).thenReturn(NOW);
        when(hintUnlockLedger.recordUnlock(any(), any(), any(), any()))
                .thenThrow(new LedgerConflictException("duplicate unlock", null));

        ScoringResponses.HintUnlockResult result = hintUnlockService.unlock(teamId, "alice", firstHint.getHintId());

        assertEquals(HintUnlockStatus.ALREADY_UNLOCKED, result.status());
        assertEquals(0, result.cost());
    }

    @Test
    void hintOfHiddenChallengeIsRejected() {
        challenge.setVisible(false);
        when(hintRepository.findById(firstHint.getHintId())).thenReturn(Optional.of(firstHint));
        when(challengeRepository.findById(challenge.getChallengeId())).thenReturn(Optional.of(challenge));

        ScoringValidationException ex = assertThrows(
                ScoringValidationException.class,
                () -> hintUnlockService.unlock(teamId, "alice", firstHint.getHintId())
        );

        assertEquals("hint_unavailable", ex.getCode());
    }

    private HintUnlock unlockOf(Hint hint) {
        HintUnlock unlock = new HintUnlock();
        unlock.setUnlockId(UUID.randomUUID());
        unlock.setTeamId(teamId);
        unlock.setHintId(hint.getHintId());
        unlock.setChallengeId(hint.getChallengeId());
        unlock.setHintRank(hint.getHintRank());
        unlock.setCostCharged(hint.getCost());
        unlock.setUnlockedAt(NOW);
        return unlock;
    }
}
