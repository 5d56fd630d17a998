package com.flagrank.service;

import com.flagrank.model.Hint;
import com.flagrank.model.HintUnlock;
import com.flagrank.repository.HintUnlockRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class HintUnlockLedger {

    private final HintUnlockRepository hintUnlockRepository;
    private final ScoreEventPublisher scoreEventPublisher;

    /**
     * Inserts the unlock and charges the hint's current cost. Throws {@link LedgerConflictException}
     * when the team already holds the unlock.
     */
    @Transactional
    public HintUnlock recordUnlock(Hint hint, UUID teamId, String memberId, OffsetDateTime unlockedAt) {
        HintUnlock unlock = new HintUnlock();
        unlock.setUnlockId(UUID.randomUUID());
        unlock.setTeamId(teamId);
        unlock.setHintId(hint.getHintId());
        unlock.setChallengeId(hint.getChallengeId());
        unlock.setHintRank(hint.getHintRank());
        unlock.setCostCharged(hint.getCost());
        unlock.setMemberId(memberId);
        unlock.setUnlockedAt(unlockedAt);

        HintUnlock saved;
        try {
            saved = hintUnlockRepository.saveAndFlush(unlock);
        } catch (DataIntegrityViolationException ex) {
            throw new LedgerConflictException("Team " + teamId + " already unlocked hint " + hint.getHintId(), ex);
        }
        scoreEventPublisher.publish(ScoreEvent.hintUnlocked(saved));
        return saved;
    }
}
