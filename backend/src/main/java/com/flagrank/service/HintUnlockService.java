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
import com.flagrank.web.ScoringValidationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class HintUnlockService {

    private static final Logger log = LoggerFactory.getLogger(HintUnlockService.class);

    private final HintRepository hintRepository;
    private final HintUnlockRepository hintUnlockRepository;
    private final ChallengeRepository challengeRepository;
    private final HintUnlockLedger hintUnlockLedger;
    private final CompetitionService competitionService;
    private final CompetitionClock competitionClock;
    private final FlagrankResponseMapper flagrankResponseMapper;

    public ScoringResponses.HintUnlockResult unlock(UUID teamId, String memberId, UUID hintId) {
        return LedgerCalls.guarded("Hint unlock", () -> {
            competitionService.requireActive();
            Hint hint = hintRepository.findById(hintId)
                    .orElseThrow(() -> ScoringValidationException.hintUnavailable("Hint not found: " + hintId));
            boolean challengeOpen = challengeRepository.findById(hint.getChallengeId())
                    .map(Challenge::isOpenForPlay)
                    .orElse(false);
            if (!challengeOpen) {
                throw ScoringValidationException.hintUnavailable("Hint belongs to a challenge that is not open: " + hintId);
            }

            if (hintUnlockRepository.existsByTeamIdAndHintId(teamId, hintId)) {
                return flagrankResponseMapper.toHintUnlockResult(hint, teamId, HintUnlockStatus.ALREADY_UNLOCKED, 0);
            }
            if (!lowerRanksUnlocked(teamId, hint)) {
                return flagrankResponseMapper.toHintUnlockResult(hint, teamId, HintUnlockStatus.OUT_OF_ORDER, 0);
            }

            try {
                HintUnlock unlock = hintUnlockLedger.recordUnlock(hint, teamId, memberId, competitionClock.now());
                log.info("Team {} unlocked hint {} (rank {}) for {} points", teamId, hintId, hint.getHintRank(), unlock.getCostCharged());
                return flagrankResponseMapper.toHintUnlockResult(
                        hint, teamId, HintUnlockStatus.UNLOCKED, unlock.getCostCharged()
                );
            } catch (LedgerConflictException ex) {
                log.debug("Concurrent hint unlock lost the race: {}", ex.getMessage());
                return flagrankResponseMapper.toHintUnlockResult(hint, teamId, HintUnlockStatus.ALREADY_UNLOCKED, 0);
            }
        });
    }

    private boolean lowerRanksUnlocked(UUID teamId, Hint hint) {
        List<UUID> lowerHintIds = hintRepository
                .findByChallengeIdAndHintRankLessThanOrderByHintRankAsc(hint.getChallengeId(), hint.getHintRank())
                .stream()
                .map(Hint::getHintId)
                .toList();
        if (lowerHintIds.isEmpty()) {
            return true;
        }
        return hintUnlockRepository.countByTeamIdAndHintIdIn(teamId, lowerHintIds) == lowerHintIds.size();
    }
}
