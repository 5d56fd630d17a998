package com.flagrank.service;

import com.flagrank.model.SubmissionOutcome;
import com.flagrank.repository.HintUnlockRepository;
import com.flagrank.repository.KothAccrualRepository;
import com.flagrank.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * From-scratch folds over committed scoring rows: solves, hint charges and KOTH accruals.
 */
@Component
@RequiredArgsConstructor
public class ScoreLedgerReader {

    private final SubmissionRepository submissionRepository;
    private final HintUnlockRepository hintUnlockRepository;
    private final KothAccrualRepository kothAccrualRepository;

    @Transactional(readOnly = true)
    public TeamTally foldTeam(UUID teamId) {
        List<TallyEntry> entries = new ArrayList<>();
        submissionRepository.findByTeamIdAndOutcome(teamId, SubmissionOutcome.CORRECT)
                .forEach(solve -> entries.add(TallyEntry.of(solve)));
        hintUnlockRepository.findByTeamId(teamId)
                .forEach(unlock -> entries.add(TallyEntry.of(unlock)));
        kothAccrualRepository.findByTeamId(teamId)
                .forEach(accrual -> entries.add(TallyEntry.of(accrual)));
        return TeamTally.of(teamId, entries);
    }

    /**
     * Folds every team. With a cutoff, only rows that occurred at or before it are included.
     */
    @Transactional(readOnly = true)
    public Map<UUID, TeamTally> foldAll(OffsetDateTime cutoff) {
        Map<UUID, List<TallyEntry>> entriesByTeam = new HashMap<>();
        (cutoff == null
                ? submissionRepository.findByOutcome(SubmissionOutcome.CORRECT)
                : submissionRepository.findByOutcomeAndSubmittedAtLessThanEqual(SubmissionOutcome.CORRECT, cutoff))
                .forEach(solve -> entriesByTeam.computeIfAbsent(solve.getTeamId(), id -> new ArrayList<>())
                        .add(TallyEntry.of(solve)));
        (cutoff == null ? hintUnlockRepository.findAll() : hintUnlockRepository.findByUnlockedAtLessThanEqual(cutoff))
                .forEach(unlock -> entriesByTeam.computeIfAbsent(unlock.getTeamId(), id -> new ArrayList<>())
                        .add(TallyEntry.of(unlock)));
        (cutoff == null ? kothAccrualRepository.findAll() : kothAccrualRepository.findByCreditedAtLessThanEqual(cutoff))
                .forEach(accrual -> entriesByTeam.computeIfAbsent(accrual.getTeamId(), id -> new ArrayList<>())
                        .add(TallyEntry.of(accrual)));

        Map<UUID, TeamTally> tallies = new HashMap<>();
        entriesByTeam.forEach((teamId, entries) -> tallies.put(teamId, TeamTally.of(teamId, entries)));
        return tallies;
    }
}
