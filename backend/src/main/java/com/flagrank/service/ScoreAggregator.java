package com.flagrank.service;

import com.flagrank.config.FlagrankRuntimeProperties;
import com.flagrank.model.Team;
import com.flagrank.repository.TeamRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Derives team scores from the scoring ledger.
 * <p>
 * Two views are kept: the committed score folded from ledger rows on demand, and a running tally fed by
 * score events. Reconciliation compares them; settled differences are logged and the running tally is
 * rebuilt from the committed rows. Entries younger than the leaderboard staleness bound count as in
 * flight.
 */
@Service
@RequiredArgsConstructor
public class ScoreAggregator implements ScoreEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(ScoreAggregator.class);

    private final ScoreLedgerReader scoreLedgerReader;
    private final TeamRepository teamRepository;
    private final ScoreEventQueue scoreEventQueue;
    private final CompetitionClock competitionClock;
    private final FlagrankRuntimeProperties flagrankRuntimeProperties;

    private final Map<UUID, TeamTally> tallies = new ConcurrentHashMap<>();
    private final List<Runnable> standingsListeners = new CopyOnWriteArrayList<>();
    private final Object warmUpMonitor = new Object();
    private volatile boolean warmedUp;

    @PostConstruct
    void registerQueueConsumer() {
        scoreEventQueue.setConsumer(this);
    }

    public void addStandingsListener(Runnable listener) {
        standingsListeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    /**
     * Applies a score event to the running tally. Returns false when the entry was already applied.
     */
    public boolean apply(ScoreEvent event) {
        return applyEvents(event.teamId(), List.of(event)) > 0;
    }

    @Override
    public void applyTeamEvents(UUID teamId, List<ScoreEvent> events) {
        applyEvents(teamId, events);
    }

    @Override
    public void resync(UUID teamId) {
        if (teamId == null) {
            ReconciliationReport report = reconcileAll();
            log.info("Resynced score tallies of {} teams ({} mismatches)", report.teamsChecked(), report.mismatches());
            return;
        }
        recompute(teamId);
        log.info("Resynced score tally of team {} from the ledger", teamId);
        notifyStandingsListeners();
    }

    private int applyEvents(UUID teamId, List<ScoreEvent> events) {
        AtomicInteger applied = new AtomicInteger();
        tallies.compute(teamId, (id, current) -> {
            TeamTally tally = current != null ? current : TeamTally.empty(id);
            for (ScoreEvent event : events) {
                if (!id.equals(event.teamId())) {
                    throw new IllegalArgumentException("Score event " + event.entryKey() + " belongs to team " + event.teamId());
                }
                TeamTally next = tally.apply(event.toTallyEntry());
                if (next == tally) {
                    log.debug("Ignoring already applied score entry {}", event.entryKey());
                } else {
                    applied.incrementAndGet();
                }
                tally = next;
            }
            return tally;
        });
        if (applied.get() > 0) {
            notifyStandingsListeners();
        }
        return applied.get();
    }

    public TeamTally committedTally(UUID teamId) {
        return scoreLedgerReader.foldTeam(teamId);
    }

    public TeamTally teamScore(UUID teamId) {
        if (!teamRepository.existsById(teamId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Team not found: " + teamId);
        }
        return committedTally(teamId);
    }

    public long scoreOf(UUID teamId) {
        return committedTally(teamId).score();
    }

    public long runningScoreOf(UUID teamId) {
        ensureWarm();
        TeamTally tally = tallies.get(teamId);
        return tally != null ? tally.score() : 0L;
    }

    /**
     * Rebuilds the team's running tally from committed rows, keeping entries that are still in flight.
     */
    public TeamTally recompute(UUID teamId) {
        TeamTally committed = scoreLedgerReader.foldTeam(teamId);
        OffsetDateTime settledBefore = settledBefore();
        return tallies.compute(teamId, (id, current) ->
                (current != null ? current : TeamTally.empty(id)).mergedWith(committed, settledBefore));
    }

    /**
     * Returns true when the running tally agreed with the committed rows.
     */
    public boolean reconcile(UUID teamId) {
        ensureWarm();
        boolean matched = settle(scoreLedgerReader.foldTeam(teamId));
        if (!matched) {
            notifyStandingsListeners();
        }
        return matched;
    }

    public ReconciliationReport reconcileAll() {
        ensureWarm();
        Map<UUID, TeamTally> committed = scoreLedgerReader.foldAll(null);
        Set<UUID> teamIds = new HashSet<>(committed.keySet());
        teamIds.addAll(tallies.keySet());

        int mismatches = 0;
        for (UUID teamId : teamIds) {
            TeamTally committedTally = committed.getOrDefault(teamId, TeamTally.empty(teamId));
            if (!settle(committedTally)) {
                mismatches++;
            }
        }
        if (mismatches > 0) {
            notifyStandingsListeners();
        }
        return new ReconciliationReport(teamIds.size(), mismatches, competitionClock.now());
    }

    public List<TeamStanding> standings() {
        ensureWarm();
        List<TeamStanding> standings = new ArrayList<>();
        for (Team team : teamRepository.findAll()) {
            TeamTally tally = tallies.get(team.getTeamId());
            standings.add(toStanding(team, tally));
        }
        return standings;
    }

    /**
     * Standings folded from rows that occurred at or before the cutoff.
     */
    public List<TeamStanding> standingsAsOf(OffsetDateTime cutoff) {
        Map<UUID, TeamTally> committed = scoreLedgerReader.foldAll(Objects.requireNonNull(cutoff, "cutoff is required"));
        List<TeamStanding> standings = new ArrayList<>();
        for (Team team : teamRepository.findAll()) {
            standings.add(toStanding(team, committed.get(team.getTeamId())));
        }
        return standings;
    }

    private boolean settle(TeamTally committed) {
        OffsetDateTime settledBefore = settledBefore();
        AtomicReference<ReconciliationMismatchException> mismatch = new AtomicReference<>();
        tallies.compute(committed.teamId(), (teamId, current) -> {
            TeamTally running = current != null ? current : TeamTally.empty(teamId);
            try {
                running.verifyAgainst(committed, settledBefore);
            } catch (ReconciliationMismatchException ex) {
                mismatch.set(ex);
            }
            return running.mergedWith(committed, settledBefore);
        });
        if (mismatch.get() == null) {
            return true;
        }
        ReconciliationMismatchException ex = mismatch.get();
        log.error(
                "Score reconciliation mismatch for team {}: running={}, committed={}; tally rebuilt from ledger ({})",
                ex.getTeamId(),
                ex.getRunningScore(),
                ex.getCommittedScore(),
                String.join(", ", ex.getDiscrepancies())
        );
        return false;
    }

    private void ensureWarm() {
        if (warmedUp) {
            return;
        }
        synchronized (warmUpMonitor) {
            if (warmedUp) {
                return;
            }
            // Startup load: nothing to verify against yet.
            Map<UUID, TeamTally> committed = scoreLedgerReader.foldAll(null);
            OffsetDateTime settledBefore = settledBefore();
            committed.forEach((teamId, committedTally) -> tallies.compute(teamId, (id, current) ->
                    (current != null ? current : TeamTally.empty(id)).mergedWith(committedTally, settledBefore)));
            warmedUp = true;
            log.info("Score tallies loaded for {} teams", committed.size());
        }
    }

    private OffsetDateTime settledBefore() {
        long graceMs = flagrankRuntimeProperties.getLeaderboard().getStalenessBoundMs();
        return competitionClock.now().minus(Duration.ofMillis(graceMs));
    }

    private void notifyStandingsListeners() {
        for (Runnable listener : standingsListeners) {
            try {
                listener.run();
            } catch (RuntimeException ex) {
                log.warn("Standings listener failed", ex);
            }
        }
    }

    private static TeamStanding toStanding(Team team, TeamTally tally) {
        return new TeamStanding(
                team.getTeamId(),
                team.getName(),
                tally != null ? tally.score() : 0L,
                tally != null ? tally.lastSolveAt() : null
        );
    }

    public record ReconciliationReport(
            int teamsChecked,
            int mismatches,
            OffsetDateTime reconciledAt
    ) {
    }
}
