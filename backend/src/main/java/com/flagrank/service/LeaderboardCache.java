package com.flagrank.service;

import com.flagrank.config.FlagrankRuntimeProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ranked leaderboard snapshots.
 * <p>
 * Rebuilt after score changes (debounced) and on a fixed-rate timer that reconciles first. A read never
 * returns a live snapshot older than the staleness bound. After the freeze time, readers without live
 * access get standings folded as of the freeze instant.
 */
@Service
@RequiredArgsConstructor
public class LeaderboardCache {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardCache.class);

    private final ScoreAggregator scoreAggregator;
    private final CompetitionService competitionService;
    private final CompetitionClock competitionClock;
    private final FlagrankRuntimeProperties flagrankRuntimeProperties;

    private final AtomicReference<LeaderboardSnapshot> liveSnapshot = new AtomicReference<>();
    private final AtomicReference<LeaderboardSnapshot> frozenSnapshot = new AtomicReference<>();
    private final AtomicBoolean dirty = new AtomicBoolean();
    private final Object rebuildMonitor = new Object();

    @PostConstruct
    void registerWithAggregator() {
        FlagrankRuntimeProperties.Leaderboard leaderboard = flagrankRuntimeProperties.getLeaderboard();
        if (leaderboard.getStalenessBoundMs() <= 0) {
            throw new IllegalStateException("flagrank.leaderboard.staleness-bound-ms must be greater than zero");
        }
        if (leaderboard.getRefreshIntervalMs() <= 0
                || leaderboard.getRefreshIntervalMs() >= leaderboard.getStalenessBoundMs()) {
            throw new IllegalStateException(
                    "flagrank.leaderboard.refresh-interval-ms must be greater than zero and below staleness-bound-ms"
            );
        }
        scoreAggregator.addStandingsListener(this::markDirty);
    }

    /**
     * @param liveView whether the caller may see standings past the freeze time
     */
    public LeaderboardSnapshot rankedTeams(boolean liveView) {
        if (!liveView) {
            OffsetDateTime freezeTime = competitionService.freezeTimeIfFrozen();
            if (freezeTime != null) {
                return frozenAt(freezeTime);
            }
        }
        LeaderboardSnapshot snapshot = liveSnapshot.get();
        if (snapshot != null && snapshot.ageMillis() <= stalenessBoundMs()) {
            return snapshot;
        }
        synchronized (rebuildMonitor) {
            snapshot = liveSnapshot.get();
            if (snapshot != null && snapshot.ageMillis() <= stalenessBoundMs()) {
                return snapshot;
            }
            log.debug("Leaderboard snapshot is stale; rebuilding on read");
            scoreAggregator.reconcileAll();
            return rebuild();
        }
    }

    public void markDirty() {
        dirty.set(true);
    }

    @Scheduled(fixedDelayString = "${flagrank.leaderboard.debounce-ms:250}")
    public void flushPendingChanges() {
        if (dirty.getAndSet(false)) {
            synchronized (rebuildMonitor) {
                rebuild();
            }
        }
    }

    @Scheduled(
            fixedRateString = "${flagrank.leaderboard.refresh-interval-ms:2000}",
            initialDelayString = "${flagrank.leaderboard.refresh-interval-ms:2000}"
    )
    public void refresh() {
        synchronized (rebuildMonitor) {
            if (flagrankRuntimeProperties.getReconciliation().isEnabled()) {
                ScoreAggregator.ReconciliationReport report = scoreAggregator.reconcileAll();
                if (report.mismatches() > 0) {
                    log.warn("Leaderboard refresh repaired {} of {} team tallies", report.mismatches(), report.teamsChecked());
                }
            }
            dirty.set(false);
            rebuild();
        }
    }

    /**
     * Age of the live snapshot in milliseconds, or -1 before the first build.
     */
    public long snapshotAgeMillis() {
        LeaderboardSnapshot snapshot = liveSnapshot.get();
        return snapshot != null ? snapshot.ageMillis() : -1L;
    }

    public long stalenessBoundMs() {
        return flagrankRuntimeProperties.getLeaderboard().getStalenessBoundMs();
    }

    private LeaderboardSnapshot rebuild() {
        LeaderboardSnapshot snapshot = new LeaderboardSnapshot(
                LeaderboardRanking.rank(scoreAggregator.standings()),
                competitionClock.now(),
                System.nanoTime(),
                false,
                null
        );
        liveSnapshot.set(snapshot);
        return snapshot;
    }

    private LeaderboardSnapshot frozenAt(OffsetDateTime freezeTime) {
        LeaderboardSnapshot snapshot = frozenSnapshot.get();
        if (snapshot != null && freezeTime.equals(snapshot.frozenAt()) && isSettled(snapshot)) {
            return snapshot;
        }
        LeaderboardSnapshot rebuilt = new LeaderboardSnapshot(
                LeaderboardRanking.rank(scoreAggregator.standingsAsOf(freezeTime)),
                competitionClock.now(),
                System.nanoTime(),
                true,
                freezeTime
        );
        frozenSnapshot.set(rebuilt);
        return rebuilt;
    }

    // Rows stamped before the freeze may still be committing shortly after it.
    private boolean isSettled(LeaderboardSnapshot frozen) {
        OffsetDateTime settledAt = frozen.frozenAt().plusNanos(stalenessBoundMs() * 1_000_000L);
        return frozen.generatedAt().isAfter(settledAt) || frozen.ageMillis() <= stalenessBoundMs();
    }
}
