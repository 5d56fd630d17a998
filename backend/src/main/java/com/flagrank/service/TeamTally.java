package com.flagrank.service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable per-team score tally keyed by ledger entry. Applying an entry whose key is already present
 * returns the same instance.
 */
public final class TeamTally {

    private final UUID teamId;
    private final Map<String, TallyEntry> entries;
    private final long score;
    private final OffsetDateTime lastSolveAt;

    private TeamTally(UUID teamId, Map<String, TallyEntry> entries) {
        this.teamId = Objects.requireNonNull(teamId, "teamId is required");
        this.entries = Collections.unmodifiableMap(entries);
        long total = 0;
        OffsetDateTime latestSolve = null;
        for (TallyEntry entry : entries.values()) {
            total += entry.delta();
            if (entry.isSolve() && (latestSolve == null || entry.occurredAt().isAfter(latestSolve))) {
                latestSolve = entry.occurredAt();
            }
        }
        this.score = total;
        this.lastSolveAt = latestSolve;
    }

    public static TeamTally empty(UUID teamId) {
        return new TeamTally(teamId, new LinkedHashMap<>());
    }

    public static TeamTally of(UUID teamId, Collection<TallyEntry> entries) {
        Map<String, TallyEntry> byKey = new LinkedHashMap<>();
        for (TallyEntry entry : entries) {
            byKey.putIfAbsent(entry.key(), entry);
        }
        return new TeamTally(teamId, byKey);
    }

    public TeamTally apply(TallyEntry entry) {
        if (entries.containsKey(entry.key())) {
            return this;
        }
        Map<String, TallyEntry> next = new LinkedHashMap<>(entries);
        next.put(entry.key(), entry);
        return new TeamTally(teamId, next);
    }

    /**
     * Compares this running tally with a tally folded from committed rows. Differences involving entries
     * that occurred at or after {@code settledBefore} are treated as still in flight.
     *
     * @throws ReconciliationMismatchException when a settled entry differs or is missing on either side
     */
    public void verifyAgainst(TeamTally committed, OffsetDateTime settledBefore) {
        List<String> discrepancies = new ArrayList<>();
        for (TallyEntry committedEntry : committed.entries.values()) {
            TallyEntry runningEntry = entries.get(committedEntry.key());
            if (runningEntry == null) {
                if (committedEntry.occurredAt().isBefore(settledBefore)) {
                    discrepancies.add("missing " + committedEntry.key());
                }
            } else if (runningEntry.delta() != committedEntry.delta()) {
                discrepancies.add("delta " + committedEntry.key() + " running=" + runningEntry.delta()
                        + " committed=" + committedEntry.delta());
            }
        }
        for (TallyEntry runningEntry : entries.values()) {
            if (!committed.entries.containsKey(runningEntry.key()) && runningEntry.occurredAt().isBefore(settledBefore)) {
                discrepancies.add("uncommitted " + runningEntry.key());
            }
        }
        if (!discrepancies.isEmpty()) {
            throw new ReconciliationMismatchException(teamId, score, committed.score, discrepancies);
        }
    }

    /**
     * Committed entries plus running entries the committed read could not have seen yet.
     */
    public TeamTally mergedWith(TeamTally committed, OffsetDateTime settledBefore) {
        Map<String, TallyEntry> merged = new LinkedHashMap<>(committed.entries);
        for (TallyEntry runningEntry : entries.values()) {
            if (!merged.containsKey(runningEntry.key()) && !runningEntry.occurredAt().isBefore(settledBefore)) {
                merged.put(runningEntry.key(), runningEntry);
            }
        }
        return new TeamTally(teamId, merged);
    }

    public boolean contains(String entryKey) {
        return entries.containsKey(entryKey);
    }

    public UUID teamId() {
        return teamId;
    }

    public long score() {
        return score;
    }

    public OffsetDateTime lastSolveAt() {
        return lastSolveAt;
    }

    public int size() {
        return entries.size();
    }
}
