package com.flagrank.service;

import java.util.List;
import java.util.UUID;

/**
 * Receives score events grouped by team, oldest first.
 */
public interface ScoreEventConsumer {

    void applyTeamEvents(UUID teamId, List<ScoreEvent> events);

    /**
     * Rebuilds the running tally of one team from committed ledger rows, or of every team when
     * {@code teamId} is null.
     */
    void resync(UUID teamId);
}
