package com.flagrank.service;

import java.time.OffsetDateTime;

/**
 * Modules that hold open state while the competition runs.
 */
public interface CompetitionLifecycleListener {

    /**
     * Called after the competition is closed, and again on every repeated close.
     *
     * @param endedAt the instant play ended: the scheduled end time when the close came late, otherwise
     *                the close time
     */
    void onCompetitionClosed(OffsetDateTime endedAt);

    void onCompetitionReopened();
}
