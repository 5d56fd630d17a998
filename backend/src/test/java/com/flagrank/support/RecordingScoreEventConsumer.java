package com.flagrank.support;

import com.flagrank.service.ScoreEvent;
import com.flagrank.service.ScoreEventConsumer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Records batches and resync requests so queue tests can wait for them.
 */
public class RecordingScoreEventConsumer implements ScoreEventConsumer {

    private final List<List<ScoreEvent>> batches = new CopyOnWriteArrayList<>();
    private final List<Optional<UUID>> resyncs = new CopyOnWriteArrayList<>();
    private final Semaphore calls = new Semaphore(0);

    @Override
    public void applyTeamEvents(UUID teamId, List<ScoreEvent> events) {
        batches.add(List.copyOf(events));
        calls.release();
    }

    @Override
    public void resync(UUID teamId) {
        resyncs.add(Optional.ofNullable(teamId));
        calls.release();
    }

    public boolean awaitCalls(int count, long timeoutSeconds) throws InterruptedException {
        return calls.tryAcquire(count, timeoutSeconds, TimeUnit.SECONDS);
    }

    public List<List<ScoreEvent>> batches() {
        return batches;
    }

    public List<ScoreEvent> events() {
        List<ScoreEvent> events = new ArrayList<>();
        batches.forEach(events::addAll);
        return events;
    }

    public List<Optional<UUID>> resyncs() {
        return resyncs;
    }
}
