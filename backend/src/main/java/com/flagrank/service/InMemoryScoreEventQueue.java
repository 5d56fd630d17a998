package com.flagrank.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Process-local score event dispatcher. Always present: it is the queue in {@code in_memory} mode and
 * the local delivery stage of {@link RedisScoreEventQueue} in {@code redis} mode.
 * <p>
 * Whatever is waiting when the dispatcher wakes up is drained as one batch and handed over per team, so
 * a burst of solves and unlocks for one team costs a single tally update. A team whose events cannot
 * be applied is resynced from the ledger instead.
 */
@Service
public class InMemoryScoreEventQueue implements ScoreEventQueue {

    static final int MAX_BATCH_SIZE = 256;

    private static final Logger log = LoggerFactory.getLogger(InMemoryScoreEventQueue.class);

    private final BlockingQueue<Delivery> queue = new LinkedBlockingQueue<>();
    private final Object consumerMonitor = new Object();

    private volatile boolean running = true;
    private volatile ScoreEventConsumer consumer;
    private Thread dispatcherThread;

    @PostConstruct
    void startDispatcher() {
        dispatcherThread = new Thread(this::dispatchLoop, "flagrank-score-event-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    @PreDestroy
    void stopDispatcher() {
        running = false;
        synchronized (consumerMonitor) {
            consumerMonitor.notifyAll();
        }
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
        }
    }

    @Override
    public void enqueue(ScoreEvent event) {
        offer(Delivery.ofEvent(Objects.requireNonNull(event, "event is required")));
    }

    /**
     * Asks the consumer to rebuild a team's tally from the ledger, or every tally when {@code teamId}
     * is null. Used when an event was lost or could not be read.
     */
    public void requestResync(UUID teamId) {
        offer(Delivery.ofResync(teamId));
    }

    @Override
    public void setConsumer(ScoreEventConsumer consumer) {
        synchronized (consumerMonitor) {
            this.consumer = Objects.requireNonNull(consumer, "consumer is required");
            consumerMonitor.notifyAll();
        }
    }

    int pendingDeliveries() {
        return queue.size();
    }

    void dispatchBatch(ScoreEventConsumer eventConsumer, List<Delivery> batch) {
        Map<UUID, List<ScoreEvent>> eventsByTeam = new LinkedHashMap<>();
        Set<UUID> resyncTeams = new LinkedHashSet<>();
        boolean resyncAll = false;
        for (Delivery delivery : batch) {
            if (delivery.event() != null) {
                eventsByTeam.computeIfAbsent(delivery.event().teamId(), ignored -> new ArrayList<>())
                        .add(delivery.event());
            } else if (delivery.teamId() != null) {
                resyncTeams.add(delivery.teamId());
            } else {
                resyncAll = true;
            }
        }

        for (Map.Entry<UUID, List<ScoreEvent>> teamEvents : eventsByTeam.entrySet()) {
            try {
                eventConsumer.applyTeamEvents(teamEvents.getKey(), teamEvents.getValue());
            } catch (RuntimeException ex) {
                log.warn(
                        "Applying {} score events for team {} failed; rebuilding its tally from the ledger",
                        teamEvents.getValue().size(),
                        teamEvents.getKey(),
                        ex
                );
                resyncTeams.add(teamEvents.getKey());
            }
        }

        if (resyncAll) {
            resync(eventConsumer, null);
            return;
        }
        for (UUID teamId : resyncTeams) {
            resync(eventConsumer, teamId);
        }
    }

    private void offer(Delivery delivery) {
        if (!running) {
            throw new IllegalStateException("Score event queue is not running");
        }
        queue.offer(delivery);
    }

    private void dispatchLoop() {
        while (running) {
            try {
                List<Delivery> batch = new ArrayList<>();
                batch.add(queue.take());
                queue.drainTo(batch, MAX_BATCH_SIZE - 1);
                ScoreEventConsumer eventConsumer = awaitConsumer();
                if (eventConsumer == null) {
                    return;
                }
                dispatchBatch(eventConsumer, batch);
            } catch (InterruptedException ex) {
                if (!running) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private static void resync(ScoreEventConsumer eventConsumer, UUID teamId) {
        try {
            eventConsumer.resync(teamId);
        } catch (RuntimeException ex) {
            log.error(
                    "Score tally resync for {} failed; the next reconciliation pass will repair it",
                    teamId != null ? "team " + teamId : "all teams",
                    ex
            );
        }
    }

    private ScoreEventConsumer awaitConsumer() throws InterruptedException {
        synchronized (consumerMonitor) {
            while (running && consumer == null) {
                consumerMonitor.wait();
            }
            return consumer;
        }
    }

    // Either a score event or a resync request; a resync with no team covers every team.
    record Delivery(ScoreEvent event, UUID teamId) {

        static Delivery ofEvent(ScoreEvent event) {
            return new Delivery(event, event.teamId());
        }

        static Delivery ofResync(UUID teamId) {
            return new Delivery(null, teamId);
        }
    }
}
