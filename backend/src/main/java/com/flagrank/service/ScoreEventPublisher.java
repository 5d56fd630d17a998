package com.flagrank.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Objects;

/**
 * Hands score events to the queue once the ledger transaction that produced them has committed.
 * Rolled-back transactions publish nothing.
 */
@Service
@RequiredArgsConstructor
public class ScoreEventPublisher {

    private final ScoreEventQueue scoreEventQueue;

    public void publish(ScoreEvent event) {
        publishAll(List.of(Objects.requireNonNull(event, "event is required")));
    }

    public void publishAll(List<ScoreEvent> events) {
        List<ScoreEvent> pending = List.copyOf(events);
        if (pending.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publishImmediately(pending);
                }
            });
            return;
        }
        publishImmediately(pending);
    }

    private void publishImmediately(List<ScoreEvent> events) {
        for (ScoreEvent event : events) {
            scoreEventQueue.enqueue(event);
        }
    }
}
