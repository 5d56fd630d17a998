package com.flagrank.service;

import lombok.Getter;

import java.util.List;
import java.util.UUID;

@Getter
public class ReconciliationMismatchException extends RuntimeException {

    private final UUID teamId;
    private final long runningScore;
    private final long committedScore;
    private final List<String> discrepancies;

    public ReconciliationMismatchException(
            UUID teamId,
            long runningScore,
            long committedScore,
            List<String> discrepancies
    ) {
        super("Running score " + runningScore + " for team " + teamId
                + " diverged from committed score " + committedScore + ": " + String.join(", ", discrepancies));
        this.teamId = teamId;
        this.runningScore = runningScore;
        this.committedScore = committedScore;
        this.discrepancies = List.copyOf(discrepancies);
    }
}
