package com.flagrank.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

/**
 * Scoring core runtime settings: competition window defaults, leaderboard
 * freshness, KOTH module switch and the score event worker.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "flagrank")
public class FlagrankRuntimeProperties {

    private Competition competition = new Competition();
    private Leaderboard leaderboard = new Leaderboard();
    private Koth koth = new Koth();
    private Worker worker = new Worker();
    private Reconciliation reconciliation = new Reconciliation();

    /**
     * Seed values for the competition settings row. Only used when the row does not exist yet.
     */
    @Getter
    @Setter
    public static class Competition {
        private String name = "Flagrank CTF";
        private OffsetDateTime startTime;
        private OffsetDateTime endTime;
        private OffsetDateTime freezeTime;
        private long closeCheckIntervalMs = 5_000;
    }

    @Getter
    @Setter
    public static class Leaderboard {
        /**
         * Maximum age of a leaderboard snapshot served to readers.
         */
        private long stalenessBoundMs = 5_000;

        /**
         * Safety-net rebuild period. Must stay below the staleness bound.
         */
        private long refreshIntervalMs = 2_000;

        private long debounceMs = 250;
    }

    @Getter
    @Setter
    public static class Koth {
        private boolean enabled = true;
        private long initialDelayMs = 5_000;
        private long tickIntervalMs = 15_000;
        private int closeAttempts = 5;
    }

    @Getter
    @Setter
    public static class Worker {
        private String queueMode = "in_memory";
        private String redisChannel = "flagrank:score:events";
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private boolean enabled = true;
    }
}
