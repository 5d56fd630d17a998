package com.flagrank.config;

import com.flagrank.service.LeaderboardCache;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class LeaderboardHealthIndicator implements HealthIndicator {

    private final LeaderboardCache leaderboardCache;

    public LeaderboardHealthIndicator(LeaderboardCache leaderboardCache) {
        this.leaderboardCache = leaderboardCache;
    }

    @Override
    public Health health() {
        long ageMillis = leaderboardCache.snapshotAgeMillis();
        long stalenessBoundMs = leaderboardCache.stalenessBoundMs();
        if (ageMillis < 0) {
            return Health.unknown()
                    .withDetail("stalenessBoundMs", stalenessBoundMs)
                    .withDetail("snapshot", "not built yet")
                    .build();
        }
        Health.Builder builder = ageMillis <= stalenessBoundMs ? Health.up() : Health.down();
        return builder
                .withDetail("snapshotAgeMs", ageMillis)
                .withDetail("stalenessBoundMs", stalenessBoundMs)
                .build();
    }
}
