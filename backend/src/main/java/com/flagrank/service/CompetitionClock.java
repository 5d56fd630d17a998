package com.flagrank.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Single source of "now" for ledger timestamps. Truncated to the precision the database stores so that
 * values read back compare equal to the ones written.
 */
@Component
@RequiredArgsConstructor
public class CompetitionClock {

    private final Clock clock;

    public OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }
}
