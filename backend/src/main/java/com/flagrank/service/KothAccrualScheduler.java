package com.flagrank.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "flagrank.koth", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KothAccrualScheduler {

    private static final Logger log = LoggerFactory.getLogger(KothAccrualScheduler.class);

    private final KothArbiterService kothArbiterService;

    @Scheduled(
            fixedRateString = "${flagrank.koth.tick-interval-ms:15000}",
            initialDelayString = "${flagrank.koth.initial-delay-ms:5000}"
    )
    public void accrueHeldTargets() {
        int credited = kothArbiterService.accrueHeldTargets();
        if (credited > 0) {
            log.info("KOTH accrual tick: targetsCredited={}", credited);
        } else {
            log.debug("KOTH accrual tick completed with no accruals");
        }
    }
}
