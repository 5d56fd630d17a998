package com.flagrank.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CompetitionLifecycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(CompetitionLifecycleScheduler.class);

    private final CompetitionService competitionService;

    @Scheduled(
            fixedDelayString = "${flagrank.competition.close-check-interval-ms:5000}",
            initialDelayString = "${flagrank.competition.close-check-interval-ms:5000}"
    )
    public void closeEndedCompetition() {
        if (competitionService.closeIfEnded()) {
            log.info("Competition end time reached; competition closed by scheduler");
        } else {
            log.debug("Competition close check completed with no state changes");
        }
    }
}
