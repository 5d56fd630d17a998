package com.flagrank.service;

import com.flagrank.config.FlagrankRuntimeProperties;
import com.flagrank.model.CompetitionPhase;
import com.flagrank.model.CompetitionSettings;
import com.flagrank.repository.CompetitionSettingsRepository;
import com.flagrank.web.ScoringValidationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class CompetitionService {

    private static final Logger log = LoggerFactory.getLogger(CompetitionService.class);

    private final CompetitionSettingsRepository competitionSettingsRepository;
    private final FlagrankRuntimeProperties flagrankRuntimeProperties;
    private final CompetitionClock competitionClock;
    private final ObjectProvider<CompetitionLifecycleListener> lifecycleListeners;

    /**
     * Returns the settings row, seeding it from {@code flagrank.competition.*} on first use.
     */
    public CompetitionSettings settings() {
        return competitionSettingsRepository.findById(CompetitionSettings.SINGLETON_ID)
                .orElseGet(this::createDefaultSettings);
    }

    public CompetitionPhase phase() {
        return settings().phaseAt(competitionClock.now());
    }

    public void requireActive() {
        CompetitionSettings settings = settings();
        OffsetDateTime now = competitionClock.now();
        CompetitionPhase phase = settings.phaseAt(now);
        if (phase != CompetitionPhase.ACTIVE) {
            throw ScoringValidationException.competitionNotActive(
                    "Competition is " + phase.name().toLowerCase(Locale.ROOT) + " at " + now
            );
        }
    }

    public OffsetDateTime freezeTimeIfFrozen() {
        CompetitionSettings settings = settings();
        return settings.isFrozenAt(competitionClock.now()) ? settings.getFreezeTime() : null;
    }

    /**
     * Replaces the window. A closed competition is reopened and listeners reopen their state, unless the
     * new window has already ended.
     */
    public CompetitionSettings updateWindow(OffsetDateTime startTime, OffsetDateTime endTime, OffsetDateTime freezeTime) {
        validateWindow(startTime, endTime, freezeTime);
        settings();
        OffsetDateTime now = competitionClock.now();
        competitionSettingsRepository.replaceWindow(CompetitionSettings.SINGLETON_ID, startTime, endTime, freezeTime, now);
        CompetitionSettings updated = settings();
        log.info("Competition window set to {} .. {} (freeze {})", startTime, endTime, freezeTime);
        if (updated.phaseAt(now) != CompetitionPhase.FINISHED) {
            lifecycleListeners.orderedStream().forEach(CompetitionLifecycleListener::onCompetitionReopened);
        }
        return updated;
    }

    /**
     * Ends the competition and lets listeners settle their open state. Safe to call repeatedly.
     */
    public CompetitionSettings close() {
        settings();
        OffsetDateTime now = competitionClock.now();
        if (competitionSettingsRepository.stampClosedIfOpen(CompetitionSettings.SINGLETON_ID, now) > 0) {
            log.info("Competition closed at {}", now);
        }
        CompetitionSettings settings = settings();
        if (settings.getClosedAt() == null) {
            log.info("Competition was reopened while closing; listeners keep their state");
            return settings;
        }
        OffsetDateTime endedAt = endedAt(settings);
        lifecycleListeners.orderedStream().forEach(listener -> listener.onCompetitionClosed(endedAt));
        return settings;
    }

    /**
     * Closes the competition once its end time has passed. Returns true when this call closed it.
     */
    public boolean closeIfEnded() {
        CompetitionSettings settings = settings();
        OffsetDateTime now = competitionClock.now();
        if (settings.getClosedAt() != null || settings.getEndTime() == null || now.isBefore(settings.getEndTime())) {
            return false;
        }
        close();
        return true;
    }

    static OffsetDateTime endedAt(CompetitionSettings settings) {
        OffsetDateTime closedAt = settings.getClosedAt();
        OffsetDateTime endTime = settings.getEndTime();
        return endTime != null && endTime.isBefore(closedAt) ? endTime : closedAt;
    }

    static void validateWindow(OffsetDateTime startTime, OffsetDateTime endTime, OffsetDateTime freezeTime) {
        if (startTime != null && endTime != null && !startTime.isBefore(endTime)) {
            throw ScoringValidationException.invalidCompetitionWindow("startTime must be before endTime");
        }
        if (freezeTime == null) {
            return;
        }
        if (startTime != null && freezeTime.isBefore(startTime)) {
            throw ScoringValidationException.invalidCompetitionWindow("freezeTime must not be before startTime");
        }
        if (endTime != null && freezeTime.isAfter(endTime)) {
            throw ScoringValidationException.invalidCompetitionWindow("freezeTime must not be after endTime");
        }
    }

    private CompetitionSettings createDefaultSettings() {
        FlagrankRuntimeProperties.Competition defaults = flagrankRuntimeProperties.getCompetition();
        validateWindow(defaults.getStartTime(), defaults.getEndTime(), defaults.getFreezeTime());

        OffsetDateTime now = competitionClock.now();
        CompetitionSettings settings = new CompetitionSettings();
        settings.setName(defaults.getName());
        settings.setStartTime(defaults.getStartTime());
        settings.setEndTime(defaults.getEndTime());
        settings.setFreezeTime(defaults.getFreezeTime());
        settings.setCreatedAt(now);
        settings.setUpdatedAt(now);
        try {
            return competitionSettingsRepository.saveAndFlush(settings);
        } catch (DataIntegrityViolationException ex) {
            // Another request seeded the row first.
            return competitionSettingsRepository.findById(CompetitionSettings.SINGLETON_ID).orElseThrow(() -> ex);
        }
    }
}
