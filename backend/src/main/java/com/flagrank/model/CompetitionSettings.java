package com.flagrank.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "competition_settings")
public class CompetitionSettings {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "settings_id", nullable = false, updatable = false)
    private Integer settingsId = SINGLETON_ID;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "start_time")
    private OffsetDateTime startTime;

    @Column(name = "end_time")
    private OffsetDateTime endTime;

    @Column(name = "freeze_time")
    private OffsetDateTime freezeTime;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public CompetitionPhase phaseAt(OffsetDateTime now) {
        if (closedAt != null || (endTime != null && !now.isBefore(endTime))) {
            return CompetitionPhase.FINISHED;
        }
        if (startTime != null && now.isBefore(startTime)) {
            return CompetitionPhase.UPCOMING;
        }
        return CompetitionPhase.ACTIVE;
    }

    public boolean isFrozenAt(OffsetDateTime now) {
        return freezeTime != null && !now.isBefore(freezeTime);
    }
}
