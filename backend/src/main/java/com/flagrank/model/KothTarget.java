package com.flagrank.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * King-of-the-hill target. Ownership fields are only ever changed through the
 * version-checked updates in {@code KothTargetRepository}.
 */
@Getter
@Setter
@Entity
@Table(name = "koth_targets")
public class KothTarget {

    @Id
    @Column(name = "target_id", nullable = false, updatable = false)
    private UUID targetId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "challenge_id")
    private UUID challengeId;

    @Column(name = "capture_token", nullable = false, length = 255)
    private String captureToken;

    @Column(name = "points_per_period", nullable = false)
    private Integer pointsPerPeriod;

    @Column(name = "accrual_period_seconds", nullable = false)
    private Integer accrualPeriodSeconds;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private KothTargetStatus status = KothTargetStatus.OPEN;

    @Column(name = "owner_team_id")
    private UUID ownerTeamId;

    @Column(name = "owner_since")
    private OffsetDateTime ownerSince;

    // Accrual has been credited for the current hold up to this instant.
    @Column(name = "accrued_until")
    private OffsetDateTime accruedUntil;

    @Column(name = "state_version", nullable = false)
    private Long stateVersion = 0L;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
