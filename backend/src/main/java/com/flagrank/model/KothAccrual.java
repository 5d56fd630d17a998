package com.flagrank.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "koth_accruals")
public class KothAccrual {

    @Id
    @Column(name = "accrual_id", nullable = false, updatable = false)
    private UUID accrualId;

    @Column(name = "target_id", nullable = false, updatable = false)
    private UUID targetId;

    @Column(name = "claim_id", nullable = false, updatable = false)
    private UUID claimId;

    @Column(name = "team_id", nullable = false, updatable = false)
    private UUID teamId;

    @Column(name = "points", nullable = false, updatable = false)
    private Long points;

    @Column(name = "period_start", nullable = false, updatable = false)
    private OffsetDateTime periodStart;

    @Column(name = "period_end", nullable = false, updatable = false)
    private OffsetDateTime periodEnd;

    @Column(name = "credited_at", nullable = false, updatable = false)
    private OffsetDateTime creditedAt;
}
