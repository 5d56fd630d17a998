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
@Table(name = "hint_unlocks")
public class HintUnlock {

    @Id
    @Column(name = "unlock_id", nullable = false, updatable = false)
    private UUID unlockId;

    @Column(name = "team_id", nullable = false, updatable = false)
    private UUID teamId;

    @Column(name = "hint_id", nullable = false, updatable = false)
    private UUID hintId;

    @Column(name = "challenge_id", nullable = false, updatable = false)
    private UUID challengeId;

    @Column(name = "hint_rank", nullable = false, updatable = false)
    private Integer hintRank;

    // Snapshot of the hint cost at unlock time.
    @Column(name = "cost_charged", nullable = false, updatable = false)
    private Integer costCharged;

    @Column(name = "member_id", length = 150, updatable = false)
    private String memberId;

    @Column(name = "unlocked_at", nullable = false, updatable = false)
    private OffsetDateTime unlockedAt;
}
