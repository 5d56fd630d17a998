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
@Table(name = "hints")
public class Hint {

    @Id
    @Column(name = "hint_id", nullable = false, updatable = false)
    private UUID hintId;

    @Column(name = "challenge_id", nullable = false, updatable = false)
    private UUID challengeId;

    /**
     * 1-based position within the challenge. Lower ranks must be unlocked first.
     */
    @Column(name = "hint_rank", nullable = false)
    private Integer hintRank;

    @Column(name = "cost", nullable = false)
    private Integer cost;

    @Column(name = "body", nullable = false, length = 2000)
    private String body;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
