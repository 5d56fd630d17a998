package com.flagrank.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "challenges")
public class Challenge {

    @Id
    @Column(name = "challenge_id", nullable = false, updatable = false)
    private UUID challengeId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    /**
     * Base point value. For dynamic challenges this mirrors {@link #initialValue}.
     */
    @Column(name = "point_value", nullable = false)
    private Integer pointValue;

    @Column(name = "flag", nullable = false, length = 255)
    private String flag;

    @Column(name = "visible", nullable = false)
    private Boolean visible = Boolean.TRUE;

    @Column(name = "retired", nullable = false)
    private Boolean retired = Boolean.FALSE;

    @Column(name = "case_sensitive", nullable = false)
    private Boolean caseSensitive = Boolean.FALSE;

    @Enumerated(EnumType.STRING)
    @Column(name = "scoring_type", nullable = false, length = 16)
    private ChallengeScoringType scoringType = ChallengeScoringType.STATIC;

    @Column(name = "initial_value")
    private Integer initialValue;

    @Column(name = "minimum_value")
    private Integer minimumValue;

    @Column(name = "decay_factor", precision = 6, scale = 4)
    private BigDecimal decayFactor;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public boolean isOpenForPlay() {
        return Boolean.TRUE.equals(visible) && !Boolean.TRUE.equals(retired);
    }
}
