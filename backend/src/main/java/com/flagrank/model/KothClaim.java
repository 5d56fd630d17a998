package com.flagrank.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One hold of a target by a team. {@code openTargetId} equals the target id while the hold is open and
 * is cleared on release; its unique constraint allows at most one open claim per target.
 */
@Getter
@Setter
@Entity
@Table(name = "koth_claims")
public class KothClaim {

    @Id
    @Column(name = "claim_id", nullable = false, updatable = false)
    private UUID claimId;

    @Column(name = "target_id", nullable = false, updatable = false)
    private UUID targetId;

    @Column(name = "team_id", nullable = false, updatable = false)
    private UUID teamId;

    @Column(name = "member_id", length = 150, updatable = false)
    private String memberId;

    @Column(name = "proof_digest", length = 64, updatable = false)
    private String proofDigest;

    @Column(name = "open_target_id")
    private UUID openTargetId;

    @Column(name = "claimed_at", nullable = false, updatable = false)
    private OffsetDateTime claimedAt;

    @Column(name = "released_at")
    private OffsetDateTime releasedAt;
}
