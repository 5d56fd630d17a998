package com.flagrank.repository;

import com.flagrank.model.KothTarget;
import com.flagrank.model.KothTargetStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Ownership changes are compare-and-swap updates on {@code stateVersion}. A return value of zero means
 * another writer changed the target after the caller read it.
 */
@Repository
public interface KothTargetRepository extends JpaRepository<KothTarget, UUID> {
    List<KothTarget> findByStatusOrderByCreatedAtAsc(KothTargetStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update KothTarget t
               set t.ownerTeamId = :teamId,
                   t.ownerSince = :now,
                   t.accruedUntil = :now,
                   t.stateVersion = t.stateVersion + 1,
                   t.updatedAt = :now
             where t.targetId = :targetId
               and t.status = :openStatus
               and t.stateVersion = :expectedVersion
            """)
    int swapOwnerIfVersion(
            @Param("targetId") UUID targetId,
            @Param("teamId") UUID teamId,
            @Param("now") OffsetDateTime now,
            @Param("openStatus") KothTargetStatus openStatus,
            @Param("expectedVersion") Long expectedVersion
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update KothTarget t
               set t.accruedUntil = :accruedUntil,
                   t.stateVersion = t.stateVersion + 1,
                   t.updatedAt = :now
             where t.targetId = :targetId
               and t.status = :openStatus
               and t.stateVersion = :expectedVersion
            """)
    int advanceAccrualIfVersion(
            @Param("targetId") UUID targetId,
            @Param("accruedUntil") OffsetDateTime accruedUntil,
            @Param("now") OffsetDateTime now,
            @Param("openStatus") KothTargetStatus openStatus,
            @Param("expectedVersion") Long expectedVersion
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update KothTarget t
               set t.status = :closedStatus,
                   t.ownerTeamId = null,
                   t.ownerSince = null,
                   t.accruedUntil = :accruedUntil,
                   t.closedAt = :now,
                   t.stateVersion = t.stateVersion + 1,
                   t.updatedAt = :now
             where t.targetId = :targetId
               and t.status = :openStatus
               and t.stateVersion = :expectedVersion
            """)
    int closeIfVersion(
            @Param("targetId") UUID targetId,
            @Param("accruedUntil") OffsetDateTime accruedUntil,
            @Param("now") OffsetDateTime now,
            @Param("openStatus") KothTargetStatus openStatus,
            @Param("closedStatus") KothTargetStatus closedStatus,
            @Param("expectedVersion") Long expectedVersion
    );

    // Touches only the token; owner and accrual columns written by a concurrent claim stay intact.
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update KothTarget t
               set t.captureToken = :captureToken,
                   t.stateVersion = t.stateVersion + 1,
                   t.updatedAt = :now
             where t.targetId = :targetId
            """)
    int rotateCaptureToken(
            @Param("targetId") UUID targetId,
            @Param("captureToken") String captureToken,
            @Param("now") OffsetDateTime now
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update KothTarget t
               set t.status = :openStatus,
                   t.closedAt = null,
                   t.stateVersion = t.stateVersion + 1,
                   t.updatedAt = :now
             where t.status = :closedStatus
            """)
    int reopenClosed(
            @Param("closedStatus") KothTargetStatus closedStatus,
            @Param("openStatus") KothTargetStatus openStatus,
            @Param("now") OffsetDateTime now
    );
}
