package com.flagrank.repository;

import com.flagrank.model.CompetitionSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

/**
 * Lifecycle writes are single-statement updates of the columns they own, so a concurrent close and window
 * change cannot overwrite each other's fields.
 */
@Repository
public interface CompetitionSettingsRepository extends JpaRepository<CompetitionSettings, Integer> {

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update CompetitionSettings s
               set s.closedAt = :closedAt,
                   s.updatedAt = :closedAt
             where s.settingsId = :settingsId
               and s.closedAt is null
            """)
    int stampClosedIfOpen(
            @Param("settingsId") Integer settingsId,
            @Param("closedAt") OffsetDateTime closedAt
    );

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update CompetitionSettings s
               set s.startTime = :startTime,
                   s.endTime = :endTime,
                   s.freezeTime = :freezeTime,
                   s.closedAt = null,
                   s.updatedAt = :updatedAt
             where s.settingsId = :settingsId
            """)
    int replaceWindow(
            @Param("settingsId") Integer settingsId,
            @Param("startTime") OffsetDateTime startTime,
            @Param("endTime") OffsetDateTime endTime,
            @Param("freezeTime") OffsetDateTime freezeTime,
            @Param("updatedAt") OffsetDateTime updatedAt
    );
}
