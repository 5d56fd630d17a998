package com.flagrank.repository;

import com.flagrank.model.HintUnlock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface HintUnlockRepository extends JpaRepository<HintUnlock, UUID> {
    boolean existsByTeamIdAndHintId(UUID teamId, UUID hintId);

    long countByTeamIdAndHintId(UUID teamId, UUID hintId);

    long countByTeamIdAndHintIdIn(UUID teamId, Collection<UUID> hintIds);

    List<HintUnlock> findByTeamId(UUID teamId);

    List<HintUnlock> findByUnlockedAtLessThanEqual(OffsetDateTime cutoff);
}
