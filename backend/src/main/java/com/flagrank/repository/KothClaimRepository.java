package com.flagrank.repository;

import com.flagrank.model.KothClaim;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface KothClaimRepository extends JpaRepository<KothClaim, UUID> {
    Optional<KothClaim> findByOpenTargetId(UUID openTargetId);

    List<KothClaim> findByTargetIdOrderByClaimedAtAsc(UUID targetId);

    long countByTargetIdAndReleasedAtIsNull(UUID targetId);
}
