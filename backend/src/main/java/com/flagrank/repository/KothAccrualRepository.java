package com.flagrank.repository;

import com.flagrank.model.KothAccrual;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface KothAccrualRepository extends JpaRepository<KothAccrual, UUID> {
    List<KothAccrual> findByTeamId(UUID teamId);

    List<KothAccrual> findByTargetIdOrderByPeriodStartAsc(UUID targetId);

    List<KothAccrual> findByCreditedAtLessThanEqual(OffsetDateTime cutoff);
}
