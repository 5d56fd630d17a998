package com.flagrank.repository;

import com.flagrank.model.Hint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface HintRepository extends JpaRepository<Hint, UUID> {
    List<Hint> findByChallengeIdOrderByHintRankAsc(UUID challengeId);

    List<Hint> findByChallengeIdAndHintRankLessThanOrderByHintRankAsc(UUID challengeId, Integer hintRank);
}
