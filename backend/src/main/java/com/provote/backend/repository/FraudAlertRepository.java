package com.provote.backend.repository;

import com.provote.backend.domain.FraudAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FraudAlertRepository extends JpaRepository<FraudAlert, UUID> {

    boolean existsByPollIdAndPatternSignature(UUID pollId, String patternSignature);

    List<FraudAlert> findByPollIdOrderByCreatedAtDesc(UUID pollId);

    long countByPollId(UUID pollId);
}
