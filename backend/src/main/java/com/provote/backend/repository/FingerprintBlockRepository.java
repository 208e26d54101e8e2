package com.provote.backend.repository;

import com.provote.backend.domain.FingerprintBlock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FingerprintBlockRepository extends JpaRepository<FingerprintBlock, UUID> {

    Optional<FingerprintBlock> findByFingerprintAndIsActiveTrue(String fingerprint);

    Optional<FingerprintBlock> findByFingerprint(String fingerprint);

    List<FingerprintBlock> findByIsActiveTrueOrderByBlockedAtDesc();
}
