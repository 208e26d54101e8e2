package com.provote.backend.repository;

import com.provote.backend.domain.FingerprintBlockEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FingerprintBlockEventRepository extends JpaRepository<FingerprintBlockEvent, UUID> {

    List<FingerprintBlockEvent> findByFingerprintOrderByOccurredAtAsc(String fingerprint);
}
