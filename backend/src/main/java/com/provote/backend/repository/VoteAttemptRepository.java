package com.provote.backend.repository;

import com.provote.backend.domain.VoteAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface VoteAttemptRepository extends JpaRepository<VoteAttempt, UUID> {

    List<VoteAttempt> findByPollIdOrderByCreatedAtDesc(UUID pollId);

    long countByPollIdAndSuccessFalse(UUID pollId);
}
