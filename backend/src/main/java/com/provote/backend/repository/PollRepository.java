package com.provote.backend.repository;

import com.provote.backend.domain.Poll;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PollRepository extends JpaRepository<Poll, UUID> {

    List<Poll> findByIsActiveTrueAndIsDraftFalse();

    // Atomic at the storage layer: no read-modify-write in the application
    @Modifying
    @Query("UPDATE Poll p SET p.cachedTotalVotes = p.cachedTotalVotes + 1 WHERE p.id = :pollId")
    int incrementTotalVotes(@Param("pollId") UUID pollId);

    @Modifying
    @Query("UPDATE Poll p SET p.cachedUniqueVoters = p.cachedUniqueVoters + 1 WHERE p.id = :pollId")
    int incrementUniqueVoters(@Param("pollId") UUID pollId);
}
