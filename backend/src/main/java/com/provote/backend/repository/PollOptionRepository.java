package com.provote.backend.repository;

import com.provote.backend.domain.PollOption;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PollOptionRepository extends JpaRepository<PollOption, UUID> {

    List<PollOption> findByPollId(UUID pollId);

    @Modifying
    @Query("UPDATE PollOption o SET o.cachedVoteCount = o.cachedVoteCount + 1 WHERE o.id = :optionId")
    int incrementVoteCount(@Param("optionId") UUID optionId);
}
