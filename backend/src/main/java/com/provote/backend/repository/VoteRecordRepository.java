package com.provote.backend.repository;

import com.provote.backend.domain.VoteRecord;
import com.provote.backend.dto.VoteTrace;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable source of truth for accepted votes. The windowed queries all carry a
 * lower bound on created_at so they stay cheap whatever the size of the history.
 */
@Repository
public interface VoteRecordRepository extends JpaRepository<VoteRecord, UUID> {

    Optional<VoteRecord> findByIdempotencyKey(String idempotencyKey);

    boolean existsByPollIdAndUserId(UUID pollId, UUID userId);

    boolean existsByPollIdAndVoterToken(UUID pollId, String voterToken);

    long countByPollId(UUID pollId);

    @Query("SELECT new com.provote.backend.dto.VoteTrace(v.userId, v.ipAddress, v.fingerprint, v.createdAt) " +
           "FROM VoteRecord v WHERE v.fingerprint = :fingerprint AND v.pollId = :pollId AND v.createdAt >= :since " +
           "ORDER BY v.createdAt ASC")
    List<VoteTrace> findTracesByFingerprint(@Param("fingerprint") String fingerprint,
                                            @Param("pollId") UUID pollId,
                                            @Param("since") LocalDateTime since);

    @Query("SELECT new com.provote.backend.dto.VoteTrace(v.userId, v.ipAddress, v.fingerprint, v.createdAt) " +
           "FROM VoteRecord v WHERE v.fingerprint = :fingerprint AND v.createdAt >= :since ORDER BY v.createdAt ASC")
    List<VoteTrace> findTracesByFingerprintAcrossPolls(@Param("fingerprint") String fingerprint,
                                                       @Param("since") LocalDateTime since);

    @Query("SELECT new com.provote.backend.dto.VoteTrace(v.userId, v.ipAddress, v.fingerprint, v.createdAt) " +
           "FROM VoteRecord v WHERE v.userId = :userId AND v.createdAt >= :since ORDER BY v.createdAt ASC")
    List<VoteTrace> findTracesByUser(@Param("userId") UUID userId, @Param("since") LocalDateTime since);

    @Query("SELECT new com.provote.backend.dto.VoteTrace(v.userId, v.ipAddress, v.fingerprint, v.createdAt) " +
           "FROM VoteRecord v WHERE v.userId IS NULL AND v.ipAddress = :ipAddress AND v.createdAt >= :since " +
           "ORDER BY v.createdAt ASC")
    List<VoteTrace> findAnonymousTracesByIp(@Param("ipAddress") String ipAddress, @Param("since") LocalDateTime since);

    List<VoteRecord> findByPollIdAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(UUID pollId, LocalDateTime since);
}
