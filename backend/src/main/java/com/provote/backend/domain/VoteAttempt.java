package com.provote.backend.domain;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only audit row, written for every cast attempt whatever the outcome.
 */
@Data
@Entity
@Table(name = "vote_attempts", indexes = {
        @Index(name = "idx_vote_attempts_poll_voter", columnList = "poll_id, voter_token"),
        @Index(name = "idx_vote_attempts_idempotency", columnList = "idempotency_key"),
        @Index(name = "idx_vote_attempts_ip_created", columnList = "ip_address, created_at"),
        @Index(name = "idx_vote_attempts_success_created", columnList = "success, created_at"),
        @Index(name = "idx_vote_attempts_poll_created", columnList = "poll_id, created_at")
})
public class VoteAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "poll_id", updatable = false)
    private UUID pollId;

    @Column(name = "option_id", updatable = false)
    private UUID optionId;

    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Column(name = "vote_id", updatable = false)
    private UUID voteId;

    @Column(name = "voter_token", length = 64, updatable = false)
    private String voterToken;

    @Column(name = "fingerprint", length = 128, updatable = false)
    private String fingerprint;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT", updatable = false)
    private String userAgent;

    @Column(name = "idempotency_key", length = 128, updatable = false)
    private String idempotencyKey;

    @Column(nullable = false, updatable = false)
    private Boolean success = false;

    @Column(name = "error_code", updatable = false)
    private String errorCode;

    @Column(name = "error_message", columnDefinition = "TEXT", updatable = false)
    private String errorMessage;

    @Column(name = "risk_score", updatable = false)
    private Integer riskScore;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
