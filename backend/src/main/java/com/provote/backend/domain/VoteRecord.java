package com.provote.backend.domain;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One accepted ballot. After insert only isValid, fraudReasons and riskScore
 * may change (retroactive flagging by the pattern analysis job).
 */
@Data
@Entity
@Table(name = "vote_records",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_vote_records_idempotency_key", columnNames = "idempotency_key"),
                // NULL user ids never collide, so anonymous votes may repeat
                @UniqueConstraint(name = "uk_vote_records_poll_user", columnNames = {"poll_id", "user_id"})
        },
        indexes = {
                @Index(name = "idx_vote_records_poll_fingerprint", columnList = "poll_id, fingerprint"),
                @Index(name = "idx_vote_records_poll_created", columnList = "poll_id, created_at"),
                @Index(name = "idx_vote_records_fingerprint_created", columnList = "fingerprint, created_at"),
                @Index(name = "idx_vote_records_ip_created", columnList = "ip_address, created_at"),
                @Index(name = "idx_vote_records_poll_voter_token", columnList = "poll_id, voter_token")
        })
public class VoteRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "poll_id", nullable = false, updatable = false)
    private UUID pollId;

    @Column(name = "option_id", nullable = false, updatable = false)
    private UUID optionId;

    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Column(name = "voter_token", nullable = false, length = 64, updatable = false)
    private String voterToken;

    @Column(name = "fingerprint", length = 64, updatable = false)
    private String fingerprint;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT", updatable = false)
    private String userAgent;

    @Column(name = "idempotency_key", nullable = false, length = 64, updatable = false)
    private String idempotencyKey;

    @Column(name = "is_valid", nullable = false)
    private Boolean isValid = true;

    @Convert(converter = FraudReasonsConverter.class)
    @Column(name = "fraud_reasons", columnDefinition = "TEXT")
    private List<String> fraudReasons = new ArrayList<>();

    @Column(name = "risk_score", nullable = false)
    private Integer riskScore = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (isValid == null) isValid = true;
        if (riskScore == null) riskScore = 0;
        if (fraudReasons == null) fraudReasons = new ArrayList<>();
    }
}
