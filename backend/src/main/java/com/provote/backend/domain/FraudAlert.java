package com.provote.backend.domain;

import com.provote.backend.domain.enums.PatternType;
import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "fraud_alerts",
        uniqueConstraints = @UniqueConstraint(name = "uk_fraud_alerts_poll_signature",
                columnNames = {"poll_id", "pattern_signature"}),
        indexes = @Index(name = "idx_fraud_alerts_poll_created", columnList = "poll_id, created_at"))
public class FraudAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "poll_id", nullable = false, updatable = false)
    private UUID pollId;

    @Column(name = "vote_id", updatable = false)
    private UUID voteId;

    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    // comma-joined
    @Column(columnDefinition = "TEXT", updatable = false)
    private String reasons;

    @Column(name = "risk_score", nullable = false, updatable = false)
    private Integer riskScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "pattern_type", nullable = false, updatable = false)
    private PatternType patternType;

    @Column(name = "pattern_signature", nullable = false, updatable = false)
    private String patternSignature;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
