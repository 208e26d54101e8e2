package com.provote.backend.domain;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Permanent block of a device fingerprint. There is exactly one row per
 * fingerprint: unblocking flips isActive, blocking again reactivates the same
 * row. The transitions themselves are kept in {@link FingerprintBlockEvent}.
 */
@Data
@Entity
@Table(name = "fingerprint_blocks",
        uniqueConstraints = @UniqueConstraint(name = "uk_fingerprint_blocks_fingerprint", columnNames = "fingerprint"),
        indexes = @Index(name = "idx_fingerprint_blocks_active", columnList = "fingerprint, is_active"))
public class FingerprintBlock {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 128)
    private String fingerprint;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String reason;

    @Column(name = "blocked_at", nullable = false)
    private LocalDateTime blockedAt;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @Column(name = "unblocked_at")
    private LocalDateTime unblockedAt;

    // null means the block was created automatically
    @Column(name = "blocked_by")
    private UUID blockedBy;

    @Column(name = "unblocked_by")
    private UUID unblockedBy;

    @Column(name = "first_seen_user_id")
    private UUID firstSeenUserId;

    @Column(name = "total_users", nullable = false)
    private Integer totalUsers = 0;

    @Column(name = "total_votes", nullable = false)
    private Integer totalVotes = 0;

    public boolean isAutomatic() {
        return blockedBy == null;
    }
}
