package com.provote.backend.domain;

import com.provote.backend.domain.enums.BlockAction;
import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "fingerprint_block_events",
        indexes = @Index(name = "idx_fingerprint_block_events_fp", columnList = "fingerprint, occurred_at"))
public class FingerprintBlockEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 128, updatable = false)
    private String fingerprint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private BlockAction action;

    // null for automatic blocks
    @Column(name = "actor_id", updatable = false)
    private UUID actorId;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private LocalDateTime occurredAt;
}
