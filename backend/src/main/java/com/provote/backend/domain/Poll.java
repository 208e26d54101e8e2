package com.provote.backend.domain;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Poll as seen by the integrity core. Creation and editing belong to the polls
 * application; here we only read its state and bump the denormalized counters.
 */
@Data
@Entity
@Table(name = "polls")
public class Poll {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    private String title;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @Column(name = "is_draft", nullable = false)
    private Boolean isDraft = false;

    @Column(name = "starts_at")
    private LocalDateTime startsAt;

    @Column(name = "ends_at")
    private LocalDateTime endsAt;

    // Maintained only through PollRepository increments, never get-then-set
    @Column(name = "cached_total_votes", nullable = false)
    private Integer cachedTotalVotes = 0;

    @Column(name = "cached_unique_voters", nullable = false)
    private Integer cachedUniqueVoters = 0;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (isActive == null) isActive = true;
        if (isDraft == null) isDraft = false;
    }

    public boolean hasStarted(LocalDateTime now) {
        return startsAt == null || !startsAt.isAfter(now);
    }

    public boolean isExpired(LocalDateTime now) {
        return endsAt != null && endsAt.isBefore(now);
    }

    public boolean isOpen(LocalDateTime now) {
        return Boolean.TRUE.equals(isActive)
                && !Boolean.TRUE.equals(isDraft)
                && hasStarted(now)
                && !isExpired(now);
    }
}
