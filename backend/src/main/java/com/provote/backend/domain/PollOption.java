package com.provote.backend.domain;

import jakarta.persistence.*;
import lombok.Data;
import java.util.UUID;

@Data
@Entity
@Table(name = "poll_options", indexes = @Index(name = "idx_poll_options_poll", columnList = "poll_id"))
public class PollOption {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "poll_id", nullable = false)
    private UUID pollId;

    private String text;

    @Column(name = "cached_vote_count", nullable = false)
    private Integer cachedVoteCount = 0;
}
