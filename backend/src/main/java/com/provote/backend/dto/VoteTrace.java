package com.provote.backend.dto;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Minimal projection of a vote used by the windowed fraud queries.
 */
public record VoteTrace(
    UUID userId,
    String ipAddress,
    String fingerprint,
    LocalDateTime createdAt
) {}
