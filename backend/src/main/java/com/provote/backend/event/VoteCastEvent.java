package com.provote.backend.event;

import java.util.UUID;

/**
 * Published inside the cast transaction; listeners act only after commit.
 */
public record VoteCastEvent(
    UUID voteId,
    UUID pollId,
    UUID optionId,
    UUID userId,
    String fingerprint,
    String ipAddress,
    String idempotencyKey
) {}
