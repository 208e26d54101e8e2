package com.provote.backend.dto;

import java.util.UUID;

/**
 * @param userId         authenticated voter, or null for an anonymous vote
 * @param idempotencyKey caller supplied key, optional
 */
public record CastVoteCommand(
    UUID userId,
    UUID pollId,
    UUID optionId,
    String idempotencyKey,
    RequestMetadata metadata
) {
    public CastVoteCommand {
        if (metadata == null) {
            metadata = new RequestMetadata(null, null, null);
        }
    }
}
