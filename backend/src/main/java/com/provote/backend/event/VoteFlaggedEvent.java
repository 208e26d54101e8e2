package com.provote.backend.event;

import java.util.List;
import java.util.UUID;

/**
 * A vote was marked invalid, or a fingerprint was blocked automatically while
 * a user was voting. voteId is null in the second case.
 */
public record VoteFlaggedEvent(
    UUID voteId,
    UUID userId,
    UUID pollId,
    List<String> reasons
) {
    public VoteFlaggedEvent {
        reasons = List.copyOf(reasons);
    }
}
