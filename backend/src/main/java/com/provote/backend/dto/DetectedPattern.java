package com.provote.backend.dto;

import com.provote.backend.domain.VoteRecord;
import com.provote.backend.domain.enums.PatternType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A suspicious aggregate found in a poll's recent votes. The signature is
 * stable across runs over the same data and identifies the pattern per poll.
 *
 * @param ipAddress   set for IP clusters
 * @param fingerprint set for fingerprint reuse clusters
 * @param optionId    set for option surges
 * @param windowStart start of the burst bucket, for bursts and surges
 * @param windowEnd   end (exclusive) of the burst bucket
 */
public record DetectedPattern(
    UUID pollId,
    PatternType type,
    String signature,
    int riskScore,
    List<String> reasons,
    Set<UUID> voteIds,
    int distinctVoters,
    String ipAddress,
    String fingerprint,
    UUID optionId,
    LocalDateTime windowStart,
    LocalDateTime windowEnd
) {
    public DetectedPattern {
        reasons = List.copyOf(reasons);
        voteIds = Set.copyOf(voteIds);
    }

    /**
     * Reason appended to a vote when this pattern flags it.
     */
    public String flagReason() {
        return flagReasonPrefix() + String.join(", ", reasons);
    }

    /**
     * Leading part of {@link #flagReason()} that stays the same while the
     * pattern's counts grow; a vote carries at most one reason per prefix.
     */
    public String flagReasonPrefix() {
        return "Pattern " + signature + ": ";
    }

    /**
     * Whether the vote still satisfies the condition the pattern was built on.
     */
    public boolean matches(VoteRecord vote) {
        if (vote == null || !voteIds.contains(vote.getId()) || !pollId.equals(vote.getPollId())) {
            return false;
        }
        switch (type) {
            case IP_CLUSTER:
                return Objects.equals(ipAddress, vote.getIpAddress());
            case FINGERPRINT_REUSE:
                return Objects.equals(fingerprint, vote.getFingerprint());
            case OPTION_SURGE:
                return inWindow(vote.getCreatedAt()) && Objects.equals(optionId, vote.getOptionId());
            default:
                return inWindow(vote.getCreatedAt());
        }
    }

    private boolean inWindow(LocalDateTime createdAt) {
        return createdAt != null && !createdAt.isBefore(windowStart) && createdAt.isBefore(windowEnd);
    }
}
