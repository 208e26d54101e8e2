package com.provote.backend.dto;

import java.util.Set;

/**
 * Approximate, short-lived view of how a fingerprint has been used on a poll.
 */
public record ActivitySnapshot(
    long totalCount,
    Set<String> userIds,
    Set<String> ipAddresses,
    FingerprintAnalysis analysis
) {
    public ActivitySnapshot {
        userIds = userIds == null ? Set.of() : Set.copyOf(userIds);
        ipAddresses = ipAddresses == null ? Set.of() : Set.copyOf(ipAddresses);
    }

    public int userCount() {
        return userIds.size();
    }

    public int ipCount() {
        return ipAddresses.size();
    }
}
