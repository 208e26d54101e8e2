package com.provote.backend.core.cache;

import com.provote.backend.dto.ActivitySnapshot;
import com.provote.backend.dto.FingerprintAnalysis;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared per-fingerprint activity counters. Implementations must merge an
 * observation atomically: concurrent observations on the same key never lose
 * an increment or a set member.
 */
public interface FingerprintActivityStore {

    /**
     * Adds one observation and refreshes the TTL of the entry.
     *
     * @param userId    voter id, or null for anonymous voters
     * @param ipAddress client address, or null when unknown
     */
    void merge(String key, String userId, String ipAddress, Duration ttl);

    Optional<ActivitySnapshot> read(String key);

    void putAnalysis(String key, FingerprintAnalysis analysis, Duration ttl);
}
