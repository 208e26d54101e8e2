package com.provote.backend.service;

import com.provote.backend.config.IntegrityProperties;
import com.provote.backend.core.cache.FingerprintActivityStore;
import com.provote.backend.dto.ActivitySnapshot;
import com.provote.backend.dto.FingerprintAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Best-effort view of recent fingerprint activity per poll. Nothing here is
 * authoritative: reads fall back to empty and failed writes are only logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FingerprintActivityCache {

    private final FingerprintActivityStore store;
    private final RetryTemplate cacheReadRetryTemplate;
    private final IntegrityProperties properties;

    public String keyFor(String fingerprint, UUID pollId) {
        return "fp:activity:" + fingerprint + ":" + pollId;
    }

    public void record(String fingerprint, UUID pollId, UUID userId, String ipAddress) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return;
        }
        try {
            store.merge(keyFor(fingerprint, pollId), userId == null ? null : userId.toString(), ipAddress,
                    properties.getFingerprint().getCacheTtl());
        } catch (RuntimeException e) {
            log.warn("Could not record activity for fingerprint {} on poll {}: {}", fingerprint, pollId, e.getMessage());
        }
    }

    public Optional<ActivitySnapshot> read(String fingerprint, UUID pollId) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return Optional.empty();
        }
        String key = keyFor(fingerprint, pollId);
        try {
            return cacheReadRetryTemplate.execute(ctx -> store.read(key));
        } catch (RuntimeException e) {
            log.warn("Activity cache read failed for {}, continuing without it: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void recordAnalysis(String fingerprint, UUID pollId, FingerprintAnalysis analysis) {
        try {
            store.putAnalysis(keyFor(fingerprint, pollId), analysis, properties.getFingerprint().getCacheTtl());
        } catch (RuntimeException e) {
            log.warn("Could not store analysis for fingerprint {}: {}", fingerprint, e.getMessage());
        }
    }
}
