package com.provote.backend.service;

import com.provote.backend.config.IntegrityProperties;
import com.provote.backend.core.cache.KeyValueCache;
import com.provote.backend.domain.VoteRecord;
import com.provote.backend.dto.IdempotencyCheck;
import com.provote.backend.repository.VoteRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Replay protection for cast requests. The cache only short-circuits repeats;
 * the unique idempotency_key column of vote_records is what actually decides.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    static final String CACHE_PREFIX = "idempotency:";

    private static final Pattern KEY_FORMAT = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final KeyValueCache keyValueCache;
    private final VoteRecordRepository voteRecordRepository;
    private final RetryTemplate cacheReadRetryTemplate;
    private final IntegrityProperties properties;

    public String deriveKey(String voterId, UUID pollId, UUID optionId) {
        return DigestUtils.sha256Hex(voterId + ":" + pollId + ":" + optionId);
    }

    public boolean isValidKey(String key) {
        return key != null && KEY_FORMAT.matcher(key).matches();
    }

    public IdempotencyCheck check(String key) {
        if (!isValidKey(key)) {
            return IdempotencyCheck.notDuplicate();
        }
        try {
            Optional<String> cached = cacheReadRetryTemplate.execute(ctx -> keyValueCache.get(CACHE_PREFIX + key));
            return cached.map(result -> new IdempotencyCheck(true, result))
                    .orElseGet(IdempotencyCheck::notDuplicate);
        } catch (RuntimeException e) {
            log.warn("Idempotency cache unavailable, falling back to storage: {}", e.getMessage());
            return IdempotencyCheck.notDuplicate();
        }
    }

    public void store(String key, String result) {
        store(key, result, properties.getIdempotency().getResultTtl());
    }

    public void store(String key, String result, Duration ttl) {
        if (!isValidKey(key) || result == null) {
            return;
        }
        try {
            keyValueCache.put(CACHE_PREFIX + key, result, ttl);
        } catch (RuntimeException e) {
            log.warn("Could not cache idempotency result for key {}: {}", key, e.getMessage());
        }
    }

    /**
     * Looks the key up in durable storage. Storage errors propagate.
     */
    public Optional<UUID> checkDuplicateByKey(String key) {
        if (!isValidKey(key)) {
            return Optional.empty();
        }
        return voteRecordRepository.findByIdempotencyKey(key).map(VoteRecord::getId);
    }
}
