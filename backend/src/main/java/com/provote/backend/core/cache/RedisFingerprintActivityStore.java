package com.provote.backend.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.provote.backend.dto.ActivitySnapshot;
import com.provote.backend.dto.FingerprintAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis layout for a key {@code fp:activity:<fp>:<poll>}:
 * <ul>
 *   <li>{@code <key>} hash, field {@code count} incremented with HINCRBY</li>
 *   <li>{@code <key>:users} and {@code <key>:ips} sets filled with SADD</li>
 *   <li>{@code <key>:analysis} string holding the deep-analysis JSON</li>
 * </ul>
 * A merge runs inside MULTI/EXEC, so the server applies it as one unit.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisFingerprintActivityStore implements FingerprintActivityStore {

    private static final String COUNT_FIELD = "count";
    private static final String USERS_SUFFIX = ":users";
    private static final String IPS_SUFFIX = ":ips";
    private static final String ANALYSIS_SUFFIX = ":analysis";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void merge(String key, String userId, String ipAddress, Duration ttl) {
        redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForHash().increment(key, COUNT_FIELD, 1);
                if (userId != null) {
                    ops.opsForSet().add(key + USERS_SUFFIX, userId);
                }
                if (ipAddress != null) {
                    ops.opsForSet().add(key + IPS_SUFFIX, ipAddress);
                }
                ops.expire(key, ttl);
                ops.expire(key + USERS_SUFFIX, ttl);
                ops.expire(key + IPS_SUFFIX, ttl);
                return ops.exec();
            }
        });
    }

    @Override
    public Optional<ActivitySnapshot> read(String key) {
        Object rawCount = redisTemplate.opsForHash().get(key, COUNT_FIELD);
        if (rawCount == null) {
            return Optional.empty();
        }
        Set<String> users = redisTemplate.opsForSet().members(key + USERS_SUFFIX);
        Set<String> ips = redisTemplate.opsForSet().members(key + IPS_SUFFIX);
        FingerprintAnalysis analysis = readAnalysis(key + ANALYSIS_SUFFIX);
        return Optional.of(new ActivitySnapshot(Long.parseLong(rawCount.toString()), users, ips, analysis));
    }

    @Override
    public void putAnalysis(String key, FingerprintAnalysis analysis, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key + ANALYSIS_SUFFIX, objectMapper.writeValueAsString(analysis), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize fingerprint analysis", e);
        }
    }

    private FingerprintAnalysis readAnalysis(String analysisKey) {
        String json = redisTemplate.opsForValue().get(analysisKey);
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, FingerprintAnalysis.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable fingerprint analysis at {}: {}", analysisKey, e.getMessage());
            return null;
        }
    }
}
