package com.provote.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.provote.backend.core.cache.FingerprintActivityStore;
import com.provote.backend.core.cache.InMemoryFingerprintActivityStore;
import com.provote.backend.core.cache.InMemoryKeyValueCache;
import com.provote.backend.core.cache.KeyValueCache;
import com.provote.backend.core.cache.RedisFingerprintActivityStore;
import com.provote.backend.core.cache.RedisKeyValueCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Chooses the cache backend from {@code provote.cache.type}: {@code redis}
 * (default, shared between instances) or {@code memory} (single node).
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Configuration
    @ConditionalOnProperty(name = "provote.cache.type", havingValue = "redis", matchIfMissing = true)
    static class RedisCacheConfig {

        @Bean
        public KeyValueCache keyValueCache(StringRedisTemplate redisTemplate) {
            log.info("Using Redis for idempotency results and fingerprint activity");
            return new RedisKeyValueCache(redisTemplate);
        }

        @Bean
        public FingerprintActivityStore fingerprintActivityStore(StringRedisTemplate redisTemplate,
                                                                 ObjectMapper objectMapper) {
            return new RedisFingerprintActivityStore(redisTemplate, objectMapper);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "provote.cache.type", havingValue = "memory")
    static class InMemoryCacheConfig {

        @Bean
        public KeyValueCache keyValueCache(Clock clock) {
            log.warn("Using in-memory caches; activity counters are not shared between instances");
            return new InMemoryKeyValueCache(clock);
        }

        @Bean
        public FingerprintActivityStore fingerprintActivityStore(Clock clock) {
            return new InMemoryFingerprintActivityStore(clock);
        }
    }
}
