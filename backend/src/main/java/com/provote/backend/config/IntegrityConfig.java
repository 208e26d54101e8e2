package com.provote.backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(IntegrityProperties.class)
public class IntegrityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    // Bounded retries for best-effort cache reads; writes are never retried
    @Bean
    public RetryTemplate cacheReadRetryTemplate(IntegrityProperties properties) {
        IntegrityProperties.Cache cache = properties.getCache();
        return RetryTemplate.builder()
                .maxAttempts(cache.getReadAttempts())
                .fixedBackoff(Math.max(1L, cache.getReadBackoff().toMillis()))
                .retryOn(DataAccessException.class)
                .build();
    }
}
