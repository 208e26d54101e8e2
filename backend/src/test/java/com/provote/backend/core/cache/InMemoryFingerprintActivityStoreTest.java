package com.provote.backend.core.cache;

import com.provote.backend.dto.ActivitySnapshot;
import com.provote.backend.dto.FingerprintAnalysis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("InMemoryFingerprintActivityStore")
class InMemoryFingerprintActivityStoreTest {

    private static final Duration TTL = Duration.ofHours(1);

    @Test
    @DisplayName("Merges count, users and addresses")
    void mergesObservations() {
        InMemoryFingerprintActivityStore store = new InMemoryFingerprintActivityStore(Clock.systemUTC());

        store.merge("k", "user-1", "10.0.0.1", TTL);
        store.merge("k", "user-2", "10.0.0.1", TTL);
        store.merge("k", null, "10.0.0.2", TTL);

        ActivitySnapshot snapshot = store.read("k").orElseThrow();
        assertThat(snapshot.totalCount()).isEqualTo(3);
        assertThat(snapshot.userIds()).containsExactlyInAnyOrder("user-1", "user-2");
        assertThat(snapshot.ipCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Concurrent observations never lose an increment or a member")
    void concurrentMerges() throws Exception {
        InMemoryFingerprintActivityStore store = new InMemoryFingerprintActivityStore(Clock.systemUTC());
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    store.merge("k", "user-" + thread, "10.0." + thread + "." + (i % 5), TTL);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        ActivitySnapshot snapshot = store.read("k").orElseThrow();
        assertThat(snapshot.totalCount()).isEqualTo((long) threads * perThread);
        assertThat(snapshot.userCount()).isEqualTo(threads);
        assertThat(snapshot.ipCount()).isEqualTo(threads * 5);
    }

    @Test
    @DisplayName("Expired entries read as absent and restart from zero")
    void expiry() {
        Clock clock = mock(Clock.class);
        Instant start = Instant.parse("2024-05-01T10:00:00Z");
        when(clock.instant()).thenReturn(start);
        InMemoryFingerprintActivityStore store = new InMemoryFingerprintActivityStore(clock);
        store.merge("k", "user-1", "10.0.0.1", TTL);

        when(clock.instant()).thenReturn(start.plus(TTL).plusSeconds(1));

        assertThat(store.read("k")).isEmpty();
        store.merge("k", "user-2", null, TTL);
        assertThat(store.read("k").orElseThrow().totalCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Analysis is kept next to the counters")
    void analysis() {
        InMemoryFingerprintActivityStore store = new InMemoryFingerprintActivityStore(Clock.systemUTC());
        store.merge("k", "user-1", "10.0.0.1", TTL);
        FingerprintAnalysis analysis = new FingerprintAnalysis(3, 1, 1, List.of(), 0,
                LocalDateTime.now(ZoneOffset.UTC));

        store.putAnalysis("k", analysis, TTL);

        ActivitySnapshot snapshot = store.read("k").orElseThrow();
        assertThat(snapshot.analysis()).isEqualTo(analysis);
        assertThat(snapshot.totalCount()).isEqualTo(1);
    }
}
