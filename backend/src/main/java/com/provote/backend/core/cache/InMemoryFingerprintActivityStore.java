package com.provote.backend.core.cache;

import com.provote.backend.dto.ActivitySnapshot;
import com.provote.backend.dto.FingerprintAnalysis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process activity store. {@link ConcurrentHashMap#compute} runs the merge
 * under the bin lock of the key, and entries are immutable, so a reader never
 * sees a half-applied observation.
 */
public class InMemoryFingerprintActivityStore implements FingerprintActivityStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryFingerprintActivityStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void merge(String key, String userId, String ipAddress, Duration ttl) {
        Instant now = clock.instant();
        entries.compute(key, (k, current) -> {
            Entry base = (current == null || current.isExpired(now)) ? Entry.EMPTY : current;
            Set<String> users = new HashSet<>(base.userIds());
            Set<String> ips = new HashSet<>(base.ipAddresses());
            if (userId != null) users.add(userId);
            if (ipAddress != null) ips.add(ipAddress);
            return new Entry(base.count() + 1, Set.copyOf(users), Set.copyOf(ips), base.analysis(), now.plus(ttl));
        });
    }

    @Override
    public Optional<ActivitySnapshot> read(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(new ActivitySnapshot(entry.count(), entry.userIds(), entry.ipAddresses(), entry.analysis()));
    }

    @Override
    public void putAnalysis(String key, FingerprintAnalysis analysis, Duration ttl) {
        Instant now = clock.instant();
        entries.compute(key, (k, current) -> {
            Entry base = (current == null || current.isExpired(now)) ? Entry.EMPTY : current;
            return new Entry(base.count(), base.userIds(), base.ipAddresses(), analysis, now.plus(ttl));
        });
    }

    public void clear() {
        entries.clear();
    }

    private record Entry(long count, Set<String> userIds, Set<String> ipAddresses,
                         FingerprintAnalysis analysis, Instant expiresAt) {

        static final Entry EMPTY = new Entry(0, Set.of(), Set.of(), null, Instant.MAX);

        boolean isExpired(Instant now) {
            return expiresAt.isBefore(now);
        }
    }
}
