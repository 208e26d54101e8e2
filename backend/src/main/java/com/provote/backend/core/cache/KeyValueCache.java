package com.provote.backend.core.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Volatile key/value cache. Entries may disappear at any time, so nothing
 * stored here may be the only copy of a fact.
 */
public interface KeyValueCache {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);
}
