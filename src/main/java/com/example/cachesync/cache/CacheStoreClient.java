package com.example.cachesync.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value store holding materialized records.
 */
public interface CacheStoreClient {

    /**
     * Atomically sets {@code key} to {@code value} with the given time to live.
     */
    void set(String key, String value, Duration ttl);

    Optional<String> get(String key);

    boolean exists(String key);

    /**
     * Remaining time to live, empty when the key does not exist or never expires.
     */
    Optional<Duration> ttl(String key);

    /**
     * Up to {@code limit} keys starting with {@code prefix}, found by incremental scan.
     */
    List<String> keys(String prefix, int limit);
}
