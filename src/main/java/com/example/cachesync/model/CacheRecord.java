package com.example.cachesync.model;

/**
 * A single key written to the cache store. Writing the same key again overwrites it.
 */
public record CacheRecord(String key, Object value, long ttlSeconds) {
}
