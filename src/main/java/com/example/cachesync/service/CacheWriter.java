package com.example.cachesync.service;

import com.example.cachesync.cache.CacheKeys;
import com.example.cachesync.cache.CacheStoreClient;
import com.example.cachesync.config.CacheSyncProperties;
import com.example.cachesync.error.UnclassifiedException;
import com.example.cachesync.model.CacheRecord;
import com.example.cachesync.model.EnrichmentResult;
import com.example.cachesync.model.Identifiers;
import com.example.cachesync.model.PipelineMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materializes an enrichment result into cache records. Each key is written independently;
 * a failure part-way leaves earlier keys in place and the redelivered event overwrites them.
 */
@Slf4j
@Service
public class CacheWriter {

    static final long SUMMARY_TTL = 86_400;
    static final long DAY_LOG_TTL = 1_800;
    static final long COMBINED_TTL = 3_600;
    static final long PROFILE_TTL = 86_400;

    private final CacheStoreClient store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CacheSyncProperties properties;
    private final CacheKeys liveKeys;
    private final CacheKeys testKeys;

    public CacheWriter(CacheStoreClient store, ObjectMapper objectMapper, Clock clock, CacheSyncProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
        this.liveKeys = new CacheKeys(properties.getCache().keyPrefix());
        this.testKeys = new CacheKeys(properties.getCache().getTestPrefix());
    }

    public List<CacheRecord> write(PipelineMode mode, String collectionName, Identifiers identifiers,
                                   EnrichmentResult result) {
        List<CacheRecord> records = recordsFor(mode, collectionName, identifiers, result);
        for (CacheRecord record : records) {
            store.set(record.key(), serialize(record), Duration.ofSeconds(record.ttlSeconds()));
        }
        log.info("Wrote {} cache record(s) for child {}", records.size(), identifiers.childId());
        return records;
    }

    List<CacheRecord> recordsFor(PipelineMode mode, String collectionName, Identifiers identifiers,
                                 EnrichmentResult result) {
        String childId = identifiers.childId();
        CacheKeys keys = keysFor(collectionName);
        List<CacheRecord> records = new ArrayList<>();
        if (result instanceof EnrichmentResult.Profile profile) {
            requireMode(mode, PipelineMode.PROFILE, result);
            records.add(new CacheRecord(keys.profile(childId), envelope(profile.profileRecord(), PROFILE_TTL), PROFILE_TTL));
            if (identifiers.hasParent()) {
                Map<String, Object> value = new LinkedHashMap<>();
                value.put("profile", profile.profileRecord());
                records.add(new CacheRecord(keys.profileWithParent(identifiers.parentId(), childId),
                        stamped(value, collectionName, PROFILE_TTL), PROFILE_TTL));
            }
        } else if (result instanceof EnrichmentResult.Activity activity) {
            requireMode(mode, PipelineMode.ACTIVITY, result);
            records.add(new CacheRecord(keys.summary(childId), envelope(activity.summary(), SUMMARY_TTL), SUMMARY_TTL));
            records.add(new CacheRecord(keys.dayLog(childId), envelope(activity.currentLogs(), DAY_LOG_TTL), DAY_LOG_TTL));
            if (identifiers.hasParent()) {
                Map<String, Object> value = new LinkedHashMap<>();
                value.put("last7daySummary", activity.summary());
                value.put("currentDayLogs", activity.currentLogs());
                records.add(new CacheRecord(keys.combined(identifiers.parentId(), childId),
                        stamped(value, collectionName, COMBINED_TTL), COMBINED_TTL));
            }
        } else if (result instanceof EnrichmentResult.Limited limited) {
            requireMode(mode, PipelineMode.ACTIVITY, result);
            Map<String, Object> value = new LinkedHashMap<>();
            value.put("rawFields", limited.rawFields().toPlainMap());
            records.add(new CacheRecord(keys.limited(childId, collectionName),
                    stamped(value, collectionName, COMBINED_TTL), COMBINED_TTL));
        }
        return records;
    }

    private Map<String, Object> envelope(Object data, long ttlSeconds) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("data", data);
        value.put("expiresAt", expiresAt(ttlSeconds));
        return value;
    }

    // test collections never share keys with live data
    private CacheKeys keysFor(String collectionName) {
        return properties.isTestCollection(collectionName) ? testKeys : liveKeys;
    }

    private Map<String, Object> stamped(Map<String, Object> value, String collectionName, long ttlSeconds) {
        value.put("lastUpdated", Instant.now(clock).toString());
        value.put("eventSource", collectionName);
        value.put("expiresAt", expiresAt(ttlSeconds));
        return value;
    }

    private long expiresAt(long ttlSeconds) {
        return clock.millis() + ttlSeconds * 1000;
    }

    private String serialize(CacheRecord record) {
        try {
            return objectMapper.writeValueAsString(record.value());
        } catch (JsonProcessingException e) {
            throw new UnclassifiedException("Could not serialize cache record " + record.key(), e);
        }
    }

    private static void requireMode(PipelineMode mode, PipelineMode expected, EnrichmentResult result) {
        if (mode != expected) {
            throw new IllegalArgumentException(result.getClass().getSimpleName()
                    + " result cannot be written in " + mode + " mode");
        }
    }
}
