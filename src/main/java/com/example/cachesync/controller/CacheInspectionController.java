package com.example.cachesync.controller;

import com.example.cachesync.cache.CacheStoreClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of cache keys for operators.
 */
@Slf4j
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheInspectionController {

    static final int MAX_LISTED_KEYS = 1000;

    private final CacheStoreClient store;
    private final ObjectMapper objectMapper;

    @GetMapping("/{key}")
    public ResponseEntity<Map<String, Object>> inspect(@PathVariable String key) {
        log.info("Cache inspection requested for {}", key);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("key", key);
        if (!store.exists(key)) {
            body.put("exists", false);
            return ResponseEntity.status(404).body(body);
        }
        body.put("exists", true);
        body.put("ttlSeconds", store.ttl(key).map(Duration::toSeconds).orElse(-1L));
        body.put("value", store.get(key).map(this::readValue).orElse(null));
        return ResponseEntity.ok(body);
    }

    /**
     * Lists keys under a prefix, by default the test-data prefix.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam(defaultValue = "TEST_") String prefix,
                                                    @RequestParam(defaultValue = "100") int limit) {
        if (limit < 1 || limit > MAX_LISTED_KEYS) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "limit must be between 1 and " + MAX_LISTED_KEYS));
        }
        List<String> keys = store.keys(prefix, limit);
        log.info("Cache listing for prefix {} found {} key(s)", prefix, keys.size());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prefix", prefix);
        body.put("count", keys.size());
        body.put("keys", keys);
        return ResponseEntity.ok(body);
    }

    private Object readValue(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return raw;
        }
    }
}
