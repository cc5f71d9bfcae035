package com.example.cachesync.client.impl;

import com.example.cachesync.client.EnrichmentApiClient;
import com.example.cachesync.model.Identifiers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Canned enrichment data. Serves the configured test collections in every environment, and
 * replaces the data API entirely under the {@code mock} profile.
 */
@Slf4j
@Service
public class MockEnrichmentApiClient implements EnrichmentApiClient {

    static final String MOCK_TOKEN = "mock-token";

    private final ObjectMapper objectMapper;
    private final AtomicInteger callCount = new AtomicInteger(0);

    public MockEnrichmentApiClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String fetchToken(String parentId) {
        log.info("MOCK API call #{} - token for parent {}", callCount.incrementAndGet(), parentId);
        return MOCK_TOKEN;
    }

    @Override
    public JsonNode fetchSummary(Identifiers identifiers, String token) {
        log.info("MOCK API call #{} - summary for child {}", callCount.incrementAndGet(), identifiers.childId());
        ArrayNode days = objectMapper.createArrayNode();
        for (int day = 0; day < 7; day++) {
            ObjectNode entry = days.addObject();
            entry.put("dayOffset", -day);
            entry.put("feedCount", 8);
            entry.put("sleepMinutes", 840);
            entry.put("diaperCount", 6);
        }
        return days;
    }

    @Override
    public JsonNode fetchCurrentLogs(String childId, String token) {
        log.info("MOCK API call #{} - current logs for child {}", callCount.incrementAndGet(), childId);
        ObjectNode logs = objectMapper.createObjectNode();
        logs.putArray("sleep").addObject().put("durationMinutes", 95);
        logs.putArray("feed").addObject().put("amountMl", 120);
        logs.putArray("diaper").addObject().put("kind", "wet");
        logs.putArray("pumping");
        return logs;
    }

    @Override
    public JsonNode fetchProfile(String childId, String token) {
        log.info("MOCK API call #{} - profile for child {}", callCount.incrementAndGet(), childId);
        ObjectNode profile = objectMapper.createObjectNode();
        profile.put("childId", childId);
        profile.put("name", "Mock Child");
        profile.put("dateOfBirth", "2024-01-15");
        profile.put("gender", "unspecified");
        return profile;
    }

    public int getCallCount() {
        return callCount.get();
    }
}
