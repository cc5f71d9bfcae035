package com.example.cachesync.client;

import com.example.cachesync.model.Identifiers;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outbound calls to the data API used to enrich a changed document.
 * Implementations must not retry internally; retries happen by broker redelivery.
 */
public interface EnrichmentApiClient {

    /**
     * {@code GET /token/{parentId}}.
     *
     * @return the bearer credential scoped to the parent
     */
    String fetchToken(String parentId);

    /**
     * {@code POST /summary} for the multi-day aggregate.
     */
    JsonNode fetchSummary(Identifiers identifiers, String token);

    /**
     * {@code POST /current-logs}: {@code {sleep, feed, diaper, pumping}} for the current period.
     */
    JsonNode fetchCurrentLogs(String childId, String token);

    /**
     * {@code GET /profile/{childId}}.
     */
    JsonNode fetchProfile(String childId, String token);
}
