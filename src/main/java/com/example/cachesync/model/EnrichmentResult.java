package com.example.cachesync.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Output of the enrichment stage. Exactly one variant is produced per processed event.
 */
public sealed interface EnrichmentResult permits EnrichmentResult.Activity,
        EnrichmentResult.Profile, EnrichmentResult.Limited {

    /**
     * Multi-day summary plus the current period's logs.
     */
    record Activity(JsonNode summary, JsonNode currentLogs) implements EnrichmentResult {
    }

    record Profile(JsonNode profileRecord) implements EnrichmentResult {
    }

    /**
     * Degraded result when no credential is available: the decoded fields as-is.
     */
    record Limited(DocumentFields rawFields) implements EnrichmentResult {
    }
}
