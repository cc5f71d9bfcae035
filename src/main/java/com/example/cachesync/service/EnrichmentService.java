package com.example.cachesync.service;

import com.example.cachesync.client.EnrichmentApiClient;
import com.example.cachesync.client.impl.MockEnrichmentApiClient;
import com.example.cachesync.config.CacheSyncProperties;
import com.example.cachesync.error.PipelineException;
import com.example.cachesync.error.SchemaException;
import com.example.cachesync.error.ValidationException;
import com.example.cachesync.model.DocumentFields;
import com.example.cachesync.model.EnrichmentResult;
import com.example.cachesync.model.Identifiers;
import com.example.cachesync.model.PipelineMode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Gathers the auxiliary data a changed document is materialized with.
 */
@Slf4j
@Service
public class EnrichmentService {

    static final List<String> REQUIRED_PROFILE_ATTRIBUTES = List.of("name", "dateOfBirth", "gender");
    static final List<String> LOG_CATEGORIES = List.of("sleep", "feed", "diaper", "pumping");

    private final EnrichmentApiClient apiClient;
    private final MockEnrichmentApiClient cannedClient;
    private final CacheSyncProperties properties;
    private final Executor executor;
    private final ObjectMapper objectMapper;
    private final Duration callTimeout;

    public EnrichmentService(EnrichmentApiClient apiClient,
                             MockEnrichmentApiClient cannedClient,
                             CacheSyncProperties properties,
                             @Qualifier("enrichmentExecutor") Executor executor,
                             ObjectMapper objectMapper,
                             @Value("${cache-sync.enrichment.call-timeout:15s}") Duration callTimeout) {
        this.apiClient = apiClient;
        this.cannedClient = cannedClient;
        this.properties = properties;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.callTimeout = callTimeout;
    }

    public EnrichmentResult enrich(String collectionName, PipelineMode mode, Identifiers identifiers,
                                   DocumentFields fields) {
        EnrichmentApiClient client = clientFor(collectionName);
        if (mode == PipelineMode.PROFILE) {
            return enrichProfile(client, identifiers);
        }
        return enrichActivity(client, collectionName, identifiers, fields);
    }

    private EnrichmentApiClient clientFor(String collectionName) {
        if (properties.isTestCollection(collectionName)) {
            log.debug("Using canned enrichment data for test collection {}", collectionName);
            return cannedClient;
        }
        return apiClient;
    }

    private EnrichmentResult enrichProfile(EnrichmentApiClient client, Identifiers identifiers) {
        if (!identifiers.hasParent()) {
            throw new ValidationException("profile requires parentId");
        }
        String token = client.fetchToken(identifiers.parentId());
        JsonNode profile = client.fetchProfile(identifiers.childId(), token);
        List<String> absent = absentProfileAttributes(profile);
        if (!absent.isEmpty()) {
            throw new SchemaException("Profile for child " + identifiers.childId()
                    + " lacks attributes " + absent, absent);
        }
        log.info("Profile retrieved for child {}", identifiers.childId());
        return new EnrichmentResult.Profile(profile);
    }

    private EnrichmentResult enrichActivity(EnrichmentApiClient client, String collectionName,
                                            Identifiers identifiers, DocumentFields fields) {
        Optional<String> token = identifiers.parent().flatMap(parentId -> tryFetchToken(client, parentId));
        if (token.isEmpty()) {
            log.warn("No credential for child {} in {}, caching raw fields only", identifiers.childId(), collectionName);
            return new EnrichmentResult.Limited(fields);
        }

        CompletableFuture<JsonNode> summary = withFallback("summary",
                () -> client.fetchSummary(identifiers, token.get()), this::emptySummary);
        CompletableFuture<JsonNode> currentLogs = withFallback("current logs",
                () -> client.fetchCurrentLogs(identifiers.childId(), token.get()), this::emptyLogs);
        CompletableFuture.allOf(summary, currentLogs).join();

        log.info("Activity data gathered for child {}", identifiers.childId());
        return new EnrichmentResult.Activity(summary.join(), currentLogs.join());
    }

    private Optional<String> tryFetchToken(EnrichmentApiClient client, String parentId) {
        try {
            return Optional.of(client.fetchToken(parentId));
        } catch (PipelineException e) {
            log.warn("Credential lookup for parent {} failed, continuing without it: {}", parentId, e.getMessage());
            return Optional.empty();
        }
    }

    private CompletableFuture<JsonNode> withFallback(String name, Supplier<JsonNode> call, Supplier<JsonNode> fallback) {
        CompletableFuture<JsonNode> lookup;
        try {
            lookup = CompletableFuture.supplyAsync(call, executor);
        } catch (RejectedExecutionException e) {
            log.warn("{} lookup rejected by the enrichment pool, using empty default: {}", name, e.getMessage());
            return CompletableFuture.completedFuture(fallback.get());
        }
        return lookup
                .orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(result -> result != null ? result : fallback.get())
                .exceptionally(error -> {
                    log.warn("{} lookup failed, using empty default: {}", name, error.getMessage());
                    return fallback.get();
                });
    }

    private List<String> absentProfileAttributes(JsonNode profile) {
        List<String> absent = new ArrayList<>();
        for (String attribute : REQUIRED_PROFILE_ATTRIBUTES) {
            if (profile == null || !profile.hasNonNull(attribute)) {
                absent.add(attribute);
            }
        }
        return absent;
    }

    private JsonNode emptySummary() {
        return objectMapper.createArrayNode();
    }

    private JsonNode emptyLogs() {
        ObjectNode logs = objectMapper.createObjectNode();
        LOG_CATEGORIES.forEach(logs::putArray);
        return logs;
    }
}
