package com.example.cachesync.config;

import com.example.cachesync.model.PipelineMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline configuration bound from {@code cache-sync.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "cache-sync")
public class CacheSyncProperties {

    /**
     * Collection name to processing mode. Collections not listed are processed as activity data.
     */
    private Map<String, PipelineMode> collections = new LinkedHashMap<>(Map.of(
            "child_profile", PipelineMode.PROFILE,
            "child_questionnaire", PipelineMode.PROFILE));

    /**
     * Substrings that mark an event or error as originating from test data.
     */
    private List<String> testMarkers = new ArrayList<>(List.of("test-parent-123", "test-child-456", "test"));

    /**
     * Collections served with canned enrichment data and written under the test prefix, while
     * every other collection stays live.
     */
    private List<String> testCollections = new ArrayList<>(List.of("testEvents"));

    private Cache cache = new Cache();

    public PipelineMode modeFor(String collectionName) {
        if (collectionName == null) {
            return PipelineMode.ACTIVITY;
        }
        return collections.getOrDefault(collectionName, PipelineMode.ACTIVITY);
    }

    public boolean isTestCollection(String collectionName) {
        return collectionName != null && testCollections.contains(collectionName);
    }

    @Getter
    @Setter
    public static class Cache {

        /**
         * When true every key is written under {@link #testPrefix}.
         */
        private boolean testMode = false;

        private String testPrefix = "TEST_";

        public String keyPrefix() {
            return testMode ? testPrefix : "";
        }
    }
}
