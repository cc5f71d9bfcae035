package com.example.cachesync.service;

import com.example.cachesync.cache.CacheStoreClient;
import com.example.cachesync.config.CacheSyncProperties;
import com.example.cachesync.error.NetworkException;
import com.example.cachesync.error.TransportCode;
import com.example.cachesync.model.CacheRecord;
import com.example.cachesync.model.DocumentFields;
import com.example.cachesync.model.EnrichmentResult;
import com.example.cachesync.model.FieldValue;
import com.example.cachesync.model.Identifiers;
import com.example.cachesync.model.PipelineMode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("CacheWriter Tests")
class CacheWriterTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private CacheStoreClient store;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private CacheSyncProperties properties;
    private CacheWriter writer;

    @BeforeEach
    void setUp() {
        properties = new CacheSyncProperties();
        writer = new CacheWriter(store, objectMapper, clock, properties);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private JsonNode storedValue(String key, long ttlSeconds) throws Exception {
        ArgumentCaptor<String> value = ArgumentCaptor.forClass(String.class);
        verify(store).set(eq(key), value.capture(), eq(Duration.ofSeconds(ttlSeconds)));
        return objectMapper.readTree(value.getValue());
    }

    @Nested
    @DisplayName("Activity records")
    class ActivityRecords {

        @Test
        @DisplayName("Should write summary, day log and combined records")
        void shouldWriteActivityRecords() throws Exception {
            // Given
            JsonNode summary = json("[{\"day\":1}]");
            JsonNode logs = json("{\"sleep\":[],\"feed\":[],\"diaper\":[],\"pumping\":[]}");
            long nowMillis = NOW.toEpochMilli();

            // When
            List<CacheRecord> written = writer.write(PipelineMode.ACTIVITY, "feedEvents",
                    new Identifiers("p1", "c1"), new EnrichmentResult.Activity(summary, logs));

            // Then
            assertThat(written).extracting(CacheRecord::key)
                    .containsExactly("summary:c1", "daylog:c1", "parent:p1:child:c1");

            JsonNode summaryValue = storedValue("summary:c1", 86_400);
            assertThat(summaryValue.get("data")).isEqualTo(summary);
            assertThat(summaryValue.get("expiresAt").asLong()).isEqualTo(nowMillis + 86_400_000L);

            JsonNode dayLog = storedValue("daylog:c1", 1_800);
            assertThat(dayLog.get("data")).isEqualTo(logs);
            assertThat(dayLog.get("expiresAt").asLong()).isEqualTo(nowMillis + 1_800_000L);

            JsonNode combined = storedValue("parent:p1:child:c1", 3_600);
            assertThat(combined.get("last7daySummary")).isEqualTo(summary);
            assertThat(combined.get("currentDayLogs")).isEqualTo(logs);
            assertThat(combined.get("lastUpdated").asText()).isEqualTo("2024-06-01T12:00:00Z");
            assertThat(combined.get("eventSource").asText()).isEqualTo("feedEvents");
            assertThat(combined.get("expiresAt").asLong()).isEqualTo(nowMillis + 3_600_000L);
        }

        @Test
        @DisplayName("Should write only the limited record for raw fields")
        void shouldWriteLimitedRecord() throws Exception {
            DocumentFields fields = DocumentFields.of(Map.of(
                    "childId", new FieldValue.StringValue("c1"),
                    "amount", new FieldValue.IntegerValue(90)));

            writer.write(PipelineMode.ACTIVITY, "feedEvents", Identifiers.childOnly("c1"),
                    new EnrichmentResult.Limited(fields));

            JsonNode limited = storedValue("limited:child:c1:feedEvents", 3_600);
            assertThat(limited.get("rawFields")).isEqualTo(json("{\"childId\":\"c1\",\"amount\":90}"));
            assertThat(limited.get("eventSource").asText()).isEqualTo("feedEvents");
            verifyNoMoreInteractions(store);
        }

        @Test
        @DisplayName("Should produce identical writes when the same event is written twice")
        void shouldBeIdempotent() throws Exception {
            EnrichmentResult result = new EnrichmentResult.Activity(json("[]"), json("{}"));
            Identifiers identifiers = new Identifiers("p1", "c1");

            List<CacheRecord> first = writer.write(PipelineMode.ACTIVITY, "feedEvents", identifiers, result);
            List<CacheRecord> second = writer.write(PipelineMode.ACTIVITY, "feedEvents", identifiers, result);

            assertThat(second).isEqualTo(first);
            verify(store, times(2)).set(eq("parent:p1:child:c1"), anyString(), eq(Duration.ofSeconds(3_600)));
        }
    }

    @Nested
    @DisplayName("Profile records")
    class ProfileRecords {

        @Test
        @DisplayName("Should write profile and profile-with-parent records")
        void shouldWriteProfileRecords() throws Exception {
            JsonNode profile = json("{\"name\":\"Ada\",\"dateOfBirth\":\"2024-01-01\",\"gender\":\"f\"}");

            writer.write(PipelineMode.PROFILE, "child_profile", new Identifiers("p1", "c1"),
                    new EnrichmentResult.Profile(profile));

            assertThat(storedValue("profile:c1", 86_400).get("data")).isEqualTo(profile);
            JsonNode withParent = storedValue("profile:parent:p1:child:c1", 86_400);
            assertThat(withParent.get("profile")).isEqualTo(profile);
            assertThat(withParent.get("eventSource").asText()).isEqualTo("child_profile");
        }

        @Test
        @DisplayName("Should refuse a result that does not match the mode")
        void shouldRefuseMismatchedMode() throws Exception {
            EnrichmentResult profile = new EnrichmentResult.Profile(json("{}"));

            assertThatThrownBy(() -> writer.write(PipelineMode.ACTIVITY, "feedEvents",
                    new Identifiers("p1", "c1"), profile))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Should prefix every key in test mode")
    void shouldPrefixKeysInTestMode() throws Exception {
        properties.getCache().setTestMode(true);
        CacheWriter prefixed = new CacheWriter(store, objectMapper, clock, properties);

        List<CacheRecord> written = prefixed.write(PipelineMode.ACTIVITY, "feedEvents",
                new Identifiers("p1", "c1"), new EnrichmentResult.Activity(json("[]"), json("{}")));

        assertThat(written).extracting(CacheRecord::key)
                .allMatch(key -> key.startsWith("TEST_"))
                .contains("TEST_parent:p1:child:c1");
    }

    @Test
    @DisplayName("Should prefix keys of test collections while live collections stay unprefixed")
    void shouldPrefixOnlyTestCollections() throws Exception {
        // Given
        EnrichmentResult.Activity result = new EnrichmentResult.Activity(json("[]"), json("{}"));
        Identifiers identifiers = new Identifiers("p1", "c1");

        // When
        List<CacheRecord> test = writer.write(PipelineMode.ACTIVITY, "testEvents", identifiers, result);
        List<CacheRecord> live = writer.write(PipelineMode.ACTIVITY, "feedEvents", identifiers, result);

        // Then
        assertThat(test).extracting(CacheRecord::key)
                .containsExactly("TEST_summary:c1", "TEST_daylog:c1", "TEST_parent:p1:child:c1");
        assertThat(live).extracting(CacheRecord::key)
                .containsExactly("summary:c1", "daylog:c1", "parent:p1:child:c1");
    }

    @Test
    @DisplayName("Should propagate a store failure")
    void shouldPropagateStoreFailure() throws Exception {
        doThrow(new NetworkException("Cache store unavailable", TransportCode.CONNECTION_REFUSED, null))
                .when(store).set(eq("summary:c1"), anyString(), eq(Duration.ofSeconds(86_400)));

        assertThatThrownBy(() -> writer.write(PipelineMode.ACTIVITY, "feedEvents",
                new Identifiers("p1", "c1"), new EnrichmentResult.Activity(json("[]"), json("{}"))))
                .isInstanceOf(NetworkException.class);
    }
}
