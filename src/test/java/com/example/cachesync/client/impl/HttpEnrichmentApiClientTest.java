package com.example.cachesync.client.impl;

import com.example.cachesync.error.NetworkException;
import com.example.cachesync.error.SchemaException;
import com.example.cachesync.error.TransportCode;
import com.example.cachesync.error.UpstreamException;
import com.example.cachesync.model.Identifiers;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("HttpEnrichmentApiClient Tests")
class HttpEnrichmentApiClientTest {

    private static final String BASE_URL = "http://api.local";

    private MockRestServiceServer server;
    private HttpEnrichmentApiClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE_URL).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpEnrichmentApiClient(restTemplate, "America/Los_Angeles", "ML");
    }

    @Nested
    @DisplayName("Credential lookup")
    class CredentialLookup {

        @Test
        @DisplayName("Should return the token from the response")
        void shouldReturnToken() {
            // Given
            server.expect(requestTo(BASE_URL + "/token/p1"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("{\"token\":\"tok-1\"}", MediaType.APPLICATION_JSON));

            // When
            String token = client.fetchToken("p1");

            // Then
            assertThat(token).isEqualTo("tok-1");
            server.verify();
        }

        @Test
        @DisplayName("Should fail with a schema error when the token is missing")
        void shouldFailWhenTokenMissing() {
            server.expect(requestTo(BASE_URL + "/token/p1"))
                    .andRespond(withSuccess("{\"expiresIn\":3600}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.fetchToken("p1"))
                    .isInstanceOf(SchemaException.class)
                    .satisfies(e -> assertThat(((SchemaException) e).getAbsentAttributes()).containsExactly("token"));
        }

        @Test
        @DisplayName("Should translate a non-2xx status into an upstream error")
        void shouldTranslateStatus() {
            server.expect(requestTo(BASE_URL + "/token/p1"))
                    .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

            assertThatThrownBy(() -> client.fetchToken("p1"))
                    .isInstanceOf(UpstreamException.class)
                    .hasMessage("token lookup returned HTTP 401")
                    .satisfies(e -> assertThat(((UpstreamException) e).getStatus()).isEqualTo(401));
        }
    }

    @Nested
    @DisplayName("Activity lookups")
    class ActivityLookups {

        @Test
        @DisplayName("Should post the summary request with bearer credential")
        void shouldPostSummaryRequest() {
            // Given
            server.expect(requestTo(BASE_URL + "/summary"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok-1"))
                    .andExpect(content().json(
                            "{\"childId\":\"c1\",\"parentId\":\"p1\",\"timeZone\":\"America/Los_Angeles\",\"mode\":\"ML\"}"))
                    .andRespond(withSuccess("[{\"day\":1}]", MediaType.APPLICATION_JSON));

            // When
            JsonNode summary = client.fetchSummary(new Identifiers("p1", "c1"), "tok-1");

            // Then
            assertThat(summary.isArray()).isTrue();
            assertThat(summary.get(0).get("day").asInt()).isEqualTo(1);
            server.verify();
        }

        @Test
        @DisplayName("Should post the current-log request")
        void shouldPostCurrentLogsRequest() {
            server.expect(requestTo(BASE_URL + "/current-logs"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(content().json("{\"childId\":\"c1\",\"timeZone\":\"America/Los_Angeles\"}"))
                    .andRespond(withSuccess("{\"sleep\":[],\"feed\":[{\"ml\":90}],\"diaper\":[],\"pumping\":[]}",
                            MediaType.APPLICATION_JSON));

            JsonNode logs = client.fetchCurrentLogs("c1", "tok-1");

            assertThat(logs.get("feed")).hasSize(1);
        }

        @Test
        @DisplayName("Should surface server errors with their status")
        void shouldSurfaceServerErrors() {
            server.expect(requestTo(BASE_URL + "/current-logs"))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            assertThatThrownBy(() -> client.fetchCurrentLogs("c1", "tok-1"))
                    .isInstanceOf(UpstreamException.class)
                    .satisfies(e -> assertThat(((UpstreamException) e).getStatus()).isEqualTo(503));
        }

        @Test
        @DisplayName("Should translate I/O failures into network errors with a transport code")
        void shouldTranslateTimeouts() {
            server.expect(requestTo(BASE_URL + "/profile/c1"))
                    .andRespond(withException(new SocketTimeoutException("Read timed out")));

            assertThatThrownBy(() -> client.fetchProfile("c1", "tok-1"))
                    .isInstanceOf(NetworkException.class)
                    .satisfies(e -> assertThat(((NetworkException) e).getCode()).isEqualTo(TransportCode.TIMEOUT));
        }
    }
}
