package com.example.cachesync.client.impl;

import com.example.cachesync.client.EnrichmentApiClient;
import com.example.cachesync.error.NetworkException;
import com.example.cachesync.error.SchemaException;
import com.example.cachesync.error.TransportCode;
import com.example.cachesync.error.UnclassifiedException;
import com.example.cachesync.error.UpstreamException;
import com.example.cachesync.model.Identifiers;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Slf4j
@Service
@Primary
@Profile("!mock")
public class HttpEnrichmentApiClient implements EnrichmentApiClient {

    private final RestTemplate restTemplate;
    private final String timeZone;
    private final String summaryMode;

    public HttpEnrichmentApiClient(@Qualifier("enrichmentRestTemplate") RestTemplate restTemplate,
                                   @Value("${cache-sync.api.time-zone:America/Los_Angeles}") String timeZone,
                                   @Value("${cache-sync.api.summary-mode:ML}") String summaryMode) {
        this.restTemplate = restTemplate;
        this.timeZone = timeZone;
        this.summaryMode = summaryMode;
    }

    @Override
    public String fetchToken(String parentId) {
        log.info("Fetching credential for parent {}", parentId);
        JsonNode body = call("token lookup", () -> restTemplate.exchange(
                "/token/{parentId}", HttpMethod.GET, new HttpEntity<>(jsonHeaders()), JsonNode.class, parentId).getBody());
        if (body == null || !body.hasNonNull("token") || body.get("token").asText().isEmpty()) {
            throw new SchemaException("Token response for parent " + parentId + " has no token", List.of("token"));
        }
        log.info("Credential retrieved for parent {}", parentId);
        return body.get("token").asText();
    }

    @Override
    public JsonNode fetchSummary(Identifiers identifiers, String token) {
        log.info("Fetching summary for parent {}, child {}", identifiers.parentId(), identifiers.childId());
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("childId", identifiers.childId());
        request.put("parentId", identifiers.parentId());
        request.put("timeZone", timeZone);
        request.put("mode", summaryMode);
        return call("summary lookup", () -> restTemplate.postForObject(
                "/summary", new HttpEntity<>(request, bearerHeaders(token)), JsonNode.class));
    }

    @Override
    public JsonNode fetchCurrentLogs(String childId, String token) {
        log.info("Fetching current logs for child {}", childId);
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("childId", childId);
        request.put("timeZone", timeZone);
        return call("current-log lookup", () -> restTemplate.postForObject(
                "/current-logs", new HttpEntity<>(request, bearerHeaders(token)), JsonNode.class));
    }

    @Override
    public JsonNode fetchProfile(String childId, String token) {
        log.info("Fetching profile for child {}", childId);
        return call("profile lookup", () -> restTemplate.exchange(
                "/profile/{childId}", HttpMethod.GET, new HttpEntity<>(bearerHeaders(token)), JsonNode.class, childId)
                .getBody());
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpStatusCodeException e) {
            log.error("{} failed: {} - {}", operation, e.getStatusCode(), e.getResponseBodyAsString());
            throw new UpstreamException(operation, e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.error("{} failed before a response was received: {}", operation, e.getMessage());
            throw new NetworkException(operation + " failed: " + e.getMessage(), TransportCode.detect(e), e);
        } catch (RestClientException e) {
            log.error("{} failed: {}", operation, e.getMessage());
            throw new UnclassifiedException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private HttpHeaders bearerHeaders(String token) {
        HttpHeaders headers = jsonHeaders();
        headers.setBearerAuth(token);
        return headers;
    }
}
