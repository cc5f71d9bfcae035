package com.example.cachesync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Structured-mode change-event envelope as published on the change topics.
 * {@code data} is either a JSON object or a base64 string carrying binary data.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CloudEventEnvelope {

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    private String type;

    @JsonProperty("subject")
    private String subject;

    @JsonProperty("deliveryAttempt")
    private Integer deliveryAttempt;

    @JsonProperty("dataContentType")
    private String dataContentType;

    @JsonProperty("data")
    private JsonNode data;
}
