package com.browserpilot.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StartSessionResponse(
    @JsonProperty("status") String status,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("message") String message,
    @JsonProperty("details") JsonNode details
) {}
