package com.browserpilot.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSessionStatus(
    @JsonProperty("status") String status,
    @JsonProperty("task") String task,
    @JsonProperty("current_step") Integer currentStep,
    @JsonProperty("current_url") String currentUrl,
    @JsonProperty("memory_summary") JsonNode memorySummary,
    @JsonProperty("is_complete") Boolean isComplete
) {}
