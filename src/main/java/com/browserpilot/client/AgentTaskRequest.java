package com.browserpilot.client;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AgentTaskRequest(
    @JsonProperty("task") String task,
    @JsonProperty("start_url") String startUrl,
    @JsonProperty("interactive") boolean interactive,
    @JsonProperty("max_steps") int maxSteps,
    @JsonProperty("headless") boolean headless,
    @JsonProperty("browser_type") String browserType
) {}
