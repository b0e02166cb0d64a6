package com.browserpilot.client;

import com.browserpilot.core.model.StepResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentStepResponse(
    @JsonProperty("status") String status,
    @JsonProperty("message") String message,
    @JsonProperty("steps_completed") Integer stepsCompleted,
    @JsonProperty("current_url") String currentUrl,
    @JsonProperty("screenshot_path") String screenshotPath,
    @JsonProperty("details") JsonNode details,
    @JsonProperty("is_complete") Boolean isComplete
) {

    public StepResult toStepResult() {
        return new StepResult(status, message, stepsCompleted != null ? stepsCompleted : 0,
                Boolean.TRUE.equals(isComplete), currentUrl, screenshotPath, details);
    }
}
