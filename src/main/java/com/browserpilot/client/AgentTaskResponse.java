package com.browserpilot.client;

import com.browserpilot.core.model.TaskResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Answer to an agent task execution. Interactive runs return only a
 * {@code session_id}; other runs return the final outcome.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentTaskResponse(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("status") String status,
    @JsonProperty("message") String message,
    @JsonProperty("details") JsonNode details,
    @JsonProperty("steps_completed") Integer stepsCompleted,
    @JsonProperty("final_url") String finalUrl,
    @JsonProperty("screenshot_path") String screenshotPath,
    @JsonProperty("is_complete") Boolean isComplete
) {

    public TaskResult toTaskResult() {
        return new TaskResult(status, message, stepsCompleted != null ? stepsCompleted : 0,
                Boolean.TRUE.equals(isComplete), finalUrl, screenshotPath, details);
    }
}
