package com.browserpilot.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Polled status of a background command.
 * {@code status} is the processing state ("processing", "completed", "error", "failed"),
 * {@code task_status} tells whether the whole instruction has been carried out.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandStatusResponse(
    @JsonProperty("status") String status,
    @JsonProperty("task_status") String taskStatus,
    @JsonProperty("message") String message,
    @JsonProperty("result") Result result,
    @JsonProperty("progress") Progress progress,
    @JsonProperty("screenshot_path") String screenshotPath
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(
        @JsonProperty("status") String status,
        @JsonProperty("results") List<ActionResultPayload> results,
        @JsonProperty("explanation") String explanation,
        @JsonProperty("task_completed") Boolean taskCompleted,
        @JsonProperty("screenshot_path") String screenshotPath
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Progress(
        @JsonProperty("actions_completed") Integer actionsCompleted,
        @JsonProperty("last_action") String lastAction,
        @JsonProperty("current_explanation") String currentExplanation
    ) {}
}
