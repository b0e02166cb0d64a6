package com.browserpilot.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Answer to a command submission. Carries {@code details.command_id} when the
 * service processes the command in the background.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InteractResponse(
    @JsonProperty("status") String status,
    @JsonProperty("message") String message,
    @JsonProperty("details") Details details,
    @JsonProperty("screenshot_path") String screenshotPath
) {

    public String commandId() {
        return details != null ? details.commandId() : null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Details(
        @JsonProperty("command_id") String commandId,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("results") List<ActionResultPayload> results,
        @JsonProperty("task_status") String taskStatus,
        @JsonProperty("explanation") String explanation,
        @JsonProperty("error") String error
    ) {}
}
