package com.browserpilot.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionStatusResponse(
    @JsonProperty("status") String status,
    @JsonProperty("message") String message,
    @JsonProperty("session_info") SessionInfo sessionInfo,
    @JsonProperty("screenshot_path") String screenshotPath
) {

    /** Missing {@code is_active} counts as active; only an explicit false ends the session. */
    public boolean isActive() {
        return sessionInfo == null || sessionInfo.isActive() == null || sessionInfo.isActive();
    }
}
