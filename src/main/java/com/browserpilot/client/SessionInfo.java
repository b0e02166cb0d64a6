package com.browserpilot.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code session_info} block of a session status answer.
 * {@code last_activity} is seconds since the epoch, with a fraction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionInfo(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("is_active") Boolean isActive,
    @JsonProperty("browser_type") String browserType,
    @JsonProperty("headless") Boolean headless,
    @JsonProperty("pending_commands") Integer pendingCommands,
    @JsonProperty("last_activity") Double lastActivity,
    @JsonProperty("current_url") String currentUrl
) {}
