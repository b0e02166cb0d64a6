package com.browserpilot.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plain {@code {status, message}} acknowledgement.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AckResponse(
    @JsonProperty("status") String status,
    @JsonProperty("message") String message
) {

    public boolean isError() {
        return "error".equalsIgnoreCase(status);
    }

    public boolean isWarning() {
        return "warning".equalsIgnoreCase(status);
    }
}
