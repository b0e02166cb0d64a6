package com.browserpilot.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;

/**
 * Result of an agent task the service ran to completion without handing out a session.
 */
public record TaskResult(
    String status,
    String message,
    int stepsCompleted,
    boolean complete,
    String finalUrl,
    String screenshotPath,
    JsonNode details
) implements Serializable {

    public StepResult asStep() {
        return new StepResult(status, message, stepsCompleted, complete, finalUrl, screenshotPath, details);
    }
}
