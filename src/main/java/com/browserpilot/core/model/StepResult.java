package com.browserpilot.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;

/**
 * Result of executing steps of an agent task, or of running the task to completion.
 *
 * @param status         "success" or "error"
 * @param message        service message
 * @param stepsCompleted steps actually executed by this call
 * @param complete       whether the task is finished
 * @param currentUrl     URL after the steps
 * @param screenshotPath screenshot reference, passed through unmodified
 * @param details        raw details object from the service
 */
public record StepResult(
    String status,
    String message,
    int stepsCompleted,
    boolean complete,
    String currentUrl,
    String screenshotPath,
    JsonNode details
) implements Serializable {

    public boolean isError() {
        return "error".equalsIgnoreCase(status);
    }
}
