package com.browserpilot.core.model;

import java.io.Serializable;

/**
 * An agent task driven either end-to-end by the service or step by step by the caller.
 *
 * @param taskId      local identifier, stable even after the session id is relinquished
 * @param sessionId   agent session id while steppable, {@code null} otherwise
 * @param task        natural-language task
 * @param startUrl    URL the agent starts from
 * @param maxSteps    step budget
 * @param interactive whether step-wise execution was requested
 * @param stepCount   steps executed so far
 * @param complete    whether the service reported the task complete
 * @param lastStep    latest step or execution result
 */
public record InteractiveTask(
    String taskId,
    String sessionId,
    String task,
    String startUrl,
    int maxSteps,
    boolean interactive,
    int stepCount,
    boolean complete,
    StepResult lastStep
) implements Serializable {

    /** True while the caller may still request steps. */
    public boolean isSteppable() {
        return sessionId != null && !complete && stepCount < maxSteps;
    }

    public int remainingSteps() {
        return Math.max(0, maxSteps - stepCount);
    }

    public InteractiveTask advanced(int steps, boolean nowComplete, StepResult step) {
        int next = Math.min(maxSteps, stepCount + Math.max(0, steps));
        var advanced = new InteractiveTask(taskId, sessionId, task, startUrl,
                maxSteps, interactive, next, nowComplete, step);
        return nowComplete ? advanced.relinquished() : advanced;
    }

    /** Drops the agent session id; the service session is released separately. */
    public InteractiveTask relinquished() {
        return new InteractiveTask(taskId, null, task, startUrl, maxSteps, interactive,
                stepCount, complete, lastStep);
    }
}
