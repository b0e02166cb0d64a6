package com.browserpilot.core.agent;

import com.browserpilot.core.model.TaskResult;

/**
 * Outcome of starting an agent task.
 *
 * @param taskId    local task id
 * @param sessionId agent session to step, {@code null} when the service already ran the task
 * @param result    final result when the task was not handed out for stepping
 */
public record TaskHandle(String taskId, String sessionId, TaskResult result) {

    public boolean isSteppable() {
        return sessionId != null;
    }
}
