package com.browserpilot.core.agent;

import com.browserpilot.client.AckResponse;
import com.browserpilot.client.AgentSessionStatus;
import com.browserpilot.client.AgentTaskRequest;
import com.browserpilot.client.AgentTaskResponse;
import com.browserpilot.client.AutomationClient;
import com.browserpilot.config.PilotProperties;
import com.browserpilot.core.errors.BrowserPilotException;
import com.browserpilot.core.errors.SessionLostException;
import com.browserpilot.core.errors.TransportException;
import com.browserpilot.core.errors.ValidationException;
import com.browserpilot.core.events.EventBus;
import com.browserpilot.core.events.PilotEvent;
import com.browserpilot.core.metrics.PilotMetrics;
import com.browserpilot.core.model.BrowserConfig;
import com.browserpilot.core.model.ClientError;
import com.browserpilot.core.model.InteractiveTask;
import com.browserpilot.core.model.StepResult;
import com.browserpilot.core.model.TaskResult;
import com.browserpilot.core.state.ClientState;
import com.browserpilot.core.state.StateStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs agent tasks on the service, either to completion or step by step at
 * the caller's pace.
 * <p>
 * A steppable task owns an agent session on the service. The step counter only
 * grows by what the service reports, clamped to the step budget, and the
 * session id is given up as soon as the service reports the task complete.
 */
@Service
public class InteractiveStepController {

    private static final Logger log = LoggerFactory.getLogger(InteractiveStepController.class);

    public static final int MAX_STEP_BUDGET = 100;

    private final AutomationClient client;
    private final StateStore store;
    private final EventBus eventBus;
    private final PilotMetrics metrics;
    private final PilotProperties properties;

    public InteractiveStepController(AutomationClient client, StateStore store, EventBus eventBus,
                                     PilotMetrics metrics, PilotProperties properties) {
        this.client = client;
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Starts an agent task.
     *
     * @param task        natural-language task
     * @param startUrl    page to start from, the configured default when blank
     * @param interactive request step-wise execution
     * @param maxSteps    step budget, 1 to {@value #MAX_STEP_BUDGET}
     * @throws ValidationException on bad input or while another task is steppable
     * @throws TransportException  if the service could not run the task
     */
    public TaskHandle executeTask(String task, String startUrl, boolean interactive, int maxSteps) {
        if (task == null || task.isBlank()) {
            throw new ValidationException("executeTask", null, "task must not be empty");
        }
        if (maxSteps < 1 || maxSteps > MAX_STEP_BUDGET) {
            throw new ValidationException("executeTask", null,
                    "max steps must be between 1 and " + MAX_STEP_BUDGET + ", got " + maxSteps);
        }
        ClientState state = store.get();
        if (state.hasSteppableTask()) {
            throw new ValidationException("executeTask", state.task().sessionId(),
                    "another task is still in progress; finish or clean it up first");
        }
        releaseLeftover(state.task());

        String url = startUrl == null || startUrl.isBlank() ? properties.getDefaultStartUrl() : startUrl;
        BrowserConfig browser = properties.defaultBrowserConfig();
        var request = new AgentTaskRequest(task.trim(), url, interactive, maxSteps,
                browser.headless(), browser.browserType().wireName());

        AgentTaskResponse response;
        try {
            response = client.executeAgentTask(request);
        } catch (TransportException e) {
            log.warn("Agent task failed to start: {}", e.getMessage());
            store.update(s -> s.withError(ClientError.of(e)));
            throw e;
        }

        String taskId = UUID.randomUUID().toString();
        if (response.sessionId() != null && !response.sessionId().isBlank()) {
            return startSteppable(taskId, response.sessionId(), request);
        }

        TaskResult result = response.toTaskResult();
        var resolved = new InteractiveTask(taskId, null, request.task(), url, maxSteps, interactive,
                Math.min(maxSteps, Math.max(0, result.stepsCompleted())), result.complete(), result.asStep());
        store.update(s -> s.taskStarted(resolved).errorCleared());
        if (result.asStep().isError()) {
            log.warn("Agent task finished with an error: {}", result.message());
        } else {
            log.info("Agent task finished after {} steps", resolved.stepCount());
        }
        eventBus.publish(PilotEvent.of("agent.finished", null, null, payload(resolved, result.asStep())));
        return new TaskHandle(taskId, null, result);
    }

    /**
     * Executes up to {@code steps} steps of the steppable task on {@code sessionId}.
     *
     * @throws ValidationException  if no steppable task runs on that session or the budget is exhausted
     * @throws SessionLostException if the service no longer knows the session; the task is cleared
     * @throws TransportException   on any other failure; the task is unchanged
     */
    public StepResult executeStep(String sessionId, int steps) {
        if (steps < 1) {
            throw new ValidationException("executeStep", sessionId, "step count must be at least 1");
        }
        InteractiveTask task = store.get().task();
        if (task == null || sessionId == null || !sessionId.equals(task.sessionId())) {
            throw new ValidationException("executeStep", sessionId, "no steppable task for this session");
        }
        if (task.complete()) {
            throw new ValidationException("executeStep", sessionId, "task is already complete");
        }
        int remaining = task.remainingSteps();
        if (remaining == 0) {
            throw new ValidationException("executeStep", sessionId,
                    "step budget of %d exhausted".formatted(task.maxSteps()));
        }
        int requested = Math.min(steps, remaining);

        StepResult result;
        try {
            result = client.executeAgentStep(sessionId, requested).toStepResult();
        } catch (TransportException e) {
            if (e.isNotFound()) {
                var lost = new SessionLostException("executeStep", sessionId,
                        "agent session no longer exists on the service", e);
                store.update(s -> s.taskCleared(task.taskId()).withError(ClientError.of(lost)));
                log.warn("Agent session {} lost", sessionId);
                eventBus.publish(PilotEvent.of("agent.lost", sessionId, null, Map.of()));
                throw lost;
            }
            log.warn("Step on agent session {} failed: {}", sessionId, e.getMessage());
            store.update(s -> s.withError(ClientError.of(e)));
            throw e;
        }

        int counted = Math.min(Math.max(0, result.stepsCompleted()), remaining);
        boolean complete = result.complete();
        StepResult applied = result;
        ClientState next = store.update(s -> s.task() != null && s.task().taskId().equals(task.taskId())
                ? s.taskAdvanced(task.taskId(), s.task().advanced(counted, complete, applied)).errorCleared()
                : s);
        metrics.recordAgentSteps(counted);

        InteractiveTask advanced = next.task() != null && next.task().taskId().equals(task.taskId())
                ? next.task()
                : task.advanced(counted, complete, result);
        log.info("Agent session {}: {} step(s) executed, {}/{} used{}", sessionId, counted,
                advanced.stepCount(), advanced.maxSteps(), complete ? ", task complete" : "");
        eventBus.publish(PilotEvent.of("agent.step", sessionId, null, payload(advanced, result)));

        if (complete) {
            eventBus.publish(PilotEvent.of("agent.completed", sessionId, null, payload(advanced, result)));
            releaseQuietly(sessionId);
        }
        return result;
    }

    public StepResult executeStep(String sessionId) {
        return executeStep(sessionId, 1);
    }

    /**
     * Ends the task on {@code sessionId}. Local state is cleared first, so it is
     * gone even when the service call fails.
     *
     * @throws TransportException if the service could not release the session
     */
    public void cleanup(String sessionId) {
        var cleared = new boolean[1];
        store.update(s -> {
            InteractiveTask task = s.task();
            if (task == null || !sessionId.equals(task.sessionId())) return s;
            cleared[0] = true;
            return s.taskCleared(task.taskId());
        });

        try {
            AckResponse ack = client.cleanupAgentSession(sessionId);
            if (ack.isError()) {
                throw new TransportException("cleanup", sessionId, null, 200, ack.message());
            }
            if (ack.isWarning()) {
                log.info("Agent session {} was already gone: {}", sessionId, ack.message());
            } else {
                log.info("Agent session {} cleaned up", sessionId);
            }
        } catch (TransportException e) {
            log.warn("Cleanup of agent session {} failed: {}", sessionId, e.getMessage());
            store.update(s -> s.withError(ClientError.of(e)));
            throw e;
        } finally {
            if (cleared[0]) {
                eventBus.publish(PilotEvent.of("agent.cleaned_up", sessionId, null, Map.of()));
            }
        }
    }

    /** Remote status of an agent session. */
    public AgentSessionStatus status(String sessionId) {
        return client.getAgentSessionStatus(sessionId);
    }

    public Optional<InteractiveTask> current() {
        return Optional.ofNullable(store.get().task());
    }

    /** Releases the agent session of a task left open when the application shuts down. */
    @PreDestroy
    public void close() {
        InteractiveTask task = store.get().task();
        if (task != null && task.sessionId() != null) {
            try {
                cleanup(task.sessionId());
            } catch (BrowserPilotException e) {
                log.warn("Could not clean up agent session {} on shutdown: {}", task.sessionId(), e.getMessage());
            }
        }
    }

    private TaskHandle startSteppable(String taskId, String sessionId, AgentTaskRequest request) {
        var task = new InteractiveTask(taskId, sessionId, request.task(), request.startUrl(),
                request.maxSteps(), request.interactive(), 0, false, null);
        var adopted = new boolean[1];
        store.update(s -> {
            if (s.hasSteppableTask()) return s;
            adopted[0] = true;
            return s.taskStarted(task).errorCleared();
        });
        if (!adopted[0]) {
            releaseQuietly(sessionId);
            throw new ValidationException("executeTask", sessionId, "another task was started concurrently");
        }
        log.info("Agent task started on session {} (budget {} steps)", sessionId, request.maxSteps());
        eventBus.publish(PilotEvent.of("agent.started", sessionId, null, payload(task, null)));
        return new TaskHandle(taskId, sessionId, null);
    }

    /** A task whose budget ran out still holds its agent session; give it back before replacing it. */
    private void releaseLeftover(InteractiveTask previous) {
        if (previous != null && previous.sessionId() != null) {
            store.update(s -> s.taskCleared(previous.taskId()));
            releaseQuietly(previous.sessionId());
        }
    }

    private void releaseQuietly(String sessionId) {
        try {
            client.cleanupAgentSession(sessionId);
            log.debug("Released agent session {}", sessionId);
        } catch (TransportException e) {
            log.warn("Could not release agent session {}: {}", sessionId, e.getMessage());
        }
    }

    private static Map<String, Object> payload(InteractiveTask task, StepResult step) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("taskId", task.taskId());
        payload.put("stepCount", task.stepCount());
        payload.put("maxSteps", task.maxSteps());
        payload.put("complete", task.complete());
        if (step != null) {
            if (step.status() != null) payload.put("status", step.status());
            if (step.message() != null) payload.put("message", step.message());
            if (step.currentUrl() != null) payload.put("currentUrl", step.currentUrl());
            if (step.screenshotPath() != null) payload.put("screenshotPath", step.screenshotPath());
        }
        return payload;
    }
}
