package com.browserpilot.core.agent;

import com.browserpilot.client.AckResponse;
import com.browserpilot.client.AgentSessionStatus;
import com.browserpilot.client.AgentTaskRequest;
import com.browserpilot.client.AgentTaskResponse;
import com.browserpilot.core.PilotHarness;
import com.browserpilot.core.errors.ErrorKind;
import com.browserpilot.core.errors.SessionLostException;
import com.browserpilot.core.errors.TransportException;
import com.browserpilot.core.errors.ValidationException;
import com.browserpilot.core.model.InteractiveTask;
import com.browserpilot.core.model.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static com.browserpilot.core.Responses.agentSession;
import static com.browserpilot.core.Responses.ok;
import static com.browserpilot.core.Responses.step;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InteractiveStepControllerTest {

    private PilotHarness h;
    private InteractiveStepController controller;

    @BeforeEach
    void setUp() {
        h = new PilotHarness();
        controller = h.stepController;
        when(h.client.cleanupAgentSession(anyString())).thenReturn(ok());
    }

    private InteractiveTask task() {
        return controller.current().orElseThrow();
    }

    private TaskHandle startSteppable(int maxSteps) {
        when(h.client.executeAgentTask(any())).thenReturn(agentSession("X"));
        return controller.executeTask("find the cheapest flight", null, true, maxSteps);
    }

    @Nested
    @DisplayName("executeTask")
    class ExecuteTaskTests {

        @Test
        @DisplayName("an interactive run hands out a steppable agent session")
        void startsSteppableTask() {
            TaskHandle handle = startSteppable(5);

            assertTrue(handle.isSteppable());
            assertEquals("X", handle.sessionId());
            assertEquals(0, task().stepCount());
            assertTrue(h.store.get().hasSteppableTask());
            assertTrue(h.eventTypes().contains("agent.started"));

            var request = ArgumentCaptor.forClass(AgentTaskRequest.class);
            verify(h.client).executeAgentTask(request.capture());
            assertEquals("https://www.google.com", request.getValue().startUrl());
            assertTrue(request.getValue().interactive());
            assertEquals(5, request.getValue().maxSteps());
            assertEquals("chromium", request.getValue().browserType());
        }

        @Test
        @DisplayName("a run without session id is already finished")
        void synchronousTask() {
            when(h.client.executeAgentTask(any())).thenReturn(new AgentTaskResponse(null, "success",
                    "Task completed", null, 4, "https://example.com/done", null, true));

            TaskHandle handle = controller.executeTask("read the headline", "https://example.com", false, 10);

            assertFalse(handle.isSteppable());
            assertEquals(4, handle.result().stepsCompleted());
            assertEquals("https://example.com/done", handle.result().finalUrl());
            assertTrue(task().complete());
            assertFalse(h.store.get().hasSteppableTask());
            assertTrue(h.eventTypes().contains("agent.finished"));
        }

        @Test
        @DisplayName("rejects bad input before any call")
        void validatesInput() {
            assertThrows(ValidationException.class, () -> controller.executeTask(" ", null, true, 5));
            assertThrows(ValidationException.class, () -> controller.executeTask("task", null, true, 0));
            assertThrows(ValidationException.class,
                    () -> controller.executeTask("task", null, true, InteractiveStepController.MAX_STEP_BUDGET + 1));
            verify(h.client, never()).executeAgentTask(any());
        }

        @Test
        @DisplayName("rejects a second task while one is steppable")
        void rejectsSecondTask() {
            startSteppable(5);

            assertThrows(ValidationException.class, () -> controller.executeTask("other", null, true, 5));
        }

        @Test
        @DisplayName("a transport failure leaves no task")
        void startFailure() {
            when(h.client.executeAgentTask(any()))
                    .thenThrow(new TransportException("executeTask", null, null, 500, "agent crashed"));

            assertThrows(TransportException.class, () -> controller.executeTask("task", null, true, 5));
            assertTrue(controller.current().isEmpty());
        }
    }

    @Nested
    @DisplayName("executeStep")
    class ExecuteStepTests {

        @Test
        @DisplayName("single steps accumulate until the service reports completion")
        void stepsToCompletion() {
            startSteppable(5);
            when(h.client.executeAgentStep("X", 1)).thenReturn(step(1, false), step(1, false), step(1, true));

            controller.executeStep("X");
            assertEquals(1, task().stepCount());
            assertTrue(h.store.get().hasSteppableTask());
            controller.executeStep("X");
            assertEquals(2, task().stepCount());

            StepResult last = controller.executeStep("X");

            assertTrue(last.complete());
            assertEquals(3, task().stepCount());
            assertTrue(task().complete());
            assertNull(task().sessionId());
            assertTrue(h.eventTypes().contains("agent.completed"));
            verify(h.client).cleanupAgentSession("X");
            assertThrows(ValidationException.class, () -> controller.executeStep("X"));
        }

        @Test
        @DisplayName("requests are clamped to the remaining budget and so is the reported count")
        void clampsToBudget() {
            startSteppable(5);
            when(h.client.executeAgentStep("X", 2)).thenReturn(step(2, false));
            when(h.client.executeAgentStep("X", 3)).thenReturn(step(7, false));

            controller.executeStep("X", 2);
            controller.executeStep("X", 10);

            verify(h.client).executeAgentStep("X", 3);
            assertEquals(5, task().stepCount());
            assertFalse(h.store.get().hasSteppableTask());
            var e = assertThrows(ValidationException.class, () -> controller.executeStep("X"));
            assertTrue(e.getMessage().contains("exhausted"));
        }

        @Test
        @DisplayName("the step count is the sum of what the service reported")
        void sumsReportedSteps() {
            startSteppable(10);
            when(h.client.executeAgentStep("X", 3)).thenReturn(step(2, false), step(3, false));

            controller.executeStep("X", 3);
            controller.executeStep("X", 3);

            assertEquals(5, task().stepCount());
            var steps = h.registry.find("browserpilot.agent.steps").summary();
            assertEquals(2, steps.count());
            assertEquals(5.0, steps.totalAmount());
        }

        @Test
        @DisplayName("an exhausted task releases its agent session when replaced")
        void exhaustedTaskIsReleasedOnReplace() {
            startSteppable(1);
            when(h.client.executeAgentStep("X", 1)).thenReturn(step(1, false));
            controller.executeStep("X");
            when(h.client.executeAgentTask(any())).thenReturn(agentSession("Y"));

            controller.executeTask("next task", null, true, 5);

            verify(h.client).cleanupAgentSession("X");
            assertEquals("Y", task().sessionId());
        }

        @Test
        @DisplayName("rejects a step count below one and a foreign session")
        void validatesStep() {
            startSteppable(5);

            assertThrows(ValidationException.class, () -> controller.executeStep("X", 0));
            assertThrows(ValidationException.class, () -> controller.executeStep("Z", 1));
            verify(h.client, never()).executeAgentStep(anyString(), anyInt());
        }

        @Test
        @DisplayName("an unknown agent session clears the task")
        void sessionNotFound() {
            startSteppable(5);
            when(h.client.executeAgentStep("X", 1))
                    .thenThrow(new TransportException("executeStep", "X", null, 500, "404: Session X not found"));

            assertThrows(SessionLostException.class, () -> controller.executeStep("X"));

            assertTrue(controller.current().isEmpty());
            assertEquals(ErrorKind.SESSION_LOST, h.store.get().lastError().kind());
            assertTrue(h.eventTypes().contains("agent.lost"));
        }

        @Test
        @DisplayName("a transient failure leaves the task unchanged")
        void transientFailure() {
            startSteppable(5);
            when(h.client.executeAgentStep("X", 1))
                    .thenThrow(new TransportException("executeStep", "X", null, 502, "Bad gateway"));

            assertThrows(TransportException.class, () -> controller.executeStep("X"));

            assertEquals(0, task().stepCount());
            assertTrue(h.store.get().hasSteppableTask());
        }

        @Test
        @DisplayName("a successful step after a failed one clears the recorded error")
        void retryClearsError() {
            startSteppable(5);
            when(h.client.executeAgentStep("X", 1))
                    .thenThrow(new TransportException("executeStep", "X", null, 502, "Bad gateway"))
                    .thenReturn(step(1, false));

            assertThrows(TransportException.class, () -> controller.executeStep("X"));
            assertEquals(ErrorKind.TRANSPORT, h.store.get().lastError().kind());

            controller.executeStep("X");

            assertEquals(1, task().stepCount());
            assertNull(h.store.get().lastError());
        }
    }

    @Nested
    @DisplayName("cleanup")
    class CleanupTests {

        @Test
        @DisplayName("clears the task and releases the session")
        void cleansUp() {
            startSteppable(5);

            controller.cleanup("X");

            assertTrue(controller.current().isEmpty());
            verify(h.client).cleanupAgentSession("X");
            assertTrue(h.eventTypes().contains("agent.cleaned_up"));
        }

        @Test
        @DisplayName("local state is cleared even when the service call fails")
        void clearsOnFailure() {
            startSteppable(5);
            when(h.client.cleanupAgentSession("X"))
                    .thenThrow(new TransportException("cleanup", "X", null, 500, "Internal error"));

            assertThrows(TransportException.class, () -> controller.cleanup("X"));

            assertTrue(controller.current().isEmpty());
            assertTrue(h.eventTypes().contains("agent.cleaned_up"));
        }

        @Test
        @DisplayName("a warning acknowledgement is not a failure")
        void warningAck() {
            startSteppable(5);
            when(h.client.cleanupAgentSession("X")).thenReturn(new AckResponse("warning", "Session not found"));

            assertDoesNotThrow(() -> controller.cleanup("X"));
            assertTrue(controller.current().isEmpty());
        }

        @Test
        @DisplayName("status reads the remote agent session")
        void remoteStatus() {
            startSteppable(5);
            when(h.client.getAgentSessionStatus("X")).thenReturn(new AgentSessionStatus("success",
                    "find flights", 2, "https://example.com", null, false));

            AgentSessionStatus status = controller.status("X");

            assertEquals(2, status.currentStep());
            assertEquals("https://example.com", status.currentUrl());
            assertEquals(0, controller.current().orElseThrow().stepCount());
        }

        @Test
        @DisplayName("close releases an open task")
        void closeReleases() {
            startSteppable(5);

            controller.close();

            verify(h.client).cleanupAgentSession("X");
            assertTrue(controller.current().isEmpty());
        }
    }
}
