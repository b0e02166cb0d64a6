package com.browserpilot.core.command;

import com.browserpilot.client.CommandStatusResponse;
import com.browserpilot.client.InteractResponse;
import com.browserpilot.core.model.Command;
import com.browserpilot.core.model.CommandStatus;
import com.browserpilot.core.model.ProgressEvent;
import com.browserpilot.core.model.ProgressOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.browserpilot.core.Responses.action;
import static com.browserpilot.core.Responses.completed;
import static com.browserpilot.core.Responses.failed;
import static com.browserpilot.core.Responses.inProgress;
import static org.junit.jupiter.api.Assertions.*;

class ProgressMapperTest {

    private static Command polling() {
        return Command.submitted("C1", "S1", "go").withStatus(CommandStatus.POLLING);
    }

    @Nested
    @DisplayName("classify")
    class ClassifyTests {

        @Test
        @DisplayName("completed needs task_status completed as well")
        void completedNeedsTaskStatus() {
            var notYet = new CommandStatusResponse("completed", "in_progress", null, null, null, null);
            assertEquals(CommandStatus.POLLING, ProgressMapper.classify(notYet));
            assertEquals(CommandStatus.COMPLETED, ProgressMapper.classify(completed("Done")));
        }

        @Test
        @DisplayName("error and failed statuses fail the command")
        void errorStatuses() {
            assertEquals(CommandStatus.FAILED, ProgressMapper.classify(failed("boom")));
            assertEquals(CommandStatus.FAILED,
                    ProgressMapper.classify(new CommandStatusResponse("FAILED", null, null, null, null, null)));
        }

        @Test
        @DisplayName("a completed status whose result is an error fails the command")
        void completedWithErrorResult() {
            var response = new CommandStatusResponse("completed", "completed", null,
                    new CommandStatusResponse.Result("error", List.of(), "Could not click", false, null), null, null);
            assertEquals(CommandStatus.FAILED, ProgressMapper.classify(response));
            assertEquals("Could not click", ProgressMapper.apply(polling(), response).error());
        }

        @Test
        @DisplayName("unknown statuses keep polling")
        void unknownKeepsPolling() {
            assertEquals(CommandStatus.POLLING, ProgressMapper.classify(inProgress("navigate")));
            assertEquals(CommandStatus.POLLING,
                    ProgressMapper.classify(new CommandStatusResponse(null, null, null, null, null, null)));
        }
    }

    @Nested
    @DisplayName("apply")
    class ApplyTests {

        @Test
        @DisplayName("keeps the previous result and progress when a poll carries none")
        void keepsPrevious() {
            Command first = ProgressMapper.apply(polling(), inProgress("navigate"));
            Command second = ProgressMapper.apply(first,
                    new CommandStatusResponse("in-progress", "in_progress", null, null, null, null));

            assertEquals(2, second.pollCount());
            assertEquals("navigate", second.progress().lastAction());
            assertTrue(second.events().isEmpty());
        }

        @Test
        @DisplayName("results become one event per action")
        void resultEvents() {
            var response = new CommandStatusResponse("completed", "completed", null,
                    new CommandStatusResponse.Result("success",
                            List.of(action("navigate", true, "ok"), action("click", false, "missing")),
                            "Partly done", true, null), null, "/tmp/s.png");

            Command applied = ProgressMapper.apply(polling(), response);

            List<ProgressEvent> events = applied.events();
            assertEquals(2, events.size());
            assertEquals(ProgressOutcome.COMPLETED, events.get(0).outcome());
            assertEquals(ProgressOutcome.FAILED, events.get(1).outcome());
            assertEquals("/tmp/s.png", applied.result().screenshotPath());
            assertEquals("Partly done", applied.explanation());
        }
    }

    @Nested
    @DisplayName("fromImmediate")
    class FromImmediateTests {

        @Test
        @DisplayName("falls back to the response message as explanation")
        void messageFallback() {
            var response = new InteractResponse("success", "All done", null, null);

            Command command = ProgressMapper.fromImmediate("local-1", "S1", "go", response);

            assertEquals(CommandStatus.COMPLETED, command.status());
            assertEquals("All done", command.explanation());
            assertEquals(1, command.pollCount());
        }

        @Test
        @DisplayName("an error answer without details uses the message as reason")
        void errorWithoutDetails() {
            var response = new InteractResponse("error", "Session busy", null, null);

            Command command = ProgressMapper.fromImmediate("local-1", "S1", "go", response);

            assertEquals(CommandStatus.FAILED, command.status());
            assertEquals("Session busy", command.error());
        }
    }

    @Nested
    @DisplayName("render")
    class RenderTests {

        @Test
        @DisplayName("renders each status with its fallback text")
        void fallbacks() {
            assertEquals("Processing...", ProgressMapper.render(polling()));
            assertEquals("Command executed", ProgressMapper.render(polling().withStatus(CommandStatus.COMPLETED)));
            assertEquals("Error: timed out", ProgressMapper.render(polling().failed("timed out")));
            assertEquals("Command abandoned", ProgressMapper.render(polling().withStatus(CommandStatus.ABANDONED)));
        }

        @Test
        @DisplayName("appends one marked line per event")
        void eventLines() {
            Command command = ProgressMapper.apply(polling(), completed("Navigated"));
            String n = System.lineSeparator();

            assertEquals("Navigated" + n + "[ok] navigate: Navigated to https://example.com",
                    ProgressMapper.render(command));
        }

        @Test
        @DisplayName("in-flight events are marked as running")
        void inFlightMarker() {
            Command command = ProgressMapper.apply(polling(), inProgress("type"));

            assertTrue(ProgressMapper.render(command).endsWith("[..] type: Working on it"));
        }
    }
}
