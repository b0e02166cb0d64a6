package com.browserpilot.core.command;

import com.browserpilot.client.ActionResultPayload;
import com.browserpilot.client.CommandStatusResponse;
import com.browserpilot.client.InteractResponse;
import com.browserpilot.core.model.ActionResult;
import com.browserpilot.core.model.Command;
import com.browserpilot.core.model.CommandProgress;
import com.browserpilot.core.model.CommandResult;
import com.browserpilot.core.model.CommandStatus;
import com.browserpilot.core.model.ProgressEvent;
import com.browserpilot.core.model.ProgressOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps service answers about a command onto {@link Command} snapshots.
 */
public final class ProgressMapper {

    private ProgressMapper() {}

    /**
     * Classifies a polled status. {@code completed} only ends the command once
     * {@code task_status} is {@code completed} as well, unless its result reports an error.
     */
    public static CommandStatus classify(CommandStatusResponse response) {
        String status = lower(response.status());
        if ("error".equals(status) || "failed".equals(status)) {
            return CommandStatus.FAILED;
        }
        if ("completed".equals(status)) {
            if (response.result() != null && "error".equals(lower(response.result().status()))) {
                return CommandStatus.FAILED;
            }
            if ("completed".equals(lower(response.taskStatus()))) {
                return CommandStatus.COMPLETED;
            }
        }
        return CommandStatus.POLLING;
    }

    /** Applies one poll to the current snapshot. */
    public static Command apply(Command current, CommandStatusResponse response) {
        CommandStatus status = classify(response);
        CommandResult result = result(response);
        CommandProgress progress = progress(response);
        Command next = current.withPoll(status, result != null ? result : current.result(),
                progress != null ? progress : current.progress(), events(response));
        if (status == CommandStatus.FAILED) {
            return next.failed(failureReason(response));
        }
        return next;
    }

    /**
     * Sub-action events of one poll: every entry of {@code result.results} when the
     * service reported any, otherwise the in-flight {@code progress.last_action}.
     */
    public static List<ProgressEvent> events(CommandStatusResponse response) {
        var result = response.result();
        if (result != null && result.results() != null && !result.results().isEmpty()) {
            return toEvents(result.results());
        }
        var progress = response.progress();
        if (progress != null && progress.lastAction() != null && !progress.lastAction().isBlank()) {
            return List.of(new ProgressEvent(progress.lastAction(), ProgressOutcome.IN_PROGRESS,
                    progress.currentExplanation()));
        }
        return List.of();
    }

    static CommandResult result(CommandStatusResponse response) {
        var result = response.result();
        if (result == null) return null;
        String screenshot = result.screenshotPath() != null ? result.screenshotPath() : response.screenshotPath();
        return new CommandResult(result.status(), toActions(result.results()), result.explanation(),
                Boolean.TRUE.equals(result.taskCompleted()), screenshot);
    }

    static CommandProgress progress(CommandStatusResponse response) {
        var progress = response.progress();
        if (progress == null) return null;
        return new CommandProgress(progress.actionsCompleted() != null ? progress.actionsCompleted() : 0,
                progress.lastAction(), progress.currentExplanation());
    }

    /**
     * Builds the terminal snapshot of a command the service processed while
     * answering the submission itself.
     */
    public static Command fromImmediate(String commandId, String sessionId, String instruction,
                                        InteractResponse response) {
        var details = response.details();
        List<ActionResult> actions = details != null ? toActions(details.results()) : List.of();
        String explanation = details != null && details.explanation() != null
                ? details.explanation() : response.message();
        boolean failed = "error".equals(lower(response.status()));
        boolean taskCompleted = details != null && "completed".equals(lower(details.taskStatus()));
        var result = new CommandResult(response.status(), actions, explanation, taskCompleted,
                response.screenshotPath());
        List<ProgressEvent> events = details != null && details.results() != null
                ? toEvents(details.results()) : List.of();

        Command command = Command.submitted(commandId, sessionId, instruction)
                .withPoll(failed ? CommandStatus.FAILED : CommandStatus.COMPLETED, result, null, events);
        if (failed) {
            String reason = details != null && details.error() != null ? details.error() : response.message();
            return command.failed(reason != null ? reason : "command failed");
        }
        return command;
    }

    /** Text shown in the command's RESULT entry of the conversation. */
    public static String render(Command command) {
        var text = new StringBuilder();
        switch (command.status()) {
            case COMPLETED -> text.append(orElse(command.explanation(), "Command executed"));
            case FAILED -> text.append("Error: ").append(orElse(command.error(), "command failed"));
            case ABANDONED -> text.append("Command abandoned");
            default -> text.append(orElse(command.explanation(), "Processing..."));
        }
        for (ProgressEvent event : command.events()) {
            text.append(System.lineSeparator()).append(marker(event.outcome())).append(' ').append(event.action());
            if (event.message() != null && !event.message().isBlank()) {
                text.append(": ").append(event.message());
            }
        }
        return text.toString();
    }

    /** Screenshot reference of the latest snapshot, passed through unmodified. */
    public static String screenshotPath(Command command, String fallback) {
        if (command.result() != null && command.result().screenshotPath() != null) {
            return command.result().screenshotPath();
        }
        return fallback;
    }

    private static String failureReason(CommandStatusResponse response) {
        if (response.message() != null && !response.message().isBlank()) return response.message();
        if (response.result() != null && response.result().explanation() != null) {
            return response.result().explanation();
        }
        return "command failed on the service";
    }

    private static List<ProgressEvent> toEvents(List<ActionResultPayload> payloads) {
        var events = new ArrayList<ProgressEvent>(payloads.size());
        for (ActionResultPayload payload : payloads) {
            ActionResult action = payload.toActionResult();
            events.add(new ProgressEvent(action.command(),
                    action.success() ? ProgressOutcome.COMPLETED : ProgressOutcome.FAILED, action.message()));
        }
        return events;
    }

    private static List<ActionResult> toActions(List<ActionResultPayload> payloads) {
        if (payloads == null) return List.of();
        return payloads.stream().map(ActionResultPayload::toActionResult).toList();
    }

    private static String marker(ProgressOutcome outcome) {
        return switch (outcome) {
            case COMPLETED -> "[ok]";
            case FAILED -> "[failed]";
            case IN_PROGRESS -> "[..]";
        };
    }

    private static String orElse(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
