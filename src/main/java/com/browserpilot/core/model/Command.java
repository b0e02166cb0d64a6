package com.browserpilot.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A natural-language instruction submitted against a session.
 * <p>
 * Instances are immutable; every poll produces a new snapshot through the
 * {@code with*} methods. The client never edits a command on its own account
 * except to abandon it.
 *
 * @param commandId   server-assigned identifier
 * @param sessionId   owning session
 * @param instruction free-text instruction
 * @param status      client-side lifecycle status
 * @param result      structured result once the service has one
 * @param progress    in-flight progress snapshot
 * @param events      progress events from the latest poll
 * @param error       error detail for FAILED commands
 * @param pollCount   number of status polls applied so far
 * @param submittedAt when the command was submitted
 */
public record Command(
    String commandId,
    String sessionId,
    String instruction,
    CommandStatus status,
    CommandResult result,
    CommandProgress progress,
    List<ProgressEvent> events,
    String error,
    int pollCount,
    Instant submittedAt
) implements Serializable {

    public Command {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static Command submitted(String commandId, String sessionId, String instruction) {
        return new Command(commandId, sessionId, instruction, CommandStatus.SUBMITTED,
                null, null, List.of(), null, 0, Instant.now());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Latest explanation, from the final result if there is one, else from progress. */
    public String explanation() {
        if (result != null && result.explanation() != null && !result.explanation().isBlank()) {
            return result.explanation();
        }
        return progress != null ? progress.currentExplanation() : null;
    }

    public Command withStatus(CommandStatus newStatus) {
        return new Command(commandId, sessionId, instruction, newStatus, result, progress,
                events, error, pollCount, submittedAt);
    }

    public Command withPoll(CommandStatus newStatus, CommandResult newResult, CommandProgress newProgress,
                            List<ProgressEvent> newEvents) {
        return new Command(commandId, sessionId, instruction, newStatus, newResult, newProgress,
                newEvents, error, pollCount + 1, submittedAt);
    }

    public Command failed(String reason) {
        return new Command(commandId, sessionId, instruction, CommandStatus.FAILED, result, progress,
                events, reason, pollCount, submittedAt);
    }
}
