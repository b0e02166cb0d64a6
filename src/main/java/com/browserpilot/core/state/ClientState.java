package com.browserpilot.core.state;

import com.browserpilot.core.model.ClientError;
import com.browserpilot.core.model.Command;
import com.browserpilot.core.model.CommandStatus;
import com.browserpilot.core.model.InteractiveTask;
import com.browserpilot.core.model.Session;
import com.browserpilot.core.scheduler.PollHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Complete client-side view of the automation service, as one immutable value.
 * <p>
 * Every change is a pure transition returning a new instance. Transitions that
 * apply the result of an asynchronous call take the identifiers the call was
 * made for and return {@code this} unchanged when those identifiers no longer
 * match, so a late response can never overwrite newer state.
 *
 * @param session        current automation session, or {@code null}
 * @param sessionTimer   handle of the session status timer owned by {@code session}
 * @param captchaPending whether the session waits for a human to solve a captcha
 * @param command        latest command of the session, possibly terminal
 * @param commandTimer   handle of the polling timer owned by {@code command}
 * @param task           current agent task, or {@code null}
 * @param lastError      last fatal error, for rendering; cleared by the next successful operation
 */
public record ClientState(
    Session session,
    PollHandle sessionTimer,
    boolean captchaPending,
    Command command,
    PollHandle commandTimer,
    InteractiveTask task,
    ClientError lastError
) {

    public static ClientState initial() {
        return new ClientState(null, null, false, null, null, null, null);
    }

    // -- Queries --

    public boolean hasSession() {
        return session != null;
    }

    public boolean holdsSession(String sessionId) {
        return session != null && session.sessionId().equals(sessionId);
    }

    public boolean holdsCommand(String commandId) {
        return command != null && command.commandId().equals(commandId);
    }

    /** True while a command of the current session is waiting for a terminal status. */
    public boolean isCommandInFlight() {
        return command != null && !command.isTerminal();
    }

    public boolean hasSteppableTask() {
        return task != null && task.isSteppable();
    }

    /** Timer handles this state owns; the store cancels any that a transition drops. */
    List<PollHandle> ownedHandles() {
        var handles = new ArrayList<PollHandle>(2);
        if (sessionTimer != null) handles.add(sessionTimer);
        if (commandTimer != null) handles.add(commandTimer);
        return handles;
    }

    boolean owns(PollHandle handle) {
        return handle != null && (handle == sessionTimer || handle == commandTimer);
    }

    // -- Session transitions --

    public ClientState sessionStarted(Session newSession, PollHandle timer) {
        Objects.requireNonNull(newSession, "session");
        return new ClientState(newSession, timer, false, null, null, task, null);
    }

    /** Applies a status snapshot; ignored when the session is no longer current. */
    public ClientState sessionRefreshed(Session refreshed) {
        if (!holdsSession(refreshed.sessionId())) return this;
        return new ClientState(refreshed, sessionTimer, captchaPending, command, commandTimer, task, lastError);
    }

    /**
     * Ends the session lifecycle: drops its timer, abandons an in-flight command
     * together with its timer and clears the captcha flag. The agent task runs
     * on its own agent session, which the service tracks apart from browser
     * sessions, and is left alone.
     */
    public ClientState sessionEnded(String sessionId) {
        if (!holdsSession(sessionId)) return this;
        return new ClientState(null, null, false, abandonedCommand(), null, task, lastError);
    }

    public ClientState sessionLost(String sessionId, ClientError error) {
        if (!holdsSession(sessionId)) return this;
        return sessionEnded(sessionId).withError(error);
    }

    public ClientState captchaObserved(String sessionId, boolean pending) {
        if (!holdsSession(sessionId) || captchaPending == pending) return this;
        return new ClientState(session, sessionTimer, pending, command, commandTimer, task, lastError);
    }

    // -- Command transitions --

    /**
     * Records a freshly submitted command; a polling timer may be attached.
     * The error of an earlier operation is cleared.
     */
    public ClientState commandSubmitted(Command submitted, PollHandle timer) {
        if (!holdsSession(submitted.sessionId()) || isCommandInFlight()) return this;
        return new ClientState(session, sessionTimer, captchaPending, submitted, timer, task, null);
    }

    /**
     * Applies a polled snapshot of the current command. Terminal commands are
     * frozen, and reaching a terminal status drops the polling timer.
     */
    public ClientState commandUpdated(Command updated) {
        if (!holdsCommand(updated.commandId()) || command.isTerminal()
                || !holdsSession(updated.sessionId())) {
            return this;
        }
        PollHandle timer = updated.isTerminal() ? null : commandTimer;
        return new ClientState(session, sessionTimer, captchaPending, updated, timer, task, lastError);
    }

    // -- Task transitions --

    public ClientState taskStarted(InteractiveTask newTask) {
        return new ClientState(session, sessionTimer, captchaPending, command, commandTimer, newTask, lastError);
    }

    /** Applies a step result; ignored when the task was replaced or cleared meanwhile. */
    public ClientState taskAdvanced(String taskId, InteractiveTask advanced) {
        if (task == null || !task.taskId().equals(taskId)) return this;
        return new ClientState(session, sessionTimer, captchaPending, command, commandTimer, advanced, lastError);
    }

    public ClientState taskCleared(String taskId) {
        if (task == null || !task.taskId().equals(taskId)) return this;
        return new ClientState(session, sessionTimer, captchaPending, command, commandTimer, null, lastError);
    }

    // -- Errors --

    public ClientState withError(ClientError error) {
        return new ClientState(session, sessionTimer, captchaPending, command, commandTimer, task, error);
    }

    public ClientState errorCleared() {
        return lastError == null ? this
                : new ClientState(session, sessionTimer, captchaPending, command, commandTimer, task, null);
    }

    private Command abandonedCommand() {
        if (command == null || command.isTerminal()) return command;
        return command.withStatus(CommandStatus.ABANDONED);
    }
}
