package com.browserpilot.core.command;

import com.browserpilot.client.AutomationClient;
import com.browserpilot.client.CommandStatusResponse;
import com.browserpilot.client.InteractResponse;
import com.browserpilot.config.PilotProperties;
import com.browserpilot.core.captcha.CaptchaGate;
import com.browserpilot.core.conversation.ConversationLog;
import com.browserpilot.core.errors.ErrorKind;
import com.browserpilot.core.errors.SessionLostException;
import com.browserpilot.core.errors.TransportException;
import com.browserpilot.core.errors.ValidationException;
import com.browserpilot.core.events.EventBus;
import com.browserpilot.core.events.PilotEvent;
import com.browserpilot.core.logging.MdcContext;
import com.browserpilot.core.metrics.PilotMetrics;
import com.browserpilot.core.model.ClientError;
import com.browserpilot.core.model.Command;
import com.browserpilot.core.model.CommandStatus;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.scheduler.PollHandle;
import com.browserpilot.core.scheduler.PollScheduler;
import com.browserpilot.core.session.SessionManager;
import com.browserpilot.core.state.ClientState;
import com.browserpilot.core.state.StateStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Submits natural-language commands and drives each one to a terminal status.
 * <p>
 * A command the service processes in the background is polled on the shared
 * event loop at a fixed delay. Every tick fetches the command status, commits
 * it only if the command is still the current, non-terminal one, and then
 * refreshes the session status so captcha pauses are noticed while a command
 * runs. Polling is bounded by a number of consecutive failures and by the
 * command timeout plus a grace period.
 */
@Service
public class CommandOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CommandOrchestrator.class);

    private static final long AWAIT_SLEEP_MS = 200;

    private final AutomationClient client;
    private final StateStore store;
    private final PollScheduler scheduler;
    private final SessionManager sessionManager;
    private final CaptchaGate captchaGate;
    private final ConversationLog conversation;
    private final EventBus eventBus;
    private final PilotMetrics metrics;
    private final PilotProperties properties;

    /** Bookkeeping of the command being polled, if any. */
    private volatile CommandTicket active;

    public CommandOrchestrator(AutomationClient client, StateStore store, PollScheduler scheduler,
                               SessionManager sessionManager, CaptchaGate captchaGate,
                               ConversationLog conversation, EventBus eventBus, PilotMetrics metrics,
                               PilotProperties properties) {
        this.client = client;
        this.store = store;
        this.scheduler = scheduler;
        this.sessionManager = sessionManager;
        this.captchaGate = captchaGate;
        this.conversation = conversation;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /** Session teardown abandons the running command; close its conversation entry. */
    @PostConstruct
    public void subscribeToSessionEnd() {
        eventBus.subscribeAll(event -> {
            if ("session.ended".equals(event.eventType()) || "session.lost".equals(event.eventType())) {
                onSessionEnded(event.sessionId());
            }
        });
    }

    public CommandHandle submit(String sessionId, String text) {
        return submit(sessionId, text, properties.getCommandTimeoutSeconds());
    }

    /**
     * Submits a command against the current session.
     *
     * @throws ValidationException      if the text is blank, the session is not current,
     *                                  or another command is still running
     * @throws com.browserpilot.core.errors.CaptchaPendingException if the session waits for a captcha
     * @throws TransportException       if the service did not accept the command
     * @throws SessionLostException     if the session ended while the command was being submitted
     */
    public CommandHandle submit(String sessionId, String text, int timeoutSeconds) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("submit", sessionId, "command text must not be empty");
        }
        if (timeoutSeconds <= 0) {
            throw new ValidationException("submit", sessionId, "timeout must be positive");
        }
        ClientState state = store.get();
        if (sessionId == null || !state.holdsSession(sessionId)) {
            throw new ValidationException("submit", sessionId, "no active session with this id");
        }
        if (state.isCommandInFlight()) {
            throw new ValidationException("submit", sessionId,
                    "command %s is still running".formatted(state.command().commandId()));
        }
        captchaGate.checkSubmissionAllowed(sessionId);

        String instruction = text.trim();
        conversation.user(instruction, Message.Metadata.forSession(sessionId));
        Message placeholder = conversation.placeholder(Message.Metadata.forSession(sessionId));

        InteractResponse response;
        try {
            response = client.executeCommand(sessionId, instruction, timeoutSeconds);
        } catch (TransportException e) {
            log.warn("Command submission to session {} failed: {}", sessionId, e.getMessage());
            conversation.updateResult(placeholder.id(), "Error: " + e.getMessage(),
                    Message.Metadata.forSession(sessionId));
            store.update(s -> s.withError(ClientError.of(e)));
            throw e;
        }

        String commandId = response.commandId();
        if (commandId == null || commandId.isBlank()) {
            return completeImmediately(sessionId, instruction, response, placeholder.id());
        }

        Command polling = Command.submitted(commandId, sessionId, instruction).withStatus(CommandStatus.POLLING);
        var ticket = new CommandTicket(commandId, sessionId, placeholder.id(), maxTicks(timeoutSeconds));
        PollHandle timer = scheduler.scheduleWithFixedDelay("command-" + commandId,
                properties.getPollInterval(), () -> tick(ticket));
        if (!store.adopt(timer, s -> s.commandSubmitted(polling, timer))) {
            conversation.updateResult(placeholder.id(), "Command abandoned: session ended",
                    Message.Metadata.forCommand(sessionId, commandId));
            throw new SessionLostException("submit", sessionId, "session ended while the command was submitted");
        }
        active = ticket;

        MdcContext.setCommand(sessionId, commandId);
        try {
            log.info("Command {} submitted: \"{}\"", commandId, instruction);
        } finally {
            MdcContext.clear();
        }
        conversation.updateResult(placeholder.id(), ConversationLog.PROCESSING,
                Message.Metadata.forCommand(sessionId, commandId));
        eventBus.publish(PilotEvent.of("command.submitted", sessionId, commandId,
                Map.of("instruction", instruction)));
        return new CommandHandle(commandId, sessionId, placeholder.id(), true);
    }

    /**
     * Abandons a running command: its timer is cancelled and later answers are discarded.
     *
     * @return false if the command is unknown or already terminal
     */
    public boolean abandon(String commandId) {
        var abandoned = new Command[1];
        store.update(s -> {
            if (!s.holdsCommand(commandId) || s.command().isTerminal()) return s;
            abandoned[0] = s.command().withStatus(CommandStatus.ABANDONED);
            return s.commandUpdated(abandoned[0]);
        });
        if (abandoned[0] == null) {
            return false;
        }
        CommandTicket ticket = active;
        if (ticket != null && ticket.commandId.equals(commandId)) {
            announceTerminal(ticket, abandoned[0]);
        }
        return true;
    }

    /** Latest snapshot of the command, while it is the session's current command. */
    public Optional<Command> command(CommandHandle handle) {
        Command command = store.get().command();
        if (command != null && command.commandId().equals(handle.commandId())) {
            return Optional.of(command);
        }
        return Optional.empty();
    }

    /**
     * Blocks until the command is terminal or {@code timeout} elapses.
     * A command that vanished from state (its session was replaced) is reported as abandoned.
     *
     * @return the latest snapshot, which is not terminal if the wait timed out
     */
    public Command await(CommandHandle handle, Duration timeout) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        Command last = null;
        while (true) {
            Optional<Command> current = command(handle);
            if (current.isEmpty()) {
                if (last == null) {
                    throw new ValidationException("await", handle.sessionId(),
                            "unknown command " + handle.commandId());
                }
                return last.isTerminal() ? last : last.withStatus(CommandStatus.ABANDONED);
            }
            last = current.get();
            if (last.isTerminal() || System.currentTimeMillis() >= deadline) {
                return last;
            }
            try {
                Thread.sleep(AWAIT_SLEEP_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return last;
            }
        }
    }

    // -- Polling --

    void tick(CommandTicket ticket) {
        MdcContext.setCommand(ticket.sessionId, ticket.commandId);
        try {
            ClientState state = store.get();
            if (!state.holdsCommand(ticket.commandId) || state.command().isTerminal()) {
                log.debug("Skipping stale tick for command {}", ticket.commandId);
                return;
            }
            ticket.ticks++;

            CommandStatusResponse response;
            try {
                response = client.getCommandStatus(ticket.sessionId, ticket.commandId);
            } catch (TransportException e) {
                onPollFailure(ticket, e);
                return;
            }
            ticket.consecutiveFailures = 0;
            metrics.recordPoll("ok");

            Command polled = ProgressMapper.apply(state.command(), response);
            if (!polled.isTerminal() && ticket.ticks >= ticket.maxTicks) {
                polled = polled.failed("no final status after %d polls".formatted(ticket.ticks));
            }
            if (commit(polled)) {
                if (polled.isTerminal()) {
                    announceTerminal(ticket, polled);
                } else {
                    announceProgress(ticket, polled, response.screenshotPath());
                }
            }

            refreshSession(ticket.sessionId);
        } finally {
            MdcContext.clear();
        }
    }

    private void onPollFailure(CommandTicket ticket, TransportException e) {
        ticket.consecutiveFailures++;
        metrics.recordPoll("error");
        log.warn("Polling command {} failed ({} in a row): {}", ticket.commandId, ticket.consecutiveFailures,
                e.getMessage());

        boolean exhausted = ticket.consecutiveFailures >= properties.getMaxConsecutivePollFailures()
                || ticket.ticks >= ticket.maxTicks;
        if (!exhausted) {
            conversation.updateResult(ticket.resultEntryId, "Error checking command status: " + e.getMessage(),
                    Message.Metadata.forCommand(ticket.sessionId, ticket.commandId));
            eventBus.publish(PilotEvent.of("command.poll_failed", ticket.sessionId, ticket.commandId,
                    Map.of("consecutiveFailures", ticket.consecutiveFailures, "error", String.valueOf(e.getMessage()))));
            return;
        }

        Command current = store.get().command();
        if (current == null || !current.commandId().equals(ticket.commandId)) return;
        Command failed = current.failed("gave up polling after %d consecutive failures: %s"
                .formatted(ticket.consecutiveFailures, e.getMessage()));
        if (commit(failed)) {
            store.update(s -> s.withError(ClientError.of(e)));
            announceTerminal(ticket, failed);
        }
    }

    /** @return true if {@code snapshot} is now the committed command */
    private boolean commit(Command snapshot) {
        ClientState next = store.update(s -> s.commandUpdated(snapshot));
        if (next.command() != snapshot) {
            log.debug("Discarding stale update of command {}", snapshot.commandId());
            return false;
        }
        return true;
    }

    private void refreshSession(String sessionId) {
        if (!store.get().holdsSession(sessionId)) return;
        try {
            sessionManager.refreshStatus(sessionId);
        } catch (SessionLostException e) {
            log.warn("Session {} lost while polling: {}", sessionId, e.getMessage());
        } catch (TransportException | ValidationException e) {
            log.debug("Session refresh during poll skipped: {}", e.getMessage());
        }
    }

    private void announceProgress(CommandTicket ticket, Command command, String screenshotPath) {
        conversation.updateResult(ticket.resultEntryId, ProgressMapper.render(command),
                new Message.Metadata(command.commandId(), command.sessionId(),
                        ProgressMapper.screenshotPath(command, screenshotPath), command.result()));

        Map<String, Object> payload = new HashMap<>();
        payload.put("pollCount", command.pollCount());
        payload.put("events", command.events().size());
        if (command.progress() != null) {
            payload.put("actionsCompleted", command.progress().actionsCompleted());
        }
        if (command.explanation() != null) {
            payload.put("explanation", command.explanation());
        }
        eventBus.publish(PilotEvent.of("command.progress", command.sessionId(), command.commandId(), payload));
    }

    private void announceTerminal(CommandTicket ticket, Command command) {
        if (!ticket.closed.compareAndSet(false, true)) return;
        if (active == ticket) {
            active = null;
        }
        finish(command, ticket.resultEntryId);
    }

    private void finish(Command command, String resultEntryId) {
        conversation.updateResult(resultEntryId, ProgressMapper.render(command),
                new Message.Metadata(command.commandId(), command.sessionId(),
                        ProgressMapper.screenshotPath(command, null), command.result()));
        metrics.recordCommandResult(command.status().name(), Duration.between(command.submittedAt(), Instant.now()));

        switch (command.status()) {
            case COMPLETED -> log.info("Command {} completed after {} polls: {}",
                    command.commandId(), command.pollCount(), command.explanation());
            case FAILED -> {
                log.warn("Command {} failed: {}", command.commandId(), command.error());
                store.update(s -> s.lastError() != null && command.commandId().equals(s.lastError().commandId())
                        ? s
                        : s.withError(ClientError.of(ErrorKind.REMOTE_FAILURE, "poll", command.sessionId(),
                                command.commandId(), command.error())));
            }
            default -> log.info("Command {} {}", command.commandId(), command.status().name().toLowerCase(Locale.ROOT));
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("status", command.status().name());
        if (command.explanation() != null) payload.put("explanation", command.explanation());
        if (command.error() != null) payload.put("error", command.error());
        eventBus.publish(PilotEvent.of("command." + command.status().name().toLowerCase(Locale.ROOT),
                command.sessionId(), command.commandId(), payload));
    }

    private CommandHandle completeImmediately(String sessionId, String instruction,
                                              InteractResponse response, String resultEntryId) {
        String localId = "local-" + UUID.randomUUID();
        Command done = ProgressMapper.fromImmediate(localId, sessionId, instruction, response);
        store.update(s -> s.commandSubmitted(done, null));
        log.info("Command {} answered synchronously with status {}", localId, done.status());
        finish(done, resultEntryId);
        return new CommandHandle(localId, sessionId, resultEntryId, false);
    }

    private void onSessionEnded(String sessionId) {
        CommandTicket ticket = active;
        if (ticket == null || !ticket.sessionId.equals(sessionId)) return;
        Command command = store.get().command();
        if (command != null && command.commandId().equals(ticket.commandId)
                && command.status() == CommandStatus.ABANDONED) {
            announceTerminal(ticket, command);
        }
    }

    private int maxTicks(int timeoutSeconds) {
        long budgetMs = (timeoutSeconds + (long) properties.getPollGraceSeconds()) * 1000L;
        long intervalMs = Math.max(1, properties.getPollInterval().toMillis());
        return (int) Math.max(1, (budgetMs + intervalMs - 1) / intervalMs);
    }

    /**
     * Per-command polling bookkeeping. Counters are only touched by the event loop.
     */
    static final class CommandTicket {
        final String commandId;
        final String sessionId;
        final String resultEntryId;
        final int maxTicks;
        final AtomicBoolean closed = new AtomicBoolean();
        int ticks;
        int consecutiveFailures;

        CommandTicket(String commandId, String sessionId, String resultEntryId, int maxTicks) {
            this.commandId = commandId;
            this.sessionId = sessionId;
            this.resultEntryId = resultEntryId;
            this.maxTicks = maxTicks;
        }
    }
}
