package com.browserpilot.core.session;

import com.browserpilot.client.AutomationClient;
import com.browserpilot.client.SessionInfo;
import com.browserpilot.client.SessionStatusResponse;
import com.browserpilot.config.PilotProperties;
import com.browserpilot.core.captcha.CaptchaGate;
import com.browserpilot.core.conversation.ConversationLog;
import com.browserpilot.core.errors.BrowserPilotException;
import com.browserpilot.core.errors.SessionLostException;
import com.browserpilot.core.errors.TransportException;
import com.browserpilot.core.errors.ValidationException;
import com.browserpilot.core.events.EventBus;
import com.browserpilot.core.events.PilotEvent;
import com.browserpilot.core.logging.MdcContext;
import com.browserpilot.core.metrics.PilotMetrics;
import com.browserpilot.core.model.BrowserConfig;
import com.browserpilot.core.model.BrowserType;
import com.browserpilot.core.model.ClientError;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.Session;
import com.browserpilot.core.scheduler.PollHandle;
import com.browserpilot.core.scheduler.PollScheduler;
import com.browserpilot.core.state.ClientState;
import com.browserpilot.core.state.StateStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the lifecycle of the single active automation session.
 * <p>
 * While a session is current a status timer refreshes it every
 * {@code browserpilot.session.status-interval-ms}. A refresh that finds the
 * session gone tears down every piece of local state tied to it.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final AutomationClient client;
    private final StateStore store;
    private final PollScheduler scheduler;
    private final CaptchaGate captchaGate;
    private final EventBus eventBus;
    private final PilotMetrics metrics;
    private final ConversationLog conversation;
    private final PilotProperties properties;

    public SessionManager(AutomationClient client, StateStore store, PollScheduler scheduler,
                          CaptchaGate captchaGate, EventBus eventBus, PilotMetrics metrics,
                          ConversationLog conversation, PilotProperties properties) {
        this.client = client;
        this.store = store;
        this.scheduler = scheduler;
        this.captchaGate = captchaGate;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.conversation = conversation;
        this.properties = properties;
    }

    /**
     * Starts a browser session on the service and makes it current.
     *
     * @throws ValidationException if a session is already active
     * @throws TransportException  if the service could not start one
     */
    public Session start(BrowserConfig config) {
        ClientState state = store.get();
        if (state.hasSession()) {
            throw new ValidationException("start", state.session().sessionId(),
                    "a session is already active; stop it before starting another");
        }

        String sessionId;
        try {
            sessionId = client.startSession(config).sessionId();
        } catch (TransportException e) {
            metrics.recordSession("failed");
            store.update(s -> s.withError(ClientError.of(e)));
            conversation.error("Failed to start browser session: " + e.getMessage(), null);
            throw e;
        }

        Session session = Session.started(sessionId, config);
        PollHandle timer = scheduler.scheduleWithFixedDelay("session-status-" + sessionId,
                properties.getStatusInterval(), () -> pollSessionStatus(sessionId));
        boolean adopted = store.adopt(timer, s -> s.hasSession() ? s : s.sessionStarted(session, timer));
        if (!adopted) {
            // Another start won the race; release the orphan on the service
            releaseQuietly(sessionId);
            throw new ValidationException("start", sessionId, "a session was started concurrently");
        }

        MdcContext.setSession(sessionId);
        try {
            log.info("Session {} started ({}, headless={})", sessionId,
                    config.browserType().wireName(), config.headless());
        } finally {
            MdcContext.clear();
        }
        metrics.recordSession("started");
        conversation.system("Browser session started (%s%s)".formatted(config.browserType().wireName(),
                config.headless() ? ", headless" : ""), Message.Metadata.forSession(sessionId));
        eventBus.publish(PilotEvent.of("session.started", sessionId, null,
                Map.of("browserType", config.browserType().wireName(), "headless", config.headless())));
        return session;
    }

    /**
     * Fetches the session status and applies it to the current session.
     *
     * @throws ValidationException  if {@code sessionId} is not the current session
     * @throws SessionLostException if the service no longer knows the session or reports it inactive;
     *                              local state has been torn down by then
     * @throws TransportException   on any other failure; local state is unchanged
     */
    public Session refreshStatus(String sessionId) {
        Session snapshot = store.get().session();
        if (snapshot == null || !snapshot.sessionId().equals(sessionId)) {
            throw new ValidationException("refreshStatus", sessionId, "no active session with this id");
        }

        SessionStatusResponse response;
        try {
            response = client.getSessionStatus(sessionId);
        } catch (TransportException e) {
            if (e.isNotFound()) {
                throw sessionLost(sessionId, "session no longer exists on the service", e);
            }
            throw e;
        }
        if (!response.isActive()) {
            throw sessionLost(sessionId, "service reports the session inactive", null);
        }

        ClientState next = store.update(s -> s.holdsSession(sessionId)
                ? s.sessionRefreshed(merge(s.session(), response))
                : s);
        if (!next.holdsSession(sessionId)) {
            // Torn down while the request was in flight
            log.debug("Discarding status of session {}: no longer current", sessionId);
            return merge(snapshot, response);
        }
        captchaGate.observe(sessionId, response.status());
        return next.session();
    }

    /**
     * Stops a session. Idempotent: a session the service no longer knows counts as stopped.
     * On any other failure the session stays current.
     */
    public void stop(String sessionId) {
        try {
            var ack = client.stopSession(sessionId);
            if (ack.isError()) {
                throw new TransportException("stop", sessionId, null, 200, ack.message());
            }
        } catch (TransportException e) {
            if (!e.isNotFound()) {
                log.warn("Stopping session {} failed: {}", sessionId, e.getMessage());
                if (store.get().holdsSession(sessionId)) {
                    store.update(s -> s.withError(ClientError.of(e)));
                }
                throw e;
            }
            log.info("Session {} already gone on the service", sessionId);
        }
        if (teardown(sessionId)) {
            log.info("Session {} stopped", sessionId);
            metrics.recordSession("stopped");
            conversation.system("Browser session stopped", Message.Metadata.forSession(sessionId));
            eventBus.publish(PilotEvent.of("session.ended", sessionId, null, Map.of()));
        }
    }

    /**
     * Status of any session, current or not. Only the current session's local
     * state is updated; others are read from the service as they are.
     *
     * @throws SessionLostException if the service does not know the session
     */
    public Session inspect(String sessionId) {
        if (store.get().holdsSession(sessionId)) {
            return refreshStatus(sessionId);
        }
        SessionStatusResponse response;
        try {
            response = client.getSessionStatus(sessionId);
        } catch (TransportException e) {
            if (e.isNotFound()) {
                throw new SessionLostException("inspect", sessionId, "session does not exist on the service", e);
            }
            throw e;
        }
        var unknown = new Session(sessionId, response.isActive(), BrowserType.CHROMIUM, false,
                null, null, 0, null, null);
        return merge(unknown, response);
    }

    public Optional<Session> current() {
        return Optional.ofNullable(store.get().session());
    }

    /** Stops the current session, if any, when the application shuts down. */
    @PreDestroy
    public void close() {
        current().ifPresent(session -> {
            try {
                stop(session.sessionId());
            } catch (BrowserPilotException e) {
                log.warn("Could not stop session {} on shutdown: {}", session.sessionId(), e.getMessage());
            }
        });
    }

    /** Body of the status timer. Never throws. */
    void pollSessionStatus(String sessionId) {
        MdcContext.setSession(sessionId);
        try {
            refreshStatus(sessionId);
        } catch (SessionLostException e) {
            log.warn("Session {} lost: {}", sessionId, e.getMessage());
        } catch (ValidationException e) {
            log.debug("Skipping status refresh: {}", e.getMessage());
        } catch (TransportException e) {
            log.warn("Session status refresh failed, will retry: {}", e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private SessionLostException sessionLost(String sessionId, String reason, Throwable cause) {
        var lost = new SessionLostException("refreshStatus", sessionId, reason, cause);
        var held = new boolean[1];
        store.update(s -> {
            held[0] = s.holdsSession(sessionId);
            return s.sessionLost(sessionId, ClientError.of(lost));
        });
        if (held[0]) {
            log.warn("Session {} lost: {}", sessionId, reason);
            metrics.recordSession("lost");
            conversation.error("Browser session lost: " + reason, Message.Metadata.forSession(sessionId));
            eventBus.publish(PilotEvent.of("session.lost", sessionId, null, Map.of("reason", reason)));
        }
        return lost;
    }

    /** @return true if the session was current and has been torn down */
    private boolean teardown(String sessionId) {
        var held = new boolean[1];
        store.update(s -> {
            held[0] = s.holdsSession(sessionId);
            return s.sessionEnded(sessionId);
        });
        return held[0];
    }

    private void releaseQuietly(String sessionId) {
        try {
            client.stopSession(sessionId);
        } catch (TransportException e) {
            log.warn("Could not release orphan session {}: {}", sessionId, e.getMessage());
        }
    }

    static Session merge(Session current, SessionStatusResponse response) {
        SessionInfo info = response.sessionInfo();
        String screenshot = response.screenshotPath() != null ? response.screenshotPath() : current.screenshotPath();
        String status = response.status() != null ? response.status() : current.status();
        if (info == null) {
            return new Session(current.sessionId(), current.active(), current.browserType(), current.headless(),
                    current.currentUrl(), current.lastActivity(), current.pendingCommands(), status, screenshot);
        }
        return new Session(
                current.sessionId(),
                info.isActive() == null || info.isActive(),
                info.browserType() != null ? BrowserType.fromWire(info.browserType()) : current.browserType(),
                info.headless() != null ? info.headless() : current.headless(),
                info.currentUrl() != null ? info.currentUrl() : current.currentUrl(),
                info.lastActivity() != null
                        ? Instant.ofEpochMilli(Math.round(info.lastActivity() * 1000))
                        : current.lastActivity(),
                info.pendingCommands() != null ? info.pendingCommands() : current.pendingCommands(),
                status,
                screenshot);
    }
}
