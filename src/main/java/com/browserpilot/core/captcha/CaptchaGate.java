package com.browserpilot.core.captcha;

import com.browserpilot.client.AutomationClient;
import com.browserpilot.core.conversation.ConversationLog;
import com.browserpilot.core.errors.CaptchaPendingException;
import com.browserpilot.core.errors.TransportException;
import com.browserpilot.core.errors.ValidationException;
import com.browserpilot.core.events.EventBus;
import com.browserpilot.core.events.PilotEvent;
import com.browserpilot.core.metrics.PilotMetrics;
import com.browserpilot.core.model.ClientError;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pauses command submission while the service waits for a human to solve a captcha.
 * <p>
 * The flag lives in the shared {@link StateStore}. It is raised when a session
 * status reports {@value #WAITING_FOR_CAPTCHA}, lowered by any other status of the
 * same session, and lowered once the service acknowledges a resolution.
 */
@Service
public class CaptchaGate {

    private static final Logger log = LoggerFactory.getLogger(CaptchaGate.class);

    public static final String WAITING_FOR_CAPTCHA = "waiting_for_captcha";

    private final StateStore store;
    private final AutomationClient client;
    private final EventBus eventBus;
    private final PilotMetrics metrics;
    private final ConversationLog conversation;

    public CaptchaGate(StateStore store, AutomationClient client, EventBus eventBus,
                       PilotMetrics metrics, ConversationLog conversation) {
        this.store = store;
        this.client = client;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.conversation = conversation;
    }

    /**
     * Feeds one observed session status. Observations for a session that is no
     * longer current are discarded.
     */
    public void observe(String sessionId, String status) {
        boolean pending = WAITING_FOR_CAPTCHA.equals(status);
        var changed = new AtomicBoolean();
        store.update(s -> {
            var next = s.captchaObserved(sessionId, pending);
            changed.set(next != s);
            return next;
        });
        if (!changed.get()) return;

        if (pending) {
            log.warn("Session {} is waiting for a captcha to be solved", sessionId);
            metrics.recordCaptchaPause();
            conversation.system("Captcha detected. Solve it in the browser window, then resolve it here.",
                    Message.Metadata.forSession(sessionId));
            eventBus.publish(PilotEvent.of("captcha.required", sessionId, null, Map.of("status", status)));
        } else {
            log.info("Session {} no longer waiting for a captcha (status={})", sessionId, status);
            eventBus.publish(PilotEvent.of("captcha.cleared", sessionId, null,
                    Map.of("status", status == null ? "" : status)));
        }
    }

    public boolean isPending() {
        return store.get().captchaPending();
    }

    /**
     * @throws CaptchaPendingException while the current session waits for a captcha
     */
    public void checkSubmissionAllowed(String sessionId) {
        if (store.get().captchaPending()) {
            throw new CaptchaPendingException(sessionId);
        }
    }

    /**
     * Tells the service the captcha has been solved. The flag is cleared only
     * after the acknowledgement; on failure it stays set. Sessions other than
     * the current one are resolved on the service without touching local state.
     *
     * @throws ValidationException if {@code sessionId} is blank
     * @throws TransportException  if the service could not be reached or refused
     */
    public void resolve(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("resolveCaptcha", sessionId, "session id must not be empty");
        }
        try {
            var ack = client.resolveCaptcha(sessionId);
            if (ack.isError()) {
                throw new TransportException("resolveCaptcha", sessionId, null, 200, ack.message());
            }
        } catch (TransportException e) {
            log.warn("Captcha resolution for session {} failed: {}", sessionId, e.getMessage());
            store.update(s -> s.holdsSession(sessionId) ? s.withError(ClientError.of(e)) : s);
            throw e;
        }

        store.update(s -> s.holdsSession(sessionId) ? s.captchaObserved(sessionId, false).errorCleared() : s);
        log.info("Captcha resolved for session {}", sessionId);
        conversation.system("Captcha resolved, automation resumed.", Message.Metadata.forSession(sessionId));
        eventBus.publish(PilotEvent.of("captcha.resolved", sessionId, null, Map.of()));
    }
}
