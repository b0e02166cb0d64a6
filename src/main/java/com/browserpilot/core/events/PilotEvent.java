package com.browserpilot.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A state transition of the client, published for the presentation layer.
 *
 * @param eventType event type (e.g. "session.started", "command.progress", "captcha.required")
 * @param sessionId the session this event belongs to (agent session id for "agent.*" events)
 * @param commandId the command this event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PilotEvent(
    String eventType,
    String sessionId,
    String commandId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static PilotEvent of(String eventType, String sessionId, String commandId,
                                Map<String, Object> payload) {
        return new PilotEvent(eventType, sessionId, commandId,
                payload == null ? Map.of() : payload, Instant.now());
    }
}
