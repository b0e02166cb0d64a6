package com.browserpilot.core.model;

import com.browserpilot.core.errors.BrowserPilotException;
import com.browserpilot.core.errors.ErrorKind;

import java.io.Serializable;
import java.time.Instant;

/**
 * Last fatal error, kept in client state so it can be rendered as an explicit error.
 */
public record ClientError(
    ErrorKind kind,
    String operation,
    String sessionId,
    String commandId,
    String message,
    Instant timestamp
) implements Serializable {

    public static ClientError of(BrowserPilotException e) {
        return new ClientError(e.kind(), e.operation(), e.sessionId(), e.commandId(),
                e.getMessage(), Instant.now());
    }

    public static ClientError of(ErrorKind kind, String operation, String sessionId,
                                 String commandId, String message) {
        return new ClientError(kind, operation, sessionId, commandId, message, Instant.now());
    }
}
