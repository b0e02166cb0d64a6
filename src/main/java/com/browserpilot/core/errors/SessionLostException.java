package com.browserpilot.core.errors;

/**
 * The service reports the session inactive or unknown. Whoever catches this
 * can rely on local session, command and task identifiers already being cleared.
 */
public class SessionLostException extends BrowserPilotException {

    public SessionLostException(String operation, String sessionId, String message) {
        super(operation, sessionId, null, message, null);
    }

    public SessionLostException(String operation, String sessionId, String message, Throwable cause) {
        super(operation, sessionId, null, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SESSION_LOST;
    }
}
