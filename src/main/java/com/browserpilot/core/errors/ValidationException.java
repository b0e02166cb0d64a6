package com.browserpilot.core.errors;

/**
 * Bad caller input (empty command, missing session, exhausted step budget).
 * Always raised before any network call and never retried.
 */
public class ValidationException extends BrowserPilotException {

    public ValidationException(String operation, String sessionId, String message) {
        super(operation, sessionId, null, message, null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
