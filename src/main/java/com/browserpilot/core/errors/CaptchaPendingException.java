package com.browserpilot.core.errors;

/**
 * Command submission rejected because the session is paused on a captcha
 * that a human has not yet solved.
 */
public class CaptchaPendingException extends BrowserPilotException {

    public CaptchaPendingException(String sessionId) {
        super("submit", sessionId, null,
                "session is waiting for a captcha to be solved; resolve it before sending commands", null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CAPTCHA_PENDING;
    }
}
