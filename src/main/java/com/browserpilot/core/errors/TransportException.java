package com.browserpilot.core.errors;

/**
 * Network failure, timeout, non-2xx answer or unreadable body from the automation service.
 */
public class TransportException extends BrowserPilotException {

    /** Status code of the failed response, or 0 when no response was received. */
    private final int statusCode;
    private final String detail;

    public TransportException(String operation, String sessionId, String commandId,
                              int statusCode, String detail) {
        super(operation, sessionId, commandId, buildMessage(statusCode, detail), null);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public TransportException(String operation, String sessionId, String commandId,
                              String message, Throwable cause) {
        super(operation, sessionId, commandId, message, cause);
        this.statusCode = 0;
        this.detail = message;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSPORT;
    }

    public int statusCode() { return statusCode; }
    public String detail() { return detail; }

    /**
     * True when the service said the target does not exist. The service wraps
     * its own 404s into 500s with a {@code "404: ..."} detail, so the detail is
     * inspected as well as the status code.
     */
    public boolean isNotFound() {
        if (statusCode == 404) return true;
        if (detail == null) return false;
        var lower = detail.toLowerCase();
        return lower.startsWith("404") || lower.contains("not found");
    }

    private static String buildMessage(int statusCode, String detail) {
        return detail == null || detail.isBlank()
                ? "HTTP " + statusCode
                : "HTTP %d: %s".formatted(statusCode, detail);
    }
}
