package com.browserpilot.core.errors;

/**
 * Base class for every failure raised by the orchestration layer.
 * <p>
 * Carries the operation that failed and the session/command identifiers it was
 * working on, so a presentation layer can render a message without having to
 * know where the exception came from.
 */
public abstract class BrowserPilotException extends RuntimeException {

    private final String operation;
    private final String sessionId;
    private final String commandId;

    protected BrowserPilotException(String operation, String sessionId, String commandId,
                                    String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.sessionId = sessionId;
        this.commandId = commandId;
    }

    public abstract ErrorKind kind();

    public String operation() { return operation; }
    public String sessionId() { return sessionId; }
    public String commandId() { return commandId; }

    /**
     * Human-readable one-liner, e.g. {@code "submit failed [session=abc]: command text must not be empty"}.
     */
    public String describe() {
        var context = new StringBuilder();
        if (sessionId != null) context.append("session=").append(sessionId);
        if (commandId != null) {
            if (!context.isEmpty()) context.append(", ");
            context.append("command=").append(commandId);
        }
        return context.isEmpty()
                ? "%s failed: %s".formatted(operation, getMessage())
                : "%s failed [%s]: %s".formatted(operation, context, getMessage());
    }
}
