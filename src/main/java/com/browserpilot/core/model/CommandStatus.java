package com.browserpilot.core.model;

/**
 * Client-side lifecycle of a submitted command.
 */
public enum CommandStatus {
    SUBMITTED,
    POLLING,
    COMPLETED,
    FAILED,
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABANDONED;
    }
}
