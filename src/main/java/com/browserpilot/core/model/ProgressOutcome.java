package com.browserpilot.core.model;

public enum ProgressOutcome {
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
