package com.browserpilot.core.model;

public enum MessageRole {
    USER,
    SYSTEM,
    RESULT,
    ERROR
}
