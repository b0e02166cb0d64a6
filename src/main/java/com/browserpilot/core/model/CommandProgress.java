package com.browserpilot.core.model;

import java.io.Serializable;

/**
 * In-flight progress snapshot for a command that is not yet finished.
 */
public record CommandProgress(
    int actionsCompleted,
    String lastAction,
    String currentExplanation
) implements Serializable {}
