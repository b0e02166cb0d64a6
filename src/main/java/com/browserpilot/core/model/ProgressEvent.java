package com.browserpilot.core.model;

import java.io.Serializable;

/**
 * One observed sub-action while polling a command.
 *
 * @param action  action label
 * @param outcome in progress, completed or failed
 * @param message optional detail
 */
public record ProgressEvent(String action, ProgressOutcome outcome, String message) implements Serializable {}
