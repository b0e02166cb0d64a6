package com.browserpilot.core.model;

import java.io.Serializable;

/**
 * Outcome of one browser sub-action executed for a command.
 *
 * @param command label of the action, e.g. "navigate" or "click"
 * @param success whether the action succeeded
 * @param message service-provided detail
 */
public record ActionResult(String command, boolean success, String message) implements Serializable {}
