package com.browserpilot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured result of a processed command.
 *
 * @param status         service-side result status ("success" or "error")
 * @param actions        ordered sub-action outcomes
 * @param explanation    human-readable summary
 * @param taskCompleted  whether the service considers the whole instruction done
 * @param screenshotPath screenshot reference, passed through unmodified
 */
public record CommandResult(
    String status,
    List<ActionResult> actions,
    String explanation,
    boolean taskCompleted,
    String screenshotPath
) implements Serializable {
    public CommandResult {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
