package com.browserpilot.client;

import com.browserpilot.core.model.ActionResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a {@code results} array. The service echoes the executed
 * action under {@code command}, sometimes as a label, sometimes as an object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionResultPayload(
    @JsonProperty("command") JsonNode command,
    @JsonProperty("success") Boolean success,
    @JsonProperty("message") String message
) {

    public ActionResult toActionResult() {
        return new ActionResult(label(), Boolean.TRUE.equals(success), message);
    }

    private String label() {
        if (command == null || command.isNull()) return "action";
        if (command.isTextual()) return command.asText();
        if (command.hasNonNull("action")) return command.get("action").asText();
        return command.toString();
    }
}
