package com.browserpilot.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Entry of the chat-style conversation log.
 *
 * @param id        log-local identifier
 * @param role      who or what produced the entry
 * @param content   text to display
 * @param timestamp creation time
 * @param metadata  optional references to the command, session, screenshot and raw result
 */
public record Message(
    String id,
    MessageRole role,
    String content,
    Instant timestamp,
    Metadata metadata
) implements Serializable {

    public record Metadata(
        String commandId,
        String sessionId,
        String screenshotPath,
        CommandResult result
    ) implements Serializable {

        public static Metadata forSession(String sessionId) {
            return new Metadata(null, sessionId, null, null);
        }

        public static Metadata forCommand(String sessionId, String commandId) {
            return new Metadata(commandId, sessionId, null, null);
        }
    }

    public Message withContent(String newContent, Metadata newMetadata) {
        return new Message(id, role, newContent, timestamp, newMetadata != null ? newMetadata : metadata);
    }
}
