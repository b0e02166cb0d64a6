package com.browserpilot.core.conversation;

import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.MessageRole;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Chat-style log of what the user asked and what the service answered.
 * <p>
 * Append-only: the only entries ever rewritten are RESULT placeholders, which
 * a command updates in place while it is being polled. Insertion order is
 * chronological order.
 */
@Component
public class ConversationLog {

    public static final String PROCESSING = "Processing...";

    private final List<Message> messages = new ArrayList<>();

    public synchronized Message append(MessageRole role, String content, Message.Metadata metadata) {
        var message = new Message(UUID.randomUUID().toString(), role, content, Instant.now(), metadata);
        messages.add(message);
        return message;
    }

    public Message user(String content, Message.Metadata metadata) {
        return append(MessageRole.USER, content, metadata);
    }

    public Message system(String content, Message.Metadata metadata) {
        return append(MessageRole.SYSTEM, content, metadata);
    }

    public Message error(String content, Message.Metadata metadata) {
        return append(MessageRole.ERROR, content, metadata);
    }

    /** Adds the RESULT entry a command will keep updating until it is terminal. */
    public Message placeholder(Message.Metadata metadata) {
        return append(MessageRole.RESULT, PROCESSING, metadata);
    }

    /**
     * Rewrites a RESULT entry in place. Entries of any other role are never touched.
     *
     * @return the updated message, or empty if no RESULT entry has that id
     */
    public synchronized Optional<Message> updateResult(String messageId, String content, Message.Metadata metadata) {
        for (int i = 0; i < messages.size(); i++) {
            Message existing = messages.get(i);
            if (existing.id().equals(messageId)) {
                if (existing.role() != MessageRole.RESULT) {
                    return Optional.empty();
                }
                Message updated = existing.withContent(content, metadata);
                messages.set(i, updated);
                return Optional.of(updated);
            }
        }
        return Optional.empty();
    }

    public synchronized Optional<Message> find(String messageId) {
        return messages.stream().filter(m -> m.id().equals(messageId)).findFirst();
    }

    public synchronized List<Message> messages() {
        return List.copyOf(messages);
    }
}
