package com.browserpilot.core.conversation;

import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.MessageRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationLogTest {

    private ConversationLog log;

    @BeforeEach
    void setUp() {
        log = new ConversationLog();
    }

    @Test
    @DisplayName("keeps entries in insertion order")
    void keepsOrder() {
        log.user("go to example.com", Message.Metadata.forSession("S1"));
        log.placeholder(Message.Metadata.forSession("S1"));
        log.system("Browser session stopped", null);

        List<MessageRole> roles = log.messages().stream().map(Message::role).toList();
        assertEquals(List.of(MessageRole.USER, MessageRole.RESULT, MessageRole.SYSTEM), roles);
        assertEquals(ConversationLog.PROCESSING, log.messages().get(1).content());
    }

    @Test
    @DisplayName("updates a RESULT placeholder in place")
    void updatesResult() {
        log.user("go", null);
        Message placeholder = log.placeholder(Message.Metadata.forSession("S1"));
        log.system("later", null);

        var updated = log.updateResult(placeholder.id(), "Navigated", Message.Metadata.forCommand("S1", "C1"));

        assertTrue(updated.isPresent());
        assertEquals("Navigated", log.messages().get(1).content());
        assertEquals("C1", log.messages().get(1).metadata().commandId());
        assertEquals(placeholder.id(), log.messages().get(1).id());
        assertEquals(3, log.messages().size());
    }

    @Test
    @DisplayName("never rewrites entries of other roles")
    void ignoresOtherRoles() {
        Message user = log.user("go", null);

        assertTrue(log.updateResult(user.id(), "changed", null).isEmpty());
        assertEquals("go", log.find(user.id()).orElseThrow().content());
        assertTrue(log.updateResult("missing", "x", null).isEmpty());
    }

    @Test
    @DisplayName("messages() is a snapshot")
    void snapshot() {
        log.user("go", null);
        List<Message> snapshot = log.messages();
        log.user("again", null);

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(null));
    }
}
