package com.browserpilot.core.state;

import com.browserpilot.core.model.BrowserConfig;
import com.browserpilot.core.model.BrowserType;
import com.browserpilot.core.model.Command;
import com.browserpilot.core.model.CommandStatus;
import com.browserpilot.core.model.Session;
import com.browserpilot.core.scheduler.PollHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreTest {

    private static final BrowserConfig CONFIG = new BrowserConfig(BrowserType.CHROMIUM, false, 30, true);

    private StateStore store;

    @BeforeEach
    void setUp() {
        store = new StateStore();
    }

    private static final class FakeHandle implements PollHandle {
        private boolean cancelled;

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }

    private FakeHandle startSession(String sessionId) {
        var timer = new FakeHandle();
        store.update(s -> s.sessionStarted(Session.started(sessionId, CONFIG), timer));
        return timer;
    }

    private Command polling(String commandId, String sessionId) {
        return Command.submitted(commandId, sessionId, "go").withStatus(CommandStatus.POLLING);
    }

    @Nested
    @DisplayName("timer ownership")
    class OwnershipTests {

        @Test
        @DisplayName("ending a session cancels its timer and the command timer in the same commit")
        void sessionEndCancelsTimers() {
            FakeHandle sessionTimer = startSession("S1");
            var commandTimer = new FakeHandle();
            store.update(s -> s.commandSubmitted(polling("C1", "S1"), commandTimer));

            ClientState next = store.update(s -> s.sessionEnded("S1"));

            assertTrue(sessionTimer.isCancelled());
            assertTrue(commandTimer.isCancelled());
            assertNull(next.session());
            assertEquals(CommandStatus.ABANDONED, next.command().status());
        }

        @Test
        @DisplayName("a terminal command update drops the command timer only")
        void terminalUpdateCancelsCommandTimer() {
            FakeHandle sessionTimer = startSession("S1");
            var commandTimer = new FakeHandle();
            store.update(s -> s.commandSubmitted(polling("C1", "S1"), commandTimer));

            store.update(s -> s.commandUpdated(s.command().withStatus(CommandStatus.COMPLETED)));

            assertTrue(commandTimer.isCancelled());
            assertFalse(sessionTimer.isCancelled());
            assertNull(store.get().commandTimer());
        }

        @Test
        @DisplayName("adopt cancels a handle the committed state rejected")
        void adoptCancelsRejected() {
            startSession("S1");
            var orphan = new FakeHandle();

            boolean adopted = store.adopt(orphan, s -> s.commandSubmitted(polling("C1", "S2"), orphan));

            assertFalse(adopted);
            assertTrue(orphan.isCancelled());
            assertNull(store.get().command());
        }

        @Test
        @DisplayName("adopt keeps a handle the committed state owns")
        void adoptKeepsOwned() {
            var timer = new FakeHandle();

            assertTrue(store.adopt(timer, s -> s.sessionStarted(Session.started("S1", CONFIG), timer)));
            assertFalse(timer.isCancelled());
        }

        @Test
        @DisplayName("a transition returning null is rejected")
        void rejectsNull() {
            assertThrows(IllegalStateException.class, () -> store.update(s -> null));
        }
    }

    @Nested
    @DisplayName("guarded transitions")
    class GuardTests {

        @Test
        @DisplayName("a refresh for a replaced session is ignored")
        void staleRefreshIgnored() {
            startSession("S1");
            store.update(s -> s.sessionEnded("S1"));
            startSession("S2");

            ClientState before = store.get();
            ClientState after = store.update(s -> s.sessionRefreshed(Session.started("S1", CONFIG)));

            assertSame(before, after);
        }

        @Test
        @DisplayName("terminal commands are frozen")
        void terminalFrozen() {
            startSession("S1");
            store.update(s -> s.commandSubmitted(polling("C1", "S1"), null));
            store.update(s -> s.commandUpdated(s.command().withStatus(CommandStatus.ABANDONED)));

            store.update(s -> s.commandUpdated(s.command().withStatus(CommandStatus.COMPLETED)));

            assertEquals(CommandStatus.ABANDONED, store.get().command().status());
        }

        @Test
        @DisplayName("a second command cannot be submitted while one is in flight")
        void oneCommandInFlight() {
            startSession("S1");
            store.update(s -> s.commandSubmitted(polling("C1", "S1"), null));

            store.update(s -> s.commandSubmitted(polling("C2", "S1"), null));

            assertEquals("C1", store.get().command().commandId());
        }

        @Test
        @DisplayName("the captcha flag only follows the current session")
        void captchaGuarded() {
            startSession("S1");

            store.update(s -> s.captchaObserved("S2", true));
            assertFalse(store.get().captchaPending());

            store.update(s -> s.captchaObserved("S1", true));
            assertTrue(store.get().captchaPending());

            store.update(s -> s.sessionEnded("S1"));
            assertFalse(store.get().captchaPending());
        }
    }
}
