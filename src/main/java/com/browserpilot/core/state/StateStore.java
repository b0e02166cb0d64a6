package com.browserpilot.core.state;

import com.browserpilot.core.scheduler.PollHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.UnaryOperator;

/**
 * Holder of the single committed {@link ClientState}.
 * <p>
 * Transitions are applied under a lock, one at a time. Any timer handle owned
 * by the previous state but not by the new one is cancelled before the commit
 * returns, so ending a lifecycle and stopping its timer happen together.
 */
@Component
public class StateStore {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private ClientState state = ClientState.initial();

    public synchronized ClientState get() {
        return state;
    }

    /**
     * Applies {@code transition} to the committed state and commits the result.
     *
     * @return the newly committed state
     */
    public synchronized ClientState update(UnaryOperator<ClientState> transition) {
        ClientState previous = state;
        ClientState next = transition.apply(previous);
        if (next == null) {
            throw new IllegalStateException("State transition returned null");
        }
        state = next;
        for (PollHandle handle : previous.ownedHandles()) {
            if (!next.owns(handle)) {
                handle.cancel();
            }
        }
        return next;
    }

    /**
     * Commits a transition meant to hand ownership of a freshly scheduled
     * {@code handle} to the state. If the transition was rejected by its guard,
     * nobody owns the handle and it is cancelled here.
     *
     * @return true if the committed state owns the handle
     */
    public synchronized boolean adopt(PollHandle handle, UnaryOperator<ClientState> transition) {
        ClientState next = update(transition);
        if (handle != null && !next.owns(handle)) {
            log.debug("Timer {} was not adopted by the committed state, cancelling", handle);
            handle.cancel();
            return false;
        }
        return true;
    }
}
