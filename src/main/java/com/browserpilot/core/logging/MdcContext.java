package com.browserpilot.core.logging;

import org.slf4j.MDC;

/**
 * Utility for the BrowserPilot MDC keys used in the console log pattern.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String COMMAND_ID = "commandId";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
        MDC.remove(COMMAND_ID);
    }

    public static void setCommand(String sessionId, String commandId) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(COMMAND_ID, commandId);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(COMMAND_ID);
    }
}
