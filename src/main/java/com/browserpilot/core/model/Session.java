package com.browserpilot.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Local snapshot of one server-side automation session.
 *
 * @param sessionId       server-assigned identifier
 * @param active          whether the service still considers the session live
 * @param browserType     browser engine in use
 * @param headless        whether the browser runs headless
 * @param currentUrl      URL the browser is on, if known
 * @param lastActivity    last activity reported by the service
 * @param pendingCommands commands queued but not processed on the service
 * @param status          last raw status string ({@code "active"}, {@code "waiting_for_captcha"})
 * @param screenshotPath  latest screenshot reference, passed through unmodified
 */
public record Session(
    String sessionId,
    boolean active,
    BrowserType browserType,
    boolean headless,
    String currentUrl,
    Instant lastActivity,
    int pendingCommands,
    String status,
    String screenshotPath
) implements Serializable {

    public static Session started(String sessionId, BrowserConfig config) {
        return new Session(sessionId, true, config.browserType(), config.headless(),
                null, Instant.now(), 0, "active", null);
    }
}
