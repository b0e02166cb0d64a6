package com.browserpilot.core.model;

/**
 * Options for starting an automation session.
 *
 * @param browserType    browser engine to launch
 * @param headless       run without a visible window
 * @param timeoutSeconds global per-action timeout applied by the service
 * @param waitForCaptcha pause on captchas and wait for manual resolution
 */
public record BrowserConfig(
    BrowserType browserType,
    boolean headless,
    int timeoutSeconds,
    boolean waitForCaptcha
) {
    public BrowserConfig {
        if (browserType == null) browserType = BrowserType.CHROMIUM;
    }
}
