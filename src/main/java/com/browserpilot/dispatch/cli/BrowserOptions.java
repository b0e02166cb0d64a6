package com.browserpilot.dispatch.cli;

import com.browserpilot.config.PilotProperties;
import com.browserpilot.core.model.BrowserConfig;
import com.browserpilot.core.model.BrowserType;
import picocli.CommandLine.Option;

/**
 * Session options shared by the commands that start a browser session.
 * Unset options fall back to {@code browserpilot.session.*}.
 */
public class BrowserOptions {

    @Option(names = {"--browser", "-b"}, description = "Browser engine: chromium, firefox, webkit")
    String browser;

    @Option(names = "--headless", negatable = true, description = "Run the browser without a window")
    Boolean headless;

    @Option(names = "--session-timeout", description = "Per-action timeout on the service, in seconds")
    Integer sessionTimeout;

    @Option(names = "--no-captcha-wait", description = "Do not pause when a captcha shows up")
    boolean noCaptchaWait;

    public BrowserConfig toConfig(PilotProperties properties) {
        BrowserConfig defaults = properties.defaultBrowserConfig();
        return new BrowserConfig(
                browser != null ? BrowserType.fromWire(browser) : defaults.browserType(),
                headless != null ? headless : defaults.headless(),
                sessionTimeout != null ? sessionTimeout : defaults.timeoutSeconds(),
                !noCaptchaWait && defaults.waitForCaptcha());
    }
}
