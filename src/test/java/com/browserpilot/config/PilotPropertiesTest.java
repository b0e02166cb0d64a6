package com.browserpilot.config;

import com.browserpilot.core.model.BrowserConfig;
import com.browserpilot.core.model.BrowserType;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PilotPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new PilotProperties();
        assertEquals("http://localhost:8000", props.getBaseUrl());
        assertEquals(Duration.ofSeconds(5), props.getStatusInterval());
        assertEquals(Duration.ofSeconds(1), props.getPollInterval());
        assertEquals(60, props.getCommandTimeoutSeconds());
        assertEquals(10, props.getMaxConsecutivePollFailures());
        assertEquals("https://www.google.com", props.getDefaultStartUrl());
        assertEquals(10, props.getDefaultMaxSteps());
        assertEquals("screenshots", props.getScreenshotDirectory());
    }

    @Test
    void defaultBrowserConfig() {
        BrowserConfig config = new PilotProperties().defaultBrowserConfig();
        assertEquals(BrowserType.CHROMIUM, config.browserType());
        assertFalse(config.headless());
        assertEquals(30, config.timeoutSeconds());
        assertTrue(config.waitForCaptcha());
    }

    @Test
    void baseUrlTrailingSlashIsStripped() {
        var props = new PilotProperties();
        props.getService().setBaseUrl("http://automation:8000/");
        assertEquals("http://automation:8000", props.getBaseUrl());
    }

    @Test
    void bindsRelaxedPropertyNames() {
        var source = new MapConfigurationPropertySource(Map.of(
                "browserpilot.service.base-url", "http://remote:9000",
                "browserpilot.session.browser-type", "firefox",
                "browserpilot.session.headless", "true",
                "browserpilot.command.poll-interval-ms", "250",
                "browserpilot.agent.max-steps", "25"));

        PilotProperties props = new Binder(source).bind("browserpilot", PilotProperties.class).get();

        assertEquals("http://remote:9000", props.getBaseUrl());
        assertEquals(BrowserType.FIREFOX, props.defaultBrowserConfig().browserType());
        assertTrue(props.defaultBrowserConfig().headless());
        assertEquals(Duration.ofMillis(250), props.getPollInterval());
        assertEquals(25, props.getDefaultMaxSteps());
    }
}
