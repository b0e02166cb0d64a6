package com.browserpilot.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PilotMetricsTest {

    private SimpleMeterRegistry registry;
    private PilotMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PilotMetrics(registry);
    }

    @Test
    @DisplayName("recordSession counts by result tag")
    void recordSession() {
        metrics.recordSession("started");
        metrics.recordSession("started");
        metrics.recordSession("lost");

        assertEquals(2.0, registry.find("browserpilot.sessions.total").tag("result", "started").counter().count());
        assertEquals(1.0, registry.find("browserpilot.sessions.total").tag("result", "lost").counter().count());
    }

    @Test
    @DisplayName("recordCommandResult counts and times by lower-case status")
    void recordCommandResult() {
        metrics.recordCommandResult("COMPLETED", Duration.ofMillis(1500));

        var counter = registry.find("browserpilot.commands.total").tag("status", "completed").counter();
        var timer = registry.find("browserpilot.command.duration").tag("status", "completed").timer();
        assertNotNull(counter);
        assertNotNull(timer);
        assertEquals(1.0, counter.count());
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordPoll counts by result tag")
    void recordPoll() {
        metrics.recordPoll("ok");
        metrics.recordPoll("error");

        assertEquals(1.0, registry.find("browserpilot.polls.total").tag("result", "ok").counter().count());
        assertEquals(1.0, registry.find("browserpilot.polls.total").tag("result", "error").counter().count());
    }

    @Test
    @DisplayName("recordAgentSteps feeds a distribution summary")
    void recordAgentSteps() {
        metrics.recordAgentSteps(3);
        metrics.recordAgentSteps(1);

        var summary = registry.find("browserpilot.agent.steps").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(4.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordCaptchaPause increments its counter")
    void recordCaptchaPause() {
        metrics.recordCaptchaPause();
        assertEquals(1.0, registry.find("browserpilot.captcha.pauses").counter().count());
    }
}
