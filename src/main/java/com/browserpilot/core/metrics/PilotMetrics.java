package com.browserpilot.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for sessions, commands, polls and agent steps.
 */
@Service
public class PilotMetrics {

    private final MeterRegistry registry;

    public PilotMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param result "started", "stopped", "lost" or "failed"
     */
    public void recordSession(String result) {
        Counter.builder("browserpilot.sessions.total")
                .description("Session lifecycle transitions")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordCommandResult(String status, Duration elapsed) {
        Counter.builder("browserpilot.commands.total")
                .tag("status", status.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        Timer.builder("browserpilot.command.duration")
                .tag("status", status.toLowerCase(Locale.ROOT))
                .register(registry)
                .record(elapsed);
    }

    /**
     * @param result "ok" or "error"
     */
    public void recordPoll(String result) {
        Counter.builder("browserpilot.polls.total")
                .description("Command status polls")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordAgentSteps(int steps) {
        DistributionSummary.builder("browserpilot.agent.steps")
                .description("Steps reported per agent step request")
                .register(registry)
                .record(steps);
    }

    public void recordCaptchaPause() {
        Counter.builder("browserpilot.captcha.pauses")
                .register(registry)
                .increment();
    }
}
