package com.browserpilot.config;

import com.browserpilot.client.AutomationClient;
import com.browserpilot.core.scheduler.EventLoopScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PilotConfig {

    /** Single-threaded event loop shared by every timer; closed on context shutdown. */
    @Bean(destroyMethod = "close")
    public EventLoopScheduler pollScheduler() {
        return new EventLoopScheduler();
    }

    @Bean
    public AutomationClient automationClient(PilotProperties properties, ObjectMapper objectMapper) {
        return new AutomationClient(properties, objectMapper);
    }
}
