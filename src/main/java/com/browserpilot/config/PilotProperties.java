package com.browserpilot.config;

import com.browserpilot.core.model.BrowserConfig;
import com.browserpilot.core.model.BrowserType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "browserpilot")
public class PilotProperties {

    private Service service = new Service();
    private Session session = new Session();
    private Command command = new Command();
    private Agent agent = new Agent();
    private Screenshots screenshots = new Screenshots();

    // -- Convenience accessors (delegate to nested) --
    public String getBaseUrl() { return stripTrailingSlash(service.baseUrl); }
    public Duration getConnectTimeout() { return Duration.ofSeconds(service.connectTimeoutSeconds); }
    public Duration getRequestTimeout() { return Duration.ofSeconds(service.requestTimeoutSeconds); }
    public Duration getStatusInterval() { return Duration.ofMillis(session.statusIntervalMs); }
    public Duration getPollInterval() { return Duration.ofMillis(command.pollIntervalMs); }
    public int getCommandTimeoutSeconds() { return command.timeoutSeconds; }
    public int getMaxConsecutivePollFailures() { return command.maxConsecutivePollFailures; }
    public int getPollGraceSeconds() { return command.pollGraceSeconds; }
    public String getDefaultStartUrl() { return agent.startUrl; }
    public int getDefaultMaxSteps() { return agent.maxSteps; }
    public String getScreenshotDirectory() { return screenshots.directory; }

    /** Session options as configured, used when the caller does not override them. */
    public BrowserConfig defaultBrowserConfig() {
        return new BrowserConfig(BrowserType.fromWire(session.browserType), session.headless,
                session.timeoutSeconds, session.waitForCaptcha);
    }

    public Service getService() { return service; }
    public void setService(Service service) { this.service = service; }
    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }
    public Command getCommand() { return command; }
    public void setCommand(Command command) { this.command = command; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Screenshots getScreenshots() { return screenshots; }
    public void setScreenshots(Screenshots screenshots) { this.screenshots = screenshots; }

    private static String stripTrailingSlash(String url) {
        if (url == null) return "";
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static class Service {
        private String baseUrl = "http://localhost:8000";
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 30;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }

    public static class Session {
        private String browserType = "chromium";
        private boolean headless = false;
        private int timeoutSeconds = 30;
        private boolean waitForCaptcha = true;
        private long statusIntervalMs = 5000;

        public String getBrowserType() { return browserType; }
        public void setBrowserType(String browserType) { this.browserType = browserType; }
        public boolean isHeadless() { return headless; }
        public void setHeadless(boolean headless) { this.headless = headless; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public boolean isWaitForCaptcha() { return waitForCaptcha; }
        public void setWaitForCaptcha(boolean waitForCaptcha) { this.waitForCaptcha = waitForCaptcha; }
        public long getStatusIntervalMs() { return statusIntervalMs; }
        public void setStatusIntervalMs(long statusIntervalMs) { this.statusIntervalMs = statusIntervalMs; }
    }

    public static class Command {
        private int timeoutSeconds = 60;
        private long pollIntervalMs = 1000;
        private int maxConsecutivePollFailures = 10;
        private int pollGraceSeconds = 30;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
        public int getMaxConsecutivePollFailures() { return maxConsecutivePollFailures; }
        public void setMaxConsecutivePollFailures(int maxConsecutivePollFailures) { this.maxConsecutivePollFailures = maxConsecutivePollFailures; }
        public int getPollGraceSeconds() { return pollGraceSeconds; }
        public void setPollGraceSeconds(int pollGraceSeconds) { this.pollGraceSeconds = pollGraceSeconds; }
    }

    public static class Agent {
        private String startUrl = "https://www.google.com";
        private int maxSteps = 10;

        public String getStartUrl() { return startUrl; }
        public void setStartUrl(String startUrl) { this.startUrl = startUrl; }
        public int getMaxSteps() { return maxSteps; }
        public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }
    }

    public static class Screenshots {
        private String directory = "screenshots";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }
}
