package com.browserpilot.client;

import com.browserpilot.config.PilotProperties;
import com.browserpilot.core.errors.TransportException;
import com.browserpilot.core.model.BrowserConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP client for the browser automation service.
 *
 * <p>Stateless: every method maps to exactly one request and returns the
 * parsed answer. Network failures, timeouts, non-2xx answers and unreadable
 * bodies all surface as {@link TransportException}, with the service's
 * {@code detail} message when it sent one.
 */
public class AutomationClient {

    private static final Logger log = LoggerFactory.getLogger(AutomationClient.class);

    private final PilotProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public AutomationClient(PilotProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
    }

    // -- Browser sessions --

    public StartSessionResponse startSession(BrowserConfig config) {
        var path = "/start_browser?browser_type=%s&headless=%s&timeout=%d&wait_for_captcha=%s".formatted(
                encode(config.browserType().wireName()), config.headless(),
                config.timeoutSeconds(), config.waitForCaptcha());
        var response = post("start", null, null, path, null, StartSessionResponse.class);
        if (response.sessionId() == null || response.sessionId().isBlank()) {
            throw new TransportException("start", null, null, 200,
                    response.message() != null ? response.message() : "no session_id in response");
        }
        log.info("Started browser session {} ({})", response.sessionId(), config.browserType().wireName());
        return response;
    }

    public AckResponse stopSession(String sessionId) {
        return post("stop", sessionId, null, "/stop_browser/" + encode(sessionId), null, AckResponse.class);
    }

    public SessionStatusResponse getSessionStatus(String sessionId) {
        return get("refreshStatus", sessionId, null, "/session/" + encode(sessionId), SessionStatusResponse.class);
    }

    public AckResponse resolveCaptcha(String sessionId) {
        return post("resolveCaptcha", sessionId, null, "/resolve_captcha/" + encode(sessionId), null, AckResponse.class);
    }

    // -- Commands --

    /**
     * Submits a natural-language command. The request timeout is stretched to
     * cover the command timeout, since the service may answer synchronously.
     */
    public InteractResponse executeCommand(String sessionId, String userInput, int timeoutSeconds) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("user_input", userInput);
        body.put("timeout", timeoutSeconds);
        Duration requestTimeout = max(properties.getRequestTimeout(), Duration.ofSeconds(timeoutSeconds + 10L));
        return send("submit", sessionId, null,
                jsonRequest("/interact/" + encode(sessionId), requestTimeout)
                        .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                        .build(),
                InteractResponse.class);
    }

    public CommandStatusResponse getCommandStatus(String sessionId, String commandId) {
        return get("poll", sessionId, commandId,
                "/command_status/" + encode(sessionId) + "/" + encode(commandId), CommandStatusResponse.class);
    }

    // -- Agent tasks --

    public AgentTaskResponse executeAgentTask(AgentTaskRequest request) {
        return post("executeTask", null, null, "/browser-agent/execute", toJson(request), AgentTaskResponse.class);
    }

    public AgentStepResponse executeAgentStep(String sessionId, int steps) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("session_id", sessionId);
        body.put("steps", steps);
        return post("executeStep", sessionId, null, "/browser-agent/step", body.toString(), AgentStepResponse.class);
    }

    public AgentSessionStatus getAgentSessionStatus(String sessionId) {
        return get("taskStatus", sessionId, null, "/browser-agent/session/" + encode(sessionId),
                AgentSessionStatus.class);
    }

    /**
     * Releases an agent session. The service answers {@code status=warning}
     * for sessions it no longer knows.
     */
    public AckResponse cleanupAgentSession(String sessionId) {
        return send("cleanup", sessionId, null,
                jsonRequest("/browser-agent/session/" + encode(sessionId), properties.getRequestTimeout())
                        .DELETE()
                        .build(),
                AckResponse.class);
    }

    // -- Screenshots --

    public byte[] fetchScreenshot(String filename) {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + "/screenshots/" + encode(filename)))
                .timeout(properties.getRequestTimeout())
                .GET()
                .build();
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() >= 400) {
                throw new TransportException("screenshot", null, null, response.statusCode(),
                        extractDetail(new String(response.body(), StandardCharsets.UTF_8)));
            }
            return response.body();
        } catch (IOException e) {
            throw new TransportException("screenshot", null, null,
                    "Screenshot request failed: GET /screenshots/" + filename, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("screenshot", null, null, "Screenshot request interrupted", e);
        }
    }

    // -- Plumbing --

    private <T> T get(String operation, String sessionId, String commandId, String path, Class<T> type) {
        return send(operation, sessionId, commandId,
                jsonRequest(path, properties.getRequestTimeout()).GET().build(), type);
    }

    private <T> T post(String operation, String sessionId, String commandId, String path,
                       String body, Class<T> type) {
        var publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        return send(operation, sessionId, commandId,
                jsonRequest(path, properties.getRequestTimeout()).POST(publisher).build(), type);
    }

    private HttpRequest.Builder jsonRequest(String path, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
    }

    <T> T send(String operation, String sessionId, String commandId, HttpRequest request, Class<T> type) {
        String target = request.method() + " " + request.uri().getPath();
        try {
            log.debug("{} -> {}", operation, target);
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new TransportException(operation, sessionId, commandId,
                        response.statusCode(), extractDetail(response.body()));
            }
            return objectMapper.readValue(response.body(), type);
        } catch (IOException e) {
            throw new TransportException(operation, sessionId, commandId,
                    "Request failed: %s (%s)".formatted(target, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(operation, sessionId, commandId, "Request interrupted: " + target, e);
        }
    }

    /** FastAPI error bodies look like {@code {"detail": "..."}}; falls back to the raw body. */
    String extractDetail(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json != null && json.has("detail")) {
                JsonNode detail = json.get("detail");
                return detail.isTextual() ? detail.asText() : detail.toString();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
