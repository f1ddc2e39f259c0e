package com.openforge.streamkit.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.streamkit.llm.sse.SseEventSource;
import com.openforge.streamkit.llm.stream.MessageStreamSession;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Stateless streaming client for one provider.
 *
 * Submits a ready-made request body to {baseUrl}/messages with "stream": true
 * and hands back a {@link MessageStreamSession} reading the SSE response.
 * The caller pulls chunks at its own pace; the HTTP body is read lazily,
 * one event per pull, on the caller's thread.
 *
 * Building the request body (messages, tools, system prompt) is the caller's job.
 */
@Slf4j
public class LlmStreamClient {

    private static final int ERROR_SNIPPET_BYTES = 2048;

    private final HttpClient                   httpClient;
    private final ObjectMapper                 objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmStreamClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Opens a streaming completion.
     *
     * The body is copied; "stream": true is forced and the configured model is
     * filled in when the body has none.
     *
     * @return a session positioned before the first event; close it when done
     * @throws LlmException.LlmRateLimitException on HTTP 429
     * @throws LlmException on network failure or any other non-2xx status
     */
    public MessageStreamSession openStream(ObjectNode requestBody) {
        if (requestBody == null) {
            throw new LlmException("Request body must not be null for provider [%s]"
                    .formatted(config.name()));
        }

        ObjectNode body = requestBody.deepCopy();
        if (!body.hasNonNull("model")) {
            body.put("model", config.model());
        }
        body.put("stream", true);

        String json = serialize(body);
        log.debug("[LlmStreamClient:{}] → POST /messages body-length={}", config.name(), json.length());

        HttpResponse<InputStream> response = send(buildHttpRequest(json));
        int status = response.statusCode();
        if (status == 429) {
            closeQuietly(response.body());
            throw new LlmException.LlmRateLimitException(
                    "Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            throw new LlmException("Provider [%s] returned HTTP %d on stream open: %s"
                    .formatted(config.name(), status, readSnippet(response.body())));
        }

        log.debug("[LlmStreamClient:{}] ← HTTP {} stream opened", config.name(), status);
        return new MessageStreamSession(
                new SseEventSource(new InputStreamReader(response.body(), StandardCharsets.UTF_8)),
                objectMapper);
    }

    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/messages"))
                .header("Content-Type", "application/json")
                .header("Accept", "text/event-stream")
                .header("x-api-key", config.apiKey() == null ? "" : config.apiKey())
                .header("anthropic-version", config.apiVersion())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<InputStream> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new LlmException("Network error (streaming) calling provider [%s]"
                    .formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while opening stream to provider [%s]"
                    .formatted(config.name()), e);
        }
    }

    /** Error bodies are JSON, not SSE; the first couple of KB are enough to diagnose. */
    private String readSnippet(InputStream body) {
        if (body == null) return "";
        try (InputStream in = body) {
            return new String(in.readNBytes(ERROR_SNIPPET_BYTES), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "(error body unreadable: %s)".formatted(e.getMessage());
        }
    }

    private void closeQuietly(InputStream body) {
        if (body == null) return;
        try {
            body.close();
        } catch (IOException e) {
            log.debug("[LlmStreamClient:{}] Failed to close rejected response body: {}",
                    config.name(), e.getMessage());
        }
    }

    private String serialize(ObjectNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize streaming request", e);
        }
    }
}
