package com.openforge.streamkit.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.streamkit.llm.stream.MessageStreamSession;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;

/**
 * High-availability stream opener.
 *
 * Call graph:
 *
 *   openStream(body)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryClient.openStream(body with primary model)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackClient.openStream(body with fallback model)
 *
 * Only the opening handshake is guarded. Once the session is handed out,
 * a mid-stream failure surfaces from nextChunk() and ends that session;
 * nothing here replays a half-consumed stream.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    private final LlmStreamClient primaryClient;
    private final LlmStreamClient fallbackClient;
    private final CircuitBreaker  primaryCb;
    private final CircuitBreaker  fallbackCb;
    private final Retry           primaryRetry;
    private final Retry           fallbackRetry;

    @Autowired
    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this(new LlmStreamClient(httpClient, objectMapper, properties.primary()),
                properties.fallback() != null
                        ? new LlmStreamClient(httpClient, objectMapper, properties.fallback())
                        : null,
                primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
                primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmStreamClient primaryClient,
              LlmStreamClient fallbackClient,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Opens a stream on the primary provider, falling back when it cannot be opened.
     *
     * The "model" field is overridden by each provider's configured model, so
     * callers only need to supply messages, tools and sampling options.
     */
    public MessageStreamSession openStream(ObjectNode requestBody) {
        if (requestBody == null) {
            throw new LlmException("Request body must not be null");
        }
        try {
            ObjectNode primaryBody = overrideModel(requestBody, primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.openStream(primaryBody), "primary");
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null) throw primaryException;
            log.warn("[LlmRouter] Primary stream failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ObjectNode fallbackBody = overrideModel(requestBody, fallbackClient.modelName());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.openStream(fallbackBody), "fallback");
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     */
    private MessageStreamSession executeWithResilience(CircuitBreaker cb,
                                                       Retry retry,
                                                       Supplier<MessageStreamSession> call,
                                                       String label) {
        Supplier<MessageStreamSession> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (Exception e) {
            throw new LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }

    private static ObjectNode overrideModel(ObjectNode original, String modelName) {
        ObjectNode copy = original.deepCopy();
        copy.put("model", modelName);
        return copy;
    }
}
