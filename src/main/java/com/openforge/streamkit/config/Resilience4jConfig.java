package com.openforge.streamkit.config;

import com.openforge.streamkit.llm.LlmException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring for opening streams.
 *
 * Two named instances are pre-wired, one per provider:
 *   • "primaryLlm"
 *   • "fallbackLlm"
 *
 * Only the stream-open phase is guarded (see LlmRouter). Once chunks are
 * flowing a failure is terminal for that stream; re-issuing is the caller's call.
 */
@Configuration
public class Resilience4jConfig {

    public static final String PRIMARY  = "primaryLlm";
    public static final String FALLBACK = "fallbackLlm";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // a stream that takes >30 s just to open counts as slow
                .slowCallDurationThreshold(Duration.ofSeconds(30))
                .slowCallRateThreshold(80)
                // allow 2 probe calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(PRIMARY);
        registry.circuitBreaker(FALLBACK);
        return registry;
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(PRIMARY);
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(FALLBACK);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(1))
                // network errors and 429s are worth another attempt; 4xx/5xx bodies are not
                .retryOnException(Resilience4jConfig::isRetryable)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(PRIMARY);
        registry.retry(FALLBACK);
        return registry;
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry(PRIMARY);
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry(FALLBACK);
    }

    /** The client wraps IOExceptions, so look one level down as well. */
    public static boolean isRetryable(Throwable e) {
        return e instanceof IOException
                || e instanceof LlmException.LlmRateLimitException
                || (e instanceof LlmException && e.getCause() instanceof IOException);
    }
}
