package com.openforge.streamkit.llm;

/**
 * Base unchecked exception for every failure raised by the LLM client layer:
 * network errors, non-2xx responses and stream decoding failures.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) { super(message); }

    public LlmException(String message, Throwable cause) { super(message, cause); }

    /** HTTP 429 from the provider. */
    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
