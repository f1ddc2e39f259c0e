package com.openforge.streamkit.llm.stream;

import com.openforge.streamkit.llm.LlmException;
import lombok.Getter;

/**
 * Fatal failure of a {@link MessageStreamSession}.
 *
 * Once thrown, the session is terminal and rethrows this same instance on
 * every later {@code nextChunk()} call.
 */
@Getter
public class StreamDecodeException extends LlmException {

    public enum Kind {
        /** The event source failed to read; the cause is the original IOException. */
        TRANSPORT,
        /** A recognized event carried a payload that does not decode. */
        MALFORMED_EVENT,
        /** Accumulated tool-call arguments are not a JSON object. */
        MALFORMED_TOOL_ARGUMENTS,
        /** The provider sent an in-stream error event. */
        PROVIDER_ERROR
    }

    private final Kind   kind;
    /** Event type that failed, when known. */
    private final String eventType;
    /** Tool whose arguments failed, for MALFORMED_TOOL_ARGUMENTS. */
    private final String toolName;

    private StreamDecodeException(Kind kind, String eventType, String toolName,
                                  String message, Throwable cause) {
        super(message, cause);
        this.kind      = kind;
        this.eventType = eventType;
        this.toolName  = toolName;
    }

    public static StreamDecodeException transport(Throwable cause) {
        return new StreamDecodeException(Kind.TRANSPORT, null, null,
                "Stream read failed: %s".formatted(cause.getMessage()), cause);
    }

    public static StreamDecodeException malformedEvent(String eventType, String detail, Throwable cause) {
        return new StreamDecodeException(Kind.MALFORMED_EVENT, eventType, null,
                "Failed to parse %s event: %s".formatted(eventType, detail), cause);
    }

    public static StreamDecodeException malformedToolArguments(String toolName, Throwable cause) {
        return new StreamDecodeException(Kind.MALFORMED_TOOL_ARGUMENTS, "content_block_stop", toolName,
                "Failed to parse tool call arguments for \"%s\": %s".formatted(toolName, cause.getMessage()), cause);
    }

    public static StreamDecodeException providerError(String errorType, String message) {
        return new StreamDecodeException(Kind.PROVIDER_ERROR, "error", null,
                "Provider stream error [%s]: %s".formatted(errorType, message), null);
    }
}
