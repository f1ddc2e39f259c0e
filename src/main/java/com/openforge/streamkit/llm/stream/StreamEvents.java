package com.openforge.streamkit.llm.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.openforge.streamkit.llm.model.UsageIteration;

import java.util.List;
import java.util.Map;

/**
 * Payload shapes of the streaming events, one record per event type.
 *
 * Only the fields the decoder reads are mapped; everything else is ignored
 * so new provider fields never break decoding. Property names are explicit,
 * so these records decode the same whatever naming strategy the injected
 * ObjectMapper uses.
 *
 *   message_start        {"message":{"usage":{...},"content":[...]}}
 *   content_block_start  {"index":0,"content_block":{"type":"tool_use","id":..,"name":..,"input":{}}}
 *   content_block_delta  {"index":0,"delta":{"type":"input_json_delta","partial_json":"{\"a\""}}
 *   content_block_stop   {"index":0}
 *   message_delta        {"delta":{"stop_reason":"end_turn"},"usage":{"output_tokens":42}}
 *   error                {"error":{"type":"overloaded_error","message":"Overloaded"}}
 */
final class StreamEvents {

    static final String PING                = "ping";
    static final String MESSAGE_START       = "message_start";
    static final String CONTENT_BLOCK_START = "content_block_start";
    static final String CONTENT_BLOCK_DELTA = "content_block_delta";
    static final String CONTENT_BLOCK_STOP  = "content_block_stop";
    static final String MESSAGE_DELTA       = "message_delta";
    static final String MESSAGE_STOP        = "message_stop";
    static final String ERROR               = "error";

    private StreamEvents() {}

    // ── message_start ────────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageStart(@JsonProperty("message") StartedMessage message) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StartedMessage(
            @JsonProperty("usage")   StartUsage usage,
            @JsonProperty("content") List<ContentBlock> content
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StartUsage(
            @JsonProperty("input_tokens")                Long inputTokens,
            @JsonProperty("cache_read_input_tokens")     Long cacheReadInputTokens,
            @JsonProperty("cache_creation_input_tokens") Long cacheCreationInputTokens
    ) {}

    // ── content blocks ───────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentBlockStart(
            @JsonProperty("index")         Integer index,
            @JsonProperty("content_block") ContentBlock contentBlock
    ) {}

    /** Shared by content_block_start and pre-populated message_start content. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentBlock(
            @JsonProperty("type")  String type,
            @JsonProperty("id")    String id,
            @JsonProperty("name")  String name,
            @JsonProperty("input") Map<String, Object> input
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentBlockDelta(
            @JsonProperty("index") Integer index,
            @JsonProperty("delta") Delta delta
    ) {}

    /**
     * content is nullable on compaction_delta; partial_json carries tool
     * argument fragments; thinking carries reasoning text.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Delta(
            @JsonProperty("type")         String type,
            @JsonProperty("text")         String text,
            @JsonProperty("partial_json") String partialJson,
            @JsonProperty("thinking")     String thinking,
            @JsonProperty("content")      String content
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentBlockStop(@JsonProperty("index") Integer index) {}

    // ── message_delta ────────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageDelta(
            @JsonProperty("delta") MessageDeltaBody delta,
            @JsonProperty("usage") EndUsage usage
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageDeltaBody(@JsonProperty("stop_reason") String stopReason) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EndUsage(
            @JsonProperty("output_tokens") Long outputTokens,
            @JsonProperty("iterations")    List<UsageIteration> iterations
    ) {}

    // ── error ────────────────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorEvent(@JsonProperty("error") ErrorBody error) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorBody(
            @JsonProperty("type")    String type,
            @JsonProperty("message") String message
    ) {}
}
