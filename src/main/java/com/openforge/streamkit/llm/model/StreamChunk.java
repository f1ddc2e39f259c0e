package com.openforge.streamkit.llm.model;

import java.util.Map;

/**
 * One semantic unit produced by a {@code MessageStreamSession}.
 *
 * The taxonomy is closed; every variant carries only its own fields:
 *
 *   TextDelta         — a fragment of the visible answer
 *   ReasoningDelta    — a fragment of the model's thinking trace
 *   ToolCallComplete  — a fully assembled tool invocation (emitted exactly once per call)
 *   FinishSummary     — the stop reason and token usage of the whole message
 *
 * Consumers dispatch with {@code instanceof} patterns.
 */
public sealed interface StreamChunk
        permits StreamChunk.TextDelta,
                StreamChunk.ReasoningDelta,
                StreamChunk.ToolCallComplete,
                StreamChunk.FinishSummary {

    record TextDelta(String text) implements StreamChunk {}

    record ReasoningDelta(String text) implements StreamChunk {}

    /**
     * A tool invocation whose arguments are complete and parsed.
     *
     * @param id        provider-assigned call id, echoed back with the tool result
     * @param name      public tool name (provider tool names are normalized)
     * @param arguments parsed JSON object; never null, empty when the call has no arguments
     */
    record ToolCallComplete(String id, String name, Map<String, Object> arguments) implements StreamChunk {

        public ToolCallComplete {
            arguments = arguments == null ? Map.of() : arguments;
        }
    }

    record FinishSummary(FinishReason finishReason, TokenUsage usage) implements StreamChunk {}
}
