package com.openforge.streamkit.llm.model;

import java.util.List;

/**
 * Everything a fully drained stream produced, folded into one value.
 *
 * text and reasoning are null when the stream carried none; finishReason and
 * usage are null when the stream ended without a FinishSummary (e.g. the
 * provider closed the connection early).
 */
public record AssembledMessage(
        String text,
        String reasoning,
        List<StreamChunk.ToolCallComplete> toolCalls,
        FinishReason finishReason,
        TokenUsage usage
) {

    public AssembledMessage {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    /** True if the model wants to call one or more tools. */
    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
