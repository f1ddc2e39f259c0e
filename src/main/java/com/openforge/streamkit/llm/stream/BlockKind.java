package com.openforge.streamkit.llm.stream;

/**
 * What a content block carries, decided once at content_block_start.
 */
public enum BlockKind {

    /** Visible text; each delta is emitted immediately. */
    TEXT,

    /** Thinking trace; each delta is emitted immediately as reasoning. */
    REASONING,

    /** Withheld thinking; never produces a chunk. */
    REDACTED_REASONING,

    /** Client-executed tool call; arguments buffered until stop. */
    TOOL_CALL,

    /** Provider-executed ("server") tool call; buffered like TOOL_CALL, name normalized. */
    PROVIDER_TOOL_CALL,

    /** MCP tool invocation; complete at start and emitted there. */
    MCP_TOOL_USE,

    /** MCP tool result; tracked only so its stop is a no-op. */
    MCP_TOOL_RESULT,

    /** Anything else (compaction, future block types). */
    OPAQUE;

    public boolean buffersArguments() {
        return this == TOOL_CALL || this == PROVIDER_TOOL_CALL;
    }

    /** Blocks whose deltas must never surface as chunks. */
    public boolean isSilent() {
        return this == REDACTED_REASONING || this == MCP_TOOL_RESULT;
    }

    /** Maps a wire content_block type to a kind; unknown types are {@link #OPAQUE}. */
    public static BlockKind fromWireType(String type) {
        if (type == null) return OPAQUE;
        return switch (type) {
            case "text"              -> TEXT;
            case "thinking"          -> REASONING;
            case "redacted_thinking" -> REDACTED_REASONING;
            case "tool_use"          -> TOOL_CALL;
            case "server_tool_use"   -> PROVIDER_TOOL_CALL;
            case "mcp_tool_use"      -> MCP_TOOL_USE;
            case "mcp_tool_result"   -> MCP_TOOL_RESULT;
            default                  -> OPAQUE;
        };
    }
}
