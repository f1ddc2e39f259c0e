package com.openforge.streamkit.llm.stream;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Accumulation state of one open content block.
 *
 * Owned exclusively by the {@link BlockTracker} entry for its index; created
 * at content_block_start and dropped at content_block_stop.
 */
@Getter
public final class BlockState {

    private final BlockKind     kind;
    private final String        toolCallId;
    /** Name surfaced on the ToolCallComplete chunk. */
    private final String        toolName;
    /** Raw provider tool name; only used for argument framing. */
    private final String        providerToolName;
    @Getter(AccessLevel.NONE)
    private final StringBuilder buffer = new StringBuilder();
    private boolean             firstFragment;

    private BlockState(BlockKind kind, String toolCallId, String toolName,
                       String providerToolName, boolean firstFragment) {
        this.kind             = kind;
        this.toolCallId       = toolCallId;
        this.toolName         = toolName;
        this.providerToolName = providerToolName;
        this.firstFragment    = firstFragment;
    }

    // ── Factories ────────────────────────────────────────────────────────────

    /** A block that never buffers (text, reasoning, redacted, MCP, opaque). */
    public static BlockState passive(BlockKind kind) {
        return new BlockState(kind, null, null, null, false);
    }

    /**
     * A client tool call. When {@code initialArguments} is non-empty the call
     * was delivered whole and no deltas are expected.
     */
    public static BlockState toolCall(String id, String name, String initialArguments) {
        boolean prepopulated = initialArguments != null && !initialArguments.isEmpty();
        BlockState block = new BlockState(BlockKind.TOOL_CALL, id, name, null, !prepopulated);
        if (prepopulated) block.buffer.append(initialArguments);
        return block;
    }

    public static BlockState providerToolCall(String id, String displayName, String providerToolName) {
        return new BlockState(BlockKind.PROVIDER_TOOL_CALL, id, displayName, providerToolName, true);
    }

    // ── Accumulation ─────────────────────────────────────────────────────────

    void append(String fragment) {
        buffer.append(fragment);
        firstFragment = false;
    }

    String bufferedText() {
        return buffer.toString();
    }
}
