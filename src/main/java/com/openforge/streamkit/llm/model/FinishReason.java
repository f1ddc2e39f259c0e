package com.openforge.streamkit.llm.model;

/**
 * Canonical reason a generation ended.
 *
 * STOP          — natural end of turn or a configured stop sequence matched
 * LENGTH_LIMIT  — the max-tokens budget was exhausted
 * TOOL_CALLS    — the model paused to request one or more tool invocations
 * OTHER         — anything else (pause_turn, refusal, values we do not know yet)
 */
public enum FinishReason {

    STOP,
    LENGTH_LIMIT,
    TOOL_CALLS,
    OTHER;

    /** Maps a raw provider stop reason; null and unknown values map to {@link #OTHER}. */
    public static FinishReason fromProviderValue(String raw) {
        if (raw == null) return OTHER;
        return switch (raw) {
            case "end_turn", "stop_sequence", "stop" -> STOP;
            case "max_tokens", "length"              -> LENGTH_LIMIT;
            case "tool_use", "tool_calls"            -> TOOL_CALLS;
            default                                  -> OTHER;
        };
    }
}
