package com.openforge.streamkit.llm.sse;

/**
 * One framed event: the SSE {@code event:} name and the joined {@code data:} payload.
 *
 * Transient: consumed within a single decoding step and never retained.
 */
public record RawEvent(String eventType, String data) {

    public RawEvent {
        data = data == null ? "" : data;
    }
}
