package com.openforge.streamkit.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.streamkit.llm.model.AssembledMessage;
import com.openforge.streamkit.llm.model.FinishReason;
import com.openforge.streamkit.llm.model.StreamChunk;
import com.openforge.streamkit.llm.sse.SseEventSource;
import com.openforge.streamkit.llm.stream.MessageStreamSession;
import com.openforge.streamkit.llm.stream.StreamDecodeException;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StreamAssemblerTest {

    /** Records whether the session closed its transport. */
    private static final class TrackingReader extends StringReader {
        private boolean closed;

        TrackingReader(String s) {
            super(s);
        }

        @Override
        public void close() {
            closed = true;
            super.close();
        }
    }

    private static MessageStreamSession sessionOver(TrackingReader reader) {
        return new MessageStreamSession(new SseEventSource(reader), new ObjectMapper());
    }

    private static String event(String type, String data) {
        return "event: " + type + "\ndata: " + data + "\n\n";
    }

    @Test
    void shouldFoldChunksIntoMessageAndForwardEachToListener() {
        String transcript = event("message_start", "{\"type\":\"message_start\",\"message\":{\"usage\":{\"input_tokens\":12}}}")
                + event("content_block_start", "{\"index\":0,\"content_block\":{\"type\":\"thinking\",\"thinking\":\"\"}}")
                + event("content_block_delta", "{\"index\":0,\"delta\":{\"type\":\"thinking_delta\",\"thinking\":\"Plan: \"}}")
                + event("content_block_delta", "{\"index\":0,\"delta\":{\"type\":\"thinking_delta\",\"thinking\":\"look it up\"}}")
                + event("content_block_stop", "{\"index\":0}")
                + event("content_block_delta", "{\"index\":1,\"delta\":{\"type\":\"text_delta\",\"text\":\"Let me \"}}")
                + event("content_block_delta", "{\"index\":1,\"delta\":{\"type\":\"text_delta\",\"text\":\"check.\"}}")
                + event("content_block_start", "{\"index\":2,\"content_block\":{\"type\":\"tool_use\",\"id\":\"toolu_1\",\"name\":\"lookup\",\"input\":{}}}")
                + event("content_block_delta", "{\"index\":2,\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"{\\\"key\\\":\\\"x\\\"}\"}}")
                + event("content_block_stop", "{\"index\":2}")
                + event("message_delta", "{\"delta\":{\"stop_reason\":\"tool_use\"},\"usage\":{\"output_tokens\":8}}")
                + event("message_stop", "{}");
        TrackingReader reader = new TrackingReader(transcript);
        List<StreamChunk> seen = new ArrayList<>();

        AssembledMessage message = StreamAssembler.assemble(sessionOver(reader), seen::add);

        assertEquals("Let me check.", message.text());
        assertEquals("Plan: look it up", message.reasoning());
        assertEquals(1, message.toolCalls().size());
        assertEquals(Map.of("key", "x"), message.toolCalls().get(0).arguments());
        assertTrue(message.hasToolCalls());
        assertEquals(FinishReason.TOOL_CALLS, message.finishReason());
        assertEquals(20, message.usage().totalTokens());

        assertEquals(6, seen.size());
        assertInstanceOf(StreamChunk.ReasoningDelta.class, seen.get(0));
        assertInstanceOf(StreamChunk.FinishSummary.class, seen.get(5));
        assertTrue(reader.closed);
    }

    @Test
    void shouldLeaveMissingPartsNullWhenStreamEndsEarly() {
        TrackingReader reader = new TrackingReader(
                event("content_block_delta", "{\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"partial\"}}"));

        AssembledMessage message = StreamAssembler.assemble(sessionOver(reader), null);

        assertEquals("partial", message.text());
        assertNull(message.reasoning());
        assertNull(message.finishReason());
        assertNull(message.usage());
        assertFalse(message.hasToolCalls());
        assertTrue(reader.closed);
    }

    @Test
    void shouldPropagateDecodeFailureAndStillClose() {
        TrackingReader reader = new TrackingReader(
                event("content_block_delta", "{\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"ok\"}}")
                        + event("error", "{\"type\":\"error\",\"error\":{\"type\":\"api_error\",\"message\":\"boom\"}}"));
        List<StreamChunk> seen = new ArrayList<>();

        StreamDecodeException e = assertThrows(StreamDecodeException.class,
                () -> StreamAssembler.assemble(sessionOver(reader), seen::add));

        assertEquals(StreamDecodeException.Kind.PROVIDER_ERROR, e.getKind());
        assertEquals(List.of(new StreamChunk.TextDelta("ok")), seen);
        assertTrue(reader.closed);
    }
}
