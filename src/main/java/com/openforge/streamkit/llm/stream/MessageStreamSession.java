package com.openforge.streamkit.llm.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.streamkit.llm.model.FinishReason;
import com.openforge.streamkit.llm.model.StreamChunk;
import com.openforge.streamkit.llm.model.StreamChunk.FinishSummary;
import com.openforge.streamkit.llm.model.StreamChunk.ReasoningDelta;
import com.openforge.streamkit.llm.model.StreamChunk.TextDelta;
import com.openforge.streamkit.llm.model.StreamChunk.ToolCallComplete;
import com.openforge.streamkit.llm.sse.FramedEventSource;
import com.openforge.streamkit.llm.sse.RawEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pull-driven decoder for one streamed message.
 *
 * Each {@link #nextChunk()} call:
 *
 *   1. returns the head of the pending queue, if any, without reading
 *   2. otherwise pulls one event from the source
 *        end of stream  → TERMINAL_EOF, returns empty
 *        read failure   → TERMINAL_ERROR, throws
 *   3. dispatches on the event type; events that produce no chunk
 *      (ping, block bookkeeping, argument fragments, unknown types)
 *      loop back to step 1 inside the same call
 *
 * The loop is iterative, so long runs of skipped events never grow the stack.
 * Terminal states are absorbing: after EOF every call returns empty, after an
 * error every call rethrows the same exception, and the source is not read again.
 *
 * One session per stream, one consuming thread per session. Not thread-safe.
 */
@Slf4j
public class MessageStreamSession implements Closeable {

    public enum State {
        IDLE,
        AWAITING_EVENT,
        FINALIZING,
        TERMINAL_EOF,
        TERMINAL_ERROR
    }

    private final FramedEventSource   source;
    private final ObjectMapper        objectMapper;
    private final BlockTracker        blocks  = new BlockTracker();
    private final UsageAccumulator    usage   = new UsageAccumulator();
    private final Deque<StreamChunk>  pending = new ArrayDeque<>();
    private final FragmentAccumulator fragments;

    private State                 state = State.IDLE;
    private StreamDecodeException failure;

    public MessageStreamSession(FramedEventSource source, ObjectMapper objectMapper) {
        this.source       = source;
        this.objectMapper = objectMapper;
        this.fragments    = new FragmentAccumulator(objectMapper);
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Returns the next semantic chunk, blocking on the source as needed.
     *
     * @return the chunk, or empty once the stream has ended cleanly
     * @throws StreamDecodeException on transport failure, malformed payloads,
     *                               malformed tool arguments or a provider error event
     */
    public Optional<StreamChunk> nextChunk() {
        if (state == State.TERMINAL_ERROR) throw failure;
        if (state == State.TERMINAL_EOF)   return Optional.empty();

        while (true) {
            if (!pending.isEmpty()) {
                state = State.IDLE;
                return Optional.of(pending.poll());
            }

            state = State.AWAITING_EVENT;
            Optional<RawEvent> next = readEvent();
            if (next.isEmpty()) {
                log.debug("[StreamSession] Source exhausted, {} block(s) left open", blocks.openCount());
                state = State.TERMINAL_EOF;
                return Optional.empty();
            }

            StreamChunk chunk;
            try {
                chunk = dispatch(next.get());
            } catch (StreamDecodeException e) {
                throw fail(e);
            }

            if (chunk != null) {
                state = State.IDLE;
                return Optional.of(chunk);
            }
            if (state == State.TERMINAL_EOF) {
                return Optional.empty();
            }
        }
    }

    public State state() {
        return state;
    }

    public boolean isTerminal() {
        return state == State.TERMINAL_EOF || state == State.TERMINAL_ERROR;
    }

    /** Blocks started but not yet stopped. */
    public int openBlockCount() {
        return blocks.openCount();
    }

    /**
     * Closes the underlying source. A later {@link #nextChunk()} that still
     * needs to read surfaces the resulting failure as a terminal error.
     */
    @Override
    public void close() throws IOException {
        source.close();
    }

    // ── Event loop ───────────────────────────────────────────────────────────

    private Optional<RawEvent> readEvent() {
        try {
            return source.next();
        } catch (IOException e) {
            throw fail(StreamDecodeException.transport(e));
        } catch (UncheckedIOException e) {
            throw fail(StreamDecodeException.transport(e.getCause()));
        }
    }

    private StreamDecodeException fail(StreamDecodeException e) {
        log.warn("[StreamSession] Stream terminated: {}", e.getMessage());
        state   = State.TERMINAL_ERROR;
        failure = e;
        return e;
    }

    /** @return the chunk this event produces, or null to keep reading */
    private StreamChunk dispatch(RawEvent event) {
        String type = event.eventType();
        switch (type) {
            case StreamEvents.PING:
                return null;
            case StreamEvents.MESSAGE_START:
                onMessageStart(event);
                return null;
            case StreamEvents.CONTENT_BLOCK_START:
                return onBlockStart(event);
            case StreamEvents.CONTENT_BLOCK_DELTA:
                return onBlockDelta(event);
            case StreamEvents.CONTENT_BLOCK_STOP:
                state = State.FINALIZING;
                return onBlockStop(event);
            case StreamEvents.MESSAGE_DELTA:
                return onMessageDelta(event);
            case StreamEvents.MESSAGE_STOP:
                log.debug("[StreamSession] message_stop received");
                state = State.TERMINAL_EOF;
                return null;
            case StreamEvents.ERROR:
                throw onError(event);
            default:
                log.debug("[StreamSession] Skipping unknown event type '{}'", type);
                return null;
        }
    }

    // ── message_start ────────────────────────────────────────────────────────

    private void onMessageStart(RawEvent event) {
        StreamEvents.MessageStart start = decode(event, StreamEvents.MessageStart.class);
        StreamEvents.StartedMessage message = start.message();
        if (message == null) {
            throw StreamDecodeException.malformedEvent(event.eventType(), "missing message", null);
        }

        StreamEvents.StartUsage startUsage = message.usage();
        if (startUsage != null) {
            usage.recordStart(startUsage.inputTokens(),
                    startUsage.cacheReadInputTokens(),
                    startUsage.cacheCreationInputTokens());
        }

        // Deferred / programmatic tool calls arrive whole, with no block events.
        if (message.content() != null) {
            for (StreamEvents.ContentBlock part : message.content()) {
                if (part == null || !"tool_use".equals(part.type())) continue;
                pending.add(new ToolCallComplete(part.id(), part.name(), copyOf(part.input())));
            }
        }
    }

    // ── content_block_start ──────────────────────────────────────────────────

    private StreamChunk onBlockStart(RawEvent event) {
        StreamEvents.ContentBlockStart start = decode(event, StreamEvents.ContentBlockStart.class);
        int index = requireIndex(event, start.index());
        StreamEvents.ContentBlock content = start.contentBlock();
        if (content == null) {
            throw StreamDecodeException.malformedEvent(event.eventType(), "missing content_block", null);
        }

        BlockKind kind = BlockKind.fromWireType(content.type());
        switch (kind) {
            case TOOL_CALL -> open(index, BlockState.toolCall(
                    content.id(), content.name(), serializeInitialInput(event, content.input())));
            case PROVIDER_TOOL_CALL -> open(index, BlockState.providerToolCall(
                    content.id(), ServerToolRegistry.displayName(content.name()), content.name()));
            case MCP_TOOL_USE -> {
                open(index, BlockState.passive(kind));
                return new ToolCallComplete(content.id(), content.name(), copyOf(content.input()));
            }
            default -> open(index, BlockState.passive(kind));
        }
        return null;
    }

    private void open(int index, BlockState block) {
        BlockState replaced = blocks.open(index, block);
        if (replaced != null) {
            log.debug("[StreamSession] Block {} restarted ({} → {})", index, replaced.getKind(), block.getKind());
        }
    }

    /** A non-empty input on tool_use start means the call was delivered whole; {} means deltas follow. */
    private String serializeInitialInput(RawEvent event, Map<String, Object> input) {
        if (input == null || input.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw StreamDecodeException.malformedEvent(event.eventType(), "unserializable input", e);
        }
    }

    // ── content_block_delta ──────────────────────────────────────────────────

    private StreamChunk onBlockDelta(RawEvent event) {
        StreamEvents.ContentBlockDelta blockDelta = decode(event, StreamEvents.ContentBlockDelta.class);
        int index = requireIndex(event, blockDelta.index());
        StreamEvents.Delta delta = blockDelta.delta();
        if (delta == null) {
            throw StreamDecodeException.malformedEvent(event.eventType(), "missing delta", null);
        }

        BlockState block = blocks.get(index);
        if (block != null && block.getKind().isSilent()) return null;

        String deltaType = delta.type() == null ? "" : delta.type();
        switch (deltaType) {
            case "text_delta":
                return new TextDelta(nullToEmpty(delta.text()));
            case "thinking_delta":
                return new ReasoningDelta(nullToEmpty(delta.thinking()));
            case "input_json_delta":
                if (block == null || !block.getKind().buffersArguments()) {
                    log.debug("[StreamSession] Dropping argument fragment for non-tool block {}", index);
                    return null;
                }
                if (!fragments.append(block, delta.partialJson())) {
                    log.debug("[StreamSession] Skipped empty argument fragment for block {}", index);
                }
                return null;
            case "signature_delta":
                return null;
            case "compaction_delta":
                return delta.content() != null ? new TextDelta(delta.content()) : null;
            default:
                log.debug("[StreamSession] Skipping unknown delta type '{}'", deltaType);
                return null;
        }
    }

    // ── content_block_stop ───────────────────────────────────────────────────

    private StreamChunk onBlockStop(RawEvent event) {
        StreamEvents.ContentBlockStop stop = decode(event, StreamEvents.ContentBlockStop.class);
        int index = requireIndex(event, stop.index());

        BlockState block = blocks.close(index);
        if (block == null || !block.getKind().buffersArguments()) return null;

        Map<String, Object> arguments = fragments.finish(block);
        return new ToolCallComplete(block.getToolCallId(), block.getToolName(), arguments);
    }

    // ── message_delta ────────────────────────────────────────────────────────

    private StreamChunk onMessageDelta(RawEvent event) {
        StreamEvents.MessageDelta messageDelta = decode(event, StreamEvents.MessageDelta.class);

        if (messageDelta.usage() != null) {
            usage.recordEnd(messageDelta.usage().outputTokens(), messageDelta.usage().iterations());
        }

        String stopReason = messageDelta.delta() != null ? messageDelta.delta().stopReason() : null;
        if (stopReason == null || stopReason.isEmpty()) return null;

        state = State.FINALIZING;
        return new FinishSummary(FinishReason.fromProviderValue(stopReason), usage.snapshot());
    }

    // ── error ────────────────────────────────────────────────────────────────

    private StreamDecodeException onError(RawEvent event) {
        StreamEvents.ErrorEvent error = decode(event, StreamEvents.ErrorEvent.class);
        if (error.error() == null) {
            return StreamDecodeException.providerError("unknown", event.data());
        }
        return StreamDecodeException.providerError(error.error().type(), error.error().message());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private <T> T decode(RawEvent event, Class<T> payloadType) {
        T payload;
        try {
            payload = objectMapper.readerFor(payloadType)
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readValue(event.data());
        } catch (JsonProcessingException e) {
            throw StreamDecodeException.malformedEvent(event.eventType(), e.getOriginalMessage(), e);
        }
        if (payload == null) {
            throw StreamDecodeException.malformedEvent(event.eventType(), "payload is null", null);
        }
        return payload;
    }

    private static int requireIndex(RawEvent event, Integer index) {
        if (index == null) {
            throw StreamDecodeException.malformedEvent(event.eventType(), "missing index", null);
        }
        return index;
    }

    private static Map<String, Object> copyOf(Map<String, Object> input) {
        return input == null ? new LinkedHashMap<>() : new LinkedHashMap<>(input);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
