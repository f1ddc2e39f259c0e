package com.openforge.streamkit.llm;

import com.openforge.streamkit.llm.model.AssembledMessage;
import com.openforge.streamkit.llm.model.FinishReason;
import com.openforge.streamkit.llm.model.StreamChunk;
import com.openforge.streamkit.llm.model.TokenUsage;
import com.openforge.streamkit.llm.stream.MessageStreamSession;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Drains a {@link MessageStreamSession} into an {@link AssembledMessage}.
 *
 * Every chunk is handed to the listener synchronously, in stream order, before
 * it is folded in, so a caller can forward tokens to a UI in real time and
 * still act on the complete message (tool calls, usage) when the stream ends.
 *
 * The session is always closed on return; decoding errors propagate as-is.
 */
@Slf4j
public final class StreamAssembler {

    private StreamAssembler() {}

    public static AssembledMessage assemble(MessageStreamSession session, Consumer<StreamChunk> listener) {
        StringBuilder                        text      = new StringBuilder();
        StringBuilder                        reasoning = new StringBuilder();
        List<StreamChunk.ToolCallComplete>   toolCalls = new ArrayList<>();
        FinishReason                         finish    = null;
        TokenUsage                           usage     = null;

        try (session) {
            Optional<StreamChunk> next;
            while ((next = session.nextChunk()).isPresent()) {
                StreamChunk chunk = next.get();
                if (listener != null) listener.accept(chunk);

                if (chunk instanceof StreamChunk.TextDelta delta) {
                    text.append(delta.text());
                } else if (chunk instanceof StreamChunk.ReasoningDelta delta) {
                    reasoning.append(delta.text());
                } else if (chunk instanceof StreamChunk.ToolCallComplete call) {
                    toolCalls.add(call);
                } else if (chunk instanceof StreamChunk.FinishSummary summary) {
                    finish = summary.finishReason();
                    usage  = summary.usage();
                }
            }
        } catch (IOException e) {
            throw new LlmException("Failed to close stream session", e);
        }

        if (finish == null) {
            log.debug("[StreamAssembler] Stream ended without a finish summary");
        }
        return new AssembledMessage(
                text.isEmpty() ? null : text.toString(),
                reasoning.isEmpty() ? null : reasoning.toString(),
                toolCalls,
                finish,
                usage);
    }
}
