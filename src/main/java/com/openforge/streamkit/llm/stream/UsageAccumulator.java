package com.openforge.streamkit.llm.stream;

import com.openforge.streamkit.llm.model.TokenUsage;
import com.openforge.streamkit.llm.model.UsageIteration;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges token figures that arrive split across the stream.
 *
 *   message_start  → input, cache-read, cache-write (only reported here)
 *   message_delta  → output, optional per-iteration breakdown
 *
 * When iterations are present they supersede the flat input/output counts:
 * the top-level counters exclude e.g. a compaction pass, the iteration sums
 * do not. Cache figures are added on top either way.
 */
public class UsageAccumulator {

    private long inputTokens;
    private long cacheReadTokens;
    private long cacheWriteTokens;
    private long outputTokens;
    private final List<UsageIteration> iterations = new ArrayList<>();

    public void recordStart(Long input, Long cacheRead, Long cacheWrite) {
        if (input != null)      inputTokens      = input;
        if (cacheRead != null)  cacheReadTokens  = cacheRead;
        if (cacheWrite != null) cacheWriteTokens = cacheWrite;
    }

    public void recordEnd(Long output, List<UsageIteration> iterationBreakdown) {
        if (output != null) outputTokens = output;
        if (iterationBreakdown != null && !iterationBreakdown.isEmpty()) {
            iterations.clear();
            iterations.addAll(iterationBreakdown);
        }
    }

    public TokenUsage snapshot() {
        long noCache = inputTokens;
        long output  = outputTokens;
        if (!iterations.isEmpty()) {
            noCache = iterations.stream().mapToLong(UsageIteration::inputTokens).sum();
            output  = iterations.stream().mapToLong(UsageIteration::outputTokens).sum();
        }
        long totalInput = noCache + cacheReadTokens + cacheWriteTokens;

        return new TokenUsage(
                totalInput,
                output,
                totalInput + output,
                new TokenUsage.InputTokenDetails(noCache, cacheReadTokens, cacheWriteTokens),
                iterations);
    }
}
