package com.openforge.streamkit.llm.model;

import java.util.List;

/**
 * Final token accounting for one streamed message.
 *
 * inputTokens is the total prompt cost: non-cached + cache-read + cache-write.
 * totalTokens is always inputTokens + outputTokens.
 *
 * When the provider ran several sampling iterations (e.g. a context
 * compaction pass before the visible answer) the per-iteration records are
 * kept in {@code iterations}; the flat counts already include them.
 */
public record TokenUsage(
        long              inputTokens,
        long              outputTokens,
        long              totalTokens,
        InputTokenDetails inputDetails,
        List<UsageIteration> iterations
) {

    public TokenUsage {
        iterations = iterations == null ? List.of() : List.copyOf(iterations);
    }

    /** Breakdown of {@link #inputTokens()}; cache figures are 0 when the provider did not report them. */
    public record InputTokenDetails(
            long noCacheTokens,
            long cacheReadTokens,
            long cacheWriteTokens
    ) {}
}
