package com.openforge.streamkit.llm.stream;

import java.util.HashMap;
import java.util.Map;

/**
 * Index-keyed table of open content blocks.
 *
 * Exactly one entry per open index. Opening an index that is already open
 * replaces the old entry; the stream does not fail on a repeated start.
 * Different indices are independent and may interleave freely.
 */
public class BlockTracker {

    private final Map<Integer, BlockState> blocks = new HashMap<>();

    /** @return the entry that was replaced, or null */
    public BlockState open(int index, BlockState block) {
        return blocks.put(index, block);
    }

    public BlockState get(int index) {
        return blocks.get(index);
    }

    /** Removes and returns the entry for {@code index}, or null if none was open. */
    public BlockState close(int index) {
        return blocks.remove(index);
    }

    public int openCount() {
        return blocks.size();
    }
}
