package com.hunkyhsu.bufferpool.storage;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * BufferPool 某一时刻的统计快照
 */
@Getter
@AllArgsConstructor
public class BufferPoolStats {
    private final int poolSize;
    private final int used;
    private final int free;
    private final int dirty;
    private final int pinned;
    private final int evictable;

    @Override
    public String toString() {
        return String.format(
                "BufferPool Stats: poolSize=%d, used=%d, free=%d, dirty=%d, pinned=%d, evictable=%d",
                poolSize, used, free, dirty, pinned, evictable
        );
    }
}
