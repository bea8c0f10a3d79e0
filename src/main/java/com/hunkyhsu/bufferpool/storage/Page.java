package com.hunkyhsu.bufferpool.storage;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Page - BufferPool 中的一个 Frame
 *
 * 一个 Frame 在 BufferPool 生命周期内只创建一次，随后在不同的逻辑 Page 之间复用。
 * pageId / pinCount / dirty 只能由 {@link BufferPoolManager} 修改；
 * 调用者只读写 pageData 以及 lsn。
 *
 * @author hunkyhsu
 */
@Getter
public class Page {
    public static final int DEFAULT_PAGE_SIZE = 4096; // 4kb
    public static final int INVALID_PAGE_ID = -1;
    public static final long INVALID_LSN = -1L;

    @Setter(AccessLevel.PACKAGE)
    private int pageId = INVALID_PAGE_ID;

    private final ByteBuffer pageData;

    @Setter(AccessLevel.PACKAGE)
    private boolean dirty = false;

    private int pinCount = 0;

    /**
     * 最后一次修改该 Page 的日志序列号，由上层在写入数据后设置
     */
    @Setter
    private long lsn = INVALID_LSN;

    public Page(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.pageData = ByteBuffer.allocate(pageSize);
    }

    public int getPageSize() {
        return pageData.capacity();
    }

    /**
     * 清空元数据并将内容全部置 0，Frame 回到 Free 状态
     */
    void resetMemory() {
        this.pageId = INVALID_PAGE_ID;
        this.dirty = false;
        this.pinCount = 0;
        this.lsn = INVALID_LSN;
        zeroData();
    }

    void zeroData() {
        Arrays.fill(pageData.array(), (byte) 0);
        pageData.clear();
    }

    /**
     * increase the pinCount
     */
    void pin() {
        this.pinCount++;
    }

    /**
     * decrease the pinCount
     *
     * @return false if the pinCount was already 0
     */
    boolean unpin() {
        if (this.pinCount <= 0) {
            return false;
        }
        this.pinCount--;
        return true;
    }

    @Override
    public String toString() {
        return String.format("Page{pageId=%d, pinCount=%d, dirty=%s, lsn=%d}",
                pageId, pinCount, dirty, lsn);
    }
}
