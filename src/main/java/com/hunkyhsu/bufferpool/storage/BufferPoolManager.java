package com.hunkyhsu.bufferpool.storage;

import com.hunkyhsu.bufferpool.config.BufferPoolConfig;
import com.hunkyhsu.bufferpool.hash.ExtendibleHashTable;
import com.hunkyhsu.bufferpool.hash.HashTable;
import com.hunkyhsu.bufferpool.log.LogManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * BufferPoolManager - 页缓存
 *
 * 在构造时一次性分配 poolSize 个 Frame，之后只在不同的逻辑 Page 之间复用它们。
 * 每个 Frame 在任一时刻处于且只处于以下一种状态：
 * <ul>
 *   <li>Free：pageId 无效，不在 PageTable，不在 Replacer，在空闲列表中</li>
 *   <li>Resident-Pinned：在 PageTable，pinCount &gt;= 1，不在 Replacer</li>
 *   <li>Resident-Unpinned：在 PageTable，pinCount == 0，在 Replacer 中恰好一次</li>
 * </ul>
 *
 * 所有公开操作都持有同一把全局锁，磁盘 IO 也在锁内完成。
 * 没有可用 Frame 时 fetchPage / newPage 返回 null，不会阻塞等待。
 *
 * @author hunkyhsu
 */
public class BufferPoolManager implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(BufferPoolManager.class);

    private final int poolSize;

    private final int pageSize;

    private final Page[] pages;

    // pageId -> frameId
    private final HashTable<Integer, Integer> pageTable;

    // guarded by globalLock
    private final Deque<Integer> freeList;

    private final Replacer replacer;

    private final DiskManager diskManager;

    // null 表示不记日志
    private final LogManager logManager;

    private final ReentrantLock globalLock;

    public BufferPoolManager(int poolSize, DiskManager diskManager) {
        this(poolSize, diskManager, null);
    }

    public BufferPoolManager(int poolSize, DiskManager diskManager, LogManager logManager) {
        this(BufferPoolConfig.builder()
                        .poolSize(poolSize)
                        .pageSize(diskManager.getPageSize())
                        .build(),
                diskManager, logManager);
    }

    public BufferPoolManager(BufferPoolConfig config, DiskManager diskManager, LogManager logManager) {
        config.validate();
        if (config.getPageSize() != diskManager.getPageSize()) {
            throw new IllegalArgumentException(String.format(
                    "pageSize mismatch: config=%d, diskManager=%d",
                    config.getPageSize(), diskManager.getPageSize()));
        }
        this.poolSize = config.getPoolSize();
        this.pageSize = config.getPageSize();
        this.pages = new Page[poolSize];
        this.pageTable = new ExtendibleHashTable<>(config.getBucketSize());
        this.freeList = new ArrayDeque<>(poolSize);
        this.replacer = config.getReplacerType().create(poolSize);
        this.diskManager = diskManager;
        this.logManager = logManager;
        this.globalLock = new ReentrantLock();

        for (int i = 0; i < poolSize; i++) {
            pages[i] = new Page(pageSize);
            freeList.offer(i);
        }

        logger.info("BufferPoolManager initialized: poolSize={}, pageSize={}, replacer={}, logging={}",
                poolSize, pageSize, config.getReplacerType(), logManager != null);
    }

    /**
     * 获取 Page 并 pin 住，用完后必须调用 {@link #unpinPage(int, boolean)}
     *
     * @return 被 pin 住的 Page；所有 Frame 都被 pin 住时返回 null
     */
    public Page fetchPage(int pageId) throws IOException {
        globalLock.lock();
        try {
            // case 1. Page 已在内存中
            Integer cached = pageTable.find(pageId);
            if (cached != null) {
                int frameId = cached;
                Page page = pages[frameId];
                page.pin();
                replacer.erase(frameId);
                // 重置 ByteBuffer position 到开头，方便用户读取
                page.getPageData().rewind();
                logger.debug("Page {} hit in buffer pool (frameId={}, pinCount={})",
                        pageId, frameId, page.getPinCount());
                return page;
            }

            // case 2. Page 不在内存，需要从磁盘加载
            int frameId = findVictimFrame();
            if (frameId == Replacer.NO_VICTIM) {
                logger.warn("Cannot fetch page {}: all frames are pinned", pageId);
                return null;
            }
            Page page = pages[frameId];
            evict(frameId, page);

            try {
                diskManager.readPage(pageId, page.getPageData());
            } catch (IOException | RuntimeException e) {
                // 旧 Page 已经写回并移出 PageTable，Frame 直接回到空闲列表
                page.resetMemory();
                freeList.offerFirst(frameId);
                logger.error("Failed to load page {} into frame {}", pageId, frameId, e);
                throw e;
            }
            page.setPageId(pageId);
            page.pin();
            pageTable.insert(pageId, frameId);

            logger.debug("Page {} loaded from disk (frameId={})", pageId, frameId);
            return page;
        } finally {
            globalLock.unlock();
        }
    }

    /**
     * 释放一次 pin
     *
     * @param isDirty 调用者是否修改了 Page；脏标记一旦设置，只有写回磁盘才会清除
     * @return Page 不在内存中，或者 pinCount 已经为 0 时返回 false
     */
    public boolean unpinPage(int pageId, boolean isDirty) {
        globalLock.lock();
        try {
            Integer cached = pageTable.find(pageId);
            if (cached == null) {
                logger.warn("Attempted to unpin non-existent page {}", pageId);
                return false;
            }
            int frameId = cached;
            Page page = pages[frameId];
            if (page.getPinCount() <= 0) {
                logger.warn("Attempted to unpin page {} with pinCount 0 (frameId={})", pageId, frameId);
                return false;
            }
            if (isDirty) {
                page.setDirty(true);
            }
            page.unpin();
            if (page.getPinCount() == 0) {
                replacer.insert(frameId);
                logger.debug("Page {} unpinned (frameId={}, pinCount=0, added to replacer)",
                        pageId, frameId);
            } else {
                logger.debug("Page {} unpinned (frameId={}, pinCount={})",
                        pageId, frameId, page.getPinCount());
            }
            return true;

        } finally {
            globalLock.unlock();
        }
    }

    /**
     * 手动刷盘：1. CheckPoint; 2. Database close; 3. Testing
     *
     * 只有脏页才会真正写盘；pinCount 不变。
     *
     * @return Page 不在内存中时返回 false
     */
    public boolean flushPage(int pageId) throws IOException {
        globalLock.lock();
        try {
            Integer cached = pageTable.find(pageId);
            if (cached == null) {
                logger.warn("Attempted to flush non-existent page {}", pageId);
                return false;
            }
            Page page = pages[cached];
            if (page.getPageId() == Page.INVALID_PAGE_ID) {
                logger.warn("Attempted to flush page {} mapped to an unassigned frame {}", pageId, cached);
                return false;
            }
            if (page.isDirty()) {
                writeBack(page);
                logger.debug("Page {} flushed to disk", pageId);
            }
            return true;

        } finally {
            globalLock.unlock();
        }
    }

    public void flushAllPages() throws IOException {
        globalLock.lock();
        try {
            int flushed = 0;
            for (Page page : pages) {
                if (page.getPageId() != Page.INVALID_PAGE_ID && page.isDirty()) {
                    writeBack(page);
                    flushed++;
                }
            }
            logger.info("Flushed {} dirty pages to disk", flushed);
        } finally {
            globalLock.unlock();
        }
    }

    /**
     * 创建新 Page 并 pin 住，新 pageId 通过 {@link Page#getPageId()} 获得
     *
     * @return 内容全为 0 的 Page；所有 Frame 都被 pin 住时返回 null（此时不会分配 pageId）
     */
    public Page newPage() throws IOException {
        globalLock.lock();
        try {
            // 1. 找一个可用的 Frame
            int frameId = findVictimFrame();
            if (frameId == Replacer.NO_VICTIM) {
                logger.warn("Cannot create new page: all frames are pinned");
                return null;
            }

            // 2. 如果 Frame 中有旧 Page，处理淘汰逻辑
            Page page = pages[frameId];
            evict(frameId, page);

            // 3. 分配新 Page ID
            int newPageId;
            try {
                newPageId = diskManager.allocatePage();
            } catch (IOException | RuntimeException e) {
                page.resetMemory();
                freeList.offerFirst(frameId);
                throw e;
            }
            Integer mapped = pageTable.find(newPageId);
            if (mapped != null) {
                // DiskManager 分配了一个仍在内存中的 pageId，不能覆盖已有映射
                page.resetMemory();
                freeList.offerFirst(frameId);
                throw new IllegalStateException(String.format(
                        "Allocated page %d is already resident in frame %d", newPageId, mapped));
            }

            page.setPageId(newPageId);
            page.pin();
            pageTable.insert(newPageId, frameId);

            logger.info("Created new page {} (frameId={})", newPageId, frameId);
            return page;

        } finally {
            globalLock.unlock();
        }
    }

    /**
     * 删除 Page，并通知 DiskManager 释放该 pageId
     *
     * Page 不在内存中也会释放 pageId 并返回 true。
     *
     * @return Page 正在被使用（pinCount &gt; 0）时返回 false，且不做任何修改
     */
    public boolean deletePage(int pageId) {
        globalLock.lock();
        try {
            Integer cached = pageTable.find(pageId);
            if (cached != null) {
                int frameId = cached;
                Page page = pages[frameId];

                // 如果 Page 正在使用，不能删除
                if (page.getPinCount() > 0) {
                    logger.warn("Cannot delete page {} (pinCount={})", pageId, page.getPinCount());
                    return false;
                }
                // 从 PageTable 和 Replacer 中移除
                replacer.erase(frameId);
                pageTable.remove(pageId);
                page.resetMemory();
                freeList.offer(frameId);
                logger.info("Deleted page {} (frameId={})", pageId, frameId);
            }

            diskManager.deallocatePage(pageId);
            return true;

        } finally {
            globalLock.unlock();
        }
    }

    public boolean containsPage(int pageId) {
        globalLock.lock();
        try {
            return pageTable.find(pageId) != null;
        } finally {
            globalLock.unlock();
        }
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int getPageSize() {
        return pageSize;
    }

    Page getFrame(int frameId) {
        return pages[frameId];
    }

    /**
     * 选择一个 Frame 给新 Page 使用：空闲列表优先，其次才向 Replacer 要 victim，
     * 这样在还有空闲 Frame 时不会产生不必要的写回。
     *
     * 返回的 Frame 已经不在空闲列表和 Replacer 中。
     */
    private int findVictimFrame() {
        // 1. 优先从空闲列表获取
        Integer frameId = freeList.poll();
        if (frameId != null) {
            logger.trace("Allocated free frame {}", frameId);
        } else {
            // 2. 没有空闲 Frame，通过 Replacer 淘汰
            int victim = replacer.victim();
            if (victim == Replacer.NO_VICTIM) {
                // 3. 所有 Page 都被 pin 住，无法淘汰
                return Replacer.NO_VICTIM;
            }
            frameId = victim;
            logger.trace("Evicted frame {} via replacer", frameId);
        }

        Page page = pages[frameId];
        if (page.getPinCount() != 0) {
            throw new IllegalStateException(String.format(
                    "Victim frame %d holds page %d with pinCount %d",
                    frameId, page.getPageId(), page.getPinCount()));
        }
        return frameId;
    }

    /**
     * 清空 victim Frame：脏页先写回（以旧 pageId），再从 PageTable 移除旧映射
     */
    private void evict(int frameId, Page page) throws IOException {
        int oldPageId = page.getPageId();
        if (oldPageId != Page.INVALID_PAGE_ID) {
            if (page.isDirty()) {
                try {
                    writeBack(page);
                } catch (IOException | RuntimeException e) {
                    // 写回失败，旧 Page 仍然驻留，放回 Replacer
                    replacer.insert(frameId);
                    throw e;
                }
                logger.debug("Flushed dirty page {} before eviction", oldPageId);
            }
            pageTable.remove(oldPageId);
            logger.debug("Evicted page {} from frame {}", oldPageId, frameId);
        }
        page.resetMemory();
    }

    /**
     * 写回脏页，遵守 WAL：先保证日志持久化到该页的 LSN
     */
    private void writeBack(Page page) throws IOException {
        if (logManager != null && page.getLsn() != Page.INVALID_LSN
                && page.getLsn() > logManager.getPersistentLsn()) {
            logManager.flush(page.getLsn());
            logger.trace("Log flushed up to lsn {} before writing page {}", page.getLsn(), page.getPageId());
        }
        diskManager.writePage(page.getPageId(), page.getPageData());
        page.setDirty(false);
    }

    public BufferPoolStats getStats() {
        globalLock.lock();
        try {
            int dirtyPages = 0;
            int pinnedPages = 0;

            for (Page page : pages) {
                if (page.isDirty()) dirtyPages++;
                if (page.getPinCount() > 0) pinnedPages++;
            }

            return new BufferPoolStats(poolSize, poolSize - freeList.size(), freeList.size(),
                    dirtyPages, pinnedPages, replacer.size());

        } finally {
            globalLock.unlock();
        }
    }

    @Override
    public void close() throws IOException {
        globalLock.lock();
        try {
            logger.info("Closing BufferPoolManager...");
            flushAllPages();
            logger.info("BufferPoolManager closed. {}", getStats());

        } finally {
            globalLock.unlock();
        }
    }
}
