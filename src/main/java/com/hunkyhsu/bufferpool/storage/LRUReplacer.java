package com.hunkyhsu.bufferpool.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;

/**
 * LRU Replacer - 基于 LRU 算法的页面替换器
 *
 * 核心设计：
 * - 以 frameId 为下标的侵入式双向链表（prev[] / next[]），不分配链表节点
 * - head 是最久未使用的 Frame，tail 是最近 insert 的 Frame
 * - insert / victim / erase / size 都是 O(1)
 * - 线程安全：所有操作加锁保护
 *
 * 淘汰顺序只由 insert 的先后决定：被跟踪的 Frame 中最早 insert 的那个最先被淘汰。
 *
 * @author hunkyhsu
 */
public class LRUReplacer implements Replacer {

    private static final Logger logger = LoggerFactory.getLogger(LRUReplacer.class);

    private static final int NIL = -1;

    private final int capacity;

    private final int[] prev;

    private final int[] next;

    private final boolean[] tracked;

    private int head = NIL;

    private int tail = NIL;

    private int size = 0;

    private final ReentrantLock lock;

    public LRUReplacer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.prev = new int[capacity];
        this.next = new int[capacity];
        this.tracked = new boolean[capacity];
        Arrays.fill(prev, NIL);
        Arrays.fill(next, NIL);
        this.lock = new ReentrantLock();
        logger.info("LRU Replacer initialized with capacity {}", capacity);
    }

    /**
     * 将 Frame 加入链表尾部（最近使用）
     *
     * @param frameId Frame ID
     */
    @Override
    public void insert(int frameId) {
        checkFrameId(frameId);
        lock.lock();
        try {
            if (tracked[frameId]) {
                logger.trace("Frame {} already tracked, insert ignored", frameId);
                return;
            }
            linkLast(frameId);
            logger.trace("Frame {} inserted (added to LRU tail)", frameId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 选择一个 Frame 进行淘汰
     *
     * 实现：摘下链表头部（最久未使用）
     *
     * @return Frame ID，如果没有可淘汰的 Frame 则返回 -1
     */
    @Override
    public int victim() {
        lock.lock();
        try {
            if (head == NIL) {
                logger.debug("No victim available (all frames are pinned)");
                return NO_VICTIM;
            }
            int frameId = head;
            unlink(frameId);

            logger.debug("Victim selected: frameId={}", frameId);
            return frameId;

        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean erase(int frameId) {
        checkFrameId(frameId);
        lock.lock();
        try {
            if (!tracked[frameId]) {
                return false;
            }
            unlink(frameId);
            logger.trace("Frame {} erased (removed from LRU)", frameId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    private void linkLast(int frameId) {
        prev[frameId] = tail;
        next[frameId] = NIL;
        if (tail == NIL) {
            head = frameId;
        } else {
            next[tail] = frameId;
        }
        tail = frameId;
        tracked[frameId] = true;
        size++;
    }

    private void unlink(int frameId) {
        int p = prev[frameId];
        int n = next[frameId];
        if (p == NIL) {
            head = n;
        } else {
            next[p] = n;
        }
        if (n == NIL) {
            tail = p;
        } else {
            prev[n] = p;
        }
        prev[frameId] = NIL;
        next[frameId] = NIL;
        tracked[frameId] = false;
        size--;
    }

    private void checkFrameId(int frameId) {
        if (frameId < 0 || frameId >= capacity) {
            throw new IllegalArgumentException(String.format(
                    "Invalid frameId: %d (capacity: %d)", frameId, capacity));
        }
    }
}
