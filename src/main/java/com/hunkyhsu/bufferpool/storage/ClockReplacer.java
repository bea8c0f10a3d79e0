package com.hunkyhsu.bufferpool.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Clock Replacer - 时钟（二次机会）页面替换器
 *
 * - 每个 Frame 一个引用位，insert 时置 1
 * - victim 时指针循环扫描：引用位为 1 的清 0 并跳过，遇到引用位为 0 的即淘汰
 * - 开销比 LRU 低，淘汰顺序是 LRU 的近似
 *
 * @author hunkyhsu
 */
public class ClockReplacer implements Replacer {

    private static final Logger logger = LoggerFactory.getLogger(ClockReplacer.class);

    private final int capacity;

    private final boolean[] tracked;

    private final boolean[] referenced;

    private int hand = 0;

    private int size = 0;

    private final ReentrantLock lock;

    public ClockReplacer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.tracked = new boolean[capacity];
        this.referenced = new boolean[capacity];
        this.lock = new ReentrantLock();
        logger.info("Clock Replacer initialized with capacity {}", capacity);
    }

    @Override
    public void insert(int frameId) {
        checkFrameId(frameId);
        lock.lock();
        try {
            if (tracked[frameId]) {
                return;
            }
            tracked[frameId] = true;
            referenced[frameId] = true;
            size++;
            logger.trace("Frame {} inserted into clock (ref=1)", frameId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int victim() {
        lock.lock();
        try {
            if (size == 0) {
                logger.debug("No victim available (all frames are pinned)");
                return NO_VICTIM;
            }
            // 最多两圈：第一圈清掉所有引用位，第二圈必然命中
            while (true) {
                int frameId = hand;
                hand = (hand + 1) % capacity;
                if (!tracked[frameId]) {
                    continue;
                }
                if (referenced[frameId]) {
                    referenced[frameId] = false;
                    logger.trace("Frame {} gets a second chance", frameId);
                    continue;
                }
                tracked[frameId] = false;
                size--;
                logger.debug("Victim selected: frameId={}", frameId);
                return frameId;
            }
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
            tracked[frameId] = false;
            referenced[frameId] = false;
            size--;
            logger.trace("Frame {} erased from clock", frameId);
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

    private void checkFrameId(int frameId) {
        if (frameId < 0 || frameId >= capacity) {
            throw new IllegalArgumentException(String.format(
                    "Invalid frameId: %d (capacity: %d)", frameId, capacity));
        }
    }
}
