package com.hunkyhsu.bufferpool.hash;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Extendible Hash Table - 可扩展哈希
 *
 * 结构：
 * - directory：长度为 2^globalDepth 的数组，每个槽位指向一个 Bucket（多个槽位可以指向同一个 Bucket）
 * - Bucket：最多 bucketSize 个条目，带 localDepth
 *
 * 插入时 Bucket 满了：
 * 1. localDepth == globalDepth：目录翻倍（globalDepth + 1）
 * 2. 分裂该 Bucket（localDepth + 1），按新增的那一位重新分配条目，只修改指向它的目录槽位
 * 重复直到放得下，不会发生整表 rehash。
 *
 * 删除时不合并 Bucket，目录也不收缩。
 *
 * @param <K> key type
 * @param <V> value type
 * @author hunkyhsu
 */
public class ExtendibleHashTable<K, V> implements HashTable<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(ExtendibleHashTable.class);

    /**
     * 超过该深度后不再分裂，Bucket 允许溢出；目录最多 2^MAX_DEPTH 个槽位
     */
    static final int MAX_DEPTH = 16;

    private static final int DEPTH_MASK = (1 << MAX_DEPTH) - 1;

    private final int bucketSize;

    private final List<Bucket<K, V>> directory;

    private int globalDepth;

    private int numBuckets;

    private int size;

    private final ReentrantLock lock;

    public ExtendibleHashTable(int bucketSize) {
        if (bucketSize <= 0) {
            throw new IllegalArgumentException("bucketSize must be positive: " + bucketSize);
        }
        this.bucketSize = bucketSize;
        this.directory = new ArrayList<>();
        this.directory.add(new Bucket<>(0));
        this.globalDepth = 0;
        this.numBuckets = 1;
        this.size = 0;
        this.lock = new ReentrantLock();
    }

    @Override
    public V find(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            return bucketOf(hash(key)).items.get(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void insert(K key, V value) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            int h = hash(key);
            while (true) {
                Bucket<K, V> bucket = bucketOf(h);
                if (bucket.items.containsKey(key)) {
                    bucket.items.put(key, value);
                    return;
                }
                if (bucket.items.size() < bucketSize || !canSplit(bucket, h)) {
                    bucket.items.put(key, value);
                    size++;
                    return;
                }
                split(bucket);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            Bucket<K, V> bucket = bucketOf(hash(key));
            if (!bucket.items.containsKey(key)) {
                return false;
            }
            bucket.items.remove(key);
            size--;
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

    public int getGlobalDepth() {
        lock.lock();
        try {
            return globalDepth;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param directoryIndex index into the directory, in {@code [0, 2^globalDepth)}
     * @return local depth of the bucket that slot points to
     */
    public int getLocalDepth(int directoryIndex) {
        lock.lock();
        try {
            if (directoryIndex < 0 || directoryIndex >= directory.size()) {
                throw new IllegalArgumentException(String.format(
                        "Invalid directory index: %d (directory size: %d)", directoryIndex, directory.size()));
            }
            return directory.get(directoryIndex).localDepth;
        } finally {
            lock.unlock();
        }
    }

    public int getNumBuckets() {
        lock.lock();
        try {
            return numBuckets;
        } finally {
            lock.unlock();
        }
    }

    private Bucket<K, V> bucketOf(int h) {
        return directory.get(h & ((1 << globalDepth) - 1));
    }

    /**
     * 分裂只看哈希值的低 MAX_DEPTH 位：所有条目与新 key 在这些位上相同时分裂没有意义
     */
    private boolean canSplit(Bucket<K, V> bucket, int h) {
        if (bucket.localDepth >= MAX_DEPTH) {
            return false;
        }
        for (K existing : bucket.items.keySet()) {
            if (((hash(existing) ^ h) & DEPTH_MASK) != 0) {
                return true;
            }
        }
        logger.warn("Bucket overflow: {} keys share hash {}", bucket.items.size() + 1, h);
        return false;
    }

    private void split(Bucket<K, V> bucket) {
        if (bucket.localDepth == globalDepth) {
            int oldSize = directory.size();
            for (int i = 0; i < oldSize; i++) {
                directory.add(directory.get(i));
            }
            globalDepth++;
            logger.debug("Directory doubled: globalDepth={}, slots={}", globalDepth, directory.size());
        }

        int splitBit = 1 << bucket.localDepth;
        bucket.localDepth++;
        Bucket<K, V> sibling = new Bucket<>(bucket.localDepth);

        Iterator<Map.Entry<K, V>> it = bucket.items.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<K, V> entry = it.next();
            if ((hash(entry.getKey()) & splitBit) != 0) {
                sibling.items.put(entry.getKey(), entry.getValue());
                it.remove();
            }
        }

        for (int i = 0; i < directory.size(); i++) {
            if (directory.get(i) == bucket && (i & splitBit) != 0) {
                directory.set(i, sibling);
            }
        }
        numBuckets++;

        if (logger.isTraceEnabled()) {
            logger.trace("Bucket split: localDepth={}, kept={}, moved={}",
                    bucket.localDepth, bucket.items.size(), sibling.items.size());
        }
    }

    private static int hash(Object key) {
        int h = key.hashCode();
        return h ^ (h >>> 16);
    }

    private static final class Bucket<K, V> {
        private int localDepth;
        private final Map<K, V> items = new HashMap<>();

        private Bucket(int localDepth) {
            this.localDepth = localDepth;
        }
    }
}
