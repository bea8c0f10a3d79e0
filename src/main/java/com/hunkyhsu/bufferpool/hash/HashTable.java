package com.hunkyhsu.bufferpool.hash;

/**
 * 点查询的关联索引，BufferPool 用它作为 PageTable（pageId -> frameId）
 *
 * @param <K> key type, must not be null
 * @param <V> value type
 */
public interface HashTable<K, V> {

    /**
     * @return the value mapped to {@code key}, or {@code null} if absent
     */
    V find(K key);

    /**
     * Map {@code key} to {@code value}, replacing any previous value.
     */
    void insert(K key, V value);

    /**
     * @return true if an entry was removed
     */
    boolean remove(K key);

    int size();
}
