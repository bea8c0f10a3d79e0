package com.hunkyhsu.bufferpool.storage;

/**
 * Replacer - 页面替换策略接口
 *
 * 职责：
 * - 决定当 BufferPool 没有空闲 Frame 时应该淘汰哪个 Frame
 * - 只跟踪 Resident-Unpinned 的 Frame（pinCount == 0 且在 PageTable 中）
 * - 提供线程安全的操作接口
 *
 * 实现：{@link LRUReplacer}（默认）、{@link ClockReplacer}
 *
 * @author hunkyhsu
 */
public interface Replacer {

    /**
     * victim() 没有可淘汰 Frame 时的返回值
     */
    int NO_VICTIM = -1;

    /**
     * 将 Frame 标记为可淘汰，放到最近使用的位置
     *
     * 当 Page 的 pinCount 降为 0 时调用。已经被跟踪的 Frame 再次 insert 不产生任何效果。
     *
     * @param frameId Frame ID
     */
    void insert(int frameId);

    /**
     * 选择一个 Frame 进行淘汰，并停止跟踪它
     *
     * @return Frame ID，如果没有可淘汰的 Frame 则返回 {@link #NO_VICTIM}
     */
    int victim();

    /**
     * 停止跟踪 Frame（被 pin 住或者被删除）
     *
     * 对未被跟踪的 Frame 调用是安全的。
     *
     * @param frameId Frame ID
     * @return Frame 之前是否被跟踪
     */
    boolean erase(int frameId);

    /**
     * 获取当前可淘汰的 Frame 数量
     *
     * @return 可淘汰的 Frame 数量
     */
    int size();

}
