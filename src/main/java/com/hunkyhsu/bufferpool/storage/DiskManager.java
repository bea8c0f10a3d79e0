package com.hunkyhsu.bufferpool.storage;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Disk IO 接口
 *
 * BufferPoolManager 只通过该接口读写 Page 内容、分配和释放 pageId。
 * 实现需要是同步、可靠的；出错时抛出 IOException，BufferPool 不做重试。
 */
public interface DiskManager {

    /**
     * 每个 Page 的字节数，进程生命周期内固定
     */
    int getPageSize();

    /**
     * 读取 pageId 的全部内容到 buffer（从 position 0 开始写满 pageSize 字节）
     */
    void readPage(int pageId, ByteBuffer buffer) throws IOException;

    /**
     * 将 buffer 的全部 pageSize 字节持久化到 pageId
     */
    void writePage(int pageId, ByteBuffer buffer) throws IOException;

    /**
     * 分配一个未使用的 pageId
     */
    int allocatePage() throws IOException;

    /**
     * 释放 pageId，之后可以被 allocatePage 复用
     */
    void deallocatePage(int pageId);
}
