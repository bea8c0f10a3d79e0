package com.hunkyhsu.bufferpool.log;

import java.io.IOException;

/**
 * 预写日志（WAL）接口
 *
 * BufferPool 在把一个脏页写回磁盘之前，保证该页 LSN 之前的日志已经持久化。
 * 日志格式和恢复协议不属于 BufferPool 的职责。
 */
public interface LogManager {

    /**
     * @return 已经持久化到磁盘的最大 LSN
     */
    long getPersistentLsn();

    /**
     * 将 LSN 不超过 {@code lsn} 的日志全部刷到磁盘
     */
    void flush(long lsn) throws IOException;
}
