package com.hunkyhsu.bufferpool.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于单个文件的 Disk IO Manager
 *
 * pageId 为 i 的 Page 位于文件偏移 i * pageSize 处。
 * 释放的 pageId 记录在内存中的空闲列表里，分配时优先复用最小的那个；
 * 空闲列表不持久化，重新打开文件后所有已存在的 Page 都视为已分配。
 */
public class FileDiskManager implements DiskManager, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(FileDiskManager.class);

    private final int pageSize;

    /**
     * 全 0 的 Page Buffer，通过 duplicate() 创建独立视图
     */
    private final ByteBuffer emptyPageBuffer;

    private final FileChannel fileChannel;
    private final Path dbFilePath;
    private final AtomicInteger numPages;

    private final TreeSet<Integer> freePageIds;
    private final ReentrantLock allocationLock;

    public FileDiskManager(String dbFilePath) throws IOException {
        this(dbFilePath, Page.DEFAULT_PAGE_SIZE);
    }

    public FileDiskManager(String dbFilePath, int pageSize) throws IOException {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.pageSize = pageSize;
        this.emptyPageBuffer = ByteBuffer.allocateDirect(pageSize);
        this.dbFilePath = Path.of(dbFilePath);
        this.freePageIds = new TreeSet<>();
        this.allocationLock = new ReentrantLock();

        // 确保父目录存在（如果有父目录）
        Path parentPath = this.dbFilePath.getParent();
        if (parentPath != null) {
            File parentDir = parentPath.toFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create directory: " + parentDir.getAbsolutePath());
            }
        }
        this.fileChannel = FileChannel.open(
                this.dbFilePath,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE,
                StandardOpenOption.CREATE
        );
        long fileSize = this.fileChannel.size();
        if (fileSize % pageSize != 0) {
            logger.warn("File size {} is not a multiple of pageSize {}, file may be corrupted",
                    fileSize, pageSize);
        }
        this.numPages = new AtomicInteger((int) (fileSize / pageSize));
        logger.info("Disk Manager opened: file={}, pageSize={}, pages={}",
                this.dbFilePath.toAbsolutePath(), pageSize, numPages.get());
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public void readPage(int pageId, ByteBuffer buffer) throws IOException {
        checkPageId(pageId);
        checkBuffer(buffer);
        long offset = (long) pageId * pageSize;

        ByteBuffer target = buffer.duplicate();
        target.clear();
        target.limit(pageSize);

        int totalBytesRead = 0;
        while (totalBytesRead < pageSize) {
            int bytesRead = this.fileChannel.read(target, offset + totalBytesRead);
            if (bytesRead == -1) {
                throw new IOException(String.format(
                        "Unexpected EOF: page %d is incomplete (expected %d bytes, got %d)",
                        pageId, pageSize, totalBytesRead));
            }
            totalBytesRead += bytesRead;
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Read page {} from disk (offset={}, bytes={})",
                    pageId, offset, totalBytesRead);
        }
    }

    @Override
    public void writePage(int pageId, ByteBuffer buffer) throws IOException {
        checkPageId(pageId);
        checkBuffer(buffer);
        long offset = (long) pageId * pageSize;
        try {
            ByteBuffer source = buffer.duplicate();
            source.clear();
            source.limit(pageSize);
            int totalBytesWritten = 0;
            while (source.hasRemaining()) {
                int written = fileChannel.write(source, offset + totalBytesWritten);
                totalBytesWritten += written;
            }
            fileChannel.force(false);
            if (logger.isDebugEnabled()) {
                logger.debug("Wrote page {} to disk (offset={}, bytes={})",
                        pageId, offset, totalBytesWritten);
            }
        } catch (IOException e) {
            throw new IOException(String.format(
                    "Failed to write page %d (offset=%d): %s", pageId, offset, e.getMessage()), e
            );
        }
    }

    @Override
    public int allocatePage() throws IOException {
        allocationLock.lock();
        try {
            Integer reused = freePageIds.pollFirst();
            if (reused != null) {
                try {
                    writeEmptyPage(reused);
                } catch (IOException e) {
                    freePageIds.add(reused);
                    throw e;
                }
                logger.debug("Reused deallocated page {}", reused);
                return reused;
            }

            int newPageId = this.numPages.getAndIncrement();
            try {
                writeEmptyPage(newPageId);
                if (logger.isDebugEnabled()) {
                    logger.debug("Allocated new page {} (total pages: {})", newPageId, numPages.get());
                }
                return newPageId;
            } catch (IOException e) {
                numPages.decrementAndGet();
                logger.error("Failed to allocate page {}, rolling back numPages to {}",
                        newPageId, numPages.get());
                throw e;
            }
        } finally {
            allocationLock.unlock();
        }
    }

    @Override
    public void deallocatePage(int pageId) {
        if (pageId < 0 || pageId >= numPages.get()) {
            logger.warn("Attempted to deallocate invalid pageId: {}", pageId);
            return;
        }
        allocationLock.lock();
        try {
            if (!freePageIds.add(pageId)) {
                logger.warn("Page {} is already deallocated", pageId);
                return;
            }
            logger.debug("Deallocated page {} (free pages: {})", pageId, freePageIds.size());
        } finally {
            allocationLock.unlock();
        }
    }

    public int getNumPages() {
        return numPages.get();
    }

    public int getNumFreePages() {
        allocationLock.lock();
        try {
            return freePageIds.size();
        } finally {
            allocationLock.unlock();
        }
    }

    public long getFileSize() throws IOException {
        return fileChannel.size();
    }

    private void writeEmptyPage(int pageId) throws IOException {
        long offset = (long) pageId * pageSize;
        ByteBuffer buffer = emptyPageBuffer.duplicate();
        buffer.clear();
        try {
            while (buffer.hasRemaining()) {
                int written = fileChannel.write(buffer, offset + buffer.position());
                if (written == 0) {
                    throw new IOException("Cannot write to disk, possibly full");
                }
            }
            fileChannel.force(false);
        } catch (IOException e) {
            throw new IOException(
                    String.format("Failed to allocate page %d: %s", pageId, e.getMessage()), e);
        }
    }

    /**
     * 只允许读写已分配的 Page：越界或已释放的 pageId 都视为非法
     */
    private void checkPageId(int pageId) {
        if (pageId < 0 || pageId >= numPages.get()) {
            throw new IllegalArgumentException(String.format(
                    "Invalid pageId: %d (total pages: %d)", pageId, numPages.get()));
        }
        allocationLock.lock();
        try {
            if (freePageIds.contains(pageId)) {
                throw new IllegalArgumentException("Page " + pageId + " is deallocated");
            }
        } finally {
            allocationLock.unlock();
        }
    }

    private void checkBuffer(ByteBuffer buffer) {
        if (buffer.capacity() < pageSize) {
            throw new IllegalArgumentException(String.format(
                    "Buffer too small: %d bytes (pageSize: %d)", buffer.capacity(), pageSize));
        }
    }

    @Override
    public void close() {
        try {
            if (fileChannel != null && fileChannel.isOpen()) {
                fileChannel.force(true);
                fileChannel.close();
                logger.info("Disk Manager closed: file={}", dbFilePath.toAbsolutePath());
            }
        } catch (IOException e) {
            logger.error("Failed to close Disk Manager", e);
        }
    }

}
