package com.hunkyhsu.bufferpool.storage;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FileDiskManager 单元测试
 *
 * 测试覆盖：
 * 1. 基本读写功能
 * 2. 数据持久化
 * 3. Page 分配、释放与复用
 * 4. 并发读写
 * 5. 异常处理
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class FileDiskManagerTest {

    private static final Logger logger = LoggerFactory.getLogger(FileDiskManagerTest.class);
    private static final int PAGE_SIZE = 512;

    @TempDir
    Path tempDir;

    private String dbPath;
    private FileDiskManager diskManager;

    @BeforeEach
    void setUp() throws IOException {
        dbPath = tempDir.resolve("test_disk_manager.db").toString();
        diskManager = new FileDiskManager(dbPath, PAGE_SIZE);
        logger.info("Test setup completed");
    }

    @AfterEach
    void tearDown() {
        if (diskManager != null) {
            diskManager.close();
        }
        logger.info("Test teardown completed");
    }

    private static ByteBuffer pageWith(String content) {
        ByteBuffer buffer = ByteBuffer.allocate(PAGE_SIZE);
        buffer.put(content.getBytes());
        return buffer;
    }

    private static String readString(ByteBuffer buffer, int length) {
        byte[] data = new byte[length];
        buffer.duplicate().rewind().get(data);
        return new String(data);
    }

    // ========== 基本功能测试 ==========

    @Test
    @Order(1)
    @DisplayName("测试：分配新 Page")
    void testAllocatePage() throws IOException {
        int pageId = diskManager.allocatePage();
        assertEquals(0, pageId, "First page ID should be 0");

        int pageId2 = diskManager.allocatePage();
        assertEquals(1, pageId2, "Second page ID should be 1");

        assertEquals(2L * PAGE_SIZE, diskManager.getFileSize(),
                "File size should be 2 * PAGE_SIZE");
        assertEquals(PAGE_SIZE, diskManager.getPageSize());

        logger.info("✅ testAllocatePage passed");
    }

    @Test
    @Order(2)
    @DisplayName("测试：写入和读取 Page")
    void testWriteAndReadPage() throws IOException {
        int pageId = diskManager.allocatePage();
        String testData = "Hello BufferPool Test";

        diskManager.writePage(pageId, pageWith(testData));

        ByteBuffer readBuffer = ByteBuffer.allocate(PAGE_SIZE);
        diskManager.readPage(pageId, readBuffer);

        assertEquals(testData, readString(readBuffer, testData.length()),
                "Read data should match written data");
        assertEquals(0, readBuffer.position(), "readPage should not move the caller's position");

        logger.info("✅ testWriteAndReadPage passed");
    }

    @Test
    @Order(3)
    @DisplayName("测试：反复读写同一个 Page")
    void testRepeatedReadWrite() throws IOException {
        int pageId = diskManager.allocatePage();
        int iterations = 100;

        for (int i = 0; i < iterations; i++) {
            String testString = "Iteration " + i;
            diskManager.writePage(pageId, pageWith(testString));

            ByteBuffer readBuffer = ByteBuffer.allocate(PAGE_SIZE);
            diskManager.readPage(pageId, readBuffer);
            assertEquals(testString, readString(readBuffer, testString.length()),
                    "Data mismatch at iteration " + i);
        }

        logger.info("✅ testRepeatedReadWrite passed ({} iterations)", iterations);
    }

    @Test
    @Order(4)
    @DisplayName("测试：数据持久化（重启验证）")
    void testPersistence() throws IOException {
        int pageId = diskManager.allocatePage();
        String persistentData = "This data must survive restart";
        diskManager.writePage(pageId, pageWith(persistentData));

        // 关闭 DiskManager（模拟程序关闭）
        diskManager.close();

        diskManager = new FileDiskManager(dbPath, PAGE_SIZE);
        assertEquals(1, diskManager.getNumPages(), "Should have 1 page after restart");

        ByteBuffer readBuffer = ByteBuffer.allocate(PAGE_SIZE);
        diskManager.readPage(pageId, readBuffer);
        assertEquals(persistentData, readString(readBuffer, persistentData.length()),
                "Data should persist after restart");

        logger.info("✅ testPersistence passed");
    }

    @Test
    @Order(5)
    @DisplayName("测试：多个 Page 的数据隔离")
    void testMultiplePageIsolation() throws IOException {
        int numPages = 10;
        int[] pageIds = new int[numPages];
        for (int i = 0; i < numPages; i++) {
            pageIds[i] = diskManager.allocatePage();
        }

        for (int i = 0; i < numPages; i++) {
            diskManager.writePage(pageIds[i], pageWith("Page " + i + " data"));
        }

        for (int i = 0; i < numPages; i++) {
            ByteBuffer readBuffer = ByteBuffer.allocate(PAGE_SIZE);
            diskManager.readPage(pageIds[i], readBuffer);
            String expectedData = "Page " + i + " data";
            assertEquals(expectedData, readString(readBuffer, expectedData.length()),
                    "Page " + i + " data should be isolated");
        }

        logger.info("✅ testMultiplePageIsolation passed");
    }

    // ========== 释放与复用 ==========

    @Test
    @Order(6)
    @DisplayName("测试：释放的 pageId 被复用且内容清零")
    void testDeallocateAndReuse() throws IOException {
        for (int i = 0; i < 3; i++) {
            diskManager.allocatePage();
        }
        diskManager.writePage(1, pageWith("stale content"));

        diskManager.deallocatePage(1);
        assertEquals(1, diskManager.getNumFreePages());

        // 已释放的 pageId 在重新分配前不可读写
        ByteBuffer freed = ByteBuffer.allocate(PAGE_SIZE);
        assertThrows(IllegalArgumentException.class, () -> diskManager.readPage(1, freed));
        assertThrows(IllegalArgumentException.class, () -> diskManager.writePage(1, freed));

        int reused = diskManager.allocatePage();
        assertEquals(1, reused, "Deallocated page id should be reused");
        assertEquals(0, diskManager.getNumFreePages());
        assertEquals(3, diskManager.getNumPages(), "File should not grow when reusing");

        ByteBuffer readBuffer = ByteBuffer.allocate(PAGE_SIZE);
        diskManager.readPage(reused, readBuffer);
        for (int i = 0; i < PAGE_SIZE; i++) {
            assertEquals(0, readBuffer.get(i), "Reused page must be zeroed at offset " + i);
        }

        // 没有可复用的 id 时继续追加
        assertEquals(3, diskManager.allocatePage());

        logger.info("✅ testDeallocateAndReuse passed");
    }

    @Test
    @Order(7)
    @DisplayName("测试：复用时优先最小的 pageId，重复释放被忽略")
    void testReuseLowestIdFirst() throws IOException {
        for (int i = 0; i < 5; i++) {
            diskManager.allocatePage();
        }
        diskManager.deallocatePage(3);
        diskManager.deallocatePage(1);
        diskManager.deallocatePage(3);
        diskManager.deallocatePage(42);
        assertEquals(2, diskManager.getNumFreePages());

        assertEquals(1, diskManager.allocatePage());
        assertEquals(3, diskManager.allocatePage());
        assertEquals(5, diskManager.allocatePage());

        logger.info("✅ testReuseLowestIdFirst passed");
    }

    // ========== 异常处理测试 ==========

    @Test
    @Order(8)
    @DisplayName("测试：读写无效的 Page ID")
    void testInvalidPageId() {
        ByteBuffer buffer = ByteBuffer.allocate(PAGE_SIZE);
        assertThrows(IllegalArgumentException.class, () -> diskManager.readPage(-1, buffer),
                "Should throw exception for negative page ID");
        assertThrows(IllegalArgumentException.class, () -> diskManager.readPage(999, buffer),
                "Should throw exception for non-existent page ID");
        assertThrows(IllegalArgumentException.class, () -> diskManager.writePage(-1, buffer),
                "Should throw exception for negative page ID");
        assertThrows(IllegalArgumentException.class, () -> diskManager.writePage(999, buffer),
                "Should throw exception for non-existent page ID");

        logger.info("✅ testInvalidPageId passed");
    }

    @Test
    @Order(9)
    @DisplayName("测试：Buffer 小于 pageSize")
    void testBufferTooSmall() throws IOException {
        int pageId = diskManager.allocatePage();
        ByteBuffer small = ByteBuffer.allocate(PAGE_SIZE / 2);
        assertThrows(IllegalArgumentException.class, () -> diskManager.readPage(pageId, small));
        assertThrows(IllegalArgumentException.class, () -> diskManager.writePage(pageId, small));

        logger.info("✅ testBufferTooSmall passed");
    }

    // ========== 并发测试 ==========

    @Test
    @Order(10)
    @DisplayName("测试：并发分配不产生重复 pageId")
    void testConcurrentAllocate() throws Exception {
        int numThreads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch latch = new CountDownLatch(numThreads);
        ConcurrentHashMap<Integer, String> expectedData = new ConcurrentHashMap<>();
        AtomicInteger errorCount = new AtomicInteger(0);

        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    int pageId = diskManager.allocatePage();
                    String data = "Thread " + threadId + " data";
                    assertNull(expectedData.put(pageId, data), "Duplicate page id " + pageId);
                    diskManager.writePage(pageId, pageWith(data));
                } catch (Throwable e) {
                    logger.error("Concurrent write error in thread " + threadId, e);
                    errorCount.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(30, TimeUnit.SECONDS), "Test should complete within 30 seconds");
        executor.shutdown();

        assertEquals(0, errorCount.get(), "No errors should occur");
        assertEquals(numThreads, diskManager.getNumPages(), "Should have " + numThreads + " pages");

        for (var entry : expectedData.entrySet()) {
            ByteBuffer readBuffer = ByteBuffer.allocate(PAGE_SIZE);
            diskManager.readPage(entry.getKey(), readBuffer);
            assertEquals(entry.getValue(), readString(readBuffer, entry.getValue().length()),
                    "Page " + entry.getKey() + " data should match");
        }

        logger.info("✅ testConcurrentAllocate passed ({} threads)", numThreads);
    }

    @Test
    @Order(11)
    @DisplayName("压力测试：并发随机读写")
    void testConcurrentRandomReadWrite() throws Exception {
        int numPages = 20;
        for (int i = 0; i < numPages; i++) {
            diskManager.allocatePage();
            diskManager.writePage(i, pageWith("Initial data " + i));
        }

        int numThreads = 8;
        int operationsPerThread = 100;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch latch = new CountDownLatch(numThreads);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);

        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    Random random = new Random(threadId);
                    for (int j = 0; j < operationsPerThread; j++) {
                        int pageId = random.nextInt(numPages);
                        if (random.nextBoolean()) {
                            diskManager.readPage(pageId, ByteBuffer.allocate(PAGE_SIZE));
                        } else {
                            diskManager.writePage(pageId, pageWith("T" + threadId + "-Op" + j));
                        }
                        successCount.incrementAndGet();
                    }
                } catch (Exception e) {
                    logger.error("Error in thread " + threadId, e);
                    errorCount.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(60, TimeUnit.SECONDS),
                "Stress test should complete within 60 seconds");
        executor.shutdown();

        assertEquals(numThreads * operationsPerThread, successCount.get(), "All operations should succeed");
        assertEquals(0, errorCount.get(), "No errors should occur");

        logger.info("✅ testConcurrentRandomReadWrite passed");
    }
}
