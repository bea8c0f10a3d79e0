package com.hunkyhsu.bufferpool.config;

import com.hunkyhsu.bufferpool.storage.Page;
import com.hunkyhsu.bufferpool.storage.ReplacerType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * BufferPool 构造参数
 *
 * <pre>
 * bufferpool.pool-size   = 64      # Frame 数量（必填）
 * bufferpool.page-size   = 4096    # 每个 Page 的字节数
 * bufferpool.bucket-size = 50      # PageTable 每个 Bucket 的容量
 * bufferpool.replacer    = LRU     # LRU | CLOCK
 * </pre>
 */
@Getter
@Builder
@ToString
public class BufferPoolConfig {

    public static final String POOL_SIZE_KEY = "bufferpool.pool-size";
    public static final String PAGE_SIZE_KEY = "bufferpool.page-size";
    public static final String BUCKET_SIZE_KEY = "bufferpool.bucket-size";
    public static final String REPLACER_KEY = "bufferpool.replacer";

    public static final int DEFAULT_BUCKET_SIZE = 50;

    private final int poolSize;

    @Builder.Default
    private final int pageSize = Page.DEFAULT_PAGE_SIZE;

    @Builder.Default
    private final int bucketSize = DEFAULT_BUCKET_SIZE;

    @Builder.Default
    private final ReplacerType replacerType = ReplacerType.LRU;

    public static BufferPoolConfig of(int poolSize) {
        return BufferPoolConfig.builder().poolSize(poolSize).build();
    }

    public void validate() {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive: " + poolSize);
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        if (bucketSize <= 0) {
            throw new IllegalArgumentException("bucketSize must be positive: " + bucketSize);
        }
        if (replacerType == null) {
            throw new IllegalArgumentException("replacerType must not be null");
        }
    }

    public static BufferPoolConfig fromProperties(Properties props) {
        String poolSize = props.getProperty(POOL_SIZE_KEY);
        if (poolSize == null) {
            throw new IllegalArgumentException("Missing required property: " + POOL_SIZE_KEY);
        }
        BufferPoolConfigBuilder builder = BufferPoolConfig.builder()
                .poolSize(parseInt(POOL_SIZE_KEY, poolSize));

        String pageSize = props.getProperty(PAGE_SIZE_KEY);
        if (pageSize != null) {
            builder.pageSize(parseInt(PAGE_SIZE_KEY, pageSize));
        }
        String bucketSize = props.getProperty(BUCKET_SIZE_KEY);
        if (bucketSize != null) {
            builder.bucketSize(parseInt(BUCKET_SIZE_KEY, bucketSize));
        }
        String replacer = props.getProperty(REPLACER_KEY);
        if (replacer != null) {
            builder.replacerType(ReplacerType.fromName(replacer));
        }

        BufferPoolConfig config = builder.build();
        config.validate();
        return config;
    }

    /**
     * 从 classpath 加载 properties 文件
     */
    public static BufferPoolConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream in = BufferPoolConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Config resource not found: " + resource);
            }
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config resource " + resource, e);
        }
        return fromProperties(props);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid value for %s: '%s'", key, value), e);
        }
    }
}
