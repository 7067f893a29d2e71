package org.csu.pagebuf.storage.buffer;

import lombok.Builder;
import lombok.Getter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 缓冲池参数。可以用 builder 直接构造，也可以从 classpath 上的 properties 文件读取。
 */
@Getter
@Builder
public class BufferPoolConfig {
    public static final String DEFAULT_RESOURCE = "pagebuf.properties";
    public static final int DEFAULT_NUM_BUFS = 64;
    public static final double DEFAULT_HASH_TABLE_SCALE = 1.2;

    @Builder.Default
    private final int numBufs = DEFAULT_NUM_BUFS;

    // 槽位索引相对帧数的余量
    @Builder.Default
    private final double hashTableScale = DEFAULT_HASH_TABLE_SCALE;

    // 打开后会打印淘汰、写回、flush 等过程
    @Builder.Default
    private final boolean verbose = false;

    public void validate() {
        if (numBufs <= 0) {
            throw new IllegalArgumentException("numBufs must be positive: " + numBufs);
        }
        if (!(hashTableScale >= 1.0)) {
            throw new IllegalArgumentException("hashTableScale must be at least 1.0: " + hashTableScale);
        }
    }

    /**
     * 从 classpath 资源读取配置，缺省的键取默认值；资源不存在时整体取默认值。
     */
    public static BufferPoolConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream in = BufferPoolConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read buffer pool config '" + resource + "'", e);
        }

        BufferPoolConfig config;
        try {
            config = BufferPoolConfig.builder()
                    .numBufs(Integer.parseInt(props.getProperty("pagebuf.numBufs", String.valueOf(DEFAULT_NUM_BUFS)).trim()))
                    .hashTableScale(Double.parseDouble(props.getProperty("pagebuf.hashTableScale", String.valueOf(DEFAULT_HASH_TABLE_SCALE)).trim()))
                    .verbose(Boolean.parseBoolean(props.getProperty("pagebuf.verbose", "false").trim()))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed number in buffer pool config '" + resource + "'", e);
        }
        config.validate();
        return config;
    }

    public static BufferPoolConfig load() {
        return load(DEFAULT_RESOURCE);
    }
}
