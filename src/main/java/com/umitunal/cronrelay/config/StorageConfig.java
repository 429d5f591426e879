package com.umitunal.cronrelay.config;

import java.util.Properties;

/**
 * Configuration for the RocksDB stream store.
 */
public class StorageConfig {
    public static final String PREFIX = "cronrelay.storage.";

    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final int blockCacheSizeMB;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    /**
     * Read {@code cronrelay.storage.*} keys. {@code data-directory} is required.
     */
    public static StorageConfig fromProperties(Properties props) {
        String dir = props.getProperty(PREFIX + "data-directory");
        if (dir == null || dir.isBlank()) {
            throw new IllegalArgumentException("Missing property " + PREFIX + "data-directory");
        }
        Builder builder = newBuilder(dir.trim());
        String durable = props.getProperty(PREFIX + "durable-writes");
        if (durable != null) {
            builder.withDurableWrites(Boolean.parseBoolean(durable.trim()));
        }
        String buffer = props.getProperty(PREFIX + "memory-buffer-mb");
        if (buffer != null) {
            builder.withMemoryBufferSize(Integer.parseInt(buffer.trim()));
        }
        String cache = props.getProperty(PREFIX + "block-cache-mb");
        if (cache != null) {
            builder.withBlockCacheSize(Integer.parseInt(cache.trim()));
        }
        return builder.build();
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 2;
        private int blockCacheSizeMB = 32;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Sync the write-ahead log on every write. An appended entry then survives a
         * machine crash, not only a process crash.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Default: 32 MB
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }
    }
}
