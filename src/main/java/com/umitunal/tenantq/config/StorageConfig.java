package com.umitunal.tenantq.config;

import java.nio.file.Paths;

/**
 * Configuration for the underlying storage engine.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final long blockCacheSizeMB;

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
    public long getBlockCacheSizeMB() { return blockCacheSizeMB; }

    /**
     * Same settings, rooted at a child directory of this one.
     * The job store and the queue each get their own database.
     */
    public StorageConfig forSubdirectory(String child) {
        return newBuilder(Paths.get(dataDirectory, child).toString())
                .withDurableWrites(durableWrites)
                .withMemoryBufferSize(memoryBufferSizeMB)
                .withMaxMemoryBuffers(maxMemoryBuffers)
                .withBackgroundThreads(backgroundThreads)
                .withBlockCacheSize(blockCacheSizeMB)
                .build();
    }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 64;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 4;
        private long blockCacheSizeMB = 64;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Enable durable writes (fsync on every write).
         * Slower but an acknowledged enqueue survives a crash.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memory buffer size in MB.
         * Default: 64 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Set maximum number of memory buffers.
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Set number of background compaction threads.
         * Default: 4
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Set the block cache size in MB.
         * Default: 64 MB
         */
        public Builder withBlockCacheSize(long sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }
    }
}
