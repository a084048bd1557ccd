package com.umitunal.tenantq.storage;

import com.umitunal.tenantq.config.StorageConfig;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.Cache;
import org.rocksdb.CompressionType;
import org.rocksdb.Filter;
import org.rocksdb.LRUCache;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.WriteOptions;

import java.io.File;

/**
 * Native option handles shared by one RocksDB instance.
 * They must outlive the database and are released after it.
 */
final class RocksResources implements AutoCloseable {
    private final Options dbOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final WriteOptions writeOpts;
    private final ReadOptions scanReadOpts;

    RocksResources(StorageConfig config) {
        RocksDB.loadLibrary();

        File dir = new File(config.getDataDirectory());
        if (!dir.exists() && !dir.mkdirs()) {
            throw new IllegalStateException("Cannot create data directory " + dir);
        }

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTargetFileSizeBase(64 * 1024 * 1024)
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setIncreaseParallelism(Runtime.getRuntime().availableProcessors())
                .setAllowConcurrentMemtableWrite(true)
                .setEnableWriteThreadAdaptiveYield(true)
                .setTableFormatConfig(tableConfig)
                .setMaxOpenFiles(-1);

        // Queue entries and status changes must hit the WAL; sync only when durable
        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        // Scans don't pollute the block cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);
    }

    Options dbOptions() { return dbOptions; }
    WriteOptions writeOptions() { return writeOpts; }
    ReadOptions scanReadOptions() { return scanReadOpts; }

    @Override
    public void close() {
        scanReadOpts.close();
        writeOpts.close();
        dbOptions.close();
        // BlockBasedTableConfig has no close(); it goes with the Options
        blockCache.close();
        bloomFilter.close();
    }
}
