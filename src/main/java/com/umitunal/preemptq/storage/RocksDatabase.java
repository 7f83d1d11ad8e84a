package com.umitunal.preemptq.storage;

import com.umitunal.preemptq.config.StorageConfig;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Shared RocksDB handle holding every durable structure of the scheduler in its own column family.
 *
 * Opened as an OptimisticTransactionDB so single-record read-modify-writes and lane pops
 * can be made atomic without locks.
 */
public class RocksDatabase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RocksDatabase.class);

    public enum Family {
        JOBS("jobs"),
        EXECUTION_STATE("execution_state"),
        LANES("lanes"),
        DELAYED("delayed");

        private final String columnFamilyName;

        Family(String columnFamilyName) {
            this.columnFamilyName = columnFamilyName;
        }

        byte[] nameBytes() {
            return columnFamilyName.getBytes(StandardCharsets.UTF_8);
        }
    }

    private final OptimisticTransactionDB transactionDB;
    private final StorageConfig config;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions scanReadOpts;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final List<ColumnFamilyHandle> allHandles = new ArrayList<>();
    private final Map<Family, ColumnFamilyHandle> handles = new EnumMap<>(Family.class);

    public RocksDatabase(StorageConfig config) throws RocksDBException {
        this.config = config;

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache((long) config.getBlockCacheSizeMB() * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false); // 10 bits per key

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.cfOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTargetFileSizeBase(64L * 1024 * 1024)
                .setTableFormatConfig(tableConfig);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setIncreaseParallelism(Runtime.getRuntime().availableProcessors())
                .setAllowConcurrentMemtableWrite(true)
                .setEnableWriteThreadAdaptiveYield(true)
                .setMaxOpenFiles(-1);

        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions));
        for (Family family : Family.values()) {
            descriptors.add(new ColumnFamilyDescriptor(family.nameBytes(), cfOptions));
        }

        this.transactionDB = OptimisticTransactionDB.open(
                dbOptions, config.getDataDirectory(), descriptors, allHandles);

        // Handle order matches descriptor order, index 0 is the default family
        Family[] families = Family.values();
        for (int i = 0; i < families.length; i++) {
            handles.put(families[i], allHandles.get(i + 1));
        }

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        // ReadOptions for scans - don't pollute cache with full table scans
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        log.info("Opened RocksDB at {} (durable writes: {})",
                config.getDataDirectory(), config.isDurableWrites());
    }

    public OptimisticTransactionDB db() {
        return transactionDB;
    }

    public ColumnFamilyHandle handle(Family family) {
        return handles.get(family);
    }

    public WriteOptions writeOptions() {
        return writeOpts;
    }

    public ReadOptions scanOptions() {
        return scanReadOpts;
    }

    public Transaction beginTransaction() {
        return transactionDB.beginTransaction(writeOpts, txnOpts);
    }

    /**
     * Whether a failed commit lost an optimistic conflict (and may simply be retried).
     */
    public static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    @Override
    public void close() {
        if (!config.isDurableWrites()) {
            // No WAL to replay, so memtables must reach disk before closing
            try (FlushOptions flushOptions = new FlushOptions().setWaitForFlush(true)) {
                transactionDB.flush(flushOptions, allHandles);
            } catch (RocksDBException e) {
                log.error("Failed to flush memtables on close", e);
            }
        }
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        for (ColumnFamilyHandle handle : allHandles) {
            handle.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        if (cfOptions != null) {
            cfOptions.close();
        }
        // Note: BlockBasedTableConfig doesn't have close() method
        if (blockCache != null) {
            blockCache.close();
        }
        if (bloomFilter != null) {
            bloomFilter.close();
        }
        log.info("Closed RocksDB at {}", config.getDataDirectory());
    }
}
