package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.JobMirror;
import com.umitunal.cronlite.error.PersistenceException;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.serialization.JobRecordCodec;
import com.umitunal.cronlite.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed job mirror.
 *
 * Two key spaces share one database:
 * - {@code job:<id>} holds the encoded record
 * - {@code at:<scheduleTime(8 bytes)><id>} is the time-ordered index
 *
 * Writes that touch both key spaces run in an optimistic transaction so the
 * index never points at a schedule time the record no longer has.
 */
public class RocksJobMirror implements JobMirror {
    private static final Logger log = LoggerFactory.getLogger(RocksJobMirror.class);

    private static final byte[] RECORD_PREFIX = "job:".getBytes(UTF_8);
    private static final byte[] INDEX_PREFIX = "at:".getBytes(UTF_8);
    private static final byte[] EMPTY = new byte[0];

    private final StorageConfig config;
    private final PayloadCodec<JobRecord> codec;

    private OptimisticTransactionDB transactionDB;
    private WriteOptions writeOpts;
    private OptimisticTransactionOptions txnOpts;
    private ReadOptions txnReadOpts;
    private ReadOptions scanReadOpts;
    private Options dbOptions;
    private Cache blockCache;
    private Filter bloomFilter;

    public RocksJobMirror(StorageConfig config) {
        this(config, new JobRecordCodec());
    }

    public RocksJobMirror(StorageConfig config, PayloadCodec<JobRecord> codec) {
        this.config = config;
        this.codec = codec;
    }

    @Override
    public synchronized void open() throws PersistenceException {
        if (transactionDB != null) {
            return;
        }
        RocksDB.loadLibrary();

        this.blockCache = new LRUCache((long) config.getBlockCacheSizeMB() * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10); // 10 bits per key

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
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig);

        try {
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());
        } catch (RocksDBException e) {
            closeOptions();
            throw new PersistenceException("Failed to open job mirror at " + config.getDataDirectory(), e);
        }

        // WAL always on; durable writes add an fsync per write
        this.writeOpts = new WriteOptions().setSync(config.isDurableWrites());
        this.txnOpts = new OptimisticTransactionOptions().setSetSnapshot(true);
        this.txnReadOpts = new ReadOptions();
        // Don't pollute cache with full table scans
        this.scanReadOpts = new ReadOptions().setFillCache(false);

        log.info("Opened job mirror at {}", config.getDataDirectory());
    }

    @Override
    public synchronized boolean isOpen() {
        return transactionDB != null;
    }

    @Override
    public synchronized void put(String jobId, JobRecord record) throws PersistenceException {
        ensureOpen();
        byte[] key = recordKey(jobId);

        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
            byte[] previous = txn.getForUpdate(txnReadOpts, key, true);
            if (previous != null) {
                deleteIndexEntry(txn, jobId, previous);
            }

            txn.put(key, codec.encode(record));
            OptionalLong scheduleTime = record.getScheduleTime();
            if (scheduleTime.isPresent()) {
                txn.put(indexKey(scheduleTime.getAsLong(), jobId), EMPTY);
            }
            txn.commit();
        } catch (RocksDBException e) {
            throw new PersistenceException("Failed to store job " + jobId, e);
        }
    }

    @Override
    public synchronized List<JobRecord> getAll() throws PersistenceException {
        ensureOpen();
        List<JobRecord> records = new ArrayList<>();

        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seek(RECORD_PREFIX);

            while (iter.isValid() && startsWith(iter.key(), RECORD_PREFIX)) {
                try {
                    records.add(codec.decode(iter.value()));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping undecodable record {}: {}",
                            new String(iter.key(), UTF_8), e.getMessage());
                }
                iter.next();
            }
        }

        return records;
    }

    @Override
    public synchronized List<JobRecord> getDue(long uptoInstant) throws PersistenceException {
        ensureOpen();
        List<JobRecord> due = new ArrayList<>();

        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seek(INDEX_PREFIX);

            while (iter.isValid() && startsWith(iter.key(), INDEX_PREFIX)) {
                byte[] key = iter.key();
                long scheduleTime = indexTime(key);

                // Index is time-ordered, nothing after this point is due
                if (scheduleTime > uptoInstant) {
                    break;
                }

                String jobId = indexJobId(key);
                byte[] value = transactionDB.get(recordKey(jobId));
                if (value != null) {
                    try {
                        JobRecord record = codec.decode(value);
                        OptionalLong recordTime = record.getScheduleTime();
                        if (recordTime.isPresent() && recordTime.getAsLong() == scheduleTime) {
                            due.add(record);
                        }
                    } catch (IllegalArgumentException e) {
                        log.warn("Skipping undecodable record for job {}: {}", jobId, e.getMessage());
                    }
                }

                iter.next();
            }
        } catch (RocksDBException e) {
            throw new PersistenceException("Failed to read due jobs", e);
        }

        return due;
    }

    @Override
    public synchronized void updateFields(String jobId, Map<String, String> fields) throws PersistenceException {
        ensureOpen();
        byte[] key = recordKey(jobId);

        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
            byte[] value = txn.getForUpdate(txnReadOpts, key, true);

            if (value == null) {
                throw new PersistenceException("No stored record for job " + jobId);
            }

            JobRecord record = decodeStored(jobId, value);
            OptionalLong oldTime = record.getScheduleTime();
            record.merge(fields);
            OptionalLong newTime = record.getScheduleTime();

            if (!oldTime.equals(newTime)) {
                if (oldTime.isPresent()) {
                    txn.delete(indexKey(oldTime.getAsLong(), jobId));
                }
                if (newTime.isPresent()) {
                    txn.put(indexKey(newTime.getAsLong(), jobId), EMPTY);
                }
            }

            txn.put(key, codec.encode(record));
            txn.commit();
        } catch (RocksDBException e) {
            throw new PersistenceException("Failed to update job " + jobId, e);
        }
    }

    @Override
    public synchronized void delete(String jobId) throws PersistenceException {
        ensureOpen();
        byte[] key = recordKey(jobId);

        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
            byte[] value = txn.getForUpdate(txnReadOpts, key, true);

            if (value != null) {
                deleteIndexEntry(txn, jobId, value);
                txn.delete(key);
            }
            txn.commit();
        } catch (RocksDBException e) {
            throw new PersistenceException("Failed to delete job " + jobId, e);
        }
    }

    @Override
    public synchronized void close() {
        if (scanReadOpts != null) {
            scanReadOpts.close();
            scanReadOpts = null;
        }
        if (txnReadOpts != null) {
            txnReadOpts.close();
            txnReadOpts = null;
        }
        if (txnOpts != null) {
            txnOpts.close();
            txnOpts = null;
        }
        if (writeOpts != null) {
            writeOpts.close();
            writeOpts = null;
        }
        if (transactionDB != null) {
            transactionDB.close();
            transactionDB = null;
            log.info("Closed job mirror at {}", config.getDataDirectory());
        }
        closeOptions();
    }

    private void closeOptions() {
        // BlockBasedTableConfig has no close(); it goes with Options
        if (dbOptions != null) {
            dbOptions.close();
            dbOptions = null;
        }
        if (blockCache != null) {
            blockCache.close();
            blockCache = null;
        }
        if (bloomFilter != null) {
            bloomFilter.close();
            bloomFilter = null;
        }
    }

    private void ensureOpen() throws PersistenceException {
        if (transactionDB == null) {
            throw new PersistenceException("Job mirror is not open");
        }
    }

    private JobRecord decodeStored(String jobId, byte[] value) throws PersistenceException {
        try {
            return codec.decode(value);
        } catch (IllegalArgumentException e) {
            throw new PersistenceException("Stored record for job " + jobId + " is corrupt", e);
        }
    }

    private void deleteIndexEntry(Transaction txn, String jobId, byte[] storedValue) throws RocksDBException {
        try {
            OptionalLong scheduleTime = codec.decode(storedValue).getScheduleTime();
            if (scheduleTime.isPresent()) {
                txn.delete(indexKey(scheduleTime.getAsLong(), jobId));
            }
        } catch (IllegalArgumentException e) {
            // A stale entry is harmless: getDue checks the record's own time
            log.warn("Previous record for job {} is corrupt, its index entry is left behind", jobId);
        }
    }

    static byte[] recordKey(String jobId) {
        byte[] id = jobId.getBytes(UTF_8);
        return ByteBuffer.allocate(RECORD_PREFIX.length + id.length)
                .put(RECORD_PREFIX)
                .put(id)
                .array();
    }

    /**
     * Create index key for a job.
     * Format: [prefix][scheduleTime(8 bytes)][jobId bytes]
     * The sign bit is flipped so the bytewise order matches numeric order.
     */
    static byte[] indexKey(long scheduleTime, String jobId) {
        byte[] id = jobId.getBytes(UTF_8);
        return ByteBuffer.allocate(INDEX_PREFIX.length + 8 + id.length)
                .put(INDEX_PREFIX)
                .putLong(scheduleTime ^ Long.MIN_VALUE)
                .put(id)
                .array();
    }

    private static long indexTime(byte[] key) {
        return ByteBuffer.wrap(key, INDEX_PREFIX.length, 8).getLong() ^ Long.MIN_VALUE;
    }

    private static String indexJobId(byte[] key) {
        int offset = INDEX_PREFIX.length + 8;
        return new String(key, offset, key.length - offset, UTF_8);
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        return key.length >= prefix.length
                && Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }
}
