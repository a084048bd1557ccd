package com.umitunal.tenantq.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.tenantq.config.StorageConfig;
import com.umitunal.tenantq.core.Job;
import com.umitunal.tenantq.core.JobMetrics;
import com.umitunal.tenantq.core.JobPage;
import com.umitunal.tenantq.core.JobStatus;
import com.umitunal.tenantq.core.JobStore;
import com.umitunal.tenantq.core.StorageException;
import com.umitunal.tenantq.core.UpdateResult;
import com.umitunal.tenantq.model.JobRecord;
import com.umitunal.tenantq.serialization.JsonCodec;
import com.umitunal.tenantq.serialization.PayloadCodec;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.OptimisticTransactionDB;
import org.rocksdb.OptimisticTransactionOptions;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Status;
import org.rocksdb.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed implementation of JobStore.
 * Status updates run in optimistic transactions so a conditional claim is atomic
 * across workers.
 */
public class RocksJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);

    private static final int MAX_TXN_ATTEMPTS = 16;
    private static final Comparator<Job> NEWEST_FIRST =
            Comparator.comparingLong(Job::getCreatedAt).reversed().thenComparing(Job::getId);

    private final RocksResources resources;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions columnOptions;
    private final OptimisticTransactionDB transactionDB;
    private final ColumnFamilyHandle jobsColumn;
    private final OptimisticTransactionOptions txnOpts;
    private final PayloadCodec<JsonNode> codec;
    private final Clock clock;
    private final AtomicLong txnRetryCount = new AtomicLong(0);
    private final ReentrantReadWriteLock closeLock = new ReentrantReadWriteLock();
    private boolean closed;

    public RocksJobStore(StorageConfig config) throws StorageException {
        this(config, JsonCodec.forPayloads(), Clock.systemUTC());
    }

    public RocksJobStore(StorageConfig config, PayloadCodec<JsonNode> codec, Clock clock)
            throws StorageException {
        this.codec = codec;
        this.clock = clock;
        this.resources = new RocksResources(config);
        this.dbOptions = new DBOptions(resources.dbOptions());
        this.columnOptions = new ColumnFamilyOptions(resources.dbOptions());

        // Open through the column-family overload; transactional reads need the handle
        List<ColumnFamilyDescriptor> descriptors =
                List.of(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, columnOptions));
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try {
            this.transactionDB = OptimisticTransactionDB.open(
                    dbOptions, config.getDataDirectory(), descriptors, handles);
        } catch (RocksDBException e) {
            columnOptions.close();
            dbOptions.close();
            resources.close();
            throw new StorageException("Failed to open job store at " + config.getDataDirectory(), e);
        }
        this.jobsColumn = handles.get(0);
        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);
        log.info("Job store opened at {}", config.getDataDirectory());
    }

    @Override
    public String create(String tenantId, String type, JsonNode payload) throws StorageException {
        String id = UUID.randomUUID().toString();
        JobRecord record = new JobRecord(id, tenantId, type, payload, clock.millis());

        Lock lock = openLock();
        try {
            transactionDB.put(jobsColumn, resources.writeOptions(), key(id), record.serialize(codec));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to create job for tenant " + tenantId, e);
        } finally {
            lock.unlock();
        }
        log.debug("Created job {} ({}) for tenant {}", id, type, tenantId);
        return id;
    }

    @Override
    public Optional<Job> get(String id) throws StorageException {
        Lock lock = openLock();
        try {
            byte[] value = transactionDB.get(jobsColumn, key(id));
            return value == null ? Optional.empty() : Optional.of(JobRecord.deserialize(value, codec));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to read job " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public UpdateResult updateStatus(String id, JobStatus status, int attemptsDelta, String error)
            throws StorageException {
        return update(id, null, status, attemptsDelta, error);
    }

    @Override
    public UpdateResult updateStatusIf(String id, JobStatus expected, JobStatus status,
                                       int attemptsDelta, String error) throws StorageException {
        if (expected == null) {
            throw new IllegalArgumentException("expected status is required");
        }
        return update(id, expected, status, attemptsDelta, error);
    }

    private UpdateResult update(String id, JobStatus expected, JobStatus status,
                                int attemptsDelta, String error) throws StorageException {
        if (attemptsDelta < 0) {
            throw new IllegalArgumentException("attemptsDelta must not be negative: " + attemptsDelta);
        }
        byte[] key = key(id);

        Lock lock = openLock();
        try {
            for (int attempt = 1; ; attempt++) {
                try (Transaction txn = transactionDB.beginTransaction(resources.writeOptions(), txnOpts);
                     ReadOptions readOpts = new ReadOptions()) {
                    byte[] value = txn.getForUpdate(readOpts, jobsColumn, key, true);
                    if (value == null) {
                        return UpdateResult.NOT_FOUND;
                    }

                    JobRecord record = JobRecord.deserialize(value, codec);
                    if (record.getStatus().isTerminal()
                            || (expected != null && record.getStatus() != expected)) {
                        return UpdateResult.CONFLICT;
                    }

                    record.transition(status, attemptsDelta, error, clock.millis());
                    txn.put(jobsColumn, key, record.serialize(codec));
                    txn.commit();
                    return UpdateResult.UPDATED;
                } catch (RocksDBException e) {
                    if (!isWriteConflict(e) || attempt >= MAX_TXN_ATTEMPTS) {
                        throw new StorageException("Failed to update job " + id, e);
                    }
                    // Another writer touched the key after our snapshot; re-read and retry
                    txnRetryCount.incrementAndGet();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public JobPage list(String tenantId, JobStatus statusFilter, int limit, int offset) throws StorageException {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }

        List<Job> matches = scan(job -> job.getTenantId().equals(tenantId)
                && (statusFilter == null || job.getStatus() == statusFilter));
        matches.sort(NEWEST_FIRST);

        int from = Math.min(offset, matches.size());
        int to = Math.min(from + limit, matches.size());
        return new JobPage(matches.subList(from, to), matches.size());
    }

    @Override
    public List<Job> findByStatusOlderThan(JobStatus status, long cutoffMillis) throws StorageException {
        return scan(job -> job.getStatus() == status && job.getUpdatedAt() < cutoffMillis);
    }

    @Override
    public JobMetrics getMetrics() throws StorageException {
        long total = 0;
        long pending = 0;
        long running = 0;
        long completed = 0;
        long failed = 0;

        for (Job job : scan(job -> true)) {
            total++;
            switch (job.getStatus()) {
                case PENDING -> pending++;
                case RUNNING -> running++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }

        return new JobMetrics(total, pending, running, completed, failed);
    }

    /**
     * Get the number of transaction retries that occurred.
     * Useful for monitoring contention between workers.
     */
    public long getTransactionRetryCount() {
        return txnRetryCount.get();
    }

    @Override
    public void close() {
        closeLock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            txnOpts.close();
            jobsColumn.close();
            transactionDB.close();
            columnOptions.close();
            dbOptions.close();
            resources.close();
            log.info("Job store closed");
        } finally {
            closeLock.writeLock().unlock();
        }
    }

    private List<Job> scan(Predicate<Job> filter) throws StorageException {
        List<Job> result = new ArrayList<>();

        Lock lock = openLock();
        try (final RocksIterator iter = transactionDB.newIterator(jobsColumn, resources.scanReadOptions())) {
            iter.seekToFirst();
            while (iter.isValid()) {
                JobRecord record = JobRecord.deserialize(iter.value(), codec);
                if (filter.test(record)) {
                    result.add(record);
                }
                iter.next();
            }
            iter.status();
        } catch (RocksDBException e) {
            throw new StorageException("Failed to scan job store", e);
        } finally {
            lock.unlock();
        }
        return result;
    }

    private Lock openLock() throws StorageException {
        Lock lock = closeLock.readLock();
        lock.lock();
        if (closed) {
            lock.unlock();
            throw new StorageException("Job store is closed");
        }
        return lock;
    }

    private static boolean isWriteConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    private static byte[] key(String id) {
        return id.getBytes(UTF_8);
    }
}
