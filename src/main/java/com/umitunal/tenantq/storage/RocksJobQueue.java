package com.umitunal.tenantq.storage;

import com.umitunal.tenantq.config.StorageConfig;
import com.umitunal.tenantq.core.JobQueue;
import com.umitunal.tenantq.core.StorageException;
import com.umitunal.tenantq.serialization.PayloadCodec;
import com.umitunal.tenantq.serialization.JobIdCodec;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * RocksDB-backed implementation of JobQueue.
 *
 * Keys are an 8-byte big-endian sequence number, so RocksDB's key order is the
 * FIFO order. Sequence assignment, writes and pops all happen under one lock:
 * each entry is handed to exactly one consumer, and waiting consumers are
 * woken on enqueue.
 */
public class RocksJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(RocksJobQueue.class);

    private final RocksResources resources;
    private final RocksDB database;
    private final PayloadCodec<String> codec;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private long nextSequence;
    private long size;
    private boolean closed;

    public RocksJobQueue(StorageConfig config) throws StorageException {
        this(config, new JobIdCodec());
    }

    public RocksJobQueue(StorageConfig config, PayloadCodec<String> codec) throws StorageException {
        this.codec = codec;
        this.resources = new RocksResources(config);
        try {
            this.database = RocksDB.open(resources.dbOptions(), config.getDataDirectory());
        } catch (RocksDBException e) {
            resources.close();
            throw new StorageException("Failed to open queue at " + config.getDataDirectory(), e);
        }
        recoverState();
        log.info("Queue opened at {} with {} pending entries", config.getDataDirectory(), size);
    }

    @Override
    public void enqueue(String jobId) throws StorageException {
        lock.lock();
        try {
            ensureOpen();
            byte[] key = sequenceKey(nextSequence);
            database.put(resources.writeOptions(), key, codec.encode(jobId));
            nextSequence++;
            size++;
            notEmpty.signal();
        } catch (RocksDBException e) {
            throw new StorageException("Failed to enqueue job " + jobId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void enqueueAll(Collection<String> jobIds) throws StorageException {
        if (jobIds.isEmpty()) {
            return;
        }

        lock.lock();
        try (final WriteBatch batch = new WriteBatch()) {
            ensureOpen();
            long sequence = nextSequence;
            for (String jobId : jobIds) {
                batch.put(sequenceKey(sequence++), codec.encode(jobId));
            }
            database.write(resources.writeOptions(), batch);
            nextSequence = sequence;
            size += jobIds.size();
            notEmpty.signalAll();
        } catch (RocksDBException e) {
            throw new StorageException("Failed to enqueue " + jobIds.size() + " jobs", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String dequeue(Duration timeout) throws StorageException, InterruptedException {
        long remaining = timeout.toNanos();

        lock.lockInterruptibly();
        try {
            while (true) {
                ensureOpen();
                String jobId = popHead();
                if (jobId != null) {
                    return jobId;
                }
                if (remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> drain(int max) throws StorageException {
        List<String> drained = new ArrayList<>();

        lock.lock();
        try {
            ensureOpen();
            while (drained.size() < max) {
                String jobId = popHead();
                if (jobId == null) {
                    break;
                }
                drained.add(jobId);
            }
        } finally {
            lock.unlock();
        }
        return drained;
    }

    @Override
    public long length() throws StorageException {
        lock.lock();
        try {
            ensureOpen();
            return size;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() throws StorageException {
        lock.lock();
        try {
            ensureOpen();
            try (final RocksIterator iter = database.newIterator(resources.scanReadOptions());
                 final WriteBatch batch = new WriteBatch()) {

                iter.seekToFirst();
                while (iter.isValid()) {
                    batch.delete(iter.key());
                    iter.next();
                }

                if (batch.count() > 0) {
                    database.write(resources.writeOptions(), batch);
                }
                size = 0;
            }
        } catch (RocksDBException e) {
            throw new StorageException("Failed to clear queue", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            // Blocked consumers wake up and see the closed queue
            notEmpty.signalAll();
            database.close();
            resources.close();
            log.info("Queue closed");
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private String popHead() throws StorageException {
        try (final RocksIterator iter = database.newIterator(resources.scanReadOptions())) {
            iter.seekToFirst();
            if (!iter.isValid()) {
                iter.status();
                return null;
            }
            byte[] key = iter.key();
            String jobId = codec.decode(iter.value());
            database.delete(resources.writeOptions(), key);
            size--;
            return jobId;
        } catch (RocksDBException e) {
            throw new StorageException("Failed to dequeue", e);
        }
    }

    private void recoverState() {
        long count = 0;
        long next = 0;
        try (final RocksIterator iter = database.newIterator(resources.scanReadOptions())) {
            iter.seekToFirst();
            while (iter.isValid()) {
                count++;
                iter.next();
            }
            iter.seekToLast();
            if (iter.isValid()) {
                next = ByteBuffer.wrap(iter.key()).getLong() + 1;
            }
        }
        this.size = count;
        this.nextSequence = next;
    }

    private void ensureOpen() throws StorageException {
        if (closed) {
            throw new StorageException("Queue is closed");
        }
    }

    private static byte[] sequenceKey(long sequence) {
        return ByteBuffer.allocate(Long.BYTES).putLong(sequence).array();
    }
}
