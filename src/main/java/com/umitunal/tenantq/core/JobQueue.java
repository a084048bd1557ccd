package com.umitunal.tenantq.core;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Durable FIFO channel of job ids shared by competing consumers.
 *
 * Values may repeat: a retried job is pushed again at the tail.
 */
public interface JobQueue extends AutoCloseable {

    /**
     * Append an id at the tail. Never blocks.
     */
    void enqueue(String jobId) throws StorageException;

    /**
     * Append several ids at the tail, in order, as one write.
     */
    void enqueueAll(Collection<String> jobIds) throws StorageException;

    /**
     * Remove and return the head of the queue, waiting up to {@code timeout}
     * for an entry to arrive. Concurrent callers never receive the same entry.
     *
     * @return the job id, or null if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    String dequeue(Duration timeout) throws StorageException, InterruptedException;

    /**
     * Remove up to {@code max} ids that are immediately available.
     */
    List<String> drain(int max) throws StorageException;

    /**
     * Get the approximate number of entries.
     */
    long length() throws StorageException;

    /**
     * Remove every entry.
     */
    void clear() throws StorageException;

    @Override
    void close();
}
