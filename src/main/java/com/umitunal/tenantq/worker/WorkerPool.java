package com.umitunal.tenantq.worker;

import com.umitunal.tenantq.config.WorkerConfig;
import com.umitunal.tenantq.core.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * A fixed set of independent worker loops sharing one queue.
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final List<QueueWorker> workers;
    private final Duration drainTimeout;

    public WorkerPool(JobQueue queue, JobLifecycle lifecycle, WorkerConfig config) {
        this("worker", queue, lifecycle, config);
    }

    public WorkerPool(String namePrefix, JobQueue queue, JobLifecycle lifecycle, WorkerConfig config) {
        this.drainTimeout = config.getDrainTimeout();
        List<QueueWorker> created = new ArrayList<>();
        for (int i = 1; i <= config.getPoolSize(); i++) {
            created.add(QueueWorker.builder(namePrefix + "-" + i, queue, lifecycle)
                    .withDequeueTimeout(config.getDequeueTimeout())
                    .withErrorBackoff(config.getErrorBackoff())
                    .withDrainTimeout(config.getDrainTimeout())
                    .build());
        }
        this.workers = List.copyOf(created);
    }

    public void start() {
        workers.forEach(QueueWorker::start);
        log.info("Worker pool started with {} workers", workers.size());
    }

    /**
     * Stop taking new jobs and wait for in-flight ones, up to the drain timeout overall.
     *
     * @return true if every worker exited in time
     */
    public boolean stop() {
        workers.forEach(QueueWorker::requestStop);

        long deadline = System.nanoTime() + drainTimeout.toNanos();
        boolean drained = true;
        for (QueueWorker worker : workers) {
            Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            drained &= worker.awaitTermination(remaining);
        }
        log.info("Worker pool stopped: processed={}, completed={}, failed={}, retried={}",
                getProcessedCount(), getCompletedCount(), getFailedCount(), getRetriedCount());
        return drained;
    }

    public List<QueueWorker> getWorkers() { return workers; }

    public long getProcessedCount() {
        return workers.stream().mapToLong(QueueWorker::getProcessedCount).sum();
    }

    public long getCompletedCount() {
        return workers.stream().mapToLong(QueueWorker::getCompletedCount).sum();
    }

    public long getFailedCount() {
        return workers.stream().mapToLong(QueueWorker::getFailedCount).sum();
    }

    public long getRetriedCount() {
        return workers.stream().mapToLong(QueueWorker::getRetriedCount).sum();
    }

    public boolean isRunning() {
        return workers.stream().anyMatch(QueueWorker::isRunning);
    }

    @Override
    public void close() {
        stop();
    }
}
