package com.umitunal.tenantq.worker;

import com.umitunal.tenantq.core.JobQueue;
import com.umitunal.tenantq.core.StorageException;
import com.umitunal.tenantq.worker.JobLifecycle.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A worker that blocks on the queue and runs each dequeued job through its lifecycle.
 *
 * Stopping is cooperative: the flag is checked before each dequeue, so an
 * in-flight job always finishes.
 */
public class QueueWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private final String workerId;
    private final JobQueue queue;
    private final JobLifecycle lifecycle;
    private final Duration dequeueTimeout;
    private final Duration errorBackoff;
    private final Duration drainTimeout;
    private final AtomicBoolean running;
    private final AtomicLong processedCount;
    private final AtomicLong completedCount;
    private final AtomicLong failedCount;
    private final AtomicLong retriedCount;
    private final AtomicLong errorCount;

    private Thread workerThread;

    private QueueWorker(Builder builder) {
        this.workerId = builder.workerId;
        this.queue = builder.queue;
        this.lifecycle = builder.lifecycle;
        this.dequeueTimeout = builder.dequeueTimeout;
        this.errorBackoff = builder.errorBackoff;
        this.drainTimeout = builder.drainTimeout;
        this.running = new AtomicBoolean(false);
        this.processedCount = new AtomicLong(0);
        this.completedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
        this.retriedCount = new AtomicLong(0);
        this.errorCount = new AtomicLong(0);
    }

    /**
     * Start the worker in the background.
     * Refused while a previous loop is still draining its last job.
     *
     * @return true if a new loop was started
     */
    public synchronized boolean start() {
        if (workerThread != null && workerThread.isAlive()) {
            if (!running.get()) {
                log.warn("Worker {} is still stopping, not restarting", workerId);
            }
            return false;
        }
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        workerThread = new Thread(this::run, "QueueWorker-" + workerId);
        workerThread.setDaemon(false);
        workerThread.start();
        log.info("Worker {} started", workerId);
        return true;
    }

    /**
     * Ask the loop to exit after the current job. Does not wait.
     */
    public void requestStop() {
        running.set(false);
    }

    /**
     * Stop the worker gracefully, waiting for the in-flight job.
     */
    public void stop() {
        requestStop();
        awaitTermination(drainTimeout);
    }

    /**
     * Wait for the loop thread to exit.
     *
     * @return true if the thread has exited
     */
    public boolean awaitTermination(Duration timeout) {
        Thread thread;
        synchronized (this) {
            thread = workerThread;
        }
        if (thread == null) {
            return true;
        }
        try {
            thread.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Worker {} still busy after {}", workerId, timeout);
            return false;
        }
        return true;
    }

    /**
     * Dequeue and process a single job synchronously.
     *
     * @return false if the queue stayed empty for the dequeue timeout
     */
    public boolean processOne() throws StorageException, InterruptedException {
        String jobId = queue.dequeue(dequeueTimeout);

        if (jobId == null) {
            return false;
        }

        Outcome outcome = lifecycle.process(jobId);
        processedCount.incrementAndGet();
        switch (outcome) {
            case COMPLETED -> completedCount.incrementAndGet();
            case FAILED -> failedCount.incrementAndGet();
            case RETRY_SCHEDULED -> retriedCount.incrementAndGet();
            case SKIPPED -> log.debug("Worker {} skipped {}", workerId, jobId);
        }
        return true;
    }

    private void run() {
        while (running.get()) {
            try {
                processOne();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (StorageException e) {
                errorCount.incrementAndGet();
                log.error("Worker {} storage failure, backing off {}", workerId, errorBackoff, e);
                if (!backOff()) {
                    break;
                }
            } catch (RuntimeException e) {
                // One bad job must not end the loop
                errorCount.incrementAndGet();
                log.error("Worker {} unexpected error", workerId, e);
                if (!backOff()) {
                    break;
                }
            }
        }
        running.set(false);
        log.info("Worker {} stopped after {} jobs", workerId, processedCount.get());
    }

    private boolean backOff() {
        try {
            Thread.sleep(errorBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String getWorkerId() { return workerId; }
    public long getProcessedCount() { return processedCount.get(); }
    public long getCompletedCount() { return completedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public long getRetriedCount() { return retriedCount.get(); }
    public long getErrorCount() { return errorCount.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder(String workerId, JobQueue queue, JobLifecycle lifecycle) {
        return new Builder(workerId, queue, lifecycle);
    }

    public static class Builder {
        private final String workerId;
        private final JobQueue queue;
        private final JobLifecycle lifecycle;
        private Duration dequeueTimeout = Duration.ofSeconds(5);
        private Duration errorBackoff = Duration.ofSeconds(1);
        private Duration drainTimeout = Duration.ofSeconds(30);

        private Builder(String workerId, JobQueue queue, JobLifecycle lifecycle) {
            this.workerId = workerId;
            this.queue = queue;
            this.lifecycle = lifecycle;
        }

        public Builder withDequeueTimeout(Duration timeout) {
            this.dequeueTimeout = timeout;
            return this;
        }

        public Builder withErrorBackoff(Duration backoff) {
            this.errorBackoff = backoff;
            return this;
        }

        public Builder withDrainTimeout(Duration timeout) {
            this.drainTimeout = timeout;
            return this;
        }

        public QueueWorker build() {
            return new QueueWorker(this);
        }
    }
}
