package com.umitunal.tenantq.worker;

import com.umitunal.tenantq.bus.NotificationBus;
import com.umitunal.tenantq.core.Job;
import com.umitunal.tenantq.core.JobQueue;
import com.umitunal.tenantq.core.JobStatus;
import com.umitunal.tenantq.core.JobStore;
import com.umitunal.tenantq.core.StorageException;
import com.umitunal.tenantq.core.UpdateEvent;
import com.umitunal.tenantq.core.UpdateResult;
import com.umitunal.tenantq.worker.JobProcessor.ProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Drives one dequeued job id through its state machine.
 *
 * <pre>
 * PENDING -> RUNNING -> COMPLETED
 *                    -> PENDING  (retryable failure, re-enqueued at the tail)
 *                    -> FAILED   (attempt budget used up)
 * PENDING -> FAILED              (attempts already at the ceiling)
 * </pre>
 *
 * Every transition publishes one update, including the return to PENDING,
 * which carries the failure message.
 */
public class JobLifecycle {
    private static final Logger log = LoggerFactory.getLogger(JobLifecycle.class);

    public static final String MAX_ATTEMPTS_EXCEEDED = "max attempts exceeded";
    static final String DEFAULT_FAILURE = "Job processing failed";

    /**
     * What happened to a dequeued id.
     */
    public enum Outcome {
        /**
         * Missing, not PENDING, or claimed by someone else; or the attempt ran but
         * the job left RUNNING underneath it, so its result was not recorded.
         */
        SKIPPED,
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED
    }

    private final JobStore store;
    private final JobQueue queue;
    private final NotificationBus bus;
    private final ProcessorRegistry processors;
    private final int maxAttempts;

    public JobLifecycle(JobStore store, JobQueue queue, NotificationBus bus,
                        ProcessorRegistry processors, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.store = store;
        this.queue = queue;
        this.bus = bus;
        this.processors = processors;
        this.maxAttempts = maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Run one attempt for the job, or settle it without running.
     *
     * @throws StorageException if the store or the queue fails mid-way; the job
     *         may then be left RUNNING until reconciled
     */
    public Outcome process(String jobId) throws StorageException {
        Optional<Job> found = store.get(jobId);
        if (found.isEmpty()) {
            log.warn("Job {} not found, skipping", jobId);
            return Outcome.SKIPPED;
        }

        Job job = found.get();
        if (job.getStatus() != JobStatus.PENDING) {
            // Duplicate or late delivery
            log.debug("Job {} is {}, skipping", jobId, job.getStatus());
            return Outcome.SKIPPED;
        }

        if (job.getAttempts() >= maxAttempts) {
            UpdateResult result = store.updateStatusIf(jobId, JobStatus.PENDING, JobStatus.FAILED,
                    0, MAX_ATTEMPTS_EXCEEDED);
            if (result != UpdateResult.UPDATED) {
                return Outcome.SKIPPED;
            }
            log.info("Job {} -> FAILED ({} attempts used)", jobId, job.getAttempts());
            publish(job, JobStatus.FAILED, MAX_ATTEMPTS_EXCEEDED);
            return Outcome.FAILED;
        }

        UpdateResult claim = store.updateStatusIf(jobId, JobStatus.PENDING, JobStatus.RUNNING,
                1, job.getError());
        if (claim != UpdateResult.UPDATED) {
            log.debug("Job {} claim lost ({})", jobId, claim);
            return Outcome.SKIPPED;
        }

        int attempt = job.getAttempts() + 1;
        log.info("Job {} -> RUNNING (attempt {}/{})", jobId, attempt, maxAttempts);
        publish(job, JobStatus.RUNNING, null);

        ProcessingResult result = processors.process(job.getType(), job.getPayload());

        if (result.isSuccess()) {
            if (!settle(job, JobStatus.COMPLETED, null)) {
                return Outcome.SKIPPED;
            }
            log.info("Job {} -> COMPLETED", jobId);
            return Outcome.COMPLETED;
        }

        String error = result.getMessage() != null ? result.getMessage() : DEFAULT_FAILURE;
        log.warn("Job {} attempt {}/{} failed: {}", jobId, attempt, maxAttempts, error);

        if (attempt >= maxAttempts) {
            if (!settle(job, JobStatus.FAILED, error)) {
                return Outcome.SKIPPED;
            }
            log.info("Job {} -> FAILED", jobId);
            return Outcome.FAILED;
        }

        if (!settle(job, JobStatus.PENDING, error)) {
            return Outcome.SKIPPED;
        }
        // Publish before the id is visible again, so RUNNING of the next attempt follows
        queue.enqueue(jobId);
        log.info("Job {} requeued for retry ({}/{})", jobId, attempt, maxAttempts);
        return Outcome.RETRY_SCHEDULED;
    }

    /**
     * Leave RUNNING. Publishes only if the store accepted the change.
     */
    private boolean settle(Job job, JobStatus status, String error) throws StorageException {
        UpdateResult result = store.updateStatusIf(job.getId(), JobStatus.RUNNING, status, 0, error);
        if (result != UpdateResult.UPDATED) {
            log.warn("Job {} could not move RUNNING -> {}: {}", job.getId(), status, result);
            return false;
        }
        publish(job, status, error);
        return true;
    }

    private void publish(Job job, JobStatus status, String error) {
        try {
            bus.publish(UpdateEvent.of(job, status, error));
        } catch (RuntimeException e) {
            log.warn("Publishing {} for job {} failed", status, job.getId(), e);
        }
    }
}
