package com.umitunal.tenantq.worker;

import com.umitunal.tenantq.bus.NotificationBus;
import com.umitunal.tenantq.core.Job;
import com.umitunal.tenantq.core.JobQueue;
import com.umitunal.tenantq.core.JobStatus;
import com.umitunal.tenantq.core.JobStore;
import com.umitunal.tenantq.core.StorageException;
import com.umitunal.tenantq.core.UpdateEvent;
import com.umitunal.tenantq.core.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Returns jobs stuck in RUNNING by a lost worker to the queue.
 *
 * Operators invoke it explicitly. The threshold must exceed the longest
 * legitimate processing time, or a live job gets processed twice.
 */
public class StaleJobSweeper {
    private static final Logger log = LoggerFactory.getLogger(StaleJobSweeper.class);

    public static final String STALE_ERROR = "stale: worker lost";

    private final JobStore store;
    private final JobQueue queue;
    private final NotificationBus bus;
    private final Clock clock;

    public StaleJobSweeper(JobStore store, JobQueue queue, NotificationBus bus) {
        this(store, queue, bus, Clock.systemUTC());
    }

    public StaleJobSweeper(JobStore store, JobQueue queue, NotificationBus bus, Clock clock) {
        this.store = store;
        this.queue = queue;
        this.bus = bus;
        this.clock = clock;
    }

    /**
     * Reset RUNNING jobs not updated within {@code threshold} to PENDING and re-enqueue them.
     *
     * @return number of jobs recovered
     */
    public int sweep(Duration threshold) throws StorageException {
        long cutoff = clock.millis() - threshold.toMillis();
        int recovered = 0;

        for (Job job : store.findByStatusOlderThan(JobStatus.RUNNING, cutoff)) {
            UpdateResult result = store.updateStatusIf(job.getId(), JobStatus.RUNNING, JobStatus.PENDING,
                    0, STALE_ERROR);
            if (result != UpdateResult.UPDATED) {
                continue;
            }
            bus.publish(UpdateEvent.of(job, JobStatus.PENDING, STALE_ERROR));
            queue.enqueue(job.getId());
            recovered++;
        }

        if (recovered > 0) {
            log.warn("Recovered {} stale RUNNING jobs older than {}", recovered, threshold);
        }
        return recovered;
    }
}
