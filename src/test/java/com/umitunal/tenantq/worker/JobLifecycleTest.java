package com.umitunal.tenantq.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.tenantq.config.StorageConfig;
import com.umitunal.tenantq.core.Job;
import com.umitunal.tenantq.core.JobStatus;
import com.umitunal.tenantq.core.UpdateEvent;
import com.umitunal.tenantq.storage.RocksJobQueue;
import com.umitunal.tenantq.storage.RocksJobStore;
import com.umitunal.tenantq.worker.JobLifecycle.Outcome;
import com.umitunal.tenantq.worker.JobProcessor.ProcessingResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class JobLifecycleTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private RocksJobStore store;
    private RocksJobQueue queue;
    private RecordingBus bus;
    private ProcessorRegistry processors;
    private JobLifecycle lifecycle;
    private final AtomicInteger flakyCalls = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        StorageConfig config = StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build();
        store = new RocksJobStore(config.forSubdirectory("jobs"));
        queue = new RocksJobQueue(config.forSubdirectory("queue"));
        bus = new RecordingBus();
        processors = new ProcessorRegistry()
                .register("ok", payload -> ProcessingResult.success())
                .register("fail", payload -> ProcessingResult.failure("boom"))
                .register("throws", payload -> {
                    throw new IllegalStateException("exploded");
                })
                .register("flaky", payload -> flakyCalls.incrementAndGet() < payload.get("succeedOn").asInt()
                        ? ProcessingResult.failure("not yet")
                        : ProcessingResult.success());
        lifecycle = new JobLifecycle(store, queue, bus, processors, 3);
    }

    @AfterEach
    void tearDown() {
        queue.close();
        store.close();
    }

    private String submit(String type, ObjectNode payload) throws Exception {
        String id = store.create("t1", type, payload);
        queue.enqueue(id);
        return id;
    }

    /**
     * Run dequeued ids through the lifecycle until the queue is empty.
     */
    private List<Outcome> runUntilIdle() throws Exception {
        List<Outcome> outcomes = new ArrayList<>();
        String id;
        while ((id = queue.dequeue(Duration.ZERO)) != null) {
            outcomes.add(lifecycle.process(id));
        }
        return outcomes;
    }

    private static List<JobStatus> statuses(List<UpdateEvent> events) {
        List<JobStatus> statuses = new ArrayList<>();
        events.forEach(e -> statuses.add(e.getStatus()));
        return statuses;
    }

    @Test
    @DisplayName("Should complete a successful job in one attempt")
    void testSuccess() throws Exception {
        // Given
        String id = submit("ok", mapper.createObjectNode());

        // When
        List<Outcome> outcomes = runUntilIdle();

        // Then
        assertThat(outcomes).containsExactly(Outcome.COMPLETED);
        Job job = store.get(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getError()).isNull();
        assertThat(statuses(bus.eventsFor(id))).containsExactly(JobStatus.RUNNING, JobStatus.COMPLETED);
        assertThat(bus.events()).allMatch(e -> e.getTenantId().equals("t1"));
    }

    @Test
    @DisplayName("Should retry an always-failing job and fail it at the attempt ceiling")
    void testRetriesThenFails() throws Exception {
        // Given
        String id = submit("fail", mapper.createObjectNode());

        // When
        List<Outcome> outcomes = runUntilIdle();

        // Then
        assertThat(outcomes).containsExactly(Outcome.RETRY_SCHEDULED, Outcome.RETRY_SCHEDULED, Outcome.FAILED);
        Job job = store.get(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getAttempts()).isEqualTo(3);
        assertThat(job.getError()).isEqualTo("boom");

        List<UpdateEvent> events = bus.eventsFor(id);
        assertThat(statuses(events)).containsExactly(
                JobStatus.RUNNING, JobStatus.PENDING,
                JobStatus.RUNNING, JobStatus.PENDING,
                JobStatus.RUNNING, JobStatus.FAILED);
        assertThat(events.get(1).getError()).isEqualTo("boom");
        assertThat(events.get(5).getError()).isEqualTo("boom");
        assertThat(queue.length()).isZero();
    }

    @Test
    @DisplayName("Should complete a job that succeeds on its second attempt")
    void testSucceedsAfterRetry() throws Exception {
        // Given
        String id = submit("flaky", mapper.createObjectNode().put("succeedOn", 2));

        // When
        List<Outcome> outcomes = runUntilIdle();

        // Then
        assertThat(outcomes).containsExactly(Outcome.RETRY_SCHEDULED, Outcome.COMPLETED);
        Job job = store.get(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getAttempts()).isEqualTo(2);
        assertThat(job.getError()).isNull();
        assertThat(statuses(bus.eventsFor(id))).containsExactly(
                JobStatus.RUNNING, JobStatus.PENDING, JobStatus.RUNNING, JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should use the exception message when a processor throws")
    void testProcessorThrows() throws Exception {
        // Given
        String id = submit("throws", mapper.createObjectNode());

        // When
        runUntilIdle();

        // Then
        Job job = store.get(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("exploded");
    }

    @Test
    @DisplayName("Should fail a job whose type has no processor")
    void testUnknownType() throws Exception {
        // Given
        String id = submit("nope", mapper.createObjectNode());

        // When
        runUntilIdle();

        // Then
        Job job = store.get(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getAttempts()).isEqualTo(3);
        assertThat(job.getError()).isEqualTo("Unknown job type: nope");
    }

    @Test
    @DisplayName("Should skip an id that is not in the store")
    void testMissingJob() throws Exception {
        // When
        Outcome outcome = lifecycle.process("missing");

        // Then
        assertThat(outcome).isEqualTo(Outcome.SKIPPED);
        assertThat(bus.events()).isEmpty();
    }

    @Test
    @DisplayName("Should ignore a duplicate delivery of a finished job")
    void testDuplicateOfCompletedJob() throws Exception {
        // Given
        String id = submit("ok", mapper.createObjectNode());
        runUntilIdle();
        int eventsBefore = bus.events().size();

        // When
        Outcome outcome = lifecycle.process(id);

        // Then
        assertThat(outcome).isEqualTo(Outcome.SKIPPED);
        assertThat(bus.events()).hasSize(eventsBefore);
        assertThat(store.get(id).orElseThrow().getAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should ignore an id whose job is already running")
    void testDuplicateOfRunningJob() throws Exception {
        // Given
        String id = store.create("t1", "ok", mapper.createObjectNode());
        store.updateStatus(id, JobStatus.RUNNING, 1, null);

        // When
        Outcome outcome = lifecycle.process(id);

        // Then
        assertThat(outcome).isEqualTo(Outcome.SKIPPED);
        assertThat(store.get(id).orElseThrow().getAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not report a completion the store refused after the job was reset underneath")
    void testSettleLostToReset() throws Exception {
        // Given
        String id = store.create("t1", "reset-then-ok", mapper.createObjectNode());
        processors.register("reset-then-ok", payload -> {
            // The sweeper reclaims the job while this attempt is still running
            store.updateStatusIf(id, JobStatus.RUNNING, JobStatus.PENDING, 0, StaleJobSweeper.STALE_ERROR);
            return ProcessingResult.success();
        });

        // When
        Outcome outcome = lifecycle.process(id);

        // Then
        assertThat(outcome).isEqualTo(Outcome.SKIPPED);
        Job job = store.get(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getError()).isEqualTo(StaleJobSweeper.STALE_ERROR);
        assertThat(statuses(bus.eventsFor(id))).containsExactly(JobStatus.RUNNING);
    }

    @Test
    @DisplayName("Should fail a pending job that already used every attempt")
    void testAttemptsAlreadyExhausted() throws Exception {
        // Given
        String id = store.create("t1", "ok", mapper.createObjectNode());
        store.updateStatus(id, JobStatus.RUNNING, 3, null);
        store.updateStatus(id, JobStatus.PENDING, 0, "stale: worker lost");

        // When
        Outcome outcome = lifecycle.process(id);

        // Then
        assertThat(outcome).isEqualTo(Outcome.FAILED);
        Job job = store.get(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getAttempts()).isEqualTo(3);
        assertThat(job.getError()).isEqualTo(JobLifecycle.MAX_ATTEMPTS_EXCEEDED);
        assertThat(statuses(bus.eventsFor(id))).containsExactly(JobStatus.FAILED);
    }

    @Test
    @DisplayName("Should fail on the first error when only one attempt is allowed")
    void testSingleAttempt() throws Exception {
        // Given
        JobLifecycle strict = new JobLifecycle(store, queue, bus, processors, 1);
        String id = store.create("t1", "fail", mapper.createObjectNode());

        // When
        Outcome outcome = strict.process(id);

        // Then
        assertThat(outcome).isEqualTo(Outcome.FAILED);
        assertThat(queue.length()).isZero();
        assertThat(statuses(bus.eventsFor(id))).containsExactly(JobStatus.RUNNING, JobStatus.FAILED);
    }

    @Test
    @DisplayName("Should reject a non-positive attempt ceiling")
    void testInvalidMaxAttempts() {
        assertThatThrownBy(() -> new JobLifecycle(store, queue, bus, processors, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
