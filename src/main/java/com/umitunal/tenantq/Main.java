package com.umitunal.tenantq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.tenantq.bus.InMemoryNotificationBus;
import com.umitunal.tenantq.config.AppConfig;
import com.umitunal.tenantq.config.WorkerConfig;
import com.umitunal.tenantq.core.JobQueue;
import com.umitunal.tenantq.fanout.FanoutDispatcher;
import com.umitunal.tenantq.fanout.LiveConnection;
import com.umitunal.tenantq.fanout.SessionHandler;
import com.umitunal.tenantq.fanout.SubscriptionRegistry;
import com.umitunal.tenantq.protocol.MessageCodec;
import com.umitunal.tenantq.serialization.JsonCodec;
import com.umitunal.tenantq.service.JobService;
import com.umitunal.tenantq.storage.RocksJobQueue;
import com.umitunal.tenantq.storage.RocksJobStore;
import com.umitunal.tenantq.worker.JobLifecycle;
import com.umitunal.tenantq.worker.ProcessorRegistry;
import com.umitunal.tenantq.worker.StaleJobSweeper;
import com.umitunal.tenantq.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs the queue with an in-process worker pool and a console subscriber,
 * then submits a few demo jobs for one tenant.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        AppConfig config = AppConfig.load();
        WorkerConfig workerConfig = config.getWorkerConfig();
        log.info("Starting with {}", workerConfig);

        RocksJobStore store = new RocksJobStore(config.getStorageConfig().forSubdirectory("jobs"));
        JobQueue queue = new RocksJobQueue(config.getStorageConfig().forSubdirectory("queue"));
        InMemoryNotificationBus bus = new InMemoryNotificationBus(config.getBusBufferSize(), 256);

        MessageCodec codec = new MessageCodec();
        SubscriptionRegistry registry = new SubscriptionRegistry();
        new FanoutDispatcher(registry, codec).attach(bus);
        SessionHandler sessions = new SessionHandler(registry, codec);

        ProcessorRegistry processors = ProcessorRegistry.withDefaults();
        JobLifecycle lifecycle = new JobLifecycle(store, queue, bus, processors, workerConfig.getMaxAttempts());
        WorkerPool pool = new WorkerPool(queue, lifecycle, workerConfig);
        JobService service = new JobService(store, queue, processors);

        // Jobs left RUNNING by a previous crash
        int recovered = new StaleJobSweeper(store, queue, bus).sweep(Duration.ofMinutes(5));
        if (recovered > 0) {
            log.info("Recovered {} jobs from a previous run", recovered);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            pool.stop();
            bus.close();
            queue.close();
            store.close();
        }, "tenantq-shutdown"));

        LiveConnection console = new ConsoleConnection("console-1");
        sessions.onOpen(console);
        sessions.onMessage(console, "{\"type\":\"SUBSCRIBE\",\"tenantId\":\"demo\"}");

        pool.start();

        ObjectMapper mapper = JsonCodec.createDefaultMapper();
        ObjectNode sleep = mapper.createObjectNode().put("delayMs", 200);
        ObjectNode email = mapper.createObjectNode()
                .put("to", "ops@example.com")
                .put("subject", "Nightly report");
        ObjectNode data = mapper.createObjectNode()
                .put("dataId", "3f2b8c1e-6a4d-4f7e-9b21-0c5d7e8a9f10")
                .put("operation", "aggregate");

        service.submit("demo", ProcessorRegistry.SLEEP, sleep);
        service.submit("demo", ProcessorRegistry.EMAIL, email);
        service.submit("demo", ProcessorRegistry.DATA_PROCESSING, data);

        long deadline = System.currentTimeMillis() + 15_000;
        while (pool.getCompletedCount() + pool.getFailedCount() < 3
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(100);
        }
        log.info("Demo finished: completed={}, failed={}, retried={}, metrics={}",
                pool.getCompletedCount(), pool.getFailedCount(), pool.getRetriedCount(), store.getMetrics());
        log.info("Store transaction retries={}, bus delivered={}, dropped={}, pending={}",
                store.getTransactionRetryCount(), bus.getDeliveredCount(), bus.getDroppedCount(),
                bus.getPendingCount());
        sessions.onClose(console);
    }

    private static final class ConsoleConnection implements LiveConnection {
        private final String id;

        ConsoleConnection(String id) {
            this.id = id;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public void send(String message) {
            System.out.println("[" + id + "] " + message);
        }

        @Override
        public boolean isOpen() {
            return true;
        }
    }
}
