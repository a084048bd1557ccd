package com.umitunal.tenantq.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.tenantq.worker.JobProcessor.ProcessingResult;
import com.umitunal.tenantq.worker.processors.DataProcessingProcessor;
import com.umitunal.tenantq.worker.processors.EmailProcessor;
import com.umitunal.tenantq.worker.processors.SleepProcessor;
import com.umitunal.tenantq.worker.processors.WebhookProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatch table from job type name to processor.
 *
 * New types are added by registering a processor; the worker loop does not change.
 */
public class ProcessorRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProcessorRegistry.class);

    public static final String EMAIL = "email";
    public static final String WEBHOOK = "webhook";
    public static final String SLEEP = "sleep";
    public static final String DATA_PROCESSING = "data_processing";

    private final Map<String, JobProcessor> processors = new ConcurrentHashMap<>();

    /**
     * Registry with the built-in email, webhook, sleep and data_processing types.
     */
    public static ProcessorRegistry withDefaults() {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        return new ProcessorRegistry()
                .register(EMAIL, new EmailProcessor())
                .register(WEBHOOK, new WebhookProcessor(client))
                .register(SLEEP, new SleepProcessor())
                .register(DATA_PROCESSING, new DataProcessingProcessor());
    }

    public ProcessorRegistry register(String type, JobProcessor processor) {
        processors.put(type, processor);
        return this;
    }

    public boolean supports(String type) {
        return type != null && processors.containsKey(type);
    }

    public Set<String> types() {
        return Set.copyOf(processors.keySet());
    }

    /**
     * Validate a payload against the type's rules.
     *
     * @throws IllegalArgumentException for an unknown type
     */
    public List<String> validate(String type, JsonNode payload) {
        JobProcessor processor = processors.get(type);
        if (processor == null) {
            throw new IllegalArgumentException("Unknown job type: " + type);
        }
        return processor.validate(payload);
    }

    /**
     * Run the processor for a type. Never throws: an unknown type or an
     * exception raised by the processor becomes a failure result.
     */
    public ProcessingResult process(String type, JsonNode payload) {
        JobProcessor processor = processors.get(type);
        if (processor == null) {
            return ProcessingResult.failure("Unknown job type: " + type);
        }

        try {
            ProcessingResult result = processor.process(payload);
            return result != null ? result : ProcessingResult.failure("Processor returned no result");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProcessingResult.failure("Interrupted");
        } catch (Exception e) {
            log.debug("Processor for {} raised", type, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ProcessingResult.failure(message);
        }
    }
}
