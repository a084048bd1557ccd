package com.umitunal.tenantq.worker.processors;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.tenantq.worker.JobProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Simulated data processing over a dataset identified by {@code dataId}.
 */
public class DataProcessingProcessor implements JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(DataProcessingProcessor.class);

    private final long workMs;

    public DataProcessingProcessor() {
        this(1000);
    }

    public DataProcessingProcessor(long workMs) {
        this.workMs = workMs;
    }

    @Override
    public ProcessingResult process(JsonNode payload) throws InterruptedException {
        log.info("Processing {} with operation {}",
                PayloadRules.text(payload, "dataId"), PayloadRules.text(payload, "operation"));
        Thread.sleep(workMs);
        return ProcessingResult.success();
    }

    @Override
    public List<String> validate(JsonNode payload) {
        List<String> violations = new ArrayList<>();
        if (!PayloadRules.requireObject(payload, violations)) {
            return violations;
        }
        String dataId = PayloadRules.text(payload, "dataId");
        if (dataId == null || !isUuid(dataId)) {
            violations.add("dataId must be a UUID");
        }
        PayloadRules.requireText(payload, "operation", 1, Integer.MAX_VALUE, violations);
        return violations;
    }

    private static boolean isUuid(String value) {
        try {
            return UUID.fromString(value).toString().equalsIgnoreCase(value);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
