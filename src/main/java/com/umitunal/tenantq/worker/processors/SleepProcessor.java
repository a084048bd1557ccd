package com.umitunal.tenantq.worker.processors;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.tenantq.worker.JobProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Waits for {@code delayMs} milliseconds. Useful for testing the pipeline.
 */
public class SleepProcessor implements JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(SleepProcessor.class);

    static final long MAX_DELAY_MS = 60_000;

    @Override
    public ProcessingResult process(JsonNode payload) throws InterruptedException {
        long delayMs = payload.path("delayMs").asLong(0);
        log.debug("Sleeping for {}ms", delayMs);
        Thread.sleep(delayMs);
        return ProcessingResult.success();
    }

    @Override
    public List<String> validate(JsonNode payload) {
        List<String> violations = new ArrayList<>();
        if (!PayloadRules.requireObject(payload, violations)) {
            return violations;
        }
        JsonNode delay = payload.get("delayMs");
        if (delay == null || !delay.canConvertToLong() || !delay.isIntegralNumber()) {
            violations.add("delayMs must be an integer");
        } else if (delay.asLong() < 0 || delay.asLong() > MAX_DELAY_MS) {
            violations.add("delayMs must be 0.." + MAX_DELAY_MS);
        }
        return violations;
    }
}
