package com.umitunal.tenantq.worker.processors;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.tenantq.worker.JobProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Simulated email delivery.
 *
 * A non-zero failure rate makes a share of sends fail with a transient
 * error, which exercises the retry path. One send in ten fails by default.
 */
public class EmailProcessor implements JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(EmailProcessor.class);

    public static final double DEFAULT_FAILURE_RATE = 0.1;

    private static final Pattern ADDRESS = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final long sendDelayMs;
    private final double failureRate;
    private final Random random;

    public EmailProcessor() {
        this(500, DEFAULT_FAILURE_RATE, new Random());
    }

    public EmailProcessor(long sendDelayMs, double failureRate, Random random) {
        this.sendDelayMs = sendDelayMs;
        this.failureRate = failureRate;
        this.random = random;
    }

    @Override
    public ProcessingResult process(JsonNode payload) throws InterruptedException {
        String to = PayloadRules.text(payload, "to");
        String subject = PayloadRules.text(payload, "subject");
        log.info("Sending email to {} ({})", to, subject);

        Thread.sleep(sendDelayMs);

        if (failureRate > 0 && random.nextDouble() < failureRate) {
            return ProcessingResult.failure("SMTP connection failed");
        }
        return ProcessingResult.success();
    }

    public double getFailureRate() {
        return failureRate;
    }

    @Override
    public List<String> validate(JsonNode payload) {
        List<String> violations = new ArrayList<>();
        if (!PayloadRules.requireObject(payload, violations)) {
            return violations;
        }
        String to = PayloadRules.text(payload, "to");
        if (to == null || !ADDRESS.matcher(to).matches()) {
            violations.add("to must be an email address");
        }
        PayloadRules.requireText(payload, "subject", 1, 200, violations);
        PayloadRules.optionalText(payload, "body", violations);
        return violations;
    }
}
