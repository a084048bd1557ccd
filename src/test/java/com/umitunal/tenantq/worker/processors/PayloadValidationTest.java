package com.umitunal.tenantq.worker.processors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.tenantq.worker.JobProcessor.ProcessingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class PayloadValidationTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should accept a sleep within bounds and reject others")
    void testSleepValidation() {
        SleepProcessor processor = new SleepProcessor();

        assertThat(processor.validate(mapper.createObjectNode().put("delayMs", 100))).isEmpty();
        assertThat(processor.validate(mapper.createObjectNode().put("delayMs", 0))).isEmpty();
        assertThat(processor.validate(mapper.createObjectNode().put("delayMs", 60_001)))
                .containsExactly("delayMs must be 0..60000");
        assertThat(processor.validate(mapper.createObjectNode().put("delayMs", -1)))
                .containsExactly("delayMs must be 0..60000");
        assertThat(processor.validate(mapper.createObjectNode().put("delayMs", "soon")))
                .containsExactly("delayMs must be an integer");
        assertThat(processor.validate(mapper.createObjectNode()))
                .containsExactly("delayMs must be an integer");
        assertThat(processor.validate(mapper.createArrayNode()))
                .containsExactly("payload must be a JSON object");
    }

    @Test
    @DisplayName("Should complete a short sleep")
    void testSleepProcess() throws Exception {
        ProcessingResult result = new SleepProcessor().process(mapper.createObjectNode().put("delayMs", 10));

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Should validate email recipients and subjects")
    void testEmailValidation() {
        // Given
        EmailProcessor processor = new EmailProcessor(0, 0.0, new Random(1));
        ObjectNode valid = mapper.createObjectNode().put("to", "user@example.com").put("subject", "Hi");

        // Then
        assertThat(processor.validate(valid)).isEmpty();
        assertThat(processor.validate(valid.deepCopy().put("to", "not-an-address")))
                .containsExactly("to must be an email address");
        assertThat(processor.validate(valid.deepCopy().put("subject", "x".repeat(201))))
                .containsExactly("subject must be 1..200 characters");
        assertThat(processor.validate(valid.deepCopy().put("body", 5)))
                .containsExactly("body must be a string");
        assertThat(processor.validate(mapper.createObjectNode()))
                .containsExactly("to must be an email address", "subject is required");
    }

    @Test
    @DisplayName("Should fail every send when the failure rate is one")
    void testEmailSimulatedFailure() throws Exception {
        // Given
        ObjectNode payload = mapper.createObjectNode().put("to", "user@example.com").put("subject", "Hi");

        // When
        ProcessingResult failing = new EmailProcessor(0, 1.0, new Random(1)).process(payload);
        ProcessingResult passing = new EmailProcessor(0, 0.0, new Random(1)).process(payload);

        // Then
        assertThat(failing.isSuccess()).isFalse();
        assertThat(failing.getMessage()).isEqualTo("SMTP connection failed");
        assertThat(passing.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Should fail roughly one send in ten at the default failure rate")
    void testEmailDefaultFailureRate() throws Exception {
        // Given
        ObjectNode payload = mapper.createObjectNode().put("to", "user@example.com").put("subject", "Hi");
        EmailProcessor processor = new EmailProcessor(0, EmailProcessor.DEFAULT_FAILURE_RATE, new Random(42));

        // When
        int failures = 0;
        for (int i = 0; i < 1_000; i++) {
            if (!processor.process(payload).isSuccess()) {
                failures++;
            }
        }

        // Then
        assertThat(new EmailProcessor().getFailureRate()).isEqualTo(0.1);
        assertThat(failures).isBetween(50, 150);
    }

    @Test
    @DisplayName("Should require a UUID data id and an operation")
    void testDataProcessingValidation() {
        DataProcessingProcessor processor = new DataProcessingProcessor(0);

        assertThat(processor.validate(mapper.createObjectNode()
                .put("dataId", "3f2b8c1e-6a4d-4f7e-9b21-0c5d7e8a9f10")
                .put("operation", "aggregate"))).isEmpty();
        assertThat(processor.validate(mapper.createObjectNode()
                .put("dataId", "12345")
                .put("operation", "aggregate"))).containsExactly("dataId must be a UUID");
        assertThat(processor.validate(mapper.createObjectNode()
                .put("dataId", "3f2b8c1e-6a4d-4f7e-9b21-0c5d7e8a9f10")))
                .containsExactly("operation is required");
    }
}
