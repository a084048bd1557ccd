package com.umitunal.tenantq.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.tenantq.worker.JobProcessor.ProcessingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ProcessorRegistryTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should register the built-in job types")
    void testDefaults() {
        ProcessorRegistry registry = ProcessorRegistry.withDefaults();

        assertThat(registry.types()).containsExactlyInAnyOrder(
                ProcessorRegistry.EMAIL, ProcessorRegistry.WEBHOOK,
                ProcessorRegistry.SLEEP, ProcessorRegistry.DATA_PROCESSING);
        assertThat(registry.supports("sleep")).isTrue();
        assertThat(registry.supports("unknown")).isFalse();
        assertThat(registry.supports(null)).isFalse();
    }

    @Test
    @DisplayName("Should turn an unknown type into a failure result")
    void testUnknownType() {
        ProcessingResult result = new ProcessorRegistry().process("mystery", mapper.createObjectNode());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Unknown job type: mystery");
    }

    @Test
    @DisplayName("Should turn a thrown exception into a failure result")
    void testProcessorThrows() {
        // Given
        ProcessorRegistry registry = new ProcessorRegistry()
                .register("msg", payload -> {
                    throw new IllegalStateException("bad state");
                })
                .register("nomsg", payload -> {
                    throw new UnsupportedOperationException();
                });

        // Then
        assertThat(registry.process("msg", mapper.createObjectNode()).getMessage()).isEqualTo("bad state");
        assertThat(registry.process("nomsg", mapper.createObjectNode()).getMessage())
                .isEqualTo("UnsupportedOperationException");
    }

    @Test
    @DisplayName("Should restore the interrupt flag when a processor is interrupted")
    void testInterrupted() {
        // Given
        ProcessorRegistry registry = new ProcessorRegistry()
                .register("interrupted", payload -> {
                    throw new InterruptedException();
                });

        // When
        ProcessingResult result = registry.process("interrupted", mapper.createObjectNode());

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Interrupted");
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    @DisplayName("Should treat a missing result as a failure")
    void testNullResult() {
        ProcessorRegistry registry = new ProcessorRegistry().register("null", payload -> null);

        assertThat(registry.process("null", mapper.createObjectNode()).isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Should reject validation of an unregistered type")
    void testValidateUnknownType() {
        assertThatThrownBy(() -> new ProcessorRegistry().validate("nope", mapper.createObjectNode()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown job type: nope");
    }
}
