package com.umitunal.tenantq.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.tenantq.core.JobStatus;
import com.umitunal.tenantq.serialization.JsonCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JobRecordSerializerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JobRecordSerializer serializer = new JobRecordSerializer(JsonCodec.forPayloads());

    @Test
    @DisplayName("Should preserve lifecycle fields")
    void testLifecycleFields() {
        // Given
        ObjectNode payload = mapper.createObjectNode().put("to", "a@b.io");
        payload.putObject("nested").put("k", 1);
        JobRecord original = new JobRecord("job-1", "tenant-1", "email", payload, 1000L);
        original.transition(JobStatus.RUNNING, 2, "SMTP connection failed", 2000L);

        // When
        JobRecord restored = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(restored.getId()).isEqualTo("job-1");
        assertThat(restored.getTenantId()).isEqualTo("tenant-1");
        assertThat(restored.getType()).isEqualTo("email");
        assertThat(restored.getPayload()).isEqualTo(payload);
        assertThat(restored.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(restored.getAttempts()).isEqualTo(2);
        assertThat(restored.getError()).isEqualTo("SMTP connection failed");
        assertThat(restored.getCreatedAt()).isEqualTo(1000L);
        assertThat(restored.getUpdatedAt()).isEqualTo(2000L);
    }

    @Test
    @DisplayName("Should tell a null error apart from an empty one")
    void testNullVersusEmptyError() {
        // Given
        JobRecord withNull = new JobRecord("a", "t", "sleep", mapper.createObjectNode(), 1L);
        JobRecord withEmpty = new JobRecord("b", "t", "sleep", mapper.createObjectNode(), 1L);
        withEmpty.transition(JobStatus.PENDING, 0, "", 2L);

        // Then
        assertThat(serializer.deserialize(serializer.serialize(withNull)).getError()).isNull();
        assertThat(serializer.deserialize(serializer.serialize(withEmpty)).getError()).isEmpty();
    }

    @Test
    @DisplayName("Should handle Unicode identifiers and payloads")
    void testUnicode() {
        // Given
        ObjectNode payload = mapper.createObjectNode().put("subject", "Grüße 🚀 日本語");
        JobRecord original = new JobRecord("job-ü", "テナント", "email", payload, 1L);

        // When
        JobRecord restored = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(restored.getId()).isEqualTo("job-ü");
        assertThat(restored.getTenantId()).isEqualTo("テナント");
        assertThat(restored.getPayload().get("subject").asText()).isEqualTo("Grüße 🚀 日本語");
    }

    @Test
    @DisplayName("Should be deterministic")
    void testDeterminism() {
        JobRecord record = new JobRecord("job-2", "t", "sleep", mapper.createObjectNode().put("delayMs", 5), 42L);

        assertThat(serializer.serialize(record)).isEqualTo(serializer.serialize(record));
    }

    @Test
    @DisplayName("Should only allow attempts to grow")
    void testTransitionRejectsNegativeDelta() {
        JobRecord record = new JobRecord("job-3", "t", "sleep", mapper.createObjectNode(), 1L);

        assertThatThrownBy(() -> record.transition(JobStatus.RUNNING, -1, null, 2L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
