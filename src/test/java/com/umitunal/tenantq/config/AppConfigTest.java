package com.umitunal.tenantq.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class AppConfigTest {

    private static Properties defaults() {
        Properties props = new Properties();
        props.setProperty("TENANTQ_DATA_DIR", "/var/lib/tenantq");
        props.setProperty("MAX_ATTEMPTS", "3");
        props.setProperty("DEQUEUE_TIMEOUT_MS", "5000");
        props.setProperty("WORKER_POOL_SIZE", "2");
        props.setProperty("BUS_BUFFER_SIZE", "1024");
        return props;
    }

    @Test
    @DisplayName("Should read settings from properties")
    void testFromProperties() {
        // When
        AppConfig config = AppConfig.load(defaults(), Map.of());

        // Then
        assertThat(config.getStorageConfig().getDataDirectory()).isEqualTo("/var/lib/tenantq");
        assertThat(config.getStorageConfig().isDurableWrites()).isTrue();
        assertThat(config.getWorkerConfig().getMaxAttempts()).isEqualTo(3);
        assertThat(config.getWorkerConfig().getDequeueTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getWorkerConfig().getPoolSize()).isEqualTo(2);
        assertThat(config.getBusBufferSize()).isEqualTo(1024);
    }

    @Test
    @DisplayName("Should let environment variables override properties")
    void testEnvironmentOverrides() {
        // When
        AppConfig config = AppConfig.load(defaults(), Map.of(
                "MAX_ATTEMPTS", "5",
                "WORKER_POOL_SIZE", " 4 ",
                "DURABLE_WRITES", "false",
                "BUS_BUFFER_SIZE", ""));

        // Then
        assertThat(config.getWorkerConfig().getMaxAttempts()).isEqualTo(5);
        assertThat(config.getWorkerConfig().getPoolSize()).isEqualTo(4);
        assertThat(config.getStorageConfig().isDurableWrites()).isFalse();
        assertThat(config.getBusBufferSize()).isEqualTo(1024);
    }

    @Test
    @DisplayName("Should fall back to built-in defaults when nothing is set")
    void testBuiltInDefaults() {
        AppConfig config = AppConfig.load(new Properties(), Map.of());

        assertThat(config.getStorageConfig().getDataDirectory()).isEqualTo("./data");
        assertThat(config.getWorkerConfig().getMaxAttempts()).isEqualTo(3);
        assertThat(config.getWorkerConfig().getPoolSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should name the setting that is not a number")
    void testInvalidNumber() {
        assertThatThrownBy(() -> AppConfig.load(defaults(), Map.of("MAX_ATTEMPTS", "three")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MAX_ATTEMPTS");
    }

    @Test
    @DisplayName("Should reject a non-positive attempt ceiling")
    void testInvalidMaxAttempts() {
        assertThatThrownBy(() -> AppConfig.load(defaults(), Map.of("MAX_ATTEMPTS", "0")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should root store and queue in separate subdirectories")
    void testSubdirectories() {
        StorageConfig base = AppConfig.load(defaults(), Map.of()).getStorageConfig();

        assertThat(base.forSubdirectory("jobs").getDataDirectory()).endsWith("jobs");
        assertThat(base.forSubdirectory("queue").getDataDirectory()).endsWith("queue");
        assertThat(base.forSubdirectory("queue").isDurableWrites()).isEqualTo(base.isDurableWrites());
    }
}
