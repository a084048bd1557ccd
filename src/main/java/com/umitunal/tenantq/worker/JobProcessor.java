package com.umitunal.tenantq.worker;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Processing strategy for one job type.
 */
@FunctionalInterface
public interface JobProcessor {

    /**
     * Process a job payload and return the result.
     *
     * @param payload the job payload
     * @return processing result
     * @throws Exception if processing fails; treated as a failed attempt
     */
    ProcessingResult process(JsonNode payload) throws Exception;

    /**
     * Check a payload before the job is accepted.
     *
     * @return human-readable violations, empty if the payload is acceptable
     */
    default List<String> validate(JsonNode payload) {
        return List.of();
    }

    /**
     * Result of job processing.
     */
    class ProcessingResult {
        private final boolean success;
        private final String message;

        private ProcessingResult(boolean success, String message) {
            this.success = success;
            this.message = message;
        }

        public boolean isSuccess() { return success; }
        public String getMessage() { return message; }

        public static ProcessingResult success() {
            return new ProcessingResult(true, null);
        }

        public static ProcessingResult success(String message) {
            return new ProcessingResult(true, message);
        }

        public static ProcessingResult failure(String message) {
            return new ProcessingResult(false, message);
        }

        @Override
        public String toString() {
            return success ? "success" : "failure(" + message + ")";
        }
    }
}
