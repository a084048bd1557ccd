package com.umitunal.tenantq.worker.processors;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Small field checks shared by the built-in processors.
 */
final class PayloadRules {

    private PayloadRules() {
    }

    static boolean requireObject(JsonNode payload, List<String> violations) {
        if (payload == null || !payload.isObject()) {
            violations.add("payload must be a JSON object");
            return false;
        }
        return true;
    }

    static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    static void requireText(JsonNode payload, String field, int minLength, int maxLength,
                            List<String> violations) {
        String value = text(payload, field);
        if (value == null) {
            violations.add(field + " is required");
        } else if (value.length() < minLength || value.length() > maxLength) {
            violations.add(field + " must be " + minLength + ".." + maxLength + " characters");
        }
    }

    static void optionalText(JsonNode payload, String field, List<String> violations) {
        JsonNode node = payload.get(field);
        if (node != null && !node.isNull() && !node.isTextual()) {
            violations.add(field + " must be a string");
        }
    }
}
