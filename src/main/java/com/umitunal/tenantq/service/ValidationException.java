package com.umitunal.tenantq.service;

import java.util.List;

/**
 * A job submission was rejected before anything was persisted.
 */
public class ValidationException extends RuntimeException {
    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super("Invalid job: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
