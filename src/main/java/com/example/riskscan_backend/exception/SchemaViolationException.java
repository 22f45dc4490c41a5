package com.example.riskscan_backend.exception;

import com.example.riskscan_backend.util.FailureReason;

import java.util.List;

/**
 * The reasoning step kept returning output that does not satisfy the assessment schema.
 */
public class SchemaViolationException extends AnalysisException {
    private final List<String> violations;

    public SchemaViolationException(String message, List<String> violations) {
        super(FailureReason.SCHEMA_ERROR, message);
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
