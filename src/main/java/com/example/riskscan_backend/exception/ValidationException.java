package com.example.riskscan_backend.exception;

import com.example.riskscan_backend.util.FailureReason;

/**
 * Caller input rejected at ingest. Never retried.
 */
public class ValidationException extends AnalysisException {
    public ValidationException(FailureReason reason, String message) {
        super(reason, message);
    }

    public ValidationException(FailureReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
