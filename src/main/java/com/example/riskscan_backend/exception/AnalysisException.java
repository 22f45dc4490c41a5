package com.example.riskscan_backend.exception;

import com.example.riskscan_backend.util.FailureReason;

/**
 * Base class for failures that end up as a reason code on an analysis request.
 */
public class AnalysisException extends RuntimeException {
    private final FailureReason reason;

    public AnalysisException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AnalysisException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
