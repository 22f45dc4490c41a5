package com.example.riskscan_backend.exception;

/**
 * Provider failure worth retrying: throttling, 5xx, timeouts, dropped connections.
 */
public class TransientServiceException extends ServiceException {
    public TransientServiceException(String provider, String message) {
        super(provider, message, null);
    }

    public TransientServiceException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
