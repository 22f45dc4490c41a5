package com.example.riskscan_backend.exception;

/**
 * Provider rejected the call in a way a retry cannot fix.
 */
public class PermanentServiceException extends ServiceException {
    public PermanentServiceException(String provider, String message) {
        super(provider, message, null);
    }

    public PermanentServiceException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
