package com.example.riskscan_backend.util;

/**
 * Reason codes exposed on a failed analysis request.
 */
public enum FailureReason {
    INVALID_FORMAT("The uploaded file is not a supported video."),
    TOO_LARGE("The uploaded video exceeds the size or duration limit."),
    EXTRACTION_FAILURE("The audio track could not be extracted from the video."),
    VISUAL_FAILED("Visual emotion analysis failed permanently."),
    SPEECH_FAILED("Speech transcription failed permanently."),
    SENTIMENT_FAILED("Sentiment analysis failed permanently."),
    SCHEMA_ERROR("The reasoning step did not return a valid assessment."),
    REASONING_FAILED("The reasoning step rejected the request."),
    RESOURCE_EXHAUSTED("Retry or time budget exhausted."),
    INTERNAL_ERROR("Unexpected processing error.");

    private final String defaultMessage;

    FailureReason(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
