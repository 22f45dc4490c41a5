package com.example.riskscan_backend.util;

import java.util.List;
import java.util.Locale;

/**
 * One analysis channel. {@code disclosureTerms} are the words a narrative must use to name the
 * modality when it is missing.
 */
public enum Modality {
    VISUAL("visual", List.of("visual", "facial", "face"), FailureReason.VISUAL_FAILED),
    SPEECH("speech", List.of("speech", "transcript", "audio"), FailureReason.SPEECH_FAILED),
    SENTIMENT("sentiment", List.of("sentiment"), FailureReason.SENTIMENT_FAILED);

    private final String key;
    private final List<String> disclosureTerms;
    private final FailureReason failureReason;

    Modality(String key, List<String> disclosureTerms, FailureReason failureReason) {
        this.key = key;
        this.disclosureTerms = disclosureTerms;
        this.failureReason = failureReason;
    }

    /** Lower-case name used in storage keys and idempotency keys. */
    public String key() {
        return key;
    }

    public List<String> disclosureTerms() {
        return disclosureTerms;
    }

    /** Reason recorded on the request when this modality is hard and fails permanently. */
    public FailureReason failureReason() {
        return failureReason;
    }

    public boolean isNamedIn(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return disclosureTerms.stream().anyMatch(lower::contains);
    }
}
