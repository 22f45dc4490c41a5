package com.example.riskscan_backend.dto;

import com.example.riskscan_backend.util.Modality;

/**
 * One merged observation. {@code observations} counts the raw events folded into it and
 * {@code windowId} names the cross-modal window it belongs to.
 */
public record TimelineEntry(String windowId,
                            Modality source,
                            String label,
                            double confidence,
                            TimeWindow window,
                            int observations,
                            String text) {
    public TimelineEntry withWindowId(String id) {
        return new TimelineEntry(id, source, label, confidence, window, observations, text);
    }
}
