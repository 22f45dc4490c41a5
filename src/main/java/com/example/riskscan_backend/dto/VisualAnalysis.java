package com.example.riskscan_backend.dto;

import java.util.List;

/** Dominant emotion per sampled face, ordered by time. */
public record VisualAnalysis(List<EmotionEvent> events, int facesSampled) {
    public VisualAnalysis {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
