package com.example.riskscan_backend.dto;

/**
 * Half-open interval {@code [startMs, endMs)} on the source video timeline.
 */
public record TimeWindow(long startMs, long endMs) {
    public TimeWindow {
        if (startMs < 0 || endMs < startMs) {
            throw new IllegalArgumentException("invalid window [" + startMs + ", " + endMs + ")");
        }
    }

    /** True when the windows overlap or the gap between them is at most {@code gapMs}. */
    public boolean touches(TimeWindow other, long gapMs) {
        return other.startMs <= this.endMs + gapMs && this.startMs <= other.endMs + gapMs;
    }

    public TimeWindow union(TimeWindow other) {
        return new TimeWindow(Math.min(startMs, other.startMs), Math.max(endMs, other.endMs));
    }

    public long durationMs() {
        return endMs - startMs;
    }

    public long midpointMs() {
        return startMs + (endMs - startMs) / 2;
    }
}
