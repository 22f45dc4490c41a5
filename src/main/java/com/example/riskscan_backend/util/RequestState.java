package com.example.riskscan_backend.util;

/**
 * Lifecycle of an analysis request. The happy path is strictly linear; {@link #FAILED} and
 * {@link #CANCELLED} can be entered from any non-terminal state and are final.
 */
public enum RequestState {
    RECEIVED(0),
    EXTRACTING(1),
    ANALYZING_MODALITIES(2),
    AGGREGATING(3),
    FUSING(4),
    SELECTING_EVIDENCE(5),
    COMPLETED(6),
    FAILED(-1),
    CANCELLED(-1);

    private final int step;

    RequestState(int step) {
        this.step = step;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Returns whether {@code next} is a legal successor of this state.
     *
     * @param next candidate next state.
     * @return {@code true} for the immediate successor on the happy path, or for FAILED/CANCELLED
     * from a non-terminal state.
     */
    public boolean canTransitionTo(RequestState next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return next.step == this.step + 1;
    }
}
