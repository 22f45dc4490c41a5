package com.example.riskscan_backend.engine.Interfaces;

import com.example.riskscan_backend.util.Modality;

import java.util.UUID;

/**
 * Uniform submit/poll contract over one external analysis capability.
 */
public interface ModalityAdapter {

    record Input(UUID requestId,
                 String idempotencyKey,
                 String sourceRef,
                 String audioRef,
                 String language,
                 Long durationMs,
                 String speechResultRef) {}

    enum Status { PENDING, SUCCEEDED, FAILED, TIMED_OUT }

    /**
     * @param payload canonical JSON of the modality result, only for SUCCEEDED.
     * @param message provider failure detail, only for FAILED or TIMED_OUT.
     */
    record PollResult(Status status, String payload, String message) {
        public static PollResult pending() {
            return new PollResult(Status.PENDING, null, null);
        }

        public static PollResult succeeded(String payload) {
            return new PollResult(Status.SUCCEEDED, payload, null);
        }

        public static PollResult failed(String message) {
            return new PollResult(Status.FAILED, null, message);
        }

        public static PollResult timedOut(String message) {
            return new PollResult(Status.TIMED_OUT, null, message);
        }
    }

    Modality modality();

    /**
     * Starts external work. Calling it again with the same {@link Input#idempotencyKey()} returns the
     * handle of the existing external job instead of creating a second one.
     *
     * @throws com.example.riskscan_backend.exception.TransientServiceException when a retry may help.
     * @throws com.example.riskscan_backend.exception.PermanentServiceException when the input is rejected.
     */
    String submit(Input input);

    /**
     * Non-blocking status check.
     *
     * @throws com.example.riskscan_backend.exception.TransientServiceException when the status could not be read.
     */
    PollResult poll(String handle);

    /** Best effort; failures are ignored by callers. */
    default void abort(String handle) {}
}
