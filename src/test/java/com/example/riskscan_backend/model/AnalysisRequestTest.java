package com.example.riskscan_backend.model;

import com.example.riskscan_backend.util.FailureReason;
import com.example.riskscan_backend.util.Modality;
import com.example.riskscan_backend.util.RequestState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AnalysisRequestTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private AnalysisRequest request() {
        return new AnalysisRequest(UUID.randomUUID(), "s", "a", "clip.mp4", "pt-BR", 60_000L, T0);
    }

    @Test
    void transitionResetsStepBookkeeping() {
        AnalysisRequest r = request();
        r.setStepAttempts(2);
        r.setNextWakeAt(T0.plusSeconds(30));

        r.transitionTo(RequestState.EXTRACTING, T0.plusSeconds(1));

        assertThat(r.getState()).isEqualTo(RequestState.EXTRACTING);
        assertThat(r.getStepAttempts()).isZero();
        assertThat(r.getNextWakeAt()).isNull();
        assertThat(r.getUpdatedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(r.getCompletedAt()).isNull();
    }

    @Test
    void skippingAStateIsRejected() {
        AnalysisRequest r = request();

        assertThrows(IllegalStateException.class, () -> r.transitionTo(RequestState.AGGREGATING, T0));
        assertThat(r.getState()).isEqualTo(RequestState.RECEIVED);
    }

    @Test
    void failureIsTerminalAndFallsBackToDefaultMessage() {
        AnalysisRequest r = request();

        r.fail(FailureReason.SCHEMA_ERROR, null, T0.plusSeconds(5));

        assertThat(r.getState()).isEqualTo(RequestState.FAILED);
        assertThat(r.getFailureMessage()).isEqualTo(FailureReason.SCHEMA_ERROR.defaultMessage());
        assertThat(r.getCompletedAt()).isEqualTo(T0.plusSeconds(5));
        assertThrows(IllegalStateException.class, () -> r.cancel(T0.plusSeconds(6)));
    }

    @Test
    void missingModalitiesAreStoredSorted() {
        AnalysisRequest r = request();

        r.setMissingModalities(List.of(Modality.SENTIMENT, Modality.VISUAL));
        assertThat(r.missingModalityList()).containsExactly(Modality.VISUAL, Modality.SENTIMENT);

        r.setMissingModalities(List.of());
        assertThat(r.missingModalityList()).isEmpty();
    }

    @Test
    void rejectedRequestIsBornFailed() {
        AnalysisRequest r = AnalysisRequest.rejected(UUID.randomUUID(), "clip.avi", null,
                FailureReason.TOO_LARGE, "too long", T0);

        assertThat(r.getState()).isEqualTo(RequestState.FAILED);
        assertThat(r.getFailureReason()).isEqualTo(FailureReason.TOO_LARGE);
        assertThat(r.getSourceRef()).isNull();
        assertThat(r.getCompletedAt()).isEqualTo(T0);
    }
}
