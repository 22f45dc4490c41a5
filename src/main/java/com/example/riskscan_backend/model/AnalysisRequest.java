package com.example.riskscan_backend.model;

import com.example.riskscan_backend.util.FailureReason;
import com.example.riskscan_backend.util.Modality;
import com.example.riskscan_backend.util.RequestState;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * One uploaded video moving through the analysis pipeline. Every orchestration decision is
 * derived from the persisted fields, so a restarted invoker resumes where the last one stopped.
 */
@Entity
@Table(
        name = "analysis_request",
        indexes = {
                @Index(name = "idx_request_state_wake", columnList = "state, next_wake_at")
        }
)
public class AnalysisRequest {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "source_ref", length = 512)
    private String sourceRef;

    @Column(name = "audio_ref", length = 512)
    private String audioRef;

    @Column(name = "original_filename", length = 512)
    private String originalFilename;

    @Column(name = "language", length = 16)
    private String language;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private RequestState state;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 32)
    private FailureReason failureReason;

    @Column(name = "failure_message", length = 2000)
    private String failureMessage;

    // comma separated modality names
    @Column(name = "missing_modalities", length = 64)
    private String missingModalities;

    @Column(name = "timeline_ref", length = 512)
    private String timelineRef;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "assessment_json")
    private String assessmentJson;

    @Column(name = "step_attempts", nullable = false)
    private int stepAttempts = 0;

    @Column(name = "next_wake_at")
    private Instant nextWakeAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    protected AnalysisRequest() {}

    public AnalysisRequest(UUID id, String sourceRef, String audioRef, String originalFilename,
                           String language, Long durationMs, Instant now) {
        this.id = id;
        this.sourceRef = sourceRef;
        this.audioRef = audioRef;
        this.originalFilename = originalFilename;
        this.language = language;
        this.durationMs = durationMs;
        this.state = RequestState.RECEIVED;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /** A request rejected at ingest; it exists only to carry the reason back to the caller. */
    public static AnalysisRequest rejected(UUID id, String originalFilename, String language,
                                           FailureReason reason, String message, Instant now) {
        AnalysisRequest r = new AnalysisRequest(id, null, null, originalFilename, language, null, now);
        r.state = RequestState.FAILED;
        r.failureReason = reason;
        r.failureMessage = message;
        r.completedAt = now;
        return r;
    }

    /**
     * Moves to {@code next} if it is a legal successor.
     *
     * @throws IllegalStateException on an illegal transition.
     */
    public void transitionTo(RequestState next, Instant now) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for request " + id);
        }
        this.state = next;
        this.stepAttempts = 0;
        this.nextWakeAt = null;
        this.updatedAt = now;
        if (next.isTerminal()) {
            this.completedAt = now;
        }
    }

    public void fail(FailureReason reason, String message, Instant now) {
        transitionTo(RequestState.FAILED, now);
        this.failureReason = reason;
        this.failureMessage = message != null ? message : reason.defaultMessage();
    }

    public void cancel(Instant now) {
        transitionTo(RequestState.CANCELLED, now);
    }

    public List<Modality> missingModalityList() {
        if (missingModalities == null || missingModalities.isBlank()) {
            return List.of();
        }
        List<Modality> out = new ArrayList<>();
        Arrays.stream(missingModalities.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Modality::valueOf)
                .forEach(out::add);
        return out;
    }

    public void setMissingModalities(Collection<Modality> modalities) {
        this.missingModalities = modalities == null || modalities.isEmpty()
                ? null
                : String.join(",", modalities.stream().sorted().map(Modality::name).toList());
    }

    public UUID getId() {
        return id;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    public String getAudioRef() {
        return audioRef;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public String getLanguage() {
        return language;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public RequestState getState() {
        return state;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public String getTimelineRef() {
        return timelineRef;
    }

    public void setTimelineRef(String timelineRef) {
        this.timelineRef = timelineRef;
    }

    public String getAssessmentJson() {
        return assessmentJson;
    }

    public void setAssessmentJson(String assessmentJson) {
        this.assessmentJson = assessmentJson;
    }

    public int getStepAttempts() {
        return stepAttempts;
    }

    public void setStepAttempts(int stepAttempts) {
        this.stepAttempts = stepAttempts;
    }

    public Instant getNextWakeAt() {
        return nextWakeAt;
    }

    public void setNextWakeAt(Instant nextWakeAt) {
        this.nextWakeAt = nextWakeAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
