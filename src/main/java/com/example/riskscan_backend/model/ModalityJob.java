package com.example.riskscan_backend.model;

import com.example.riskscan_backend.util.JobState;
import com.example.riskscan_backend.util.Modality;
import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * External work for one modality of one request. {@code handle} is set exactly once per attempt;
 * a job with a handle is polled, never submitted again.
 */
@Entity
@Table(
        name = "modality_job",
        uniqueConstraints = @UniqueConstraint(name = "uq_modality_job_request_modality", columnNames = {"request_id", "modality"}),
        indexes = @Index(name = "idx_modality_job_request", columnList = "request_id")
)
public class ModalityJob {

    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "request_id", nullable = false, updatable = false)
    private UUID requestId;

    @Enumerated(EnumType.STRING)
    @Column(name = "modality", nullable = false, length = 16, updatable = false)
    private Modality modality;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private JobState state = JobState.PENDING;

    @Column(name = "handle", length = 512)
    private String handle;

    @Column(name = "idempotency_key", length = 128)
    private String idempotencyKey;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

    /** Set when retries are used up, which makes FAILED terminal. */
    @Column(name = "exhausted", nullable = false)
    private boolean exhausted = false;

    @Column(name = "submit_claimed_at")
    private Instant submitClaimedAt;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "next_poll_at")
    private Instant nextPollAt;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "result_ref", length = 512)
    private String resultRef;

    @Column(name = "completed_at")
    private Instant completedAt;

    /** Set once the request has aggregated; later polls or aborts ignore the job. */
    @Column(name = "retired_at")
    private Instant retiredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version")
    private Long version;

    protected ModalityJob() {}

    public ModalityJob(UUID requestId, Modality modality, Instant now) {
        this.requestId = requestId;
        this.modality = modality;
        this.createdAt = now;
    }

    public boolean isTerminal() {
        return state == JobState.SUCCEEDED || (state == JobState.FAILED && exhausted);
    }

    public boolean isPermanentlyFailed() {
        return state == JobState.FAILED && exhausted;
    }

    public void transitionTo(JobState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal job transition " + state + " -> " + next + " for " + modality + " of " + requestId);
        }
        this.state = next;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public Modality getModality() {
        return modality;
    }

    public JobState getState() {
        return state;
    }

    public String getHandle() {
        return handle;
    }

    public void setHandle(String handle) {
        this.handle = handle;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public void setIdempotencyKey(String idempotencyKey) {
        this.idempotencyKey = idempotencyKey;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public void setExhausted(boolean exhausted) {
        this.exhausted = exhausted;
    }

    public Instant getSubmitClaimedAt() {
        return submitClaimedAt;
    }

    public void setSubmitClaimedAt(Instant submitClaimedAt) {
        this.submitClaimedAt = submitClaimedAt;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(Instant submittedAt) {
        this.submittedAt = submittedAt;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public void setNextAttemptAt(Instant nextAttemptAt) {
        this.nextAttemptAt = nextAttemptAt;
    }

    public Instant getNextPollAt() {
        return nextPollAt;
    }

    public void setNextPollAt(Instant nextPollAt) {
        this.nextPollAt = nextPollAt;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public String getResultRef() {
        return resultRef;
    }

    public void setResultRef(String resultRef) {
        this.resultRef = resultRef;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Instant getRetiredAt() {
        return retiredAt;
    }

    public void setRetiredAt(Instant retiredAt) {
        this.retiredAt = retiredAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
