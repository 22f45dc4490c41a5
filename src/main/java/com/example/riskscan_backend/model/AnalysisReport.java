package com.example.riskscan_backend.model;

import com.example.riskscan_backend.util.RiskClassification;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.Immutable;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Final, immutable output of a completed request. {@code content} holds the canonical JSON bytes
 * served to callers.
 */
@Entity
@Immutable
@Table(
        name = "analysis_report",
        uniqueConstraints = @UniqueConstraint(name = "uq_analysis_report_request", columnNames = "request_id")
)
public class AnalysisReport {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "request_id", nullable = false, updatable = false)
    private UUID requestId;

    @Column(name = "score", nullable = false)
    private int score;

    @Enumerated(EnumType.STRING)
    @Column(name = "classification", nullable = false, length = 16)
    private RiskClassification classification;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "content", nullable = false)
    private String content;

    @Column(name = "completed_at", nullable = false)
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    protected AnalysisReport() {}

    public AnalysisReport(UUID id, UUID requestId, int score, RiskClassification classification,
                          String content, Instant completedAt) {
        this.id = id;
        this.requestId = requestId;
        this.score = score;
        this.classification = classification;
        this.content = content;
        this.completedAt = completedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public int getScore() {
        return score;
    }

    public RiskClassification getClassification() {
        return classification;
    }

    public String getContent() {
        return content;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
