package com.example.riskscan_backend.dto;

import com.example.riskscan_backend.util.Modality;
import com.example.riskscan_backend.util.RiskClassification;

import java.util.List;
import java.util.UUID;

/**
 * Serialized form of a report. {@code completedAt} is ISO-8601 text so the bytes never depend on
 * the JSON date settings.
 */
public record ReportDocument(UUID reportId,
                             UUID requestId,
                             int score,
                             RiskClassification classification,
                             String narrative,
                             List<String> citedWindows,
                             List<EvidenceFrame> evidenceFrames,
                             List<Modality> missingModalities,
                             TimelineSummary summary,
                             String transcript,
                             String disclaimer,
                             String completedAt) {}
