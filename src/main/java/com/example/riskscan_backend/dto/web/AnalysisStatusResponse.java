package com.example.riskscan_backend.dto.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * {@code report} is only present once the analysis completed; a failed analysis carries the
 * reason and message and never a score.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisStatusResponse(UUID id,
                                     String state,
                                     Instant createdAt,
                                     Instant updatedAt,
                                     Instant completedAt,
                                     String language,
                                     Long durationMs,
                                     String failureReason,
                                     String failureMessage,
                                     List<String> missingModalities,
                                     List<ModalityStatusResponse> modalities,
                                     JsonNode report) {}
