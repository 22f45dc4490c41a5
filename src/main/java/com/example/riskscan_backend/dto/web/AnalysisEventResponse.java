package com.example.riskscan_backend.dto.web;

import java.time.Instant;
import java.util.Map;

public record AnalysisEventResponse(Long id, String step, String message, Map<String, Object> details, Instant createdAt) {}
