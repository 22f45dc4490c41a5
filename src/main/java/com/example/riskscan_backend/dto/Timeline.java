package com.example.riskscan_backend.dto;

import java.util.List;
import java.util.UUID;

public record Timeline(UUID requestId,
                       long durationMs,
                       List<TimelineEntry> entries,
                       List<TimelineWindow> windows,
                       TimelineSummary summary,
                       String transcript) {}
