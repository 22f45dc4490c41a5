package com.example.riskscan_backend.dto.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisCreatedResponse(UUID id, String state, String failureReason, String failureMessage) {}
