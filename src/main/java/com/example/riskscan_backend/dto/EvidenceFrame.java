package com.example.riskscan_backend.dto;

public record EvidenceFrame(long timestampMs, String frameRef, String windowId) {}
