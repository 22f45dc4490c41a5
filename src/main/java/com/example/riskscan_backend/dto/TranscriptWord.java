package com.example.riskscan_backend.dto;

public record TranscriptWord(long startMs, long endMs, String word, double confidence) {}
