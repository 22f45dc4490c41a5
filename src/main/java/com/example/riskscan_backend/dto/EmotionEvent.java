package com.example.riskscan_backend.dto;

public record EmotionEvent(TimeWindow window, String label, double confidence) {}
