package com.example.riskscan_backend.dto.web;

public record ModalityStatusResponse(String modality, String state, int attempts, String lastError) {}
