package com.example.riskscan_backend.dto;

import com.example.riskscan_backend.util.Modality;
import com.example.riskscan_backend.util.RiskClassification;

import java.util.List;
import java.util.Map;

/**
 * Validated reasoning output. {@code classification} is always derived from {@code score}.
 */
public record FusedAssessment(int score,
                              RiskClassification classification,
                              String narrative,
                              List<String> citedWindows,
                              List<Modality> missingModalities,
                              Map<Modality, Double> weights,
                              double coverage,
                              int reasoningCalls) {}
