package com.example.riskscan_backend.dto;

import com.example.riskscan_backend.util.Modality;

import java.util.List;
import java.util.Map;

/**
 * Numeric digest of the timeline handed to the reasoning step. Contains no free text.
 */
public record TimelineSummary(Map<String, Double> emotionShare,
                              String dominantEmotion,
                              Double meanSentimentScore,
                              double negativeUtteranceShare,
                              int utteranceCount,
                              int entryCount,
                              int windowCount,
                              List<Modality> availableModalities,
                              List<Modality> missingModalities) {}
