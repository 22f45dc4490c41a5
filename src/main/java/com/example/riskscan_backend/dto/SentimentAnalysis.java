package com.example.riskscan_backend.dto;

import java.util.List;

public record SentimentAnalysis(String language, List<Utterance> utterances) {
    public SentimentAnalysis {
        utterances = utterances == null ? List.of() : List.copyOf(utterances);
    }
}
