package com.example.riskscan_backend.dto;

import java.util.List;

public record Transcript(String text, String language, List<TranscriptWord> words) {
    public Transcript {
        words = words == null ? List.of() : List.copyOf(words);
    }
}
