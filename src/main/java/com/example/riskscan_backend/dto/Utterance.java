package com.example.riskscan_backend.dto;

import java.util.List;

/**
 * A transcript segment. {@code sentiment} and {@code sentimentScore} are null until the sentiment
 * capability has scored it; the score is positive minus negative confidence, in {@code [-1, 1]}.
 */
public record Utterance(int index,
                        TimeWindow window,
                        String text,
                        String sentiment,
                        Double sentimentScore,
                        List<EntityMention> entities) {
    public Utterance {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public static Utterance unscored(int index, TimeWindow window, String text) {
        return new Utterance(index, window, text, null, null, List.of());
    }
}
