package com.example.riskscan_backend.engine.Interfaces;

import com.example.riskscan_backend.dto.EntityMention;

import java.util.List;

/**
 * Synchronous sentiment and entity detection over text segments.
 */
public interface SentimentClient {
    record Scores(double positive, double negative, double neutral, double mixed) {}
    record Result(String sentiment, Scores scores, List<EntityMention> entities) {}

    /** @return one result per input text, in input order. */
    List<Result> analyze(String languageCode, List<String> texts);
}
