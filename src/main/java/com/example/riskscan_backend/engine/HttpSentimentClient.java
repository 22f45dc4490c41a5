package com.example.riskscan_backend.engine;

import com.example.riskscan_backend.dto.EntityMention;
import com.example.riskscan_backend.engine.Interfaces.SentimentClient;
import com.example.riskscan_backend.exception.TransientServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.*;

/**
 * Batch sentiment and entity detection. Segments are sent in batches of {@value #BATCH_SIZE}.
 */
public class HttpSentimentClient extends AbstractHttpProviderClient implements SentimentClient {
    static final int BATCH_SIZE = 25;
    static final int MAX_SEGMENT_CHARS = 4500;

    public HttpSentimentClient(WebClient client, ObjectMapper om, Duration timeout) {
        super("sentiment", client, om, timeout);
    }

    @Override
    public List<Result> analyze(String languageCode, List<String> texts) {
        List<Result> out = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += BATCH_SIZE) {
            List<String> batch = texts.subList(from, Math.min(texts.size(), from + BATCH_SIZE));
            out.addAll(analyzeBatch(languageCode, batch));
        }
        return out;
    }

    private List<Result> analyzeBatch(String languageCode, List<String> batch) {
        List<Map<String, Object>> segments = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            String t = batch.get(i);
            segments.add(Map.of("index", i, "text", t.length() > MAX_SEGMENT_CHARS ? t.substring(0, MAX_SEGMENT_CHARS) : t));
        }
        JsonNode root = execute(client.post()
                .uri("/v1/sentiment/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("languageCode", languageCode, "segments", segments)), "batch");

        Map<Integer, Result> byIndex = new HashMap<>();
        for (JsonNode r : root.path("results")) {
            JsonNode s = r.path("scores");
            List<EntityMention> entities = new ArrayList<>();
            for (JsonNode e : r.path("entities")) {
                entities.add(new EntityMention(e.path("text").asText(""), e.path("type").asText("OTHER")));
            }
            byIndex.put(r.path("index").asInt(-1), new Result(
                    r.path("sentiment").asText("NEUTRAL").toUpperCase(Locale.ROOT),
                    new Scores(s.path("positive").asDouble(0), s.path("negative").asDouble(0),
                            s.path("neutral").asDouble(0), s.path("mixed").asDouble(0)),
                    entities));
        }
        List<Result> out = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Result r = byIndex.get(i);
            if (r == null) {
                throw new TransientServiceException(provider, "batch response is missing index " + i);
            }
            out.add(r);
        }
        return out;
    }
}
