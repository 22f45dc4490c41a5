package com.example.riskscan_backend.engine;

import com.example.riskscan_backend.dto.Transcript;
import com.example.riskscan_backend.dto.TranscriptWord;
import com.example.riskscan_backend.engine.Interfaces.ProviderJob;
import com.example.riskscan_backend.engine.Interfaces.SpeechClient;
import com.example.riskscan_backend.exception.PermanentServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Asynchronous transcription. Word times on the wire are seconds.
 */
public class HttpSpeechClient extends AbstractHttpProviderClient implements SpeechClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpSpeechClient.class);

    public HttpSpeechClient(WebClient client, ObjectMapper om, Duration timeout) {
        super("speech", client, om, timeout);
    }

    @Override
    public String startTranscription(URI mediaUri, String languageCode, String clientToken) {
        JsonNode root = execute(client.post()
                .uri("/v1/transcription/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "mediaUri", mediaUri.toString(),
                        "languageCode", languageCode,
                        "clientToken", clientToken)), "start");
        String jobId = text(root, "jobId");
        if (jobId == null || jobId.isBlank()) {
            throw new PermanentServiceException(provider, "start returned no jobId");
        }
        LOGGER.debug("SPEECH started jobId={} lang={} token={}", jobId, languageCode, clientToken);
        return jobId;
    }

    @Override
    public ProviderJob<Transcript> getTranscription(String jobId) {
        JsonNode root = execute(client.get().uri("/v1/transcription/jobs/{id}", jobId), "get");
        String status = root.path("status").asText("");
        return switch (status) {
            case "COMPLETED", "SUCCEEDED" -> ProviderJob.succeeded(parseTranscript(root.path("transcript")));
            case "FAILED" -> ProviderJob.failed(root.path("failureReason").asText("transcription failed"));
            case "IN_PROGRESS", "QUEUED" -> ProviderJob.inProgress();
            default -> throw new PermanentServiceException(provider, "unknown job status '" + status + "'");
        };
    }

    @Override
    public void cancel(String jobId) {
        executeDiscarding(client.delete().uri("/v1/transcription/jobs/{id}", jobId), "cancel");
    }

    private Transcript parseTranscript(JsonNode node) {
        List<TranscriptWord> words = new ArrayList<>();
        for (JsonNode w : node.path("words")) {
            String word = w.path("word").asText("");
            if (word.isBlank()) continue;
            long start = Math.round(w.path("start").asDouble(0) * 1000);
            long end = Math.max(start, Math.round(w.path("end").asDouble(0) * 1000));
            words.add(new TranscriptWord(start, end, word, w.path("confidence").asDouble(1.0)));
        }
        return new Transcript(node.path("text").asText(""), node.path("language").asText(null), words);
    }
}
