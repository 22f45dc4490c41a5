package com.example.riskscan_backend.engine;

import com.example.riskscan_backend.engine.Interfaces.ProviderJob;
import com.example.riskscan_backend.engine.Interfaces.VisualEmotionClient;
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
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Face emotion detection over a stored video. Confidences on the wire are percentages.
 */
public class HttpVisualEmotionClient extends AbstractHttpProviderClient implements VisualEmotionClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpVisualEmotionClient.class);

    public HttpVisualEmotionClient(WebClient client, ObjectMapper om, Duration timeout) {
        super("visual", client, om, timeout);
    }

    @Override
    public String startFaceEmotion(URI videoUri, String clientToken) {
        JsonNode root = execute(client.post()
                .uri("/v1/face-emotion/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("videoUri", videoUri.toString(), "clientToken", clientToken)), "start");
        String jobId = text(root, "jobId");
        if (jobId == null || jobId.isBlank()) {
            throw new PermanentServiceException(provider, "start returned no jobId");
        }
        LOGGER.debug("VISUAL started jobId={} token={}", jobId, clientToken);
        return jobId;
    }

    @Override
    public ProviderJob<List<FaceSample>> getFaceEmotion(String jobId) {
        JsonNode root = execute(client.get().uri("/v1/face-emotion/jobs/{id}", jobId), "get");
        String status = root.path("status").asText("");
        return switch (status) {
            case "SUCCEEDED" -> ProviderJob.succeeded(parseFaces(root.path("faces")));
            case "FAILED" -> ProviderJob.failed(root.path("statusMessage").asText("face emotion job failed"));
            case "IN_PROGRESS", "QUEUED" -> ProviderJob.inProgress();
            default -> throw new PermanentServiceException(provider, "unknown job status '" + status + "'");
        };
    }

    @Override
    public void cancel(String jobId) {
        executeDiscarding(client.delete().uri("/v1/face-emotion/jobs/{id}", jobId), "cancel");
    }

    private List<FaceSample> parseFaces(JsonNode faces) {
        List<FaceSample> out = new ArrayList<>();
        if (!faces.isArray()) {
            return out;
        }
        for (JsonNode f : faces) {
            List<EmotionScore> emotions = new ArrayList<>();
            for (JsonNode e : f.path("emotions")) {
                String type = e.path("type").asText(null);
                if (type == null || type.isBlank()) continue;
                emotions.add(new EmotionScore(type, e.path("confidence").asDouble(0) / 100.0));
            }
            out.add(new FaceSample(f.path("timestampMs").asLong(0), emotions));
        }
        out.sort(Comparator.comparingLong(FaceSample::timestampMs));
        return out;
    }
}
