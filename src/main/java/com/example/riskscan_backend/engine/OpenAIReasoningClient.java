package com.example.riskscan_backend.engine;

import com.example.riskscan_backend.engine.Interfaces.ReasoningClient;
import com.example.riskscan_backend.exception.TransientServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions in JSON mode at temperature 0.
 */
public class OpenAIReasoningClient extends AbstractHttpProviderClient implements ReasoningClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAIReasoningClient.class);
    private final String model;

    public OpenAIReasoningClient(WebClient client, ObjectMapper om, Duration timeout, String model) {
        super("reasoning", client, om, timeout);
        this.model = model;
    }

    @Override
    public String complete(List<Message> messages) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("temperature", 0);
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", messages.stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList());

        long start = System.currentTimeMillis();
        JsonNode root = execute(client.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body), "chat");

        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new TransientServiceException(provider, "chat returned no message content");
        }
        LOGGER.debug("REASONING model={} messages={} in={}ms", model, messages.size(), System.currentTimeMillis() - start);
        return content.asText();
    }
}
