package com.example.riskscan_backend.engine;

import com.example.riskscan_backend.exception.PermanentServiceException;
import com.example.riskscan_backend.exception.ServiceException;
import com.example.riskscan_backend.exception.TransientServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Shared request plumbing for the provider clients: status classification, short transport
 * retries and a bounded blocking wait.
 */
abstract class AbstractHttpProviderClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractHttpProviderClient.class);
    static final Duration RETRY_BACKOFF = Duration.ofMillis(200);
    static final int RETRY_MAX_ATTEMPTS = 2;

    protected final WebClient client;
    protected final ObjectMapper om;
    protected final Duration timeout;
    protected final String provider;

    protected AbstractHttpProviderClient(String provider, WebClient client, ObjectMapper om, Duration timeout) {
        this.provider = provider;
        this.client = client;
        this.om = om;
        this.timeout = timeout;
    }

    /**
     * Executes the request and parses the body as JSON.
     *
     * @throws TransientServiceException for 408, 429, 5xx, transport errors and timeouts.
     * @throws PermanentServiceException for any other error status.
     */
    protected JsonNode execute(WebClient.RequestHeadersSpec<?> spec, String operation) {
        Mono<JsonNode> mono = spec.retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> classify(resp.statusCode(), operation, body)))
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> parseJson(body, operation))
                .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("{} retry attempt={} op={} cause={}",
                                provider,
                                signal.totalRetriesInARow() + 1,
                                operation,
                                signal.failure() == null ? "unknown" : signal.failure().toString()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
        try {
            return mono.block(timeout);
        } catch (ServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransientServiceException(provider, operation + " failed: " + e.getMessage(), e);
        }
    }

    /** Fire-and-forget style call whose body is ignored. */
    protected void executeDiscarding(WebClient.RequestHeadersSpec<?> spec, String operation) {
        try {
            spec.retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(body -> classify(resp.statusCode(), operation, body)))
                    .toBodilessEntity()
                    .block(timeout);
        } catch (ServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransientServiceException(provider, operation + " failed: " + e.getMessage(), e);
        }
    }

    ServiceException classify(HttpStatusCode status, String operation, String body) {
        int code = status.value();
        String msg = "%s %s error %s: %s".formatted(provider, operation, code, truncate(body, 500));
        if (code == 408 || code == 429 || status.is5xxServerError()) {
            return new TransientServiceException(provider, msg);
        }
        return new PermanentServiceException(provider, msg);
    }

    private JsonNode parseJson(String body, String operation) {
        if (body == null || body.isBlank()) {
            return om.createObjectNode();
        }
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransientServiceException(provider, operation + " returned malformed JSON", e);
        }
    }

    private boolean isRetryable(Throwable t) {
        Throwable cur = t;
        while (cur != null) {
            if (cur instanceof WebClientRequestException
                    || cur instanceof PrematureCloseException
                    || cur instanceof TimeoutException
                    || (cur instanceof IOException && !(cur instanceof JsonProcessingException))) {
                return true;
            }
            cur = cur.getCause();
        }
        return false;
    }

    static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
