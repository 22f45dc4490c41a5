package com.example.riskscan_backend.engine;

import com.example.riskscan_backend.engine.Interfaces.ProviderJob;
import com.example.riskscan_backend.engine.Interfaces.VisualEmotionClient.FaceSample;
import com.example.riskscan_backend.exception.PermanentServiceException;
import com.example.riskscan_backend.exception.TransientServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.netty.http.client.PrematureCloseException;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HttpVisualEmotionClientTest {

    private final ObjectMapper om = new ObjectMapper();

    private HttpVisualEmotionClient client(StubExchange exchange) {
        return new HttpVisualEmotionClient(exchange.webClient(), om, Duration.ofSeconds(5));
    }

    @Test
    void startPostsVideoAndClientToken() throws Exception {
        StubExchange exchange = new StubExchange().json(HttpStatus.OK, "{\"jobId\":\"fe-1\"}");

        String jobId = client(exchange).startFaceEmotion(URI.create("file:///data/raw/uploads/x/source.mp4"), "req:visual:1");

        assertThat(jobId).isEqualTo("fe-1");
        StubExchange.Recorded r = exchange.requests.get(0);
        assertThat(r.method()).isEqualTo("POST");
        assertThat(r.path()).isEqualTo("/v1/face-emotion/jobs");
        assertThat(om.readTree(r.body()).path("clientToken").asText()).isEqualTo("req:visual:1");
    }

    @Test
    void completedJobIsParsedIntoSortedFractionalScores() {
        StubExchange exchange = new StubExchange().json(HttpStatus.OK, """
                {"status":"SUCCEEDED","faces":[
                  {"timestampMs":2000,"emotions":[{"type":"CALM","confidence":12.5}]},
                  {"timestampMs":1000,"emotions":[{"type":"FEAR","confidence":91.0},{"type":"SAD","confidence":30.0},{"type":"","confidence":5}]}
                ]}
                """);

        ProviderJob<List<FaceSample>> job = client(exchange).getFaceEmotion("fe-1");

        assertThat(job.status()).isEqualTo(ProviderJob.Status.SUCCEEDED);
        assertThat(job.result()).extracting(FaceSample::timestampMs).containsExactly(1000L, 2000L);
        assertThat(job.result().get(0).emotions()).hasSize(2);
        assertThat(job.result().get(0).emotions().get(0).confidence()).isEqualTo(0.91);
        assertThat(exchange.requests.get(0).path()).isEqualTo("/v1/face-emotion/jobs/fe-1");
    }

    @Test
    void providerStatusesMapToJobStates() {
        StubExchange exchange = new StubExchange()
                .json(HttpStatus.OK, "{\"status\":\"IN_PROGRESS\"}")
                .json(HttpStatus.OK, "{\"status\":\"FAILED\",\"statusMessage\":\"video unreadable\"}")
                .json(HttpStatus.OK, "{\"status\":\"EXPLODED\"}");
        HttpVisualEmotionClient c = client(exchange);

        assertThat(c.getFaceEmotion("a").status()).isEqualTo(ProviderJob.Status.IN_PROGRESS);
        ProviderJob<List<FaceSample>> failed = c.getFaceEmotion("a");
        assertThat(failed.status()).isEqualTo(ProviderJob.Status.FAILED);
        assertThat(failed.message()).isEqualTo("video unreadable");
        assertThrows(PermanentServiceException.class, () -> c.getFaceEmotion("a"));
    }

    @Test
    void throttlingAndServerErrorsAreTransient() {
        StubExchange exchange = new StubExchange()
                .json(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"slow down\"}")
                .json(HttpStatus.BAD_GATEWAY, "");
        HttpVisualEmotionClient c = client(exchange);

        TransientServiceException throttled = assertThrows(TransientServiceException.class, () -> c.getFaceEmotion("a"));
        assertThat(throttled.getMessage()).contains("429");
        assertThrows(TransientServiceException.class, () -> c.getFaceEmotion("a"));
        assertThat(exchange.requests).hasSize(2);
    }

    @Test
    void clientErrorsArePermanent() {
        StubExchange exchange = new StubExchange().json(HttpStatus.BAD_REQUEST, "{\"error\":\"bad uri\"}");

        PermanentServiceException ex = assertThrows(PermanentServiceException.class,
                () -> client(exchange).startFaceEmotion(URI.create("file:///x.mp4"), "k"));
        assertThat(ex.getMessage()).contains("bad uri");
    }

    @Test
    void transportErrorsAreRetriedBeforeGivingUp() {
        StubExchange exchange = new StubExchange()
                .error(PrematureCloseException.TEST_EXCEPTION)
                .error(PrematureCloseException.TEST_EXCEPTION)
                .json(HttpStatus.OK, "{\"jobId\":\"fe-9\"}");

        assertThat(client(exchange).startFaceEmotion(URI.create("file:///x.mp4"), "k")).isEqualTo("fe-9");
        assertThat(exchange.requests).hasSize(3);
    }

    @Test
    void exhaustedTransportRetriesAreTransient() {
        StubExchange exchange = new StubExchange()
                .error(PrematureCloseException.TEST_EXCEPTION)
                .error(PrematureCloseException.TEST_EXCEPTION)
                .error(PrematureCloseException.TEST_EXCEPTION);

        assertThrows(TransientServiceException.class,
                () -> client(exchange).startFaceEmotion(URI.create("file:///x.mp4"), "k"));
        assertThat(exchange.requests).hasSize(3);
    }
}
