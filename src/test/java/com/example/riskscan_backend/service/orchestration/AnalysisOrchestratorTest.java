package com.example.riskscan_backend.service.orchestration;

import com.example.riskscan_backend.config.EvidenceProperties;
import com.example.riskscan_backend.config.FusionProperties;
import com.example.riskscan_backend.config.OrchestratorProperties;
import com.example.riskscan_backend.dto.*;
import com.example.riskscan_backend.engine.Interfaces.FrameExtractor;
import com.example.riskscan_backend.engine.Interfaces.ModalityAdapter.PollResult;
import com.example.riskscan_backend.engine.Interfaces.ReasoningClient;
import com.example.riskscan_backend.exception.PermanentServiceException;
import com.example.riskscan_backend.exception.TransientServiceException;
import com.example.riskscan_backend.model.AnalysisEvent;
import com.example.riskscan_backend.model.AnalysisReport;
import com.example.riskscan_backend.model.AnalysisRequest;
import com.example.riskscan_backend.model.ModalityJob;
import com.example.riskscan_backend.service.LocalStorageService;
import com.example.riskscan_backend.service.aggregation.ResultAggregator;
import com.example.riskscan_backend.service.evidence.EvidenceFrameSelector;
import com.example.riskscan_backend.service.fusion.DefaultModalityWeightingPolicy;
import com.example.riskscan_backend.service.fusion.FusionEngine;
import com.example.riskscan_backend.service.fusion.FusionResponseParser;
import com.example.riskscan_backend.service.fusion.PromptBuilder;
import com.example.riskscan_backend.service.modality.ModalityAdapterRegistry;
import com.example.riskscan_backend.service.modality.ModalityResultReader;
import com.example.riskscan_backend.service.modality.TranscriptSegmenter;
import com.example.riskscan_backend.service.report.ReportAssembler;
import com.example.riskscan_backend.util.FailureReason;
import com.example.riskscan_backend.util.JobState;
import com.example.riskscan_backend.util.Modality;
import com.example.riskscan_backend.util.RequestState;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AnalysisOrchestratorTest {

    private static final Duration TICK = Duration.ofSeconds(5);

    private final ObjectMapper om = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @TempDir
    Path dir;

    private MutableClock clock;
    private InMemoryAnalysisStore store;
    private LocalStorageService storage;
    private OrchestratorProperties props;
    private FakeModalityAdapter visual;
    private FakeModalityAdapter speech;
    private FakeModalityAdapter sentiment;
    private AtomicInteger reasoningCalls;
    private String reasoningOverride;
    private FrameExtractor frames;
    private UUID requestId;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        store = new InMemoryAnalysisStore();
        storage = new LocalStorageService(dir, "raw", "out");
        props = new OrchestratorProperties();
        reasoningCalls = new AtomicInteger();
        frames = (src, ms, target) -> Files.write(target, new byte[]{(byte) 0xFF, (byte) 0xD8});

        visual = new FakeModalityAdapter(Modality.VISUAL).succeedsWith(om.writeValueAsString(visualResult()));
        speech = new FakeModalityAdapter(Modality.SPEECH).succeedsWith(om.writeValueAsString(transcript()));
        sentiment = new FakeModalityAdapter(Modality.SENTIMENT).succeedsWith(om.writeValueAsString(sentimentResult()));

        requestId = UUID.randomUUID();
        Path video = Files.write(dir.resolve("clip.mp4"), new byte[]{0, 0, 0, 24});
        Path audio = Files.write(dir.resolve("clip.wav"), new byte[]{82, 73, 70, 70});
        storage.uploadToRaw(video, "uploads/" + requestId + "/source.mp4");
        storage.uploadToRaw(audio, "uploads/" + requestId + "/audio.wav");
        store.saveRequest(new AnalysisRequest(requestId, "uploads/" + requestId + "/source.mp4",
                "uploads/" + requestId + "/audio.wav", "clip.mp4", "pt-BR", 60_000L, clock.instant()));
    }

    private AnalysisOrchestrator orchestrator() {
        ReasoningClient reasoning = messages -> {
            reasoningCalls.incrementAndGet();
            if (reasoningOverride != null) {
                return reasoningOverride;
            }
            String prompt = messages.get(1).content();
            String disclosure = "";
            if (prompt.contains("visual analysis was unavailable")) {
                disclosure += " Facial analysis was unavailable for this video, so the assessment is less complete.";
            }
            if (prompt.contains("sentiment analysis was unavailable")) {
                disclosure += " Sentiment analysis was unavailable for this video.";
            }
            return """
                    {"score": 55, "classification": "MEDIUM",
                     "narrative": "A person repeatedly asks to be left alone while showing fear.%s",
                     "citedWindows": ["W1"]}
                    """.formatted(disclosure);
        };
        FusionProperties fusionProps = new FusionProperties();
        TranscriptSegmenter segmenter = new TranscriptSegmenter(700, 40);
        return new AnalysisOrchestrator(
                store,
                new ModalityAdapterRegistry(List.of(visual, speech, sentiment)),
                ModalityDependencyGraph.standard(),
                new ModalityResultReader(storage, om),
                new ResultAggregator(500, segmenter),
                new FusionEngine(reasoning, new PromptBuilder(om, fusionProps), new FusionResponseParser(om),
                        new DefaultModalityWeightingPolicy(fusionProps), fusionProps),
                new EvidenceFrameSelector(frames, storage, new EvidenceProperties()),
                new ReportAssembler(store, storage, clock),
                storage,
                om,
                clock,
                props);
    }

    private AnalysisRequest runToEnd(AnalysisOrchestrator orchestrator) {
        for (int i = 0; i < 400; i++) {
            orchestrator.advance(requestId);
            AnalysisRequest r = request();
            if (r.getState().isTerminal()) {
                return r;
            }
            clock.advance(TICK);
        }
        throw new AssertionError("request did not settle, state=" + request().getState());
    }

    private AnalysisRequest request() {
        return store.findRequest(requestId).orElseThrow();
    }

    private ModalityJob job(Modality m) {
        return store.findJobs(requestId).stream().filter(j -> j.getModality() == m).findFirst().orElseThrow();
    }

    @Test
    void sixtySecondClipCompletesWithMediumRiskAndEvidence() throws Exception {
        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(done.getFailureReason()).isNull();
        AnalysisReport report = store.findReport(requestId).orElseThrow();
        assertThat(report.getScore()).isEqualTo(55);
        assertThat(report.getClassification().name()).isEqualTo("MEDIUM");

        JsonNode json = om.readTree(report.getContent());
        assertThat(json.path("classification").asText()).isEqualTo("MEDIUM");
        assertThat(json.path("citedWindows")).isNotEmpty();
        assertThat(json.path("evidenceFrames")).isNotEmpty();
        assertThat(json.path("missingModalities")).isEmpty();
        assertThat(json.path("disclaimer").asText()).isNotBlank();
        for (JsonNode f : json.path("evidenceFrames")) {
            assertThat(storage.existsInOut(f.path("frameRef").asText())).isTrue();
            assertThat(f.path("timestampMs").asLong()).isBetween(0L, 60_000L);
        }
        assertThat(storage.existsInOut(ReportAssembler.storageKey(requestId))).isTrue();
    }

    @Test
    void requestStatesOnlyMoveForward() {
        runToEnd(orchestrator());

        List<String> transitions = store.findEvents(requestId).stream()
                .map(AnalysisEvent::getStep)
                .filter(s -> List.of("EXTRACTING", "ANALYZING_MODALITIES", "AGGREGATING", "FUSING",
                        "SELECTING_EVIDENCE", "COMPLETED").contains(s))
                .toList();
        assertThat(transitions).containsExactly("EXTRACTING", "ANALYZING_MODALITIES", "AGGREGATING", "FUSING",
                "SELECTING_EVIDENCE", "COMPLETED");
    }

    @Test
    void sentimentIsSubmittedOnlyAfterSpeechSucceeded() {
        AnalysisOrchestrator orchestrator = orchestrator();
        orchestrator.advance(requestId);

        assertThat(visual.submissions).hasSize(1);
        assertThat(speech.submissions).hasSize(1);
        assertThat(sentiment.submissions).isEmpty();
        assertThat(job(Modality.SENTIMENT).getState()).isEqualTo(JobState.PENDING);

        runToEnd(orchestrator);
        assertThat(sentiment.submissions).hasSize(1);
        assertThat(sentiment.submissions.get(0).speechResultRef())
                .isEqualTo(AnalysisOrchestrator.resultKey(requestId, Modality.SPEECH));
    }

    @Test
    void repeatedTicksNeverSubmitTwice() {
        AnalysisOrchestrator orchestrator = orchestrator();
        for (int i = 0; i < 5; i++) {
            orchestrator.advance(requestId);
        }
        assertThat(visual.submissions).hasSize(1);
        assertThat(speech.submissions).hasSize(1);
        assertThat(job(Modality.VISUAL).getHandle()).isEqualTo("visual-job-1");
        assertThat(job(Modality.VISUAL).getIdempotencyKey()).isEqualTo(requestId + ":visual:1");

        runToEnd(orchestrator);
        assertThat(visual.externalJobs()).isEqualTo(1);
        assertThat(speech.externalJobs()).isEqualTo(1);
        assertThat(sentiment.externalJobs()).isEqualTo(1);
    }

    @Test
    void resumesAfterRestartWithoutResubmitting() {
        orchestrator().advance(requestId);
        assertThat(request().getState()).isEqualTo(RequestState.ANALYZING_MODALITIES);

        clock.advance(TICK);
        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(visual.submissions).hasSize(1);
        assertThat(speech.submissions).hasSize(1);
    }

    @Test
    void crashBetweenSubmitAndSaveReusesTheSameExternalJob() {
        store.crashOnNextJobSave(j -> j.getModality() == Modality.VISUAL && j.getHandle() != null);
        AnalysisOrchestrator orchestrator = orchestrator();
        orchestrator.advance(requestId);

        ModalityJob claimed = job(Modality.VISUAL);
        assertThat(claimed.getHandle()).isNull();
        assertThat(claimed.getSubmitClaimedAt()).isNotNull();

        clock.advance(TICK);
        orchestrator.advance(requestId);
        assertThat(visual.submissions).hasSize(1);

        clock.advance(props.getClaimLease());
        AnalysisRequest done = runToEnd(orchestrator);

        assertThat(done.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(visual.submittedKeys()).containsExactly(requestId + ":visual:1", requestId + ":visual:1");
        assertThat(visual.externalJobs()).isEqualTo(1);
        assertThat(job(Modality.VISUAL).getAttempts()).isEqualTo(1);
    }

    @Test
    void speechFailureFailsRequestWithoutScore() {
        props.setMaxAttempts(1);
        speech.answers(() -> PollResult.failed("unsupported audio"));

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.FAILED);
        assertThat(done.getFailureReason()).isEqualTo(FailureReason.SPEECH_FAILED);
        assertThat(done.getFailureMessage()).contains("unsupported audio");
        assertThat(store.findReport(requestId)).isEmpty();
        assertThat(sentiment.submissions).isEmpty();
        assertThat(reasoningCalls.get()).isZero();
    }

    @Test
    void visualFailureCompletesAndDisclosesMissingModality() throws Exception {
        visual.answers(() -> PollResult.failed("no faces detected"));

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(done.missingModalityList()).containsExactly(Modality.VISUAL);
        assertThat(visual.submittedKeys()).containsExactly(
                requestId + ":visual:1", requestId + ":visual:2", requestId + ":visual:3");
        assertThat(job(Modality.VISUAL).isPermanentlyFailed()).isTrue();

        JsonNode report = om.readTree(store.findReport(requestId).orElseThrow().getContent());
        assertThat(report.path("missingModalities").get(0).asText()).isEqualTo("VISUAL");
        assertThat(report.path("narrative").asText()).containsIgnoringCase("facial analysis was unavailable");
        assertThat(report.path("evidenceFrames")).isNotEmpty();
    }

    @Test
    void speechFailureWhileSentimentWaitsFailsWithSingleMessage() {
        props.setMaxAttempts(1);
        visual.answers(PollResult::pending);
        speech.answers(() -> PollResult.failed("unsupported audio"));

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.FAILED);
        assertThat(done.getFailureReason()).isEqualTo(FailureReason.SPEECH_FAILED);
        assertThat(done.getFailureMessage())
                .isEqualTo(FailureReason.SPEECH_FAILED.defaultMessage() + " unsupported audio");
        assertThat(job(Modality.SENTIMENT).getState()).isEqualTo(JobState.PENDING);
        assertThat(sentiment.submissions).isEmpty();
        assertThat(visual.aborted).containsExactly("visual-job-1");
    }

    @Test
    void sentimentFailureCompletesAndDisclosesMissingModality() throws Exception {
        sentiment.answers(() -> PollResult.failed("language not supported"));

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(done.missingModalityList()).containsExactly(Modality.SENTIMENT);
        assertThat(sentiment.submittedKeys()).containsExactly(
                requestId + ":sentiment:1", requestId + ":sentiment:2", requestId + ":sentiment:3");
        assertThat(job(Modality.SENTIMENT).isPermanentlyFailed()).isTrue();

        JsonNode report = om.readTree(store.findReport(requestId).orElseThrow().getContent());
        assertThat(report.path("missingModalities").get(0).asText()).isEqualTo("SENTIMENT");
        assertThat(report.path("narrative").asText()).containsIgnoringCase("sentiment analysis was unavailable");
    }

    @Test
    void permanentSentimentRejectionCompletesWithoutSentiment() {
        sentiment.failSubmitWith(new PermanentServiceException("sentiment", "400 text too long"));

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(done.missingModalityList()).containsExactly(Modality.SENTIMENT);
        assertThat(sentiment.submissions).hasSize(1);
        assertThat(job(Modality.SENTIMENT).getLastError()).contains("400 text too long");
        assertThat(store.findReport(requestId)).isPresent();
    }

    @Test
    void unexpectedPollErrorOfSoftModalityOnlyDegradesTheResult() {
        visual.answers(() -> {
            throw new IllegalStateException("bad visual payload");
        });

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(done.missingModalityList()).containsExactly(Modality.VISUAL);
        assertThat(job(Modality.VISUAL).isPermanentlyFailed()).isTrue();
        assertThat(job(Modality.VISUAL).getLastError()).contains("bad visual payload");
        assertThat(visual.submissions).hasSize(3);
    }

    @Test
    void unexpectedSubmitErrorIsRetriedLikeAnyFailedAttempt() {
        sentiment.failSubmitWith(new IllegalStateException("cannot read transcript"));

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(done.missingModalityList()).isEmpty();
        assertThat(sentiment.submissions).hasSize(2);
        assertThat(job(Modality.SENTIMENT).getAttempts()).isEqualTo(2);
    }

    @Test
    void transientSubmitErrorRetriesWithTheSameKey() {
        speech.failSubmitWith(new TransientServiceException("speech", "503 Service Unavailable"));
        AnalysisOrchestrator orchestrator = orchestrator();
        orchestrator.advance(requestId);

        ModalityJob pending = job(Modality.SPEECH);
        assertThat(pending.getState()).isEqualTo(JobState.PENDING);
        assertThat(pending.getNextAttemptAt()).isEqualTo(clock.instant().plus(props.getBackoffBase()));

        AnalysisRequest done = runToEnd(orchestrator);
        assertThat(done.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(speech.submittedKeys()).containsExactly(requestId + ":speech:1", requestId + ":speech:1");
    }

    @Test
    void permanentSubmitRejectionOfSoftModalityIsNotRetried() {
        visual.failSubmitWith(new PermanentServiceException("visual", "400 unsupported codec"));

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(visual.submissions).hasSize(1);
        assertThat(done.missingModalityList()).containsExactly(Modality.VISUAL);
    }

    @Test
    void timedOutJobIsAbortedRetriedThenFails() {
        props.setMaxAttempts(2);
        props.getTimeouts().setSpeech(Duration.ofMinutes(1));
        speech.answers(PollResult::pending);

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.FAILED);
        assertThat(done.getFailureReason()).isEqualTo(FailureReason.SPEECH_FAILED);
        assertThat(speech.submittedKeys()).containsExactly(requestId + ":speech:1", requestId + ":speech:2");
        assertThat(speech.aborted).containsExactly("speech-job-1", "speech-job-2");
        assertThat(job(Modality.SPEECH).getLastError()).contains("no result within");
    }

    @Test
    void cancelStopsProgressAndAbortsRunningJobs() {
        AnalysisOrchestrator orchestrator = orchestrator();
        orchestrator.advance(requestId);

        AnalysisRequest cancelled = orchestrator.cancel(requestId);
        assertThat(cancelled.getState()).isEqualTo(RequestState.CANCELLED);
        assertThat(visual.aborted).containsExactly("visual-job-1");
        assertThat(speech.aborted).containsExactly("speech-job-1");

        clock.advance(Duration.ofMinutes(1));
        orchestrator.advance(requestId);
        assertThat(request().getState()).isEqualTo(RequestState.CANCELLED);
        assertThat(sentiment.submissions).isEmpty();
        assertThat(store.findReport(requestId)).isEmpty();

        assertThat(orchestrator.cancel(requestId).getState()).isEqualTo(RequestState.CANCELLED);
        assertThrows(NoSuchElementException.class, () -> orchestrator.cancel(UUID.randomUUID()));
    }

    @Test
    void cancelDuringEvidenceSelectionLeavesNoReport() {
        AtomicReference<AnalysisOrchestrator> running = new AtomicReference<>();
        frames = (src, ms, target) -> {
            running.get().cancel(requestId);
            Files.write(target, new byte[]{(byte) 0xFF, (byte) 0xD8});
        };
        running.set(orchestrator());

        AnalysisRequest done = runToEnd(running.get());

        assertThat(done.getState()).isEqualTo(RequestState.CANCELLED);
        assertThat(store.findReport(requestId)).isEmpty();
        assertThat(storage.existsInOut(ReportAssembler.storageKey(requestId))).isFalse();
        assertThat(store.findEvents(requestId)).extracting(AnalysisEvent::getStep)
                .contains("CANCELLED")
                .doesNotContain("COMPLETED");
    }

    @Test
    void invalidReasoningRepliesFailWithSchemaError() {
        reasoningOverride = "{\"score\": \"high\", \"narrative\": \"\"}";

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.FAILED);
        assertThat(done.getFailureReason()).isEqualTo(FailureReason.SCHEMA_ERROR);
        assertThat(reasoningCalls.get()).isEqualTo(3);
        assertThat(store.findReport(requestId)).isEmpty();
    }

    @Test
    void missingUploadFailsWithExtractionFailure() {
        storage.deleteRaw("uploads/" + requestId + "/audio.wav");

        AnalysisRequest done = runToEnd(orchestrator());

        assertThat(done.getState()).isEqualTo(RequestState.FAILED);
        assertThat(done.getFailureReason()).isEqualTo(FailureReason.EXTRACTION_FAILURE);
        assertThat(visual.submissions).isEmpty();
    }

    @Test
    void everyStepIsLogged() {
        runToEnd(orchestrator());

        List<String> steps = new ArrayList<>(store.findEvents(requestId).stream().map(AnalysisEvent::getStep).toList());
        assertThat(steps).contains("MODALITY_SUBMITTED", "MODALITY_DONE", "COMPLETED");
        assertThat(steps.stream().filter("MODALITY_DONE"::equals)).hasSize(3);
    }

    static VisualAnalysis visualResult() {
        return new VisualAnalysis(List.of(
                new EmotionEvent(new TimeWindow(12_000, 12_200), "FEAR", 0.91),
                new EmotionEvent(new TimeWindow(12_400, 12_600), "FEAR", 0.88),
                new EmotionEvent(new TimeWindow(30_000, 30_200), "CALM", 0.70)), 3);
    }

    static Transcript transcript() {
        return new Transcript("Please stop. Leave me alone.", "pt-BR", List.of(
                new TranscriptWord(11_000, 11_300, "Please", 0.98),
                new TranscriptWord(11_350, 11_800, "stop.", 0.97),
                new TranscriptWord(12_500, 12_800, "Leave", 0.95),
                new TranscriptWord(12_850, 13_000, "me", 0.99),
                new TranscriptWord(13_050, 13_500, "alone.", 0.96)));
    }

    static SentimentAnalysis sentimentResult() {
        return new SentimentAnalysis("pt", List.of(
                new Utterance(0, new TimeWindow(11_000, 11_800), "Please stop.", "NEGATIVE", -0.8, List.of()),
                new Utterance(1, new TimeWindow(12_500, 13_500), "Leave me alone.", "NEGATIVE", -0.9,
                        List.of(new EntityMention("me", "PERSON")))));
    }
}
