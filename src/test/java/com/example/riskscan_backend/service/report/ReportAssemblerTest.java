package com.example.riskscan_backend.service.report;

import com.example.riskscan_backend.dto.*;
import com.example.riskscan_backend.model.AnalysisReport;
import com.example.riskscan_backend.model.AnalysisRequest;
import com.example.riskscan_backend.service.Interfaces.StorageService;
import com.example.riskscan_backend.service.orchestration.AnalysisStore;
import com.example.riskscan_backend.util.Modality;
import com.example.riskscan_backend.util.RiskClassification;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReportAssemblerTest {

    @Mock
    private AnalysisStore store;

    @Mock
    private StorageService storage;

    private ReportAssembler assembler;
    private AnalysisRequest request;
    private final Map<UUID, AnalysisReport> saved = new HashMap<>();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30.123456Z"), ZoneOffset.UTC);
        assembler = new ReportAssembler(store, storage, clock);
        request = new AnalysisRequest(UUID.randomUUID(), "uploads/x/source.mp4", "uploads/x/audio.wav",
                "x.mp4", "pt-BR", 60_000L, clock.instant());
        lenient().when(store.findReport(any())).thenAnswer(inv -> Optional.ofNullable(saved.get(inv.<UUID>getArgument(0))));
        lenient().when(store.completeWithReport(any(), any())).thenAnswer(inv -> {
            AnalysisReport r = inv.getArgument(1);
            saved.put(r.getRequestId(), r);
            return inv.getArgument(0);
        });
    }

    private static FusedAssessment assessment() {
        Map<Modality, Double> weights = new EnumMap<>(Modality.class);
        weights.put(Modality.SPEECH, 0.429);
        weights.put(Modality.SENTIMENT, 0.571);
        return new FusedAssessment(48, RiskClassification.MEDIUM, "Facial analysis was unavailable. Tense exchange.",
                List.of("W1"), List.of(Modality.VISUAL), weights, 0.7, 1);
    }

    private static Timeline timeline() {
        Map<String, Double> share = new LinkedHashMap<>();
        share.put("SAD", 0.25);
        share.put("ANGRY", 0.75);
        TimelineSummary s = new TimelineSummary(share, "ANGRY", -0.5, 0.5, 2, 2, 1,
                List.of(Modality.SPEECH, Modality.SENTIMENT), List.of(Modality.VISUAL));
        return new Timeline(UUID.randomUUID(), 60_000, List.of(), List.of(), s, "leave me alone");
    }

    @Test
    void reportCarriesAssessmentFramesAndDisclaimer() throws Exception {
        List<EvidenceFrame> frames = List.of(new EvidenceFrame(12_300, "analysis/x/frames/12300.jpg", "W1"));

        AnalysisReport report = assembler.assemble(request, assessment(), frames, timeline());

        assertThat(report.getId()).isEqualTo(ReportAssembler.reportIdFor(request.getId()));
        assertThat(report.getScore()).isEqualTo(48);
        JsonNode json = new ObjectMapper().readTree(report.getContent());
        assertThat(json.path("classification").asText()).isEqualTo("MEDIUM");
        assertThat(json.path("evidenceFrames").get(0).path("timestampMs").asLong()).isEqualTo(12_300);
        assertThat(json.path("missingModalities").get(0).asText()).isEqualTo("VISUAL");
        assertThat(json.path("transcript").asText()).isEqualTo("leave me alone");
        assertThat(json.path("disclaimer").asText()).isEqualTo(ReportAssembler.DISCLAIMER);
        assertThat(json.path("completedAt").asText()).isEqualTo("2026-03-01T10:15:30.123Z");
        assertThat(report.getContent()).startsWith("{\"citedWindows\"");

        verify(storage).writeToOut(eq(ReportAssembler.storageKey(request.getId())),
                eq(report.getContent().getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void reassemblyReturnsIdenticalBytes() {
        AnalysisReport first = assembler.assemble(request, assessment(), List.of(), timeline());

        FusedAssessment different = new FusedAssessment(90, RiskClassification.HIGH, "other", List.of("W1"),
                List.of(), Map.of(), 1.0, 2);
        AnalysisReport second = assembler.assemble(request, different, List.of(), timeline());

        assertThat(second.getContent()).isEqualTo(first.getContent());
        assertThat(second.getScore()).isEqualTo(48);
        verify(store, times(1)).completeWithReport(any(), any());
        verify(store).saveRequest(request);
    }

    @Test
    void conflictingCompletionKeepsNoCopy() {
        doThrow(new ObjectOptimisticLockingFailureException(AnalysisRequest.class, request.getId()))
                .when(store).completeWithReport(any(), any());

        assertThrows(OptimisticLockingFailureException.class,
                () -> assembler.assemble(request, assessment(), List.of(), timeline()));

        verify(storage, never()).writeToOut(any(), any());
    }

    @Test
    void storageCopyFailureDoesNotLoseTheReport() {
        doThrow(new RuntimeException("disk full")).when(storage).writeToOut(any(), any());

        AnalysisReport out = assembler.assemble(request, assessment(), List.of(), timeline());

        assertThat(out.getScore()).isEqualTo(48);
        ArgumentCaptor<AnalysisReport> captor = ArgumentCaptor.forClass(AnalysisReport.class);
        verify(store).completeWithReport(eq(request), captor.capture());
        assertThat(captor.getValue().getContent()).isEqualTo(out.getContent());
    }
}
