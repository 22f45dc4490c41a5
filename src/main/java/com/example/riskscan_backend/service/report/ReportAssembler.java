package com.example.riskscan_backend.service.report;

import com.example.riskscan_backend.dto.EvidenceFrame;
import com.example.riskscan_backend.dto.FusedAssessment;
import com.example.riskscan_backend.dto.ReportDocument;
import com.example.riskscan_backend.dto.Timeline;
import com.example.riskscan_backend.model.AnalysisReport;
import com.example.riskscan_backend.model.AnalysisRequest;
import com.example.riskscan_backend.service.Interfaces.StorageService;
import com.example.riskscan_backend.service.orchestration.AnalysisStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Writes the final report once per request. The report id is derived from the request id and the
 * JSON is produced with sorted keys, so every later assembly returns the stored bytes unchanged.
 */
@Service
public class ReportAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReportAssembler.class);

    static final String DISCLAIMER = "This report is an automated triage aid built from facial-emotion, speech and "
            + "sentiment indicators. It is not a diagnosis or evidence of abuse and must be reviewed by a trained professional.";

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private final AnalysisStore store;
    private final StorageService storage;
    private final Clock clock;

    public ReportAssembler(AnalysisStore store, StorageService storage, Clock clock) {
        this.store = store;
        this.storage = storage;
        this.clock = clock;
    }

    public static UUID reportIdFor(UUID requestId) {
        return UUID.nameUUIDFromBytes(("report:" + requestId).getBytes(StandardCharsets.UTF_8));
    }

    public static String storageKey(UUID requestId) {
        return "reports/" + requestId + "_report.json";
    }

    /**
     * Stores the report together with {@code request}, which the caller has already moved to its
     * final state. A version conflict on the request propagates and nothing is kept.
     */
    public AnalysisReport assemble(AnalysisRequest request, FusedAssessment assessment,
                                   List<EvidenceFrame> frames, Timeline timeline) {
        UUID requestId = request.getId();
        var existing = store.findReport(requestId);
        if (existing.isPresent()) {
            LOGGER.debug("REPORT exists requestId={}", requestId);
            store.saveRequest(request);
            return existing.get();
        }

        Instant completedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        UUID reportId = reportIdFor(requestId);
        ReportDocument doc = new ReportDocument(
                reportId,
                requestId,
                assessment.score(),
                assessment.classification(),
                assessment.narrative(),
                assessment.citedWindows(),
                frames,
                assessment.missingModalities(),
                timeline.summary(),
                timeline.transcript(),
                DISCLAIMER,
                completedAt.toString());
        String json;
        try {
            json = CANONICAL.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize report for " + requestId, e);
        }

        AnalysisReport saved = new AnalysisReport(reportId, requestId, assessment.score(),
                assessment.classification(), json, completedAt);
        store.completeWithReport(request, saved);
        LOGGER.info("REPORT saved requestId={} reportId={} score={} class={} frames={}",
                requestId, reportId, assessment.score(), assessment.classification(), frames.size());

        try {
            storage.writeToOut(storageKey(requestId), saved.getContent().getBytes(StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            LOGGER.warn("REPORT storage copy failed requestId={} cause={}", requestId, e.toString());
        }
        return saved;
    }
}
