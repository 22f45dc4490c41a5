package com.example.riskscan_backend.service;

import com.example.riskscan_backend.dto.web.AnalysisEventResponse;
import com.example.riskscan_backend.dto.web.AnalysisStatusResponse;
import com.example.riskscan_backend.dto.web.ModalityStatusResponse;
import com.example.riskscan_backend.model.AnalysisReport;
import com.example.riskscan_backend.model.AnalysisRequest;
import com.example.riskscan_backend.service.orchestration.AnalysisStore;
import com.example.riskscan_backend.util.Modality;
import com.example.riskscan_backend.util.RequestState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Service
public class AnalysisQueryService {
    private final AnalysisStore store;
    private final ObjectMapper om;

    public AnalysisQueryService(AnalysisStore store, ObjectMapper om) {
        this.store = store;
        this.om = om;
    }

    public AnalysisStatusResponse status(UUID id) {
        AnalysisRequest r = requireRequest(id);
        List<ModalityStatusResponse> modalities = store.findJobs(id).stream()
                .sorted(Comparator.comparing(j -> j.getModality().ordinal()))
                .map(j -> new ModalityStatusResponse(j.getModality().name(), j.getState().name(), j.getAttempts(), j.getLastError()))
                .toList();
        JsonNode report = null;
        if (r.getState() == RequestState.COMPLETED) {
            report = store.findReport(id).map(this::parse).orElse(null);
        }
        return new AnalysisStatusResponse(
                r.getId(),
                r.getState().name(),
                r.getCreatedAt(),
                r.getUpdatedAt(),
                r.getCompletedAt(),
                r.getLanguage(),
                r.getDurationMs(),
                r.getFailureReason() == null ? null : r.getFailureReason().name(),
                r.getFailureMessage(),
                r.missingModalityList().stream().map(Modality::name).toList(),
                modalities,
                report);
    }

    /** Stored report bytes, exactly as assembled. */
    public String reportContent(UUID id) {
        AnalysisRequest r = requireRequest(id);
        if (r.getState() != RequestState.COMPLETED) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "REPORT_NOT_READY");
        }
        return store.findReport(id)
                .map(AnalysisReport::getContent)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "REPORT_NOT_READY"));
    }

    public List<AnalysisEventResponse> events(UUID id) {
        requireRequest(id);
        return store.findEvents(id).stream()
                .map(e -> new AnalysisEventResponse(e.getId(), e.getStep(), e.getMessage(), e.getDetails(), e.getCreatedAt()))
                .toList();
    }

    private AnalysisRequest requireRequest(UUID id) {
        return store.findRequest(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "ANALYSIS_NOT_FOUND"));
    }

    private JsonNode parse(AnalysisReport report) {
        try {
            return om.readTree(report.getContent());
        } catch (JsonProcessingException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "REPORT_UNREADABLE", e);
        }
    }
}
