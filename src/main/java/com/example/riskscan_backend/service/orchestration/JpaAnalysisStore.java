package com.example.riskscan_backend.service.orchestration;

import com.example.riskscan_backend.model.AnalysisEvent;
import com.example.riskscan_backend.model.AnalysisReport;
import com.example.riskscan_backend.model.AnalysisRequest;
import com.example.riskscan_backend.model.ModalityJob;
import com.example.riskscan_backend.repository.AnalysisEventRepository;
import com.example.riskscan_backend.repository.AnalysisReportRepository;
import com.example.riskscan_backend.repository.AnalysisRequestRepository;
import com.example.riskscan_backend.repository.ModalityJobRepository;
import com.example.riskscan_backend.util.RequestState;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every write is flushed in its own transaction so version conflicts surface at the call site.
 * Completion is the one write that spans two tables and runs as a single transaction.
 */
@Component
public class JpaAnalysisStore implements AnalysisStore {
    private static final List<RequestState> ACTIVE = Arrays.stream(RequestState.values())
            .filter(s -> !s.isTerminal())
            .toList();

    private final AnalysisRequestRepository requests;
    private final ModalityJobRepository jobs;
    private final AnalysisReportRepository reports;
    private final AnalysisEventRepository events;

    public JpaAnalysisStore(AnalysisRequestRepository requests, ModalityJobRepository jobs,
                            AnalysisReportRepository reports, AnalysisEventRepository events) {
        this.requests = requests;
        this.jobs = jobs;
        this.reports = reports;
        this.events = events;
    }

    @Override
    public Optional<AnalysisRequest> findRequest(UUID id) {
        return requests.findById(id);
    }

    @Override
    public AnalysisRequest saveRequest(AnalysisRequest request) {
        return requests.saveAndFlush(request);
    }

    @Override
    public List<ModalityJob> findJobs(UUID requestId) {
        return jobs.findByRequestIdOrderByModality(requestId);
    }

    @Override
    public ModalityJob saveJob(ModalityJob job) {
        return jobs.saveAndFlush(job);
    }

    @Override
    public Optional<AnalysisReport> findReport(UUID requestId) {
        return reports.findByRequestId(requestId);
    }

    @Override
    public AnalysisReport saveReport(AnalysisReport report) {
        return reports.saveAndFlush(report);
    }

    @Override
    @Transactional
    public AnalysisRequest completeWithReport(AnalysisRequest request, AnalysisReport report) {
        reports.saveAndFlush(report);
        return requests.saveAndFlush(request);
    }

    @Override
    public List<UUID> findDueRequestIds(Instant now, int limit) {
        return requests.findDueIds(ACTIVE, now, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public void recordEvent(AnalysisEvent event) {
        events.save(event);
    }

    @Override
    public List<AnalysisEvent> findEvents(UUID requestId) {
        return events.findByRequestIdOrderByIdAsc(requestId);
    }
}
