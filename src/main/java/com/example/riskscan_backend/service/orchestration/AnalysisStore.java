package com.example.riskscan_backend.service.orchestration;

import com.example.riskscan_backend.model.AnalysisEvent;
import com.example.riskscan_backend.model.AnalysisReport;
import com.example.riskscan_backend.model.AnalysisRequest;
import com.example.riskscan_backend.model.ModalityJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port of the orchestrator. Saves are version checked: a save based on a stale read
 * throws {@link org.springframework.dao.OptimisticLockingFailureException}. Callers must continue
 * with the returned instance.
 */
public interface AnalysisStore {

    Optional<AnalysisRequest> findRequest(UUID id);

    AnalysisRequest saveRequest(AnalysisRequest request);

    List<ModalityJob> findJobs(UUID requestId);

    ModalityJob saveJob(ModalityJob job);

    Optional<AnalysisReport> findReport(UUID requestId);

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when a report for the same
     *                                                                 request already exists.
     */
    AnalysisReport saveReport(AnalysisReport report);

    /**
     * Saves the report together with the request's move to its final state. Either both are
     * stored or neither is: a stale request fails the whole unit with
     * {@link org.springframework.dao.OptimisticLockingFailureException}, so a request cancelled in
     * the meantime never ends up with a report.
     */
    AnalysisRequest completeWithReport(AnalysisRequest request, AnalysisReport report);

    /** Non-terminal requests whose wake time has passed, oldest update first. */
    List<UUID> findDueRequestIds(Instant now, int limit);

    void recordEvent(AnalysisEvent event);

    List<AnalysisEvent> findEvents(UUID requestId);
}
