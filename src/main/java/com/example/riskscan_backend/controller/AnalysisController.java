package com.example.riskscan_backend.controller;

import com.example.riskscan_backend.dto.web.AnalysisCreatedResponse;
import com.example.riskscan_backend.dto.web.AnalysisEventResponse;
import com.example.riskscan_backend.dto.web.AnalysisStatusResponse;
import com.example.riskscan_backend.model.AnalysisRequest;
import com.example.riskscan_backend.service.AnalysisQueryService;
import com.example.riskscan_backend.service.IngestService;
import com.example.riskscan_backend.service.orchestration.AnalysisOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.constraints.Pattern;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Upload, status, report and progress endpoints of the risk triage pipeline.
 */
@RestController
@RequestMapping("/v1/analyses")
public class AnalysisController {
    private final IngestService ingestService;
    private final AnalysisQueryService queryService;
    private final AnalysisOrchestrator orchestrator;

    public AnalysisController(IngestService ingestService, AnalysisQueryService queryService, AnalysisOrchestrator orchestrator) {
        this.ingestService = ingestService;
        this.queryService = queryService;
        this.orchestrator = orchestrator;
    }

    @Operation(summary = "Upload a video and start its analysis")
    @ApiResponse(responseCode = "202", description = "Request created; state is RECEIVED, or FAILED with a reason when the upload was rejected")
    @ApiResponse(responseCode = "400", description = "Empty file or malformed language code")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AnalysisCreatedResponse> create(@RequestPart("file") MultipartFile file,
                                                          @RequestParam(value = "language", required = false)
                                                          @Pattern(regexp = "[a-z]{2,3}(-[A-Za-z]{2,4})?") String language) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FILE_EMPTY");
        }
        Path tmp = Files.createTempFile("riskscan-upload-", ".bin");
        try {
            file.transferTo(tmp);
            AnalysisRequest r = ingestService.ingest(tmp, file.getOriginalFilename(), language);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(new AnalysisCreatedResponse(
                    r.getId(),
                    r.getState().name(),
                    r.getFailureReason() == null ? null : r.getFailureReason().name(),
                    r.getFailureMessage()));
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Operation(summary = "Current state, per-modality progress and, once completed, the report")
    @ApiResponse(responseCode = "404", description = "Unknown analysis")
    @GetMapping("/{id}")
    public AnalysisStatusResponse get(@PathVariable UUID id) {
        return queryService.status(id);
    }

    @Operation(summary = "Stored report JSON, byte for byte")
    @ApiResponse(responseCode = "404", description = "Unknown analysis or report not ready")
    @GetMapping(value = "/{id}/report", produces = MediaType.APPLICATION_JSON_VALUE)
    public String report(@PathVariable UUID id) {
        return queryService.reportContent(id);
    }

    @GetMapping("/{id}/events")
    public List<AnalysisEventResponse> events(@PathVariable UUID id) {
        return queryService.events(id);
    }

    @Operation(summary = "Cancel a running analysis; a finished one is returned unchanged")
    @ApiResponse(responseCode = "409", description = "The analysis changed state concurrently; retry the cancel")
    @PostMapping("/{id}/cancel")
    public AnalysisCreatedResponse cancel(@PathVariable UUID id) {
        try {
            AnalysisRequest r = orchestrator.cancel(id);
            return new AnalysisCreatedResponse(r.getId(), r.getState().name(),
                    r.getFailureReason() == null ? null : r.getFailureReason().name(), r.getFailureMessage());
        } catch (NoSuchElementException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "ANALYSIS_NOT_FOUND");
        } catch (OptimisticLockingFailureException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "ANALYSIS_BUSY");
        }
    }
}
