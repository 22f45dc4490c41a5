package com.example.riskscan_backend.service.orchestration;

import com.example.riskscan_backend.config.OrchestratorProperties;
import com.example.riskscan_backend.dto.EvidenceFrame;
import com.example.riskscan_backend.dto.FusedAssessment;
import com.example.riskscan_backend.dto.Timeline;
import com.example.riskscan_backend.engine.Interfaces.ModalityAdapter;
import com.example.riskscan_backend.engine.Interfaces.ModalityAdapter.PollResult;
import com.example.riskscan_backend.exception.AnalysisException;
import com.example.riskscan_backend.exception.PermanentServiceException;
import com.example.riskscan_backend.exception.SchemaViolationException;
import com.example.riskscan_backend.exception.TransientServiceException;
import com.example.riskscan_backend.model.AnalysisEvent;
import com.example.riskscan_backend.model.AnalysisRequest;
import com.example.riskscan_backend.model.ModalityJob;
import com.example.riskscan_backend.service.Interfaces.StorageService;
import com.example.riskscan_backend.service.aggregation.ResultAggregator;
import com.example.riskscan_backend.service.evidence.EvidenceFrameSelector;
import com.example.riskscan_backend.service.fusion.FusionEngine;
import com.example.riskscan_backend.service.modality.ModalityAdapterRegistry;
import com.example.riskscan_backend.service.modality.ModalityResultReader;
import com.example.riskscan_backend.service.report.ReportAssembler;
import com.example.riskscan_backend.util.FailureReason;
import com.example.riskscan_backend.util.JobState;
import com.example.riskscan_backend.util.Modality;
import com.example.riskscan_backend.util.RequestState;
import com.example.riskscan_backend.service.orchestration.ModalityDependencyGraph.NodeStatus;
import com.example.riskscan_backend.service.orchestration.ModalityDependencyGraph.Verdict;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Drives one analysis request through its state machine.
 * <p>
 * {@link #advance(UUID)} is a single resumable tick: it reloads the request and its jobs, moves
 * forward as far as it can without waiting, and returns. External jobs are never awaited; the
 * scheduler calls back once {@code nextWakeAt} has passed. All saves are version checked and a
 * conflict ends the tick, leaving the work to whichever invoker won.
 */
@Service
public class AnalysisOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisOrchestrator.class);
    private static final int MAX_STEPS_PER_TICK = 16;
    private static final int CANCEL_ATTEMPTS = 3;

    private final AnalysisStore store;
    private final ModalityAdapterRegistry adapters;
    private final ModalityDependencyGraph graph;
    private final ModalityResultReader results;
    private final ResultAggregator aggregator;
    private final FusionEngine fusion;
    private final EvidenceFrameSelector evidence;
    private final ReportAssembler reports;
    private final StorageService storage;
    private final ObjectMapper om;
    private final Clock clock;
    private final OrchestratorProperties props;
    private final RetryPolicy jobRetry;
    private final RetryPolicy stepRetry;

    public AnalysisOrchestrator(AnalysisStore store, ModalityAdapterRegistry adapters, ModalityDependencyGraph graph,
                                ModalityResultReader results, ResultAggregator aggregator, FusionEngine fusion,
                                EvidenceFrameSelector evidence, ReportAssembler reports, StorageService storage,
                                ObjectMapper om, Clock clock, OrchestratorProperties props) {
        this.store = store;
        this.adapters = adapters;
        this.graph = graph;
        this.results = results;
        this.aggregator = aggregator;
        this.fusion = fusion;
        this.evidence = evidence;
        this.reports = reports;
        this.storage = storage;
        this.om = om;
        this.clock = clock;
        this.props = props;
        this.jobRetry = new RetryPolicy(props.getMaxAttempts(), props.getBackoffBase(), props.getBackoffMax());
        this.stepRetry = new RetryPolicy(props.getStepMaxAttempts(), props.getBackoffBase(), props.getBackoffMax());
    }

    public static String resultKey(UUID requestId, Modality modality) {
        return "analysis/" + requestId + "/" + modality.key() + ".json";
    }

    public static String timelineKey(UUID requestId) {
        return "analysis/" + requestId + "/timeline.json";
    }

    /**
     * Moves the request forward until it has to wait or reaches a terminal state.
     */
    public void advance(UUID requestId) {
        for (int i = 0; i < MAX_STEPS_PER_TICK; i++) {
            AnalysisRequest request = store.findRequest(requestId).orElse(null);
            if (request == null || request.getState().isTerminal()) {
                return;
            }
            boolean moved;
            try {
                moved = step(request);
            } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
                LOGGER.debug("ORCH conflict requestId={} state={}, yielding: {}", requestId, request.getState(), e.getMessage());
                return;
            } catch (RuntimeException e) {
                onUnexpected(requestId, e);
                return;
            }
            if (!moved) {
                return;
            }
        }
    }

    /**
     * Cancels a non-terminal request and aborts its running jobs. Terminal requests are returned as is.
     *
     * @throws NoSuchElementException when the request does not exist.
     */
    public AnalysisRequest cancel(UUID requestId) {
        for (int attempt = 1; ; attempt++) {
            AnalysisRequest request = store.findRequest(requestId)
                    .orElseThrow(() -> new NoSuchElementException("analysis " + requestId));
            if (request.getState().isTerminal()) {
                return request;
            }
            RequestState from = request.getState();
            try {
                request.cancel(now());
                request = store.saveRequest(request);
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= CANCEL_ATTEMPTS) throw e;
                continue;
            }
            LOGGER.info("ORCH cancelled requestId={} from={}", requestId, from);
            event(requestId, "CANCELLED", "Analysis cancelled", Map.of("from", from.name()));
            abortInFlight(requestId);
            return request;
        }
    }

    private boolean step(AnalysisRequest r) {
        LOGGER.debug("ORCH advance requestId={} state={}", r.getId(), r.getState());
        return switch (r.getState()) {
            case RECEIVED -> moveTo(r, RequestState.EXTRACTING, "Preparing modality analysis");
            case EXTRACTING -> extract(r);
            case ANALYZING_MODALITIES -> analyze(r);
            case AGGREGATING -> aggregate(r);
            case FUSING -> fuse(r);
            case SELECTING_EVIDENCE -> finish(r);
            default -> false;
        };
    }

    private boolean extract(AnalysisRequest r) {
        if (r.getSourceRef() == null || r.getAudioRef() == null
                || !storage.existsInRaw(r.getSourceRef()) || !storage.existsInRaw(r.getAudioRef())) {
            failRequest(r, FailureReason.EXTRACTION_FAILURE, "Uploaded video or extracted audio is missing from storage");
            return false;
        }
        Set<Modality> present = EnumSet.noneOf(Modality.class);
        for (ModalityJob j : store.findJobs(r.getId())) present.add(j.getModality());
        for (Modality m : graph.modalities()) {
            if (!present.contains(m)) {
                store.saveJob(new ModalityJob(r.getId(), m, now()));
            }
        }
        return moveTo(r, RequestState.ANALYZING_MODALITIES, "Modality jobs created");
    }

    // ---- ANALYZING_MODALITIES ----

    private boolean analyze(AnalysisRequest r) {
        Map<Modality, ModalityJob> jobs = new EnumMap<>(Modality.class);
        for (ModalityJob j : store.findJobs(r.getId())) jobs.put(j.getModality(), j);

        for (Modality m : graph.modalities()) {
            ModalityJob job = jobs.get(m);
            if (job == null || job.isTerminal()) continue;
            Map<Modality, NodeStatus> status = statusOf(jobs);
            if (graph.isUnreachable(m, status)) continue;
            jobs.put(m, drive(r, job, status));
        }

        Verdict verdict = graph.evaluate(statusOf(jobs));
        switch (verdict.outcome()) {
            case FAIL -> {
                Modality hard = verdict.failedHard();
                ModalityJob failed = jobs.get(hard);
                String message = hard.failureReason().defaultMessage();
                if (failed != null && failed.getLastError() != null) {
                    message += " " + failed.getLastError();
                }
                failRequest(r, hard.failureReason(), message);
                abortInFlight(r.getId());
                return false;
            }
            case PROCEED -> {
                if (!verdict.missing().isEmpty()) {
                    LOGGER.warn("ORCH degraded requestId={} missing={}", r.getId(), verdict.missing());
                }
                r.setMissingModalities(verdict.missing());
                return moveTo(r, RequestState.AGGREGATING, "All modalities settled",
                        Map.of("missing", verdict.missing().stream().map(Modality::name).toList()));
            }
            default -> {
                r.setNextWakeAt(nextWake(jobs.values()));
                r.touch(now());
                store.saveRequest(r);
                return false;
            }
        }
    }

    private ModalityJob drive(AnalysisRequest r, ModalityJob job, Map<Modality, NodeStatus> status) {
        return switch (job.getState()) {
            case PENDING -> graph.isReady(job.getModality(), status) ? submit(r, job) : job;
            case RUNNING -> poll(r, job);
            default -> job;
        };
    }

    private ModalityJob submit(AnalysisRequest r, ModalityJob job) {
        Instant now = now();
        if (job.getHandle() != null) {
            // a recorded handle is never submitted again
            job.transitionTo(JobState.RUNNING);
            return store.saveJob(job);
        }
        if (job.getNextAttemptAt() != null && now.isBefore(job.getNextAttemptAt())) {
            return job;
        }
        if (job.getSubmitClaimedAt() != null && now.isBefore(job.getSubmitClaimedAt().plus(props.getClaimLease()))) {
            return job;
        }

        boolean reclaim = job.getSubmitClaimedAt() != null;
        if (!reclaim) {
            job.setAttempts(job.getAttempts() + 1);
        }
        if (job.getIdempotencyKey() == null) {
            job.setIdempotencyKey(r.getId() + ":" + job.getModality().key() + ":" + job.getAttempts());
        }
        job.setSubmitClaimedAt(now);
        job = store.saveJob(job);

        AnalysisRequest fresh = store.findRequest(r.getId()).orElse(null);
        if (fresh == null || fresh.getState() != RequestState.ANALYZING_MODALITIES) {
            LOGGER.info("ORCH submit skipped requestId={} modality={}, request moved on", r.getId(), job.getModality());
            return job;
        }

        ModalityAdapter adapter = adapters.get(job.getModality());
        String handle;
        try {
            handle = adapter.submit(inputFor(r, job));
        } catch (TransientServiceException e) {
            job.setSubmitClaimedAt(null);
            return attemptFailed(r, job, JobState.PENDING, "submit: " + e.getMessage());
        } catch (PermanentServiceException e) {
            job.setSubmitClaimedAt(null);
            job.setLastError("submit rejected: " + e.getMessage());
            job.setExhausted(true);
            job.transitionTo(JobState.FAILED);
            job.setCompletedAt(now());
            job = store.saveJob(job);
            LOGGER.warn("ORCH job rejected requestId={} modality={} error={}", r.getId(), job.getModality(), e.getMessage());
            event(r.getId(), "MODALITY_FAILED", job.getModality().key() + " analysis failed", Map.of("error", e.getMessage()));
            return job;
        } catch (RuntimeException e) {
            LOGGER.warn("ORCH submit error requestId={} modality={}", r.getId(), job.getModality(), e);
            job.setSubmitClaimedAt(null);
            return attemptFailed(r, job, JobState.PENDING, "submit: " + e);
        }

        job.setHandle(handle);
        job.setSubmittedAt(now());
        job.setSubmitClaimedAt(null);
        job.setNextPollAt(now().plus(props.getPollInterval()));
        job.transitionTo(JobState.RUNNING);
        job = store.saveJob(job);
        LOGGER.info("ORCH submitted requestId={} modality={} attempt={} handle={}", r.getId(), job.getModality(), job.getAttempts(), handle);
        event(r.getId(), "MODALITY_SUBMITTED", job.getModality().key() + " analysis started",
                Map.of("attempt", job.getAttempts()));
        return job;
    }

    private ModalityJob poll(AnalysisRequest r, ModalityJob job) {
        Instant now = now();
        Duration ceiling = props.timeoutFor(job.getModality());
        if (job.getSubmittedAt() != null && !now.isBefore(job.getSubmittedAt().plus(ceiling))) {
            abortQuietly(job);
            return attemptEnded(r, job, JobState.TIMED_OUT, "no result within " + ceiling);
        }
        if (job.getNextPollAt() != null && now.isBefore(job.getNextPollAt())) {
            return job;
        }

        PollResult result;
        try {
            result = adapters.get(job.getModality()).poll(job.getHandle());
        } catch (TransientServiceException e) {
            LOGGER.warn("ORCH poll error requestId={} modality={} error={}", r.getId(), job.getModality(), e.getMessage());
            job.setLastError("poll: " + e.getMessage());
            job.setNextPollAt(now.plus(props.getPollInterval()));
            return store.saveJob(job);
        } catch (PermanentServiceException e) {
            return attemptEnded(r, job, JobState.FAILED, "poll: " + e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.warn("ORCH poll failed requestId={} modality={}", r.getId(), job.getModality(), e);
            abortQuietly(job);
            return attemptEnded(r, job, JobState.FAILED, "poll: " + e);
        }

        LOGGER.debug("ORCH poll requestId={} modality={} status={}", r.getId(), job.getModality(), result.status());
        return switch (result.status()) {
            case PENDING -> {
                job.setNextPollAt(now.plus(props.getPollInterval()));
                yield store.saveJob(job);
            }
            case SUCCEEDED -> {
                String key = resultKey(r.getId(), job.getModality());
                storage.writeToOut(key, result.payload().getBytes(StandardCharsets.UTF_8));
                job.setResultRef(key);
                job.transitionTo(JobState.SUCCEEDED);
                job.setCompletedAt(now);
                job.setNextPollAt(null);
                job = store.saveJob(job);
                LOGGER.info("ORCH job succeeded requestId={} modality={} attempt={}", r.getId(), job.getModality(), job.getAttempts());
                event(r.getId(), "MODALITY_DONE", job.getModality().key() + " analysis finished", Map.of("resultRef", key));
                yield job;
            }
            case FAILED -> attemptEnded(r, job, JobState.FAILED, result.message());
            case TIMED_OUT -> attemptEnded(r, job, JobState.TIMED_OUT, result.message());
        };
    }

    /** A submitted attempt ended badly: the external job is gone and a retry needs a fresh key. */
    private ModalityJob attemptEnded(AnalysisRequest r, ModalityJob job, JobState outcome, String message) {
        job.transitionTo(outcome);
        job.setHandle(null);
        job.setIdempotencyKey(null);
        job.setNextPollAt(null);
        return attemptFailed(r, job, outcome, message);
    }

    private ModalityJob attemptFailed(AnalysisRequest r, ModalityJob job, JobState outcome, String message) {
        String error = message == null ? outcome.name() : message;
        job.setLastError(error);
        if (jobRetry.canRetry(job.getAttempts())) {
            Duration wait = jobRetry.backoff(job.getAttempts());
            if (job.getState() != JobState.PENDING) {
                job.transitionTo(JobState.PENDING);
            }
            job.setNextAttemptAt(now().plus(wait));
            job = store.saveJob(job);
            LOGGER.warn("ORCH job retry requestId={} modality={} attempt={} in={}s error={}",
                    r.getId(), job.getModality(), job.getAttempts(), wait.toSeconds(), error);
            event(r.getId(), "MODALITY_RETRY", job.getModality().key() + " analysis will be retried",
                    Map.of("attempt", job.getAttempts(), "error", error));
            return job;
        }
        if (job.getState() != JobState.FAILED) {
            job.transitionTo(JobState.FAILED);
        }
        job.setExhausted(true);
        job.setCompletedAt(now());
        job = store.saveJob(job);
        LOGGER.warn("ORCH job failed requestId={} modality={} attempts={} error={}", r.getId(), job.getModality(), job.getAttempts(), error);
        event(r.getId(), "MODALITY_FAILED", job.getModality().key() + " analysis failed", Map.of("error", error));
        return job;
    }

    private ModalityAdapter.Input inputFor(AnalysisRequest r, ModalityJob job) {
        String speechRef = null;
        if (job.getModality() == Modality.SENTIMENT) {
            speechRef = store.findJobs(r.getId()).stream()
                    .filter(j -> j.getModality() == Modality.SPEECH && j.getState() == JobState.SUCCEEDED)
                    .map(ModalityJob::getResultRef)
                    .findFirst()
                    .orElse(null);
        }
        return new ModalityAdapter.Input(r.getId(), job.getIdempotencyKey(), r.getSourceRef(), r.getAudioRef(),
                r.getLanguage(), r.getDurationMs(), speechRef);
    }

    private Map<Modality, NodeStatus> statusOf(Map<Modality, ModalityJob> jobs) {
        Map<Modality, NodeStatus> out = new EnumMap<>(Modality.class);
        jobs.forEach((m, j) -> out.put(m, j.getState() == JobState.SUCCEEDED
                ? NodeStatus.SUCCEEDED
                : j.isPermanentlyFailed() ? NodeStatus.FAILED : NodeStatus.OPEN));
        return out;
    }

    private Instant nextWake(Collection<ModalityJob> jobs) {
        Instant earliest = null;
        for (ModalityJob j : jobs) {
            if (j.isTerminal()) continue;
            Instant t = switch (j.getState()) {
                case RUNNING -> min(j.getNextPollAt(),
                        j.getSubmittedAt() == null ? null : j.getSubmittedAt().plus(props.timeoutFor(j.getModality())));
                case PENDING -> j.getSubmitClaimedAt() != null
                        ? j.getSubmitClaimedAt().plus(props.getClaimLease())
                        : j.getNextAttemptAt();
                default -> null;
            };
            earliest = min(earliest, t);
        }
        Instant fallback = now().plus(props.getPollInterval());
        return earliest == null || earliest.isAfter(fallback) ? fallback : earliest;
    }

    // ---- AGGREGATING / FUSING / SELECTING_EVIDENCE ----

    private boolean aggregate(AnalysisRequest r) {
        List<ModalityJob> jobs = store.findJobs(r.getId());
        Map<Modality, String> refs = new EnumMap<>(Modality.class);
        for (ModalityJob j : jobs) {
            if (j.getState() == JobState.SUCCEEDED) refs.put(j.getModality(), j.getResultRef());
        }
        ResultAggregator.Inputs inputs = new ResultAggregator.Inputs(
                results.visual(refs.get(Modality.VISUAL)),
                results.transcript(refs.get(Modality.SPEECH)),
                results.sentiment(refs.get(Modality.SENTIMENT)));
        long duration = r.getDurationMs() == null ? 0 : r.getDurationMs();
        Timeline timeline = aggregator.aggregate(r.getId(), duration, inputs, r.missingModalityList());

        String key = timelineKey(r.getId());
        storage.writeToOut(key, toJson(timeline).getBytes(StandardCharsets.UTF_8));
        r.setTimelineRef(key);

        Instant now = now();
        for (ModalityJob j : jobs) {
            if (j.getRetiredAt() == null) {
                j.setRetiredAt(now);
                store.saveJob(j);
            }
        }
        return moveTo(r, RequestState.FUSING, "Timeline assembled",
                Map.of("entries", timeline.entries().size(), "windows", timeline.windows().size()));
    }

    private boolean fuse(AnalysisRequest r) {
        if (r.getNextWakeAt() != null && now().isBefore(r.getNextWakeAt())) {
            return false;
        }
        Timeline timeline = results.read(r.getTimelineRef(), Timeline.class);
        try {
            FusedAssessment assessment = fusion.fuse(timeline, r.missingModalityList());
            r.setAssessmentJson(toJson(assessment));
            return moveTo(r, RequestState.SELECTING_EVIDENCE, "Risk assessment produced",
                    Map.of("score", assessment.score(), "classification", assessment.classification().name()));
        } catch (SchemaViolationException e) {
            failRequest(r, FailureReason.SCHEMA_ERROR, e.getMessage() + ": " + String.join("; ", e.getViolations()));
            return false;
        } catch (PermanentServiceException e) {
            failRequest(r, FailureReason.REASONING_FAILED, e.getMessage());
            return false;
        } catch (TransientServiceException e) {
            int attempts = r.getStepAttempts() + 1;
            if (!stepRetry.canRetry(attempts)) {
                failRequest(r, FailureReason.RESOURCE_EXHAUSTED, "Reasoning unavailable after " + attempts + " attempts: " + e.getMessage());
                return false;
            }
            Duration wait = stepRetry.backoff(attempts);
            r.setStepAttempts(attempts);
            r.setNextWakeAt(now().plus(wait));
            r.touch(now());
            store.saveRequest(r);
            LOGGER.warn("ORCH fusion retry requestId={} attempt={} in={}s error={}", r.getId(), attempts, wait.toSeconds(), e.getMessage());
            event(r.getId(), "FUSION_RETRY", "Risk assessment will be retried", Map.of("attempt", attempts));
            return false;
        }
    }

    private boolean finish(AnalysisRequest r) {
        Timeline timeline = results.read(r.getTimelineRef(), Timeline.class);
        FusedAssessment assessment = fromJson(r.getAssessmentJson(), FusedAssessment.class);
        long duration = r.getDurationMs() == null ? timeline.durationMs() : r.getDurationMs();
        List<EvidenceFrame> frames = evidence.select(r.getId(), r.getSourceRef(), duration, timeline, assessment);

        AnalysisRequest fresh = store.findRequest(r.getId()).orElse(null);
        if (fresh == null || fresh.getState() != RequestState.SELECTING_EVIDENCE) {
            LOGGER.info("ORCH report skipped requestId={}, request moved on to {}", r.getId(),
                    fresh == null ? null : fresh.getState());
            return false;
        }
        // report and COMPLETED are stored as one unit; a cancel landing in between fails both
        r.transitionTo(RequestState.COMPLETED, now());
        reports.assemble(r, assessment, frames, timeline);
        LOGGER.info("ORCH transition requestId={} {} -> {}", r.getId(), RequestState.SELECTING_EVIDENCE, RequestState.COMPLETED);
        event(r.getId(), RequestState.COMPLETED.name(), "Report ready",
                Map.of("score", assessment.score(), "frames", frames.size()));
        return true;
    }

    // ---- helpers ----

    private boolean moveTo(AnalysisRequest r, RequestState next, String message) {
        return moveTo(r, next, message, Map.of());
    }

    private boolean moveTo(AnalysisRequest r, RequestState next, String message, Map<String, Object> details) {
        RequestState from = r.getState();
        r.transitionTo(next, now());
        store.saveRequest(r);
        LOGGER.info("ORCH transition requestId={} {} -> {}", r.getId(), from, next);
        event(r.getId(), next.name(), message, details);
        return true;
    }

    private void failRequest(AnalysisRequest r, FailureReason reason, String message) {
        RequestState from = r.getState();
        r.fail(reason, message, now());
        store.saveRequest(r);
        LOGGER.error("ORCH request failed requestId={} from={} reason={} message={}", r.getId(), from, reason, message);
        event(r.getId(), "FAILED", message, Map.of("reason", reason.name(), "from", from.name()));
    }

    private void onUnexpected(UUID requestId, RuntimeException e) {
        try {
            AnalysisRequest r = store.findRequest(requestId).orElse(null);
            if (r == null || r.getState().isTerminal()) return;
            int attempts = r.getStepAttempts() + 1;
            FailureReason reason = e instanceof AnalysisException ae ? ae.getReason() : FailureReason.INTERNAL_ERROR;
            if (e instanceof AnalysisException || !stepRetry.canRetry(attempts)) {
                failRequest(r, reason, e.getMessage());
                return;
            }
            Duration wait = stepRetry.backoff(attempts);
            r.setStepAttempts(attempts);
            r.setNextWakeAt(now().plus(wait));
            r.touch(now());
            store.saveRequest(r);
            LOGGER.warn("ORCH step error requestId={} state={} attempt={} retryIn={}s", requestId, r.getState(), attempts, wait.toSeconds(), e);
        } catch (OptimisticLockingFailureException conflict) {
            LOGGER.debug("ORCH conflict while recording error requestId={}", requestId);
        }
    }

    private void abortInFlight(UUID requestId) {
        for (ModalityJob j : store.findJobs(requestId)) {
            if (j.getState() == JobState.RUNNING && j.getHandle() != null && j.getRetiredAt() == null) {
                abortQuietly(j);
            }
        }
    }

    private void abortQuietly(ModalityJob job) {
        try {
            adapters.get(job.getModality()).abort(job.getHandle());
            LOGGER.info("ORCH abort requestId={} modality={} handle={}", job.getRequestId(), job.getModality(), job.getHandle());
        } catch (RuntimeException e) {
            LOGGER.warn("ORCH abort failed requestId={} modality={} handle={} error={}",
                    job.getRequestId(), job.getModality(), job.getHandle(), e.toString());
        }
    }

    private void event(UUID requestId, String step, String message, Map<String, Object> details) {
        try {
            store.recordEvent(new AnalysisEvent(requestId, step, message, details.isEmpty() ? null : details, now()));
        } catch (RuntimeException e) {
            LOGGER.warn("ORCH event not recorded requestId={} step={} error={}", requestId, step, e.toString());
        }
    }

    private String toJson(Object value) {
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return om.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read " + type.getSimpleName(), e);
        }
    }

    private static Instant min(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private Instant now() {
        return clock.instant();
    }
}
