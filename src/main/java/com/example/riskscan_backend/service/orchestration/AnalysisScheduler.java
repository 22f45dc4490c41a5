package com.example.riskscan_backend.service.orchestration;

import com.example.riskscan_backend.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Timed re-invocation of the orchestrator. Each tick picks the requests whose wake time has
 * passed and advances them on the orchestrator pool, never the same request twice at once.
 */
@Component
public class AnalysisScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisScheduler.class);

    private final AnalysisStore store;
    private final AnalysisOrchestrator orchestrator;
    private final Executor executor;
    private final OrchestratorProperties props;
    private final Clock clock;
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    public AnalysisScheduler(AnalysisStore store, AnalysisOrchestrator orchestrator,
                             @Qualifier("orchestratorTaskExecutor") Executor executor,
                             OrchestratorProperties props, Clock clock) {
        this.store = store;
        this.orchestrator = orchestrator;
        this.executor = executor;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${orchestrator.tick-millis:3000}")
    public void tick() {
        List<UUID> due = store.findDueRequestIds(clock.instant(), props.getBatchSize());
        if (due.isEmpty()) {
            LOGGER.debug("Orchestrator tick - nothing due");
            return;
        }
        LOGGER.debug("Orchestrator tick due={} inFlight={}", due.size(), inFlight.size());
        for (UUID id : due) {
            dispatch(id);
        }
    }

    /** @return false when the request is already being advanced or the pool is full. */
    public boolean dispatch(UUID requestId) {
        if (!inFlight.add(requestId)) {
            return false;
        }
        try {
            executor.execute(() -> {
                long t0 = System.nanoTime();
                try {
                    orchestrator.advance(requestId);
                } catch (RuntimeException e) {
                    LOGGER.error("Orchestrator advance crashed requestId={}: {}", requestId, e.toString(), e);
                } finally {
                    inFlight.remove(requestId);
                    LOGGER.debug("Orchestrator advance requestId={} in={}ms", requestId, (System.nanoTime() - t0) / 1_000_000);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            inFlight.remove(requestId);
            LOGGER.warn("Orchestrator pool full, requestId={} waits for next tick", requestId);
            return false;
        }
    }
}
