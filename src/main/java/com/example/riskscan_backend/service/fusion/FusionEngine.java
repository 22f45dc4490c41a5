package com.example.riskscan_backend.service.fusion;

import com.example.riskscan_backend.config.FusionProperties;
import com.example.riskscan_backend.dto.FusedAssessment;
import com.example.riskscan_backend.dto.Timeline;
import com.example.riskscan_backend.dto.TimelineWindow;
import com.example.riskscan_backend.engine.Interfaces.ReasoningClient;
import com.example.riskscan_backend.engine.Interfaces.ReasoningClient.Message;
import com.example.riskscan_backend.exception.SchemaViolationException;
import com.example.riskscan_backend.util.Modality;
import com.example.riskscan_backend.util.RiskClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Turns a timeline into a scored assessment through the reasoning capability.
 * <p>
 * Replies that break the schema are answered with a corrective prompt, at most
 * {@code fusion.max-repair-attempts} times. Provider errors are not handled here; the orchestrator
 * owns their retries.
 */
@Service
public class FusionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(FusionEngine.class);

    private final ReasoningClient reasoning;
    private final PromptBuilder prompts;
    private final FusionResponseParser parser;
    private final ModalityWeightingPolicy weighting;
    private final int maxRepairAttempts;

    public FusionEngine(ReasoningClient reasoning, PromptBuilder prompts, FusionResponseParser parser,
                        ModalityWeightingPolicy weighting, FusionProperties props) {
        this.reasoning = reasoning;
        this.prompts = prompts;
        this.parser = parser;
        this.weighting = weighting;
        this.maxRepairAttempts = Math.max(0, props.getMaxRepairAttempts());
    }

    /**
     * @throws SchemaViolationException when no valid reply was obtained within the repair budget.
     */
    public FusedAssessment fuse(Timeline timeline, List<Modality> missing) {
        List<Modality> missingSorted = missing.stream().sorted().toList();
        Set<Modality> available = EnumSet.allOf(Modality.class);
        missingSorted.forEach(available::remove);
        Map<Modality, Double> weights = weighting.weights(available);
        double coverage = weighting.coverage(available);
        List<String> windowOrder = timeline.windows().stream().map(TimelineWindow::id).toList();

        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(prompts.systemPrompt()));
        messages.add(Message.user(prompts.userPrompt(timeline, missingSorted, weights, coverage)));

        List<String> violations = List.of();
        int calls = 1 + maxRepairAttempts;
        for (int call = 1; call <= calls; call++) {
            String raw = reasoning.complete(messages);
            FusionResponseParser.Outcome outcome = parser.parse(raw, windowOrder, missingSorted);
            if (outcome.valid()) {
                FusionResponseParser.Draft d = outcome.draft();
                RiskClassification classification = RiskClassification.fromScore(d.score());
                if (!classification.name().equals(d.proposedClassification())) {
                    LOGGER.info("FUSION label mismatch requestId={} score={} proposed={} derived={}",
                            timeline.requestId(), d.score(), d.proposedClassification(), classification);
                }
                LOGGER.info("FUSION ok requestId={} score={} class={} cited={} calls={}",
                        timeline.requestId(), d.score(), classification, d.citedWindows().size(), call);
                return new FusedAssessment(d.score(), classification, d.narrative(), d.citedWindows(),
                        missingSorted, weights, coverage, call);
            }
            violations = outcome.violations();
            LOGGER.warn("FUSION schema violation requestId={} call={}/{} violations={}",
                    timeline.requestId(), call, calls, violations);
            messages.add(Message.assistant(raw == null ? "" : raw));
            messages.add(Message.user(prompts.repairPrompt(violations)));
        }
        throw new SchemaViolationException("Reasoning reply invalid after " + calls + " calls", violations);
    }
}
