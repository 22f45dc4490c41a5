package com.example.riskscan_backend.service.fusion;

import com.example.riskscan_backend.config.FusionProperties;
import com.example.riskscan_backend.dto.Timeline;
import com.example.riskscan_backend.dto.TimelineEntry;
import com.example.riskscan_backend.util.Modality;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class PromptBuilder {

    static final String SYSTEM_PROMPT = """
            You assist non-specialist reviewers in triaging videos for possible domestic-violence risk.
            You receive a structured timeline of facial-emotion observations, speech utterances and
            sentiment scores, grouped into time windows with ids such as "W1".
            Reply with a single JSON object and nothing else, using exactly these fields:
              "score": integer from 0 to 100, higher means more indicators of risk,
              "classification": one of "LOW", "MEDIUM", "HIGH",
              "narrative": plain-language rationale for the reviewer,
              "citedWindows": array of window ids from the timeline that support the score.
            Cite at least one window whenever the timeline contains windows.
            Base the assessment only on the supplied observations. Do not invent events.
            If any modality is listed under "missingModalities", the narrative must say explicitly
            that this analysis was unavailable and that the assessment is less complete.
            """;

    private final ObjectMapper om;
    private final int maxPromptEntries;

    public PromptBuilder(ObjectMapper om, FusionProperties props) {
        this.om = om;
        this.maxPromptEntries = Math.max(1, props.getMaxPromptEntries());
    }

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    /**
     * Structured context for one request. The missing modality list and its disclosure
     * instruction are always present when something is missing.
     */
    public String userPrompt(Timeline timeline, List<Modality> missing, Map<Modality, Double> weights, double coverage) {
        List<TimelineEntry> entries = capEntries(timeline.entries());
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("durationMs", timeline.durationMs());
        ctx.put("summary", timeline.summary());
        ctx.put("windows", timeline.windows());
        ctx.put("entries", entries);
        if (entries.size() < timeline.entries().size()) {
            ctx.put("entriesOmitted", timeline.entries().size() - entries.size());
        }
        ctx.put("modalityWeights", weights);
        ctx.put("evidenceCoverage", coverage);
        ctx.put("missingModalities", missing.stream().map(Modality::key).toList());
        if (!missing.isEmpty()) {
            ctx.put("disclosureRequired", "The narrative must state that the "
                    + missing.stream().map(Modality::key).collect(Collectors.joining(" and "))
                    + " analysis was unavailable for this video.");
        }
        try {
            return "Timeline:\n" + om.writeValueAsString(ctx);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize fusion prompt", e);
        }
    }

    public String repairPrompt(List<String> violations) {
        StringBuilder sb = new StringBuilder("Your previous reply did not match the required format:\n");
        for (String v : violations) {
            sb.append("- ").append(v).append('\n');
        }
        sb.append("Reply again with a corrected JSON object only.");
        return sb.toString();
    }

    /** Keeps the most confident entries when over the cap, then restores time order. */
    List<TimelineEntry> capEntries(List<TimelineEntry> entries) {
        if (entries.size() <= maxPromptEntries) {
            return entries;
        }
        List<Integer> idx = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) idx.add(i);
        idx.sort(Comparator.comparingDouble((Integer i) -> -entries.get(i).confidence()).thenComparing(i -> i));
        List<Integer> kept = new ArrayList<>(idx.subList(0, maxPromptEntries));
        Collections.sort(kept);
        return kept.stream().map(entries::get).toList();
    }
}
