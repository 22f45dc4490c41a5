package com.example.riskscan_backend.service.aggregation;

import com.example.riskscan_backend.dto.*;
import com.example.riskscan_backend.service.modality.TranscriptSegmenter;
import com.example.riskscan_backend.util.Modality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Folds modality results into one time-ordered timeline.
 * <p>
 * Events of the same modality and label whose windows overlap or lie within the adjacency gap
 * are merged into one entry; nothing is discarded. Entries are then grouped into cross-modal
 * windows {@code W1..Wn} by the same overlap rule.
 */
@Service
public class ResultAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultAggregator.class);
    static final String UTTERANCE_LABEL = "UTTERANCE";
    static final String NEGATIVE = "NEGATIVE";

    private static final Comparator<TimelineEntry> TIME_ORDER = Comparator
            .comparingLong((TimelineEntry e) -> e.window().startMs())
            .thenComparingLong(e -> e.window().endMs())
            .thenComparing(TimelineEntry::source)
            .thenComparing(TimelineEntry::label);

    /** Modality results of one request; any of them may be null. */
    public record Inputs(VisualAnalysis visual, Transcript transcript, SentimentAnalysis sentiment) {}

    private final long adjacencyMs;
    private final TranscriptSegmenter segmenter;

    public ResultAggregator(@Value("${timeline.adjacency-ms:500}") long adjacencyMs, TranscriptSegmenter segmenter) {
        this.adjacencyMs = adjacencyMs;
        this.segmenter = segmenter;
    }

    public Timeline aggregate(UUID requestId, long durationMs, Inputs in, Collection<Modality> missing) {
        List<TimelineEntry> raw = new ArrayList<>();
        List<Utterance> utterances = utterances(in, durationMs);

        if (in.visual() != null) {
            for (EmotionEvent e : in.visual().events()) {
                raw.add(new TimelineEntry(null, Modality.VISUAL, e.label(), e.confidence(), e.window(), 1, null));
            }
        }
        boolean scored = in.sentiment() != null;
        for (Utterance u : utterances) {
            if (scored && u.sentiment() != null) {
                double conf = u.sentimentScore() == null ? 0 : Math.abs(u.sentimentScore());
                raw.add(new TimelineEntry(null, Modality.SENTIMENT, u.sentiment(), round(conf), u.window(), 1, u.text()));
            } else {
                raw.add(new TimelineEntry(null, Modality.SPEECH, UTTERANCE_LABEL, 1.0, u.window(), 1, u.text()));
            }
        }

        List<TimelineEntry> merged = mergeSameKind(raw);
        List<TimelineWindow> windows = new ArrayList<>();
        List<TimelineEntry> entries = assignWindows(merged, windows);

        Set<Modality> missingSet = missing.isEmpty() ? EnumSet.noneOf(Modality.class) : EnumSet.copyOf(missing);
        TimelineSummary summary = summarize(entries, windows, utterances, missingSet);
        LOGGER.info("AGGREGATE requestId={} raw={} entries={} windows={} missing={}",
                requestId, raw.size(), entries.size(), windows.size(), missingSet);
        String transcript = in.transcript() == null ? null : in.transcript().text();
        return new Timeline(requestId, durationMs, entries, windows, summary, transcript);
    }

    private List<Utterance> utterances(Inputs in, long durationMs) {
        if (in.sentiment() != null) {
            return in.sentiment().utterances();
        }
        return segmenter.segment(in.transcript(), durationMs);
    }

    List<TimelineEntry> mergeSameKind(List<TimelineEntry> raw) {
        Map<String, List<TimelineEntry>> byKind = new TreeMap<>();
        for (TimelineEntry e : raw) {
            byKind.computeIfAbsent(e.source().name() + "|" + e.label(), k -> new ArrayList<>()).add(e);
        }
        List<TimelineEntry> out = new ArrayList<>();
        for (List<TimelineEntry> group : byKind.values()) {
            group.sort(TIME_ORDER);
            TimelineEntry cur = null;
            for (TimelineEntry e : group) {
                if (cur != null && cur.window().touches(e.window(), adjacencyMs)) {
                    cur = new TimelineEntry(null, cur.source(), cur.label(),
                            Math.max(cur.confidence(), e.confidence()),
                            cur.window().union(e.window()),
                            cur.observations() + e.observations(),
                            joinText(cur.text(), e.text()));
                } else {
                    if (cur != null) out.add(cur);
                    cur = e;
                }
            }
            if (cur != null) out.add(cur);
        }
        out.sort(TIME_ORDER);
        return out;
    }

    private List<TimelineEntry> assignWindows(List<TimelineEntry> sorted, List<TimelineWindow> windowsOut) {
        List<TimelineEntry> out = new ArrayList<>(sorted.size());
        TimeWindow span = null;
        Set<Modality> sources = EnumSet.noneOf(Modality.class);
        int n = 0;
        for (TimelineEntry e : sorted) {
            if (span == null || !span.touches(e.window(), adjacencyMs)) {
                if (span != null) {
                    windowsOut.add(new TimelineWindow("W" + n, span, List.copyOf(sources)));
                }
                n++;
                span = e.window();
                sources = EnumSet.noneOf(Modality.class);
            } else {
                span = span.union(e.window());
            }
            sources.add(e.source());
            out.add(e.withWindowId("W" + n));
        }
        if (span != null) {
            windowsOut.add(new TimelineWindow("W" + n, span, List.copyOf(sources)));
        }
        return out;
    }

    private TimelineSummary summarize(List<TimelineEntry> entries, List<TimelineWindow> windows,
                                      List<Utterance> utterances, Set<Modality> missing) {
        Map<String, Integer> counts = new TreeMap<>();
        int total = 0;
        for (TimelineEntry e : entries) {
            if (e.source() == Modality.VISUAL) {
                counts.merge(e.label(), e.observations(), Integer::sum);
                total += e.observations();
            }
        }
        Map<String, Double> share = new TreeMap<>();
        String dominant = null;
        int best = 0;
        for (Map.Entry<String, Integer> c : counts.entrySet()) {
            share.put(c.getKey(), round((double) c.getValue() / total));
            if (c.getValue() > best) {
                best = c.getValue();
                dominant = c.getKey();
            }
        }

        double sum = 0;
        int scored = 0;
        int negative = 0;
        for (Utterance u : utterances) {
            if (u.sentimentScore() != null) {
                sum += u.sentimentScore();
                scored++;
                if (NEGATIVE.equals(u.sentiment())) negative++;
            }
        }
        Double mean = scored == 0 ? null : round(sum / scored);
        double negShare = scored == 0 ? 0.0 : round((double) negative / scored);

        List<Modality> available = Arrays.stream(Modality.values()).filter(m -> !missing.contains(m)).toList();
        return new TimelineSummary(share, dominant, mean, negShare, utterances.size(), entries.size(), windows.size(),
                available, List.copyOf(missing));
    }

    private static String joinText(String a, String b) {
        if (a == null || a.isBlank()) return b;
        if (b == null || b.isBlank()) return a;
        return a + " " + b;
    }

    static double round(double v) {
        return Math.round(v * 10_000d) / 10_000d;
    }
}
