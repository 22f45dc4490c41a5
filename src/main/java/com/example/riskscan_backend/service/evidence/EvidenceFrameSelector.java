package com.example.riskscan_backend.service.evidence;

import com.example.riskscan_backend.config.EvidenceProperties;
import com.example.riskscan_backend.dto.EvidenceFrame;
import com.example.riskscan_backend.dto.FusedAssessment;
import com.example.riskscan_backend.dto.Timeline;
import com.example.riskscan_backend.dto.TimelineEntry;
import com.example.riskscan_backend.dto.TimelineWindow;
import com.example.riskscan_backend.engine.Interfaces.FrameExtractor;
import com.example.riskscan_backend.service.Interfaces.StorageService;
import com.example.riskscan_backend.util.Modality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Picks still frames for the windows cited by the assessment.
 * <p>
 * Per window, timestamps of the most confident visual observations come first, then evenly
 * spaced points. Every frame keeps at least {@code evidence.min-spacing-ms} (never under 1 ms) from
 * all others.
 * Evidence is best effort: any extraction failure yields an empty list.
 */
@Service
public class EvidenceFrameSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(EvidenceFrameSelector.class);

    private final FrameExtractor extractor;
    private final StorageService storage;
    private final int framesPerWindow;
    private final long minSpacingMs;

    public EvidenceFrameSelector(FrameExtractor extractor, StorageService storage, EvidenceProperties props) {
        this.extractor = extractor;
        this.storage = storage;
        this.framesPerWindow = Math.max(0, props.getFramesPerWindow());
        // frames are stored by timestamp, so two frames never share a millisecond
        this.minSpacingMs = Math.max(1, props.getMinSpacingMs());
    }

    public List<EvidenceFrame> select(UUID requestId, String sourceRef, long durationMs, Timeline timeline, FusedAssessment assessment) {
        List<EvidenceFrame> planned = plan(durationMs, timeline, assessment.citedWindows());
        if (planned.isEmpty()) {
            return List.of();
        }
        try {
            Path source = storage.resolveRaw(sourceRef);
            List<EvidenceFrame> out = new ArrayList<>(planned.size());
            for (EvidenceFrame f : planned) {
                String key = "analysis/" + requestId + "/frames/" + f.timestampMs() + ".jpg";
                Path tmp = storage.createWorkFile("frame-", ".jpg");
                try {
                    extractor.extractFrame(source, f.timestampMs(), tmp);
                    storage.uploadToOut(tmp, key);
                } finally {
                    Files.deleteIfExists(tmp);
                }
                out.add(new EvidenceFrame(f.timestampMs(), key, f.windowId()));
            }
            LOGGER.info("EVIDENCE requestId={} frames={} windows={}", requestId, out.size(), assessment.citedWindows());
            return out;
        } catch (Exception e) {
            LOGGER.warn("EVIDENCE extraction failed requestId={} planned={} cause={}", requestId, planned.size(), e.toString());
            return List.of();
        }
    }

    /**
     * Chooses timestamps without touching the video. {@code frameRef} is left null.
     */
    List<EvidenceFrame> plan(long durationMs, Timeline timeline, List<String> citedWindows) {
        long upper = durationMs > 0 ? durationMs - 1 : Long.MAX_VALUE;
        Map<String, TimelineWindow> windows = new HashMap<>();
        for (TimelineWindow w : timeline.windows()) windows.put(w.id(), w);

        List<EvidenceFrame> chosen = new ArrayList<>();
        for (String id : citedWindows) {
            TimelineWindow w = windows.get(id);
            if (w == null || framesPerWindow == 0) continue;
            int taken = 0;
            for (long candidate : candidates(w, timeline.entries())) {
                if (taken >= framesPerWindow) break;
                long ts = Math.min(Math.max(candidate, 0), upper);
                if (farEnough(ts, chosen)) {
                    chosen.add(new EvidenceFrame(ts, null, id));
                    taken++;
                }
            }
        }
        chosen.sort(Comparator.comparingLong(EvidenceFrame::timestampMs));
        return chosen;
    }

    private List<Long> candidates(TimelineWindow w, List<TimelineEntry> entries) {
        List<Long> out = new ArrayList<>();
        entries.stream()
                .filter(e -> w.id().equals(e.windowId()) && e.source() == Modality.VISUAL)
                .sorted(Comparator.comparingDouble((TimelineEntry e) -> -e.confidence())
                        .thenComparingLong(e -> e.window().startMs()))
                .forEach(e -> out.add(e.window().midpointMs()));
        long start = w.window().startMs();
        long span = w.window().durationMs();
        for (int i = 1; i <= framesPerWindow; i++) {
            out.add(start + span * i / (framesPerWindow + 1));
        }
        return out;
    }

    private boolean farEnough(long ts, List<EvidenceFrame> chosen) {
        for (EvidenceFrame f : chosen) {
            if (Math.abs(f.timestampMs() - ts) < minSpacingMs) {
                return false;
            }
        }
        return true;
    }
}
