package com.example.riskscan_backend.service.modality;

import com.example.riskscan_backend.dto.EmotionEvent;
import com.example.riskscan_backend.dto.TimeWindow;
import com.example.riskscan_backend.dto.VisualAnalysis;
import com.example.riskscan_backend.engine.Interfaces.ModalityAdapter;
import com.example.riskscan_backend.engine.Interfaces.ProviderJob;
import com.example.riskscan_backend.engine.Interfaces.VisualEmotionClient;
import com.example.riskscan_backend.engine.Interfaces.VisualEmotionClient.EmotionScore;
import com.example.riskscan_backend.engine.Interfaces.VisualEmotionClient.FaceSample;
import com.example.riskscan_backend.util.Modality;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Reduces each sampled face to its dominant emotion.
 */
@Component
public class VisualModalityAdapter implements ModalityAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(VisualModalityAdapter.class);
    /** Span credited to a single face sample. */
    static final long SAMPLE_SPAN_MS = 200;

    private final VisualEmotionClient client;
    private final MediaUriResolver uris;
    private final ObjectMapper om;

    public VisualModalityAdapter(VisualEmotionClient client, MediaUriResolver uris, ObjectMapper om) {
        this.client = client;
        this.uris = uris;
        this.om = om;
    }

    @Override
    public Modality modality() {
        return Modality.VISUAL;
    }

    @Override
    public String submit(Input input) {
        return client.startFaceEmotion(uris.resolve(input.sourceRef()), input.idempotencyKey());
    }

    @Override
    public PollResult poll(String handle) {
        ProviderJob<List<FaceSample>> job = client.getFaceEmotion(handle);
        return switch (job.status()) {
            case IN_PROGRESS -> PollResult.pending();
            case FAILED -> PollResult.failed(job.message());
            case SUCCEEDED -> PollResult.succeeded(toJson(toAnalysis(job.result())));
        };
    }

    @Override
    public void abort(String handle) {
        client.cancel(handle);
    }

    static VisualAnalysis toAnalysis(List<FaceSample> samples) {
        List<EmotionEvent> events = new ArrayList<>();
        for (FaceSample s : samples) {
            s.emotions().stream()
                    .max(Comparator.comparingDouble(EmotionScore::confidence))
                    .ifPresent(top -> events.add(new EmotionEvent(
                            new TimeWindow(s.timestampMs(), s.timestampMs() + SAMPLE_SPAN_MS),
                            top.type().toUpperCase(Locale.ROOT),
                            top.confidence())));
        }
        events.sort(Comparator.comparingLong((EmotionEvent e) -> e.window().startMs()).thenComparing(EmotionEvent::label));
        return new VisualAnalysis(events, samples.size());
    }

    private String toJson(VisualAnalysis analysis) {
        try {
            return om.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize visual analysis", e);
        }
    }
}
