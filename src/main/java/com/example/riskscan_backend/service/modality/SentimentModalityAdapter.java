package com.example.riskscan_backend.service.modality;

import com.example.riskscan_backend.dto.SentimentAnalysis;
import com.example.riskscan_backend.dto.Transcript;
import com.example.riskscan_backend.dto.Utterance;
import com.example.riskscan_backend.engine.Interfaces.ModalityAdapter;
import com.example.riskscan_backend.engine.Interfaces.SentimentClient;
import com.example.riskscan_backend.exception.PermanentServiceException;
import com.example.riskscan_backend.service.Interfaces.StorageService;
import com.example.riskscan_backend.util.Modality;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The sentiment capability answers synchronously, so the work happens at submit time and the
 * handle is the storage key of the stored result. A repeated submit with the same key finds the
 * stored result and makes no provider call.
 */
@Component
public class SentimentModalityAdapter implements ModalityAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SentimentModalityAdapter.class);

    private final SentimentClient client;
    private final TranscriptSegmenter segmenter;
    private final ModalityResultReader results;
    private final StorageService storage;
    private final ObjectMapper om;

    public SentimentModalityAdapter(SentimentClient client, TranscriptSegmenter segmenter, ModalityResultReader results,
                                    StorageService storage, ObjectMapper om) {
        this.client = client;
        this.segmenter = segmenter;
        this.results = results;
        this.storage = storage;
        this.om = om;
    }

    @Override
    public Modality modality() {
        return Modality.SENTIMENT;
    }

    @Override
    public String submit(Input input) {
        String key = workKey(input);
        if (storage.existsInOut(key)) {
            LOGGER.debug("SENTIMENT reuse key={}", key);
            return key;
        }
        if (input.speechResultRef() == null) {
            throw new PermanentServiceException("sentiment", "no transcript available for " + input.requestId());
        }
        Transcript transcript = results.transcript(input.speechResultRef());
        List<Utterance> segments = segmenter.segment(transcript, input.durationMs() == null ? 0 : input.durationMs());
        String lang = languageCode(input.language());

        List<Utterance> scored = new ArrayList<>(segments.size());
        if (!segments.isEmpty()) {
            List<SentimentClient.Result> res = client.analyze(lang, segments.stream().map(Utterance::text).toList());
            for (int i = 0; i < segments.size(); i++) {
                Utterance u = segments.get(i);
                SentimentClient.Result r = res.get(i);
                double score = r.scores().positive() - r.scores().negative();
                scored.add(new Utterance(u.index(), u.window(), u.text(), r.sentiment(), score, r.entities()));
            }
        }
        try {
            storage.writeToOut(key, om.writeValueAsString(new SentimentAnalysis(lang, scored)).getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize sentiment analysis", e);
        }
        LOGGER.info("SENTIMENT scored requestId={} utterances={} lang={}", input.requestId(), scored.size(), lang);
        return key;
    }

    @Override
    public PollResult poll(String handle) {
        if (!storage.existsInOut(handle)) {
            return PollResult.failed("sentiment result missing at " + handle);
        }
        return PollResult.succeeded(new String(storage.readFromOut(handle), StandardCharsets.UTF_8));
    }

    static String workKey(Input input) {
        return "analysis/" + input.requestId() + "/work/" + input.idempotencyKey().replace(':', '_') + ".json";
    }

    /** Two-letter form of a BCP-47 tag: {@code pt-BR -> pt}. */
    static String languageCode(String language) {
        if (language == null || language.isBlank()) {
            return "en";
        }
        String lower = language.trim().toLowerCase(Locale.ROOT);
        int dash = lower.indexOf('-');
        return dash > 0 ? lower.substring(0, dash) : lower;
    }
}
