package com.example.riskscan_backend.engine.Interfaces;

import java.net.URI;
import java.util.List;

public interface VisualEmotionClient {
    record EmotionScore(String type, double confidence) {}
    record FaceSample(long timestampMs, List<EmotionScore> emotions) {}

    /** @return provider job id. */
    String startFaceEmotion(URI videoUri, String clientToken);

    ProviderJob<List<FaceSample>> getFaceEmotion(String jobId);

    void cancel(String jobId);
}
