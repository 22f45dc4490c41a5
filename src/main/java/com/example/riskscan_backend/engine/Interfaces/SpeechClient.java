package com.example.riskscan_backend.engine.Interfaces;

import com.example.riskscan_backend.dto.Transcript;

import java.net.URI;

public interface SpeechClient {
    /** @return provider job id. */
    String startTranscription(URI mediaUri, String languageCode, String clientToken);

    ProviderJob<Transcript> getTranscription(String jobId);

    void cancel(String jobId);
}
