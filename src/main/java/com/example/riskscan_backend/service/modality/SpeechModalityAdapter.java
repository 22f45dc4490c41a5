package com.example.riskscan_backend.service.modality;

import com.example.riskscan_backend.dto.Transcript;
import com.example.riskscan_backend.engine.Interfaces.ModalityAdapter;
import com.example.riskscan_backend.engine.Interfaces.ProviderJob;
import com.example.riskscan_backend.engine.Interfaces.SpeechClient;
import com.example.riskscan_backend.util.Modality;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class SpeechModalityAdapter implements ModalityAdapter {
    private final SpeechClient client;
    private final MediaUriResolver uris;
    private final ObjectMapper om;

    public SpeechModalityAdapter(SpeechClient client, MediaUriResolver uris, ObjectMapper om) {
        this.client = client;
        this.uris = uris;
        this.om = om;
    }

    @Override
    public Modality modality() {
        return Modality.SPEECH;
    }

    @Override
    public String submit(Input input) {
        return client.startTranscription(uris.resolve(input.audioRef()), input.language(), input.idempotencyKey());
    }

    @Override
    public PollResult poll(String handle) {
        ProviderJob<Transcript> job = client.getTranscription(handle);
        return switch (job.status()) {
            case IN_PROGRESS -> PollResult.pending();
            case FAILED -> PollResult.failed(job.message());
            case SUCCEEDED -> {
                try {
                    yield PollResult.succeeded(om.writeValueAsString(job.result()));
                } catch (JsonProcessingException e) {
                    throw new IllegalStateException("Cannot serialize transcript", e);
                }
            }
        };
    }

    @Override
    public void abort(String handle) {
        client.cancel(handle);
    }
}
