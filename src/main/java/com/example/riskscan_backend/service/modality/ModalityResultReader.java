package com.example.riskscan_backend.service.modality;

import com.example.riskscan_backend.dto.SentimentAnalysis;
import com.example.riskscan_backend.dto.Transcript;
import com.example.riskscan_backend.dto.VisualAnalysis;
import com.example.riskscan_backend.exception.StorageException;
import com.example.riskscan_backend.service.Interfaces.StorageService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Reads persisted modality results back from out storage.
 */
@Component
public class ModalityResultReader {
    private final StorageService storage;
    private final ObjectMapper om;

    public ModalityResultReader(StorageService storage, ObjectMapper om) {
        this.storage = storage;
        this.om = om;
    }

    public VisualAnalysis visual(String ref) {
        return read(ref, VisualAnalysis.class);
    }

    public Transcript transcript(String ref) {
        return read(ref, Transcript.class);
    }

    public SentimentAnalysis sentiment(String ref) {
        return read(ref, SentimentAnalysis.class);
    }

    public <T> T read(String ref, Class<T> type) {
        if (ref == null) {
            return null;
        }
        try {
            return om.readValue(storage.readFromOut(ref), type);
        } catch (IOException e) {
            throw new StorageException("Unreadable " + type.getSimpleName() + " at " + ref, e);
        }
    }
}
