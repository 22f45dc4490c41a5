package com.example.riskscan_backend.engine.Interfaces;

import java.nio.file.Path;

public interface AudioExtractor {
    /** Writes a mono PCM wav of {@code source} to {@code target}. */
    void extractWav(Path source, Path target, int sampleRate) throws java.io.IOException;
}
