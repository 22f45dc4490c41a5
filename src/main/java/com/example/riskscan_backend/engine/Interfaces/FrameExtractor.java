package com.example.riskscan_backend.engine.Interfaces;

import java.nio.file.Path;

public interface FrameExtractor {
    /** Writes a single JPEG frame of {@code source} at {@code timestampMs} to {@code target}. */
    void extractFrame(Path source, long timestampMs, Path target) throws java.io.IOException;
}
