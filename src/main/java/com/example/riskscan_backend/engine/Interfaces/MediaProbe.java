package com.example.riskscan_backend.engine.Interfaces;

import java.nio.file.Path;
import java.util.List;

public interface MediaProbe {
    record Stream(String codecType, String codecName) {}
    record MediaInfo(List<String> containers, long durationMs, List<Stream> streams) {
        public boolean hasAudio() {
            return streams.stream().anyMatch(s -> "audio".equals(s.codecType()));
        }

        public String videoCodec() {
            return streams.stream()
                    .filter(s -> "video".equals(s.codecType()))
                    .map(Stream::codecName)
                    .findFirst()
                    .orElse(null);
        }
    }

    /**
     * @throws java.io.IOException when the file is not readable media.
     */
    MediaInfo probe(Path file) throws java.io.IOException;
}
