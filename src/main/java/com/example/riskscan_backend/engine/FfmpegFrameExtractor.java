package com.example.riskscan_backend.engine;

import com.example.riskscan_backend.engine.Interfaces.FrameExtractor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class FfmpegFrameExtractor implements FrameExtractor {
    private static final long TIMEOUT_SECONDS = 60;
    private final String ffmpeg;
    private final int quality;

    public FfmpegFrameExtractor(String ffmpeg, int quality) {
        this.ffmpeg = (ffmpeg == null || ffmpeg.isBlank()) ? "ffmpeg" : ffmpeg;
        this.quality = quality;
    }

    @Override
    public void extractFrame(Path source, long timestampMs, Path target) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        // -ss before -i seeks on keyframes then decodes forward, accurate and fast
        FfmpegProcess.Output out = FfmpegProcess.run(List.of(
                ffmpeg, "-hide_banner", "-loglevel", "error",
                "-ss", String.format(Locale.ROOT, "%.3f", timestampMs / 1000.0),
                "-i", source.toAbsolutePath().toString(),
                "-frames:v", "1",
                "-q:v", String.valueOf(quality),
                "-y", target.toAbsolutePath().toString()), TIMEOUT_SECONDS);
        if (out.exitCode() != 0) {
            throw new IOException("ffmpeg frame extraction failed at " + timestampMs + "ms: " + FfmpegProcess.tail(out.text(), 500));
        }
        if (!Files.exists(target) || Files.size(target) == 0) {
            throw new IOException("ffmpeg produced no frame at " + timestampMs + "ms");
        }
    }
}
