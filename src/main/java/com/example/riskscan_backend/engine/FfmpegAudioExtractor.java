package com.example.riskscan_backend.engine;

import com.example.riskscan_backend.engine.Interfaces.AudioExtractor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class FfmpegAudioExtractor implements AudioExtractor {
    private static final long TIMEOUT_SECONDS = 600;
    private final String ffmpeg;

    public FfmpegAudioExtractor(String ffmpeg) {
        this.ffmpeg = (ffmpeg == null || ffmpeg.isBlank()) ? "ffmpeg" : ffmpeg;
    }

    @Override
    public void extractWav(Path source, Path target, int sampleRate) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        FfmpegProcess.Output out = FfmpegProcess.run(List.of(
                ffmpeg, "-hide_banner", "-loglevel", "error",
                "-i", source.toAbsolutePath().toString(),
                "-vn", "-ac", "1", "-ar", String.valueOf(sampleRate),
                "-c:a", "pcm_s16le",
                "-y", target.toAbsolutePath().toString()), TIMEOUT_SECONDS);
        if (out.exitCode() != 0) {
            throw new IOException("ffmpeg audio extraction failed with code " + out.exitCode() + ": " + FfmpegProcess.tail(out.text(), 500));
        }
        if (!Files.exists(target) || Files.size(target) == 0) {
            throw new IOException("ffmpeg produced empty audio");
        }
    }
}
