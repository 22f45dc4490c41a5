package com.example.riskscan_backend.engine;

import com.example.riskscan_backend.engine.Interfaces.MediaProbe;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class FfprobeMediaProbe implements MediaProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeMediaProbe.class);
    private static final long TIMEOUT_SECONDS = 60;

    private final String ffprobe;
    private final ObjectMapper om;

    public FfprobeMediaProbe(String ffprobe, ObjectMapper om) {
        this.ffprobe = (ffprobe == null || ffprobe.isBlank()) ? "ffprobe" : ffprobe;
        this.om = om;
    }

    @Override
    public MediaInfo probe(Path file) throws IOException {
        FfmpegProcess.Output out = FfmpegProcess.run(List.of(
                ffprobe, "-v", "error",
                "-print_format", "json",
                "-show_format", "-show_streams",
                file.toAbsolutePath().toString()), TIMEOUT_SECONDS);
        if (out.exitCode() != 0) {
            throw new IOException("ffprobe failed with code " + out.exitCode() + ": " + FfmpegProcess.tail(out.text(), 500));
        }
        JsonNode root = om.readTree(out.text());
        JsonNode format = root.path("format");
        if (format.isMissingNode()) {
            throw new IOException("ffprobe returned no format section");
        }
        List<String> containers = Arrays.stream(format.path("format_name").asText("").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        long durationMs = Math.round(format.path("duration").asDouble(0) * 1000);

        List<Stream> streams = new ArrayList<>();
        for (JsonNode s : root.path("streams")) {
            streams.add(new Stream(s.path("codec_type").asText(""), s.path("codec_name").asText("")));
        }
        LOGGER.debug("ffprobe {} containers={} durationMs={} streams={}", file.getFileName(), containers, durationMs, streams.size());
        return new MediaInfo(containers, durationMs, streams);
    }
}
