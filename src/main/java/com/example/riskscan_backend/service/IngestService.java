package com.example.riskscan_backend.service;

import com.example.riskscan_backend.config.IngestProperties;
import com.example.riskscan_backend.engine.Interfaces.AudioExtractor;
import com.example.riskscan_backend.engine.Interfaces.MediaProbe;
import com.example.riskscan_backend.exception.ValidationException;
import com.example.riskscan_backend.model.AnalysisEvent;
import com.example.riskscan_backend.model.AnalysisRequest;
import com.example.riskscan_backend.service.Interfaces.StorageService;
import com.example.riskscan_backend.service.orchestration.AnalysisStore;
import com.example.riskscan_backend.util.FailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Admission of uploaded videos. A rejected upload still yields a persisted request, created
 * directly in FAILED with the rejection reason, and is never retried.
 */
@Service
public class IngestService {
    private static final Logger LOGGER = LoggerFactory.getLogger(IngestService.class);

    private final StorageService storage;
    private final MediaProbe probe;
    private final AudioExtractor audio;
    private final AnalysisStore store;
    private final IngestProperties props;
    private final Clock clock;

    public IngestService(StorageService storage, MediaProbe probe, AudioExtractor audio, AnalysisStore store,
                         IngestProperties props, Clock clock) {
        this.storage = storage;
        this.probe = probe;
        this.audio = audio;
        this.store = store;
        this.props = props;
        this.clock = clock;
    }

    public static String sourceKey(UUID id, String ext) {
        return "uploads/" + id + "/source." + ext;
    }

    public static String audioKey(UUID id) {
        return "uploads/" + id + "/audio.wav";
    }

    /**
     * @param upload           local copy of the uploaded bytes; the caller owns and deletes it.
     * @param originalFilename client side file name, used for the extension check.
     * @param language         BCP-47 transcription language, defaults to {@code ingest.default-language}.
     */
    public AnalysisRequest ingest(Path upload, String originalFilename, String language) {
        UUID id = UUID.randomUUID();
        String lang = (language == null || language.isBlank()) ? props.getDefaultLanguage() : language.trim();
        String ext = extension(originalFilename);
        String sourceKey = null;
        String audioKey = null;
        try {
            checkExtension(ext, originalFilename);
            long size = Files.size(upload);
            if (size > props.getMaxBytes()) {
                throw new ValidationException(FailureReason.TOO_LARGE,
                        "File is " + size + " bytes, limit is " + props.getMaxBytes());
            }

            sourceKey = sourceKey(id, ext);
            storage.uploadToRaw(upload, sourceKey);
            Path source = storage.resolveRaw(sourceKey);

            MediaProbe.MediaInfo info = probeOrReject(source);
            long durationMs = checkMedia(info);

            audioKey = audioKey(id);
            extractAudio(source, audioKey);

            Instant now = clock.instant();
            AnalysisRequest saved = store.saveRequest(new AnalysisRequest(id, sourceKey, audioKey, originalFilename, lang, durationMs, now));
            LOGGER.info("INGEST accepted requestId={} file={} durationMs={} lang={}", id, originalFilename, durationMs, lang);
            store.recordEvent(new AnalysisEvent(id, "RECEIVED", "Video accepted for analysis",
                    Map.of("durationMs", durationMs, "language", lang), now));
            return saved;
        } catch (ValidationException e) {
            return reject(id, originalFilename, lang, e, sourceKey, audioKey);
        } catch (IOException e) {
            return reject(id, originalFilename, lang,
                    new ValidationException(FailureReason.INVALID_FORMAT, "Upload could not be read", e), sourceKey, audioKey);
        }
    }

    private void checkExtension(String ext, String originalFilename) {
        Set<String> allowed = props.getAllowedExtensions().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        if (ext.isEmpty() || !allowed.contains(ext)) {
            throw new ValidationException(FailureReason.INVALID_FORMAT,
                    "Unsupported file type '" + originalFilename + "', allowed: " + props.getAllowedExtensions());
        }
    }

    private MediaProbe.MediaInfo probeOrReject(Path source) {
        try {
            return probe.probe(source);
        } catch (IOException e) {
            throw new ValidationException(FailureReason.INVALID_FORMAT, "File is not a readable video", e);
        }
    }

    /** @return duration in milliseconds. */
    private long checkMedia(MediaProbe.MediaInfo info) {
        boolean containerOk = info.containers().stream().anyMatch(c -> props.getAllowedContainers().contains(c));
        if (!containerOk) {
            throw new ValidationException(FailureReason.INVALID_FORMAT, "Unsupported container " + info.containers());
        }
        String codec = info.videoCodec();
        if (codec == null) {
            throw new ValidationException(FailureReason.INVALID_FORMAT, "No video stream found");
        }
        if (!props.getAllowedVideoCodecs().contains(codec)) {
            throw new ValidationException(FailureReason.INVALID_FORMAT, "Unsupported video codec " + codec);
        }
        if (info.durationMs() <= 0) {
            throw new ValidationException(FailureReason.INVALID_FORMAT, "Video has no measurable duration");
        }
        if (info.durationMs() > props.getMaxDurationSeconds() * 1000) {
            throw new ValidationException(FailureReason.TOO_LARGE,
                    "Video lasts " + info.durationMs() / 1000 + "s, limit is " + props.getMaxDurationSeconds() + "s");
        }
        if (!info.hasAudio()) {
            throw new ValidationException(FailureReason.EXTRACTION_FAILURE, "Video has no audio track");
        }
        return info.durationMs();
    }

    private void extractAudio(Path source, String audioKey) throws IOException {
        Path tmp = storage.createWorkFile("audio-", ".wav");
        try {
            audio.extractWav(source, tmp, props.getAudioSampleRate());
            storage.uploadToRaw(tmp, audioKey);
        } catch (IOException e) {
            throw new ValidationException(FailureReason.EXTRACTION_FAILURE, "Audio extraction failed: " + e.getMessage(), e);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private AnalysisRequest reject(UUID id, String originalFilename, String lang, ValidationException e,
                                   String sourceKey, String audioKey) {
        Instant now = clock.instant();
        LOGGER.warn("INGEST rejected requestId={} file={} reason={} message={}", id, originalFilename, e.getReason(), e.getMessage());
        cleanup(sourceKey);
        cleanup(audioKey);
        AnalysisRequest saved = store.saveRequest(AnalysisRequest.rejected(id, originalFilename, lang, e.getReason(), e.getMessage(), now));
        store.recordEvent(new AnalysisEvent(id, "FAILED", e.getMessage(), Map.of("reason", e.getReason().name()), now));
        return saved;
    }

    private void cleanup(String key) {
        if (key == null) return;
        try {
            storage.deleteRaw(key);
        } catch (RuntimeException ex) {
            LOGGER.warn("INGEST cleanup failed key={} error={}", key, ex.toString());
        }
    }

    static String extension(String filename) {
        if (filename == null) return "";
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot < 0 || dot == name.length() - 1 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
