package com.example.riskscan_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {

    private List<String> allowedExtensions = List.of("mp4", "mov", "avi", "mkv");
    /** Matched against the comma separated ffprobe {@code format_name}. */
    private List<String> allowedContainers = List.of("mov", "mp4", "matroska", "avi");
    private List<String> allowedVideoCodecs = List.of("h264", "hevc", "mpeg4", "vp8", "vp9", "av1");
    private long maxBytes = 500L * 1024 * 1024;
    private long maxDurationSeconds = 1800;
    private String defaultLanguage = "pt-BR";
    private int audioSampleRate = 16000;

    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }

    public List<String> getAllowedContainers() {
        return allowedContainers;
    }

    public void setAllowedContainers(List<String> allowedContainers) {
        this.allowedContainers = allowedContainers;
    }

    public List<String> getAllowedVideoCodecs() {
        return allowedVideoCodecs;
    }

    public void setAllowedVideoCodecs(List<String> allowedVideoCodecs) {
        this.allowedVideoCodecs = allowedVideoCodecs;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public void setMaxBytes(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    public long getMaxDurationSeconds() {
        return maxDurationSeconds;
    }

    public void setMaxDurationSeconds(long maxDurationSeconds) {
        this.maxDurationSeconds = maxDurationSeconds;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    public int getAudioSampleRate() {
        return audioSampleRate;
    }

    public void setAudioSampleRate(int audioSampleRate) {
        this.audioSampleRate = audioSampleRate;
    }
}
