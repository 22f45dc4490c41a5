package com.example.riskscan_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "evidence")
public class EvidenceProperties {

    /** K: maximum frames taken from one cited window. */
    private int framesPerWindow = 3;
    private long minSpacingMs = 2000;
    /** ffmpeg {@code -q:v}, 2 is near lossless. */
    private int frameQuality = 2;

    public int getFramesPerWindow() {
        return framesPerWindow;
    }

    public void setFramesPerWindow(int framesPerWindow) {
        this.framesPerWindow = framesPerWindow;
    }

    public long getMinSpacingMs() {
        return minSpacingMs;
    }

    public void setMinSpacingMs(long minSpacingMs) {
        this.minSpacingMs = minSpacingMs;
    }

    public int getFrameQuality() {
        return frameQuality;
    }

    public void setFrameQuality(int frameQuality) {
        this.frameQuality = frameQuality;
    }
}
