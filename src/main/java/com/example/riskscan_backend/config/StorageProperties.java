package com.example.riskscan_backend.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Layout of the local object store: uploads and extracted audio under raw, analysis artifacts
 * and reports under out, scratch files under work. All three share the base volume so finished
 * files are moved rather than copied across devices.
 */
@Validated
@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    @NotBlank
    private String baseDir = "./data";
    @NotBlank
    private String rawPrefix = "raw";
    @NotBlank
    private String outPrefix = "out";
    @NotBlank
    private String workPrefix = "work";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getRawPrefix() { return rawPrefix; }
    public void setRawPrefix(String rawPrefix) { this.rawPrefix = rawPrefix; }

    public String getOutPrefix() { return outPrefix; }
    public void setOutPrefix(String outPrefix) { this.outPrefix = outPrefix; }

    public String getWorkPrefix() { return workPrefix; }
    public void setWorkPrefix(String workPrefix) { this.workPrefix = workPrefix; }
}
