package com.example.riskscan_backend.service.Interfaces;


import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

public interface StorageService {
    /** Download location handed to external providers; local storage may map this to a file URI. */
    default URI presignDownload(String objectKey, long ttlSeconds) { return null; }

    /** Full local path of an uploaded object (ffmpeg/ffprobe input). */
    Path resolveRaw(String objectKey);

    Path resolveOut(String objectKey);

    /** Empty scratch file on the storage volume; the caller deletes it. */
    Path createWorkFile(String prefix, String suffix) throws IOException;

    /** Copies a file into raw/out, creating parent directories. */
    void uploadToRaw(Path sourceFile, String objectKey);
    void uploadToOut(Path sourceFile, String objectKey);

    /** Writes bytes to out atomically: readers see either the previous or the complete new content. */
    void writeToOut(String objectKey, byte[] content);
    byte[] readFromOut(String objectKey);

    boolean existsInRaw(String objectKey);
    boolean existsInOut(String objectKey);
    void deleteRaw(String objectKey);
}
