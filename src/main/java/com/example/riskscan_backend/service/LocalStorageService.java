package com.example.riskscan_backend.service;

import com.example.riskscan_backend.exception.StorageException;
import com.example.riskscan_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


import java.io.IOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;


public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;
    private final Path rawDir;
    private final Path outDir;
    private final Path workDir;

    public LocalStorageService(Path baseDir, String rawPrefix, String outPrefix) {
        this(baseDir, rawPrefix, outPrefix, "work");
    }

    public LocalStorageService(Path baseDir, String rawPrefix, String outPrefix, String workPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.rawDir = this.baseDir.resolve(rawPrefix).normalize();
        this.outDir = this.baseDir.resolve(outPrefix).normalize();
        this.workDir = this.baseDir.resolve(workPrefix).normalize();

        try {
            Files.createDirectories(rawDir);
            Files.createDirectories(outDir);
            Files.createDirectories(workDir);
            LOGGER.info("LocalStorageService ready. base={}, raw={}, out={}, work={}", this.baseDir, this.rawDir, this.outDir, this.workDir);
        } catch (IOException e){
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public URI presignDownload(String objectKey, long ttlSeconds) {
        return resolveRaw(objectKey).toUri();
    }

    @Override
    public Path resolveRaw(String objectKey){
        return safeResolve(rawDir, objectKey);
    }

    @Override
    public Path resolveOut(String objectKey){
        return safeResolve(outDir, objectKey);
    }

    @Override
    public Path createWorkFile(String prefix, String suffix) throws IOException {
        Files.createDirectories(workDir);
        return Files.createTempFile(workDir, prefix, suffix);
    }

    @Override
    public void uploadToRaw(Path sourceFile, String objectKey) {
        copyFile(sourceFile, safeResolve(rawDir, objectKey));
    }

    @Override
    public void uploadToOut(Path sourceFile, String objectKey) {
        copyFile(sourceFile, safeResolve(outDir, objectKey));
    }

    @Override
    public void writeToOut(String objectKey, byte[] content) {
        Path target = safeResolve(outDir, objectKey);
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), ".tmp-", ".part");
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException e) {
            throw new StorageException("Write failed to " + target, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    LOGGER.warn("Temp cleanup failed path={} err={}", tmp, e.toString());
                }
            }
        }
    }

    @Override
    public byte[] readFromOut(String objectKey) {
        Path source = safeResolve(outDir, objectKey);
        try {
            return Files.readAllBytes(source);
        } catch (IOException e) {
            throw new StorageException("Read failed from out: " + objectKey, e);
        }
    }

    @Override
    public boolean existsInRaw(String objectKey) {
        return Files.exists(safeResolve(rawDir, objectKey));
    }

    @Override
    public boolean existsInOut(String objectKey) {
        return Files.exists(safeResolve(outDir, objectKey));
    }

    @Override
    public void deleteRaw(String objectKey) {
        Path p = safeResolve(rawDir, objectKey);
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    private Path safeResolve(Path root, String objectKey) {
        if(objectKey == null || objectKey.isBlank()){
            throw new StorageException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    private void copyFile(Path source, Path target) {
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Copy failed to " + target, e);
        }
    }
}
