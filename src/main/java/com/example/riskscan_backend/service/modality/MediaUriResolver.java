package com.example.riskscan_backend.service.modality;

import com.example.riskscan_backend.service.Interfaces.StorageService;
import org.springframework.stereotype.Component;

import java.net.URI;

/**
 * Location of a stored upload as handed to an external provider.
 */
@Component
public class MediaUriResolver {
    static final long PRESIGN_TTL_SECONDS = 6 * 3600;

    private final StorageService storage;

    public MediaUriResolver(StorageService storage) {
        this.storage = storage;
    }

    public URI resolve(String rawKey) {
        URI presigned = storage.presignDownload(rawKey, PRESIGN_TTL_SECONDS);
        return presigned != null ? presigned : storage.resolveRaw(rawKey).toUri();
    }
}
