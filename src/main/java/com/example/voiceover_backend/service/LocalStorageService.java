package com.example.voiceover_backend.service;

import com.example.voiceover_backend.exception.StorageException;
import com.example.voiceover_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;
    private final Path blobDir;

    public LocalStorageService(Path baseDir, String prefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.blobDir = this.baseDir.resolve(prefix).normalize();

        try {
            Files.createDirectories(blobDir);
            LOGGER.info("LocalStorageService ready. base={}, blobs={}", this.baseDir, this.blobDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public void commit(String objectKey, byte[] content, String mimeType) {
        if (content == null) {
            throw new StorageException("No content for objectKey: " + objectKey);
        }
        Path target = safeResolve(objectKey);
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, REPLACE_EXISTING, ATOMIC_MOVE);
            } catch (java.nio.file.AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, REPLACE_EXISTING);
            }
            LOGGER.debug("Blob committed key={} bytes={} mimeType={}", objectKey, content.length, mimeType);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Commit failed for " + objectKey, e);
        }
    }

    @Override
    public byte[] get(String objectKey) {
        Path src = safeResolve(objectKey);
        try {
            return Files.readAllBytes(src);
        } catch (NoSuchFileException e) {
            throw new StorageException("Blob not found: " + objectKey, e);
        } catch (IOException e) {
            throw new StorageException("Read failed for " + objectKey, e);
        }
    }

    @Override
    public boolean exists(String objectKey) {
        return Files.exists(safeResolve(objectKey));
    }

    @Override
    public void delete(String objectKey) {
        Path p = safeResolve(objectKey);
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    @Override
    public Path root() {
        return blobDir;
    }

    private Path safeResolve(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = blobDir.resolve(normalizedKey).normalize();
        if (!p.startsWith(blobDir) || p.equals(blobDir)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    private void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOGGER.warn("Temp blob cleanup failed path={} error={}", p, e.toString());
        }
    }
}
