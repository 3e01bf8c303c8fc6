package com.example.voiceover_backend.service.Interfaces;

import java.nio.file.Path;

/**
 * Blob store for voiceover audio. Keys are slash separated, e.g.
 * {@code exploration/exp_1/audio/content_0-en-US-abc.mp3}.
 */
public interface StorageService {
    /** Writes or overwrites the blob under the key. */
    void commit(String objectKey, byte[] content, String mimeType);

    byte[] get(String objectKey);

    boolean exists(String objectKey);

    void delete(String objectKey);

    /** Local root directory, for health checks and tooling. */
    Path root();
}
