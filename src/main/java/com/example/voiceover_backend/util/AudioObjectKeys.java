package com.example.voiceover_backend.util;

/**
 * Blob keys for voiceover audio: {@code <entityType>/<entityId>/audio/<filename>}.
 */
public final class AudioObjectKeys {
    public static final String AUDIO_FOLDER = "audio";

    private AudioObjectKeys() {}

    public static String forEntity(String entityType, String entityId, String filename) {
        requirePlainSegment("entityType", entityType);
        requirePlainSegment("entityId", entityId);
        requirePlainSegment("filename", filename);
        return entityType + "/" + entityId + "/" + AUDIO_FOLDER + "/" + filename;
    }

    private static void requirePlainSegment(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is blank");
        }
        if (value.contains("/") || value.contains("\\") || value.equals(".") || value.equals("..")) {
            throw new IllegalArgumentException(name + " must be a plain name: " + value);
        }
    }
}
