package com.example.voiceover_backend.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Cached automatic voiceover, one slot per {@code <accent>:<fingerprint>:<provider>} key.
 */
@Entity
@Table(name = "cached_voiceover")
public class CachedVoiceover {
    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 255)
    private String id;
    @Column(name = "language_accent_code", nullable = false, length = 32)
    private String languageAccentCode;
    @Column(name = "provider", nullable = false, length = 64)
    private String provider;
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;
    @Column(name = "plaintext", nullable = false, length = 100_000)
    private String plaintext;
    @Column(name = "voiceover_object_key", nullable = false, length = 1024)
    private String voiceoverObjectKey;

    // [{"token": "...", "audio_offset_msecs": 0.0}, ...]
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "audio_offsets", nullable = false)
    private JsonNode audioOffsets;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected CachedVoiceover() {}

    public CachedVoiceover(String id, String languageAccentCode, String provider, String fingerprint) {
        this.id = id;
        this.languageAccentCode = languageAccentCode;
        this.provider = provider;
        this.fingerprint = fingerprint;
    }

    public static String generateId(String languageAccentCode, String fingerprint, String provider) {
        return languageAccentCode + ":" + fingerprint + ":" + provider;
    }

    public String getId() { return id; }
    public String getLanguageAccentCode() { return languageAccentCode; }
    public String getProvider() { return provider; }
    public String getFingerprint() { return fingerprint; }
    public String getPlaintext() { return plaintext; }
    public void setPlaintext(String plaintext) { this.plaintext = plaintext; }
    public String getVoiceoverObjectKey() { return voiceoverObjectKey; }
    public void setVoiceoverObjectKey(String voiceoverObjectKey) { this.voiceoverObjectKey = voiceoverObjectKey; }
    public JsonNode getAudioOffsets() { return audioOffsets; }
    public void setAudioOffsets(JsonNode audioOffsets) { this.audioOffsets = audioOffsets; }
    public Long getVersion() { return version; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
