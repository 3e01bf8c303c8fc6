package com.example.voiceover_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "voiceover")
public class VoiceoverProperties {
    private String entityType = "exploration";
    private long synthesisTimeoutSeconds = 60;
    private String accentCatalog = "voiceovers/autogeneratable_language_accent_list.json";
    private String sampleDir = "voiceovers/samples";

    public String getEntityType() { return entityType; }
    public void setEntityType(String entityType) { this.entityType = entityType; }

    public long getSynthesisTimeoutSeconds() { return synthesisTimeoutSeconds; }
    public void setSynthesisTimeoutSeconds(long synthesisTimeoutSeconds) { this.synthesisTimeoutSeconds = synthesisTimeoutSeconds; }

    public String getAccentCatalog() { return accentCatalog; }
    public void setAccentCatalog(String accentCatalog) { this.accentCatalog = accentCatalog; }

    public String getSampleDir() { return sampleDir; }
    public void setSampleDir(String sampleDir) { this.sampleDir = sampleDir; }
}
