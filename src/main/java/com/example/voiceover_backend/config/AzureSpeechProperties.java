package com.example.voiceover_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "speech.azure")
public class AzureSpeechProperties {

    private String region = "eastus";
    private String apiKeySecretName = "AZURE_TTS_API_KEY";

    public AzureSpeechProperties() {
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getApiKeySecretName() {
        return apiKeySecretName;
    }

    public void setApiKeySecretName(String apiKeySecretName) {
        this.apiKeySecretName = apiKeySecretName;
    }
}
