package com.example.voiceover_backend.config;

import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine;
import com.example.voiceover_backend.engine.AzureSpeechSynthesisEngine;
import com.example.voiceover_backend.service.Interfaces.SecretsService;
import com.example.voiceover_backend.service.Interfaces.StorageService;
import org.springframework.boot.actuate.health.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator speechSynthesisHealth(SpeechSynthesisEngine engine,
                                                 SecretsService secretsService,
                                                 AzureSpeechProperties props) {
        return () -> {
            Health.Builder builder = Health.up().withDetail("provider", engine.providerId());
            if (AzureSpeechSynthesisEngine.PROVIDER_ID.equals(engine.providerId())) {
                boolean hasKey = secretsService.getSecret(props.getApiKeySecretName()).isPresent();
                if (!hasKey) {
                    return Health.down().withDetail("provider", engine.providerId())
                            .withDetail("credential", "missing").build();
                }
                builder.withDetail("credential", "present").withDetail("region", props.getRegion());
            }
            return builder.build();
        };
    }

    @Bean
    public HealthIndicator blobStorageHealth(StorageService storageService) {
        return () -> {
            var root = storageService.root();
            if (Files.isDirectory(root) && Files.isWritable(root)) {
                return Health.up().withDetail("root", root.toString()).build();
            }
            return Health.down().withDetail("root", root.toString()).withDetail("writable", false).build();
        };
    }
}
