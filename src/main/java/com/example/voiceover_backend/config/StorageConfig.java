package com.example.voiceover_backend.config;

import com.example.voiceover_backend.service.LocalStorageService;
import com.example.voiceover_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Blob store for voiceover audio: a local directory tree under {@code storage.local.base-dir}.
 */
@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public StorageService voiceoverBlobStore(StorageProperties properties) {
        LocalStorageService store = new LocalStorageService(Path.of(properties.getBaseDir()), properties.getPrefix());
        LOGGER.info("Voiceover blob store root={}", store.root());
        return store;
    }
}
