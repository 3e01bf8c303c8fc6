package com.example.voiceover_backend.config;

import com.example.voiceover_backend.engine.AzureSdkSpeechClient;
import com.example.voiceover_backend.engine.AzureSpeechSynthesisEngine;
import com.example.voiceover_backend.engine.DevModeSpeechSynthesisEngine;
import com.example.voiceover_backend.engine.Interfaces.AzureSpeechClient;
import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine;
import com.example.voiceover_backend.service.Interfaces.SecretsService;
import com.example.voiceover_backend.service.LanguageAccentCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the speech synthesis engine once, from {@code engine.tts}: {@code azure} for the live
 * service, {@code dev} (default) for the offline sample engine.
 */
@Configuration
@EnableConfigurationProperties({AzureSpeechProperties.class, VoiceoverProperties.class})
public class SpeechSynthesisConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpeechSynthesisConfig.class);

    @Bean
    public LanguageAccentCatalog languageAccentCatalog(VoiceoverProperties props) {
        return LanguageAccentCatalog.fromClasspath(props.getAccentCatalog(), new ObjectMapper());
    }

    @Bean
    @ConditionalOnProperty(name = "engine.tts", havingValue = "azure")
    public AzureSpeechClient azureSpeechClient() {
        return new AzureSdkSpeechClient();
    }

    @Bean
    @ConditionalOnProperty(name = "engine.tts", havingValue = "azure")
    public SpeechSynthesisEngine azureSpeechSynthesisEngine(AzureSpeechClient client,
                                                            SecretsService secretsService,
                                                            LanguageAccentCatalog catalog,
                                                            AzureSpeechProperties props) {
        LOGGER.info("Speech synthesis engine: azure region={}", props.getRegion());
        return new AzureSpeechSynthesisEngine(client, secretsService, catalog, props);
    }

    @Bean
    @ConditionalOnProperty(name = "engine.tts", havingValue = "dev", matchIfMissing = true)
    public SpeechSynthesisEngine devModeSpeechSynthesisEngine(LanguageAccentCatalog catalog, VoiceoverProperties props) {
        LOGGER.info("Speech synthesis engine: dev samples={}", props.getSampleDir());
        return new DevModeSpeechSynthesisEngine(catalog, props.getSampleDir());
    }
}
