package com.example.voiceover_backend.engine;

import com.example.voiceover_backend.config.AzureSpeechProperties;
import com.example.voiceover_backend.engine.Interfaces.AzureSpeechClient;
import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine;
import com.example.voiceover_backend.service.Interfaces.SecretsService;
import com.example.voiceover_backend.service.LanguageAccentCatalog;
import com.example.voiceover_backend.util.SynthesisErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

public class AzureSpeechSynthesisEngine implements SpeechSynthesisEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(AzureSpeechSynthesisEngine.class);
    public static final String PROVIDER_ID = "azure";
    private static final int MAX_WORD_BOUNDARIES = 50_000;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final AzureSpeechClient client;
    private final SecretsService secretsService;
    private final LanguageAccentCatalog catalog;
    private final AzureSpeechProperties props;

    public AzureSpeechSynthesisEngine(AzureSpeechClient client,
                                      SecretsService secretsService,
                                      LanguageAccentCatalog catalog,
                                      AzureSpeechProperties props) {
        this.client = client;
        this.secretsService = secretsService;
        this.catalog = catalog;
        this.props = props;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public SynthesisOutcome synthesize(Request request) {
        Optional<String> apiKey = secretsService.getSecret(props.getApiKeySecretName());
        if (apiKey.isEmpty()) {
            LOGGER.warn("Azure TTS secret missing name={}", props.getApiKeySecretName());
            return SynthesisOutcome.failure(SynthesisErrorKind.CREDENTIAL_MISSING, "Azure TTS API key is not available.");
        }

        Optional<String> voiceCode = catalog.voiceCodeFor(request.languageAccentCode());
        if (voiceCode.isEmpty()) {
            LOGGER.warn("Azure TTS has no voice for accent={}", request.languageAccentCode());
            return SynthesisOutcome.failure(SynthesisErrorKind.UNSUPPORTED_ACCENT,
                    "No Azure voice is configured for language accent code: " + request.languageAccentCode());
        }

        String ssml = SsmlContentBuilder.build(request.text(), request.languageAccentCode(), voiceCode.get());
        Duration timeout = request.timeout() == null ? DEFAULT_TIMEOUT : request.timeout();
        WordBoundaryCollector collector = new WordBoundaryCollector(MAX_WORD_BOUNDARIES);

        long started = System.nanoTime();
        AzureSpeechClient.Result result;
        try {
            result = client.speakSsml(apiKey.get(), props.getRegion(), ssml, collector, timeout);
        } catch (TimeoutException e) {
            LOGGER.warn("Azure TTS timed out accent={} timeoutMs={}", request.languageAccentCode(), timeout.toMillis());
            return SynthesisOutcome.failure(SynthesisErrorKind.SYNTHESIS_TIMEOUT,
                    "Azure speech synthesis timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SynthesisOutcome.failure(SynthesisErrorKind.SYNTHESIS_FAILED, "Azure speech synthesis interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOGGER.warn("Azure TTS call failed accent={} error={}", request.languageAccentCode(), cause.toString());
            return SynthesisOutcome.failure(SynthesisErrorKind.SYNTHESIS_FAILED, String.valueOf(cause.getMessage()));
        }

        if (result.canceled()) {
            LOGGER.warn("Azure TTS canceled accent={} details={}", request.languageAccentCode(), result.errorDetails());
            return SynthesisOutcome.failure(SynthesisErrorKind.SYNTHESIS_FAILED, result.errorDetails());
        }
        byte[] audio = result.audioData() == null ? new byte[0] : result.audioData();
        List<TimingToken> timings = collector.snapshot();
        LOGGER.info("Azure TTS done accent={} voice={} bytes={} tokens={} tookMs={}",
                request.languageAccentCode(), voiceCode.get(), audio.length, timings.size(),
                (System.nanoTime() - started) / 1_000_000);
        return SynthesisOutcome.success(audio, timings);
    }
}
