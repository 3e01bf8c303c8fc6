package com.example.voiceover_backend.engine;

import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine;
import com.example.voiceover_backend.service.LanguageAccentCatalog;
import com.example.voiceover_backend.util.SynthesisErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Offline stand-in for Azure: returns a pre-recorded sample per language and a fixed timing list.
 */
public class DevModeSpeechSynthesisEngine implements SpeechSynthesisEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(DevModeSpeechSynthesisEngine.class);
    public static final String PROVIDER_ID = "azure-dev";
    static final String DEFAULT_LANGUAGE_CODE = "en";

    static final Map<String, String> LANGUAGE_CODE_TO_SAMPLE = Map.of(
            "ar", "arabic.mp3",
            "en", "english.mp3",
            "hi", "hindi.mp3",
            "pt", "portuguese.mp3"
    );

    static final List<TimingToken> CANNED_TIMINGS = List.of(
            new TimingToken("This", 0.0),
            new TimingToken("is", 100.0),
            new TimingToken("a", 200.0),
            new TimingToken("test", 300.0),
            new TimingToken("text", 400.0)
    );

    private final LanguageAccentCatalog catalog;
    private final String sampleDir;

    public DevModeSpeechSynthesisEngine(LanguageAccentCatalog catalog, String sampleDir) {
        this.catalog = catalog;
        this.sampleDir = sampleDir.endsWith("/") ? sampleDir : sampleDir + "/";
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public SynthesisOutcome synthesize(Request request) {
        String languageCode = catalog.languageCodeFor(request.languageAccentCode()).orElse(DEFAULT_LANGUAGE_CODE);
        if (!LANGUAGE_CODE_TO_SAMPLE.containsKey(languageCode)) {
            languageCode = DEFAULT_LANGUAGE_CODE;
        }
        String samplePath = sampleDir + LANGUAGE_CODE_TO_SAMPLE.get(languageCode);

        try (InputStream in = new ClassPathResource(samplePath).getInputStream()) {
            byte[] audio = in.readAllBytes();
            LOGGER.info("Dev TTS sample used accent={} language={} sample={} bytes={}",
                    request.languageAccentCode(), languageCode, samplePath, audio.length);
            return SynthesisOutcome.success(audio, CANNED_TIMINGS);
        } catch (IOException e) {
            LOGGER.warn("Dev TTS sample unreadable sample={} error={}", samplePath, e.toString());
            return SynthesisOutcome.failure(SynthesisErrorKind.SYNTHESIS_FAILED, "Sample voiceover not readable: " + samplePath);
        }
    }
}
