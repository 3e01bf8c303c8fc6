package com.example.voiceover_backend.service;

import com.example.voiceover_backend.config.VoiceoverProperties;
import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine;
import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine.SynthesisOutcome;
import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine.TimingToken;
import com.example.voiceover_backend.exception.VoiceoverRegenerationException;
import com.example.voiceover_backend.model.CachedVoiceover;
import com.example.voiceover_backend.service.Interfaces.StorageService;
import com.example.voiceover_backend.text.HtmlContentNormalizer;
import com.example.voiceover_backend.util.AudioObjectKeys;
import com.example.voiceover_backend.util.ContentHasher;
import com.example.voiceover_backend.util.Mp3AudioInspector;
import com.example.voiceover_backend.util.SynthesisErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Regenerates the automatic voiceover of one piece of lesson content.
 *
 * <p>Order of side effects: the audio blob is committed first, the cache entry is written after.
 * A crash in between leaves an unreferenced blob, never an entry pointing at missing audio. Not
 * transactional: every cache call runs in its own transaction.
 */
@Service
public class VoiceoverRegenerationService {
    private static final Logger LOGGER = LoggerFactory.getLogger(VoiceoverRegenerationService.class);

    private final HtmlContentNormalizer normalizer;
    private final VoiceoverCacheService cache;
    private final SpeechSynthesisEngine engine;
    private final StorageService storage;
    private final VoiceoverProperties props;

    public VoiceoverRegenerationService(HtmlContentNormalizer normalizer,
                                        VoiceoverCacheService cache,
                                        SpeechSynthesisEngine engine,
                                        StorageService storage,
                                        VoiceoverProperties props) {
        this.normalizer = normalizer;
        this.cache = cache;
        this.engine = engine;
        this.storage = storage;
        this.props = props;
    }

    /**
     * @param entityId           owner of the audio, e.g. an exploration id
     * @param contentHtml        lesson content to voice
     * @param languageAccentCode e.g. {@code en-US}
     * @param filename           target audio file name within the entity's audio folder
     * @return word/punctuation timings of the committed audio
     * @throws VoiceoverRegenerationException when no audio could be produced
     */
    public List<TimingToken> regenerate(String entityId, String contentHtml, String languageAccentCode, String filename) {
        String targetKey = AudioObjectKeys.forEntity(props.getEntityType(), entityId, filename);
        String plaintext = normalizer.normalize(contentHtml);
        String fingerprint = ContentHasher.hash(plaintext);
        String provider = engine.providerId();

        Optional<CachedVoiceover> cached = cache.lookup(languageAccentCode, fingerprint, provider);
        if (cached.isPresent() && plaintext.equals(cached.get().getPlaintext())) {
            CachedVoiceover entry = cached.get();
            byte[] audio = storage.get(entry.getVoiceoverObjectKey());
            storage.commit(targetKey, audio, Mp3AudioInspector.MIME_TYPE);
            LOGGER.info("Voiceover cache hit key={} entity={} source={} target={}",
                    entry.getId(), entityId, entry.getVoiceoverObjectKey(), targetKey);
            return cache.timingsOf(entry);
        }

        if (cached.isPresent()) {
            LOGGER.info("Voiceover cache collision key={} entity={}", cached.get().getId(), entityId);
        } else {
            LOGGER.info("Voiceover cache miss accent={} fingerprint={} provider={} entity={}",
                    languageAccentCode, fingerprint, provider, entityId);
        }

        SynthesisOutcome outcome = synthesize(plaintext, languageAccentCode);
        if (!outcome.isSuccess()) {
            LOGGER.warn("Voiceover synthesis failed entity={} accent={} kind={} message={}",
                    entityId, languageAccentCode, outcome.errorKind(), outcome.errorMessage());
            throw new VoiceoverRegenerationException(outcome.errorKind(), describe(outcome));
        }
        if (!Mp3AudioInspector.looksLikeMp3(outcome.audio())) {
            LOGGER.warn("Voiceover synthesis returned non-MP3 audio entity={} bytes={}", entityId, outcome.audio().length);
            throw new VoiceoverRegenerationException(SynthesisErrorKind.SYNTHESIS_FAILED,
                    "Synthesized audio is not a valid MP3 file");
        }

        storage.commit(targetKey, outcome.audio(), Mp3AudioInspector.MIME_TYPE);
        List<TimingToken> timings = outcome.timings();

        if (cached.isPresent()) {
            reconcileQuietly(cached.get(), plaintext, targetKey, timings);
        } else {
            storeOrReconcile(languageAccentCode, fingerprint, provider, plaintext, targetKey, timings);
        }
        return timings;
    }

    private SynthesisOutcome synthesize(String plaintext, String languageAccentCode) {
        Duration timeout = Duration.ofSeconds(Math.max(1, props.getSynthesisTimeoutSeconds()));
        try {
            return engine.synthesize(new SpeechSynthesisEngine.Request(plaintext, languageAccentCode, timeout));
        } catch (RuntimeException e) {
            LOGGER.warn("Speech synthesis engine threw provider={} accent={}", engine.providerId(), languageAccentCode, e);
            return SynthesisOutcome.failure(SynthesisErrorKind.SYNTHESIS_FAILED, String.valueOf(e.getMessage()));
        }
    }

    private void storeOrReconcile(String languageAccentCode,
                                  String fingerprint,
                                  String provider,
                                  String plaintext,
                                  String targetKey,
                                  List<TimingToken> timings) {
        try {
            cache.storeNew(languageAccentCode, provider, plaintext, targetKey, timings);
        } catch (DataIntegrityViolationException dup) {
            // another request stored the same key first
            LOGGER.warn("Voiceover cache insert lost race accent={} fingerprint={} provider={}",
                    languageAccentCode, fingerprint, provider);
            cache.lookup(languageAccentCode, fingerprint, provider)
                    .filter(winner -> !plaintext.equals(winner.getPlaintext()))
                    .ifPresent(winner -> reconcileQuietly(winner, plaintext, targetKey, timings));
        }
    }

    private void reconcileQuietly(CachedVoiceover existing, String plaintext, String targetKey, List<TimingToken> timings) {
        try {
            cache.reconcileOnCollision(existing, plaintext, targetKey, timings);
        } catch (ObjectOptimisticLockingFailureException conflict) {
            LOGGER.warn("Voiceover cache entry changed concurrently key={}; keeping the other writer's entry",
                    existing.getId());
        }
    }

    private static String describe(SynthesisOutcome outcome) {
        String message = outcome.errorMessage();
        return (message == null || message.isBlank()) ? "Voiceover synthesis failed: " + outcome.errorKind() : message;
    }
}
