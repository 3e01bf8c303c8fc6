package com.example.voiceover_backend.service;

import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine.TimingToken;
import com.example.voiceover_backend.model.CachedVoiceover;
import com.example.voiceover_backend.repository.CachedVoiceoverRepository;
import com.example.voiceover_backend.util.ContentHasher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Content-addressed cache of synthesized voiceovers. A fingerprint match is only a candidate:
 * the stored plaintext decides whether an entry really belongs to a text.
 */
@Service
public class VoiceoverCacheService {
    private static final Logger LOGGER = LoggerFactory.getLogger(VoiceoverCacheService.class);

    private final CachedVoiceoverRepository repository;
    private final ObjectMapper om = new ObjectMapper();

    public VoiceoverCacheService(CachedVoiceoverRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public Optional<CachedVoiceover> lookup(String languageAccentCode, String fingerprint, String provider) {
        return repository.findById(CachedVoiceover.generateId(languageAccentCode, fingerprint, provider));
    }

    /**
     * Inserts a new entry. The key must be free; a concurrent insert of the same key fails with
     * {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    @Transactional
    public CachedVoiceover storeNew(String languageAccentCode,
                                    String provider,
                                    String plaintext,
                                    String voiceoverObjectKey,
                                    List<TimingToken> timings) {
        String fingerprint = ContentHasher.hash(plaintext);
        String id = CachedVoiceover.generateId(languageAccentCode, fingerprint, provider);

        CachedVoiceover entry = new CachedVoiceover(id, languageAccentCode, provider, fingerprint);
        entry.setPlaintext(plaintext);
        entry.setVoiceoverObjectKey(voiceoverObjectKey);
        entry.setAudioOffsets(toJson(timings));

        CachedVoiceover saved = repository.saveAndFlush(entry);
        LOGGER.info("Voiceover cache stored key={} object={} tokens={}", id, voiceoverObjectKey, timings.size());
        return saved;
    }

    /**
     * Resolves a fingerprint collision between the stored text and a freshly synthesized one. The
     * shorter text wins the slot, since short texts are the ones more likely to recur.
     *
     * @return true when the entry now holds the candidate
     */
    @Transactional
    public boolean reconcileOnCollision(CachedVoiceover existing,
                                       String candidateText,
                                       String candidateObjectKey,
                                       List<TimingToken> candidateTimings) {
        String storedText = existing.getPlaintext() == null ? "" : existing.getPlaintext();
        if (storedText.equals(candidateText)) {
            return false;
        }
        if (candidateText.length() >= storedText.length()) {
            LOGGER.info("Voiceover cache collision kept key={} storedLength={} candidateLength={}",
                    existing.getId(), storedText.length(), candidateText.length());
            return false;
        }
        existing.setPlaintext(candidateText);
        existing.setVoiceoverObjectKey(candidateObjectKey);
        existing.setAudioOffsets(toJson(candidateTimings));
        repository.saveAndFlush(existing);
        LOGGER.info("Voiceover cache collision replaced key={} storedLength={} candidateLength={} object={}",
                existing.getId(), storedText.length(), candidateText.length(), candidateObjectKey);
        return true;
    }

    public List<TimingToken> timingsOf(CachedVoiceover entry) {
        JsonNode node = entry.getAudioOffsets();
        if (node == null || !node.isArray()) return List.of();
        List<TimingToken> out = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            out.add(new TimingToken(item.path("token").asText(""), item.path("audio_offset_msecs").asDouble(0.0)));
        }
        return List.copyOf(out);
    }

    private JsonNode toJson(List<TimingToken> timings) {
        return om.valueToTree(timings == null ? List.of() : timings);
    }
}
