package com.example.voiceover_backend.service;

import com.example.voiceover_backend.config.VoiceoverProperties;
import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine;
import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine.SynthesisOutcome;
import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine.TimingToken;
import com.example.voiceover_backend.exception.VoiceoverRegenerationException;
import com.example.voiceover_backend.model.CachedVoiceover;
import com.example.voiceover_backend.service.Interfaces.StorageService;
import com.example.voiceover_backend.text.HtmlContentNormalizer;
import com.example.voiceover_backend.util.ContentHasher;
import com.example.voiceover_backend.util.SynthesisErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VoiceoverRegenerationServiceTest {

    private static final byte[] MP3 = {'I', 'D', '3', 3, 0, 0, 0};
    private static final String HTML = "<p>Hello</p><p>World</p>";
    private static final String TEXT = "Hello; World";
    private static final String TARGET_KEY = "exploration/exp1/audio/content_0.mp3";
    private static final List<TimingToken> TIMINGS = List.of(new TimingToken("Hello", 0.0), new TimingToken("World", 420.0));

    @Mock
    private VoiceoverCacheService cache;

    @Mock
    private SpeechSynthesisEngine engine;

    @Mock
    private StorageService storage;

    private VoiceoverRegenerationService service;
    private String fingerprint;

    @BeforeEach
    void setUp() {
        VoiceoverProperties props = new VoiceoverProperties();
        props.setSynthesisTimeoutSeconds(15);
        service = new VoiceoverRegenerationService(new HtmlContentNormalizer(), cache, engine, storage, props);
        fingerprint = ContentHasher.hash(TEXT);
    }

    @Test
    void cacheMissSynthesizesCommitsAndStores() {
        when(engine.providerId()).thenReturn("azure");
        when(cache.lookup("en-US", fingerprint, "azure")).thenReturn(Optional.empty());
        when(engine.synthesize(any())).thenReturn(SynthesisOutcome.success(MP3, TIMINGS));

        List<TimingToken> result = service.regenerate("exp1", HTML, "en-US", "content_0.mp3");

        assertThat(result).isEqualTo(TIMINGS);
        ArgumentCaptor<SpeechSynthesisEngine.Request> request = ArgumentCaptor.forClass(SpeechSynthesisEngine.Request.class);
        verify(engine).synthesize(request.capture());
        assertThat(request.getValue().text()).isEqualTo(TEXT);
        assertThat(request.getValue().languageAccentCode()).isEqualTo("en-US");
        assertThat(request.getValue().timeout()).isEqualTo(Duration.ofSeconds(15));
        verify(storage).commit(TARGET_KEY, MP3, "audio/mpeg");
        verify(cache).storeNew("en-US", "azure", TEXT, TARGET_KEY, TIMINGS);
    }

    @Test
    void exactHitReusesCachedAudioWithoutSynthesis() {
        CachedVoiceover entry = entry(TEXT, "exploration/other/audio/old.mp3");
        when(engine.providerId()).thenReturn("azure");
        when(cache.lookup("en-US", fingerprint, "azure")).thenReturn(Optional.of(entry));
        when(storage.get("exploration/other/audio/old.mp3")).thenReturn(MP3);
        when(cache.timingsOf(entry)).thenReturn(TIMINGS);

        List<TimingToken> result = service.regenerate("exp1", HTML, "en-US", "content_0.mp3");

        assertThat(result).isEqualTo(TIMINGS);
        verify(engine, never()).synthesize(any());
        verify(storage).commit(TARGET_KEY, MP3, "audio/mpeg");
        verify(cache, never()).storeNew(anyString(), anyString(), anyString(), anyString(), any());
        verify(cache, never()).reconcileOnCollision(any(), anyString(), anyString(), any());
    }

    @Test
    void collisionSynthesizesAndReconciles() {
        CachedVoiceover colliding = entry("A different, much longer text with the same fingerprint", "exploration/x/audio/y.mp3");
        when(engine.providerId()).thenReturn("azure");
        when(cache.lookup("en-US", fingerprint, "azure")).thenReturn(Optional.of(colliding));
        when(engine.synthesize(any())).thenReturn(SynthesisOutcome.success(MP3, TIMINGS));

        List<TimingToken> result = service.regenerate("exp1", HTML, "en-US", "content_0.mp3");

        assertThat(result).isEqualTo(TIMINGS);
        verify(storage).commit(TARGET_KEY, MP3, "audio/mpeg");
        verify(cache).reconcileOnCollision(colliding, TEXT, TARGET_KEY, TIMINGS);
        verify(cache, never()).storeNew(anyString(), anyString(), anyString(), anyString(), any());
        verify(cache, never()).timingsOf(any());
    }

    @Test
    void synthesisFailureLeavesNoResidue() {
        when(engine.providerId()).thenReturn("azure");
        when(cache.lookup("en-US", fingerprint, "azure")).thenReturn(Optional.empty());
        when(engine.synthesize(any())).thenReturn(
                SynthesisOutcome.failure(SynthesisErrorKind.CREDENTIAL_MISSING, "Azure TTS API key is not available."));

        VoiceoverRegenerationException ex = assertThrows(VoiceoverRegenerationException.class,
                () -> service.regenerate("exp1", HTML, "en-US", "content_0.mp3"));

        assertThat(ex.getKind()).isEqualTo(SynthesisErrorKind.CREDENTIAL_MISSING);
        assertThat(ex).hasMessage("Azure TTS API key is not available.");

        verifyNoInteractions(storage);
        verify(cache, never()).storeNew(anyString(), anyString(), anyString(), anyString(), any());
    }

    @Test
    void engineExceptionBecomesSynthesisFailure() {
        when(engine.providerId()).thenReturn("azure");
        when(cache.lookup("en-US", fingerprint, "azure")).thenReturn(Optional.empty());
        when(engine.synthesize(any())).thenThrow(new IllegalStateException("SDK blew up"));

        assertThatThrownBy(() -> service.regenerate("exp1", HTML, "en-US", "content_0.mp3"))
                .isInstanceOf(VoiceoverRegenerationException.class)
                .hasMessage("SDK blew up");

        verifyNoInteractions(storage);
    }

    @Test
    void nonMp3AudioIsRejected() {
        when(engine.providerId()).thenReturn("azure");
        when(cache.lookup("en-US", fingerprint, "azure")).thenReturn(Optional.empty());
        when(engine.synthesize(any())).thenReturn(SynthesisOutcome.success("RIFF-WAVE".getBytes(), TIMINGS));

        VoiceoverRegenerationException ex = assertThrows(VoiceoverRegenerationException.class,
                () -> service.regenerate("exp1", HTML, "en-US", "content_0.mp3"));

        assertThat(ex.getKind()).isEqualTo(SynthesisErrorKind.SYNTHESIS_FAILED);

        verifyNoInteractions(storage);
    }

    @Test
    void lostInsertRaceAppliesCollisionRuleToWinner() {
        CachedVoiceover winner = entry("Some other text that won the race", "exploration/exp2/audio/a.mp3");
        when(engine.providerId()).thenReturn("azure");
        when(cache.lookup("en-US", fingerprint, "azure")).thenReturn(Optional.empty(), Optional.of(winner));
        when(engine.synthesize(any())).thenReturn(SynthesisOutcome.success(MP3, TIMINGS));
        when(cache.storeNew("en-US", "azure", TEXT, TARGET_KEY, TIMINGS))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        List<TimingToken> result = service.regenerate("exp1", HTML, "en-US", "content_0.mp3");

        assertThat(result).isEqualTo(TIMINGS);
        verify(cache).reconcileOnCollision(winner, TEXT, TARGET_KEY, TIMINGS);
    }

    @Test
    void lostInsertRaceWithSameTextKeepsWinner() {
        CachedVoiceover winner = entry(TEXT, "exploration/exp2/audio/a.mp3");
        when(engine.providerId()).thenReturn("azure");
        when(cache.lookup("en-US", fingerprint, "azure")).thenReturn(Optional.empty(), Optional.of(winner));
        when(engine.synthesize(any())).thenReturn(SynthesisOutcome.success(MP3, TIMINGS));
        when(cache.storeNew("en-US", "azure", TEXT, TARGET_KEY, TIMINGS))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        service.regenerate("exp1", HTML, "en-US", "content_0.mp3");

        verify(cache, never()).reconcileOnCollision(any(), anyString(), anyString(), any());
    }

    @Test
    void concurrentUpdateDuringReconcileIsTolerated() {
        CachedVoiceover colliding = entry("A longer colliding text", "exploration/x/audio/y.mp3");
        when(engine.providerId()).thenReturn("azure");
        when(cache.lookup("en-US", fingerprint, "azure")).thenReturn(Optional.of(colliding));
        when(engine.synthesize(any())).thenReturn(SynthesisOutcome.success(MP3, TIMINGS));
        when(cache.reconcileOnCollision(colliding, TEXT, TARGET_KEY, TIMINGS))
                .thenThrow(new ObjectOptimisticLockingFailureException(CachedVoiceover.class, colliding.getId()));

        assertThat(service.regenerate("exp1", HTML, "en-US", "content_0.mp3")).isEqualTo(TIMINGS);
        verify(storage).commit(TARGET_KEY, MP3, "audio/mpeg");
    }

    @Test
    void invalidFilenameIsRejectedBeforeAnyWork() {
        assertThatThrownBy(() -> service.regenerate("exp1", HTML, "en-US", "../escape.mp3"))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(cache, engine, storage);
    }

    private CachedVoiceover entry(String plaintext, String objectKey) {
        CachedVoiceover entry = new CachedVoiceover(
                CachedVoiceover.generateId("en-US", fingerprint, "azure"), "en-US", "azure", fingerprint);
        entry.setPlaintext(plaintext);
        entry.setVoiceoverObjectKey(objectKey);
        return entry;
    }
}
