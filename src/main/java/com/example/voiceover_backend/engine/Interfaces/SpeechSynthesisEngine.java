package com.example.voiceover_backend.engine.Interfaces;

import com.example.voiceover_backend.util.SynthesisErrorKind;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

public interface SpeechSynthesisEngine {
    record Request(String text, String languageAccentCode, Duration timeout) {}

    /** A word or punctuation token and the moment it is spoken in the audio. */
    record TimingToken(@JsonProperty("token") String token,
                       @JsonProperty("audio_offset_msecs") double audioOffsetMs) {}

    /** Either audio plus timings, or an error. Never both. */
    record SynthesisOutcome(byte[] audio,
                            List<TimingToken> timings,
                            SynthesisErrorKind errorKind,
                            String errorMessage) {

        public static SynthesisOutcome success(byte[] audio, List<TimingToken> timings) {
            Objects.requireNonNull(audio, "audio");
            return new SynthesisOutcome(audio, List.copyOf(timings), null, null);
        }

        public static SynthesisOutcome failure(SynthesisErrorKind kind, String message) {
            Objects.requireNonNull(kind, "kind");
            return new SynthesisOutcome(null, List.of(), kind, message);
        }

        public boolean isSuccess() {
            return errorKind == null;
        }
    }

    /** Identifier stored with every cache entry produced by this engine. */
    String providerId();

    SynthesisOutcome synthesize(Request request);
}
