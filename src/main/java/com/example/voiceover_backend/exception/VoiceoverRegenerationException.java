package com.example.voiceover_backend.exception;

import com.example.voiceover_backend.util.SynthesisErrorKind;

/**
 * Single failure signal of automatic voiceover regeneration. Nothing has been written to the
 * blob store or the voiceover cache when this is thrown.
 */
public class VoiceoverRegenerationException extends RuntimeException {
    private final SynthesisErrorKind kind;

    public VoiceoverRegenerationException(SynthesisErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public VoiceoverRegenerationException(SynthesisErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SynthesisErrorKind getKind() {
        return kind;
    }
}
