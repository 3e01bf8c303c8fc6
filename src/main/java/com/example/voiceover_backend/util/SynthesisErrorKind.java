package com.example.voiceover_backend.util;

public enum SynthesisErrorKind {
    CREDENTIAL_MISSING,
    UNSUPPORTED_ACCENT,
    SYNTHESIS_FAILED,
    SYNTHESIS_TIMEOUT
}
