package com.example.voiceover_backend.dto.web;

import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine.TimingToken;

import java.util.List;

public record VoiceoverRegenerationResponse(String filename, List<TimingToken> audioOffsets) {
}
