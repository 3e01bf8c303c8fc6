package com.example.voiceover_backend.dto.web;

import jakarta.validation.constraints.NotBlank;

public record VoiceoverRegenerationRequest(@NotBlank String contentHtml,
                                           @NotBlank String languageAccentCode,
                                           @NotBlank String filename) {
}
