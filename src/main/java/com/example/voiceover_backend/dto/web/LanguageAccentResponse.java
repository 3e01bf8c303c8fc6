package com.example.voiceover_backend.dto.web;

public record LanguageAccentResponse(String languageAccentCode, String languageCode, String voiceCode, String description) {
}
