package com.example.voiceover_backend.controller;

import com.example.voiceover_backend.dto.web.LanguageAccentResponse;
import com.example.voiceover_backend.dto.web.VoiceoverRegenerationRequest;
import com.example.voiceover_backend.dto.web.VoiceoverRegenerationResponse;
import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine.TimingToken;
import com.example.voiceover_backend.exception.VoiceoverRegenerationException;
import com.example.voiceover_backend.service.LanguageAccentCatalog;
import com.example.voiceover_backend.service.VoiceoverRegenerationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * HTTP endpoints for automatic voiceovers.
 */
@RestController
@RequestMapping("/v1")
public class VoiceoverController {
    private final VoiceoverRegenerationService regenerationService;
    private final LanguageAccentCatalog catalog;

    public VoiceoverController(VoiceoverRegenerationService regenerationService, LanguageAccentCatalog catalog) {
        this.regenerationService = regenerationService;
        this.catalog = catalog;
    }

    @Operation(summary = "Regenerate the automatic voiceover for a piece of exploration content")
    @ApiResponse(responseCode = "200", description = "Audio committed; word timings returned")
    @ApiResponse(responseCode = "400", description = "Invalid request payload or unsupported language accent")
    @ApiResponse(responseCode = "502", description = "Speech synthesis failed")
    @ApiResponse(responseCode = "503", description = "Speech synthesis credential is not configured")
    @ApiResponse(responseCode = "504", description = "Speech synthesis timed out")
    @PostMapping("/explorations/{explorationId}/voiceovers/regenerate")
    public ResponseEntity<VoiceoverRegenerationResponse> regenerate(@PathVariable String explorationId,
                                                                    @Valid @RequestBody VoiceoverRegenerationRequest request) {
        try {
            List<TimingToken> offsets = regenerationService.regenerate(
                    explorationId, request.contentHtml(), request.languageAccentCode(), request.filename());
            return ResponseEntity.ok(new VoiceoverRegenerationResponse(request.filename(), offsets));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (VoiceoverRegenerationException e) {
            throw new ResponseStatusException(statusFor(e), e.getMessage(), e);
        }
    }

    @Operation(summary = "List language accents that support automatic voiceovers")
    @GetMapping("/voiceovers/language-accents")
    public List<LanguageAccentResponse> languageAccents() {
        return catalog.entries().stream()
                .map(e -> new LanguageAccentResponse(e.getKey(), e.getValue().languageCode(),
                        e.getValue().voiceCode(), e.getValue().description()))
                .toList();
    }

    static HttpStatus statusFor(VoiceoverRegenerationException e) {
        return switch (e.getKind()) {
            case UNSUPPORTED_ACCENT -> HttpStatus.BAD_REQUEST;
            case CREDENTIAL_MISSING -> HttpStatus.SERVICE_UNAVAILABLE;
            case SYNTHESIS_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case SYNTHESIS_FAILED -> HttpStatus.BAD_GATEWAY;
        };
    }
}
