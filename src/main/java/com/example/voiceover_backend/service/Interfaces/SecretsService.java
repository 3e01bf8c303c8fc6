package com.example.voiceover_backend.service.Interfaces;

import java.util.Optional;

public interface SecretsService {
    /** Blank values count as absent. */
    Optional<String> getSecret(String name);
}
