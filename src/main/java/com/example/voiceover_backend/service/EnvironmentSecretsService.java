package com.example.voiceover_backend.service;

import com.example.voiceover_backend.service.Interfaces.SecretsService;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Secrets from the Spring environment: {@code secrets.<NAME>} first, then a property or
 * environment variable called {@code <NAME>}.
 */
@Service
public class EnvironmentSecretsService implements SecretsService {
    private final Environment environment;

    public EnvironmentSecretsService(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> getSecret(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String value = environment.getProperty("secrets." + name);
        if (value == null || value.isBlank()) {
            value = environment.getProperty(name);
        }
        return (value == null || value.isBlank()) ? Optional.empty() : Optional.of(value.trim());
    }
}
