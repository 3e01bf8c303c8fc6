package com.example.voiceover_backend.service;

import com.example.voiceover_backend.exception.StorageException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Language accents for which voiceovers can be synthesized automatically, keyed by accent code
 * (e.g. {@code en-US}).
 */
public class LanguageAccentCatalog {
    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageAccentCatalog.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LanguageAccent(@JsonProperty("language_code") String languageCode,
                                 @JsonProperty("voice_code") String voiceCode,
                                 @JsonProperty("description") String description) {}

    private final Map<String, LanguageAccent> accents;

    public LanguageAccentCatalog(Map<String, LanguageAccent> accents) {
        this.accents = Collections.unmodifiableMap(new LinkedHashMap<>(accents));
    }

    public static LanguageAccentCatalog fromClasspath(String location, ObjectMapper om) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            Map<String, LanguageAccent> parsed = om.readValue(in, new TypeReference<LinkedHashMap<String, LanguageAccent>>() {});
            LOGGER.info("Language accent catalog loaded location={} accents={}", location, parsed.keySet());
            return new LanguageAccentCatalog(parsed);
        } catch (IOException e) {
            throw new StorageException("Cannot read language accent catalog: " + location, e);
        }
    }

    public Optional<String> voiceCodeFor(String languageAccentCode) {
        return find(languageAccentCode)
                .map(LanguageAccent::voiceCode)
                .filter(v -> !v.isBlank());
    }

    /** Falls back to the part before the region, {@code pt-BR -> pt}, for accents not in the catalog. */
    public Optional<String> languageCodeFor(String languageAccentCode) {
        Optional<String> mapped = find(languageAccentCode)
                .map(LanguageAccent::languageCode)
                .filter(l -> !l.isBlank());
        if (mapped.isPresent()) return mapped;
        if (languageAccentCode == null || languageAccentCode.isBlank()) return Optional.empty();
        String prefix = languageAccentCode.split("-", 2)[0].trim().toLowerCase(Locale.ROOT);
        return prefix.isEmpty() ? Optional.empty() : Optional.of(prefix);
    }

    public Optional<LanguageAccent> find(String languageAccentCode) {
        if (languageAccentCode == null) return Optional.empty();
        return Optional.ofNullable(accents.get(languageAccentCode));
    }

    public List<Map.Entry<String, LanguageAccent>> entries() {
        return new ArrayList<>(accents.entrySet());
    }
}
