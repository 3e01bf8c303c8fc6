package com.example.voiceover_backend.repository;

import com.example.voiceover_backend.model.CachedVoiceover;
import org.springframework.data.jpa.repository.JpaRepository;

/** Keyed by {@link CachedVoiceover#generateId(String, String, String)}. */
public interface CachedVoiceoverRepository extends JpaRepository<CachedVoiceover, String> {
}
