package com.example.voiceover_backend.engine;

import com.example.voiceover_backend.engine.Interfaces.AzureSpeechClient;
import com.example.voiceover_backend.engine.Interfaces.SpeechSynthesisEngine.TimingToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects word boundary events of exactly one synthesis call. Events arrive on SDK threads, in
 * utterance order.
 */
final class WordBoundaryCollector implements AzureSpeechClient.WordBoundaryListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(WordBoundaryCollector.class);
    static final double TICKS_PER_MILLISECOND = 10_000.0;

    private final int capacity;
    private final List<TimingToken> tokens = new ArrayList<>();
    private boolean overflowLogged;

    WordBoundaryCollector(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public synchronized void onWordBoundary(String text, long audioOffsetTicks) {
        if (tokens.size() >= capacity) {
            if (!overflowLogged) {
                LOGGER.warn("Word boundary capacity reached capacity={} droppedToken='{}'", capacity, text);
                overflowLogged = true;
            }
            return;
        }
        double offsetMs = Math.max(0L, audioOffsetTicks) / TICKS_PER_MILLISECOND;
        tokens.add(new TimingToken(text == null ? "" : text, offsetMs));
    }

    synchronized List<TimingToken> snapshot() {
        return List.copyOf(tokens);
    }
}
