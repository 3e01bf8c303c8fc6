package com.example.voiceover_backend.engine.Interfaces;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Thin seam over the Azure Speech SDK so the engine can be exercised without native libraries.
 */
public interface AzureSpeechClient {

    @FunctionalInterface
    interface WordBoundaryListener {
        /** @param audioOffsetTicks offset in 100-nanosecond units */
        void onWordBoundary(String text, long audioOffsetTicks);
    }

    record Result(byte[] audioData, boolean canceled, String errorDetails) {}

    Result speakSsml(String subscriptionKey,
                     String region,
                     String ssml,
                     WordBoundaryListener listener,
                     Duration timeout) throws InterruptedException, ExecutionException, TimeoutException;
}
