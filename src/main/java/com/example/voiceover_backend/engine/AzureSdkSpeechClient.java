package com.example.voiceover_backend.engine;

import com.example.voiceover_backend.engine.Interfaces.AzureSpeechClient;
import com.microsoft.cognitiveservices.speech.CancellationReason;
import com.microsoft.cognitiveservices.speech.ResultReason;
import com.microsoft.cognitiveservices.speech.SpeechConfig;
import com.microsoft.cognitiveservices.speech.SpeechSynthesisCancellationDetails;
import com.microsoft.cognitiveservices.speech.SpeechSynthesisOutputFormat;
import com.microsoft.cognitiveservices.speech.SpeechSynthesisResult;
import com.microsoft.cognitiveservices.speech.SpeechSynthesizer;
import com.microsoft.cognitiveservices.speech.audio.AudioConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Azure Speech SDK backed client. Audio stays in memory (no audio output device) as 24kHz MP3.
 */
public class AzureSdkSpeechClient implements AzureSpeechClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(AzureSdkSpeechClient.class);
    // The synthesizer cannot be disposed while a synthesis is still running.
    static final Duration STOP_GRACE = Duration.ofSeconds(5);

    @Override
    public Result speakSsml(String subscriptionKey,
                            String region,
                            String ssml,
                            WordBoundaryListener listener,
                            Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
        try (SpeechConfig speechConfig = SpeechConfig.fromSubscription(subscriptionKey, region)) {
            speechConfig.setSpeechSynthesisOutputFormat(SpeechSynthesisOutputFormat.Audio24Khz160KBitRateMonoMp3);

            try (SpeechSynthesizer synthesizer = new SpeechSynthesizer(speechConfig, (AudioConfig) null)) {
                AtomicBoolean abandoned = new AtomicBoolean();
                synthesizer.WordBoundary.addEventListener((sender, event) -> {
                    if (!abandoned.get()) {
                        listener.onWordBoundary(event.getText(), event.getAudioOffset());
                    }
                });

                Future<SpeechSynthesisResult> pending = synthesizer.SpeakSsmlAsync(ssml);
                LOGGER.debug("Azure speech synthesis started region={} ssmlLength={}", region, ssml.length());

                SpeechSynthesisResult completed = awaitOrStop(pending, timeout, () -> {
                    abandoned.set(true);
                    return synthesizer.StopSpeakingAsync();
                }, STOP_GRACE);

                try (SpeechSynthesisResult result = completed) {
                    if (result.getReason() == ResultReason.Canceled) {
                        SpeechSynthesisCancellationDetails details = SpeechSynthesisCancellationDetails.fromResult(result);
                        String errorDetails = details.getReason() == CancellationReason.Error
                                ? details.getErrorDetails()
                                : "Speech synthesis canceled: " + details.getReason();
                        return new Result(result.getAudioData(), true, errorDetails);
                    }
                    return new Result(result.getAudioData(), false, null);
                }
            }
        }
    }

    /**
     * Waits for {@code pending}. On timeout or interrupt the synthesis is stopped and given
     * {@code grace} to settle, so the synthesizer can be closed afterwards; the original exception
     * is rethrown.
     */
    static <T extends AutoCloseable> T awaitOrStop(Future<T> pending,
                                                   Duration timeout,
                                                   Supplier<Future<Void>> stop,
                                                   Duration grace) throws InterruptedException, ExecutionException, TimeoutException {
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            stopAndDrain(pending, stop, grace);
            throw e;
        }
    }

    private static <T extends AutoCloseable> void stopAndDrain(Future<T> pending, Supplier<Future<Void>> stop, Duration grace) {
        try {
            stop.get().get(grace.toMillis(), TimeUnit.MILLISECONDS);
            T late = pending.get(grace.toMillis(), TimeUnit.MILLISECONDS);
            if (late != null) late.close();
            LOGGER.info("Azure speech synthesis stopped after timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while stopping Azure speech synthesis");
        } catch (Exception e) {
            LOGGER.warn("Azure speech synthesis did not stop cleanly error={}", e.toString());
        }
    }
}
