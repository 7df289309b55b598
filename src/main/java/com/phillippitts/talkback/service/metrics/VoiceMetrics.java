package com.phillippitts.talkback.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the voice pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Recognizer latency and outcome</li>
 *   <li>Chunks skipped by the energy gate and fragments suppressed as self-speech</li>
 *   <li>Listen call outcomes per mode</li>
 *   <li>Assembly strategy used</li>
 *   <li>Session transitions and interrupts</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class VoiceMetrics {

    private static final String METRIC_PREFIX = "talkback";

    private final MeterRegistry registry;

    public VoiceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one recognizer call.
     *
     * @param recognizer    recognizer name
     * @param durationNanos call duration in nanoseconds
     * @param outcome       text, empty or error
     */
    public void recordTranscription(String recognizer, long durationNanos, String outcome) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken by one recognizer call")
                .tag("recognizer", recognizer)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementEnergyGated(String mode) {
        Counter.builder(METRIC_PREFIX + ".capture.gated")
                .description("Chunks below the energy threshold that skipped transcription")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    /**
     * Increments the self-speech counter.
     *
     * @param rule filter rule that matched (catalog, playback-echo, length)
     */
    public void incrementSelfSpeech(String rule) {
        Counter.builder(METRIC_PREFIX + ".filter.self_speech")
                .description("Fragments classified as the assistant's own output")
                .tag("rule", rule)
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of a listen call.
     *
     * @param mode    capture mode
     * @param outcome utterance, no-speech, speaking or rejected
     */
    public void incrementListenOutcome(String mode, String outcome) {
        Counter.builder(METRIC_PREFIX + ".listen.outcome")
                .description("Listen calls by mode and outcome")
                .tag("mode", mode)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementAssembly(String strategy) {
        Counter.builder(METRIC_PREFIX + ".assembly")
                .description("Utterance assemblies by strategy that produced the result")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    public void incrementSessionTransition(String transition) {
        Counter.builder(METRIC_PREFIX + ".session.transition")
                .description("Conversation session transitions")
                .tag("transition", transition)
                .register(registry)
                .increment();
    }

    public void incrementInterrupt() {
        Counter.builder(METRIC_PREFIX + ".interrupt")
                .description("Playback stopped by a cancellation phrase")
                .register(registry)
                .increment();
    }
}
