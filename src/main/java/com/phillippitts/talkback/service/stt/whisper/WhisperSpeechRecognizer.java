package com.phillippitts.talkback.service.stt.whisper;

import com.phillippitts.talkback.config.stt.WhisperProperties;
import com.phillippitts.talkback.domain.AudioSegment;
import com.phillippitts.talkback.domain.TranscriptionResult;
import com.phillippitts.talkback.exception.TranscriptionServiceUnavailableException;
import com.phillippitts.talkback.service.audio.WavWriter;
import com.phillippitts.talkback.service.metrics.VoiceMetrics;
import com.phillippitts.talkback.service.stt.SpeechRecognizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * {@link SpeechRecognizer} backed by the external whisper.cpp binary.
 *
 * <p>Each call writes the segment to a temporary WAV file, runs whisper.cpp through
 * {@link WhisperProcessRunner} and deletes the file. BCP-47 hints are reduced to their
 * primary language subtag because whisper selects a language, not a region.
 *
 * <p><b>Thread Safety:</b> thread-safe. Concurrent runs are bounded by a semaphore so the
 * interrupt monitor and the capture loop cannot saturate the CPU together.
 *
 * <p><b>Privacy:</b> never logs transcription text at INFO level.
 */
public final class WhisperSpeechRecognizer implements SpeechRecognizer {

    private static final Logger LOG = LogManager.getLogger(WhisperSpeechRecognizer.class);

    static final String NAME = "whisper";

    /** Languages whose whisper code differs from the BCP-47 primary subtag. */
    private static final Map<String, String> WHISPER_CODES = Map.of("fil", "tl");

    private final WhisperProperties cfg;
    private final WhisperProcessRunner runner;
    private final VoiceMetrics metrics;
    private final Semaphore permits;

    public WhisperSpeechRecognizer(WhisperProperties cfg, WhisperProcessRunner runner, VoiceMetrics metrics,
                                   int maxConcurrent) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.permits = new Semaphore(Math.max(1, maxConcurrent));
    }

    @Override
    public TranscriptionResult transcribe(AudioSegment audio, String languageHint) {
        if (audio == null || audio.isEmpty()) {
            throw new IllegalArgumentException("audio must not be null or empty");
        }
        String language = toWhisperLanguage(languageHint);
        acquire();
        long start = System.nanoTime();
        Path wav = null;
        try {
            wav = Files.createTempFile("talkback-", ".wav");
            WavWriter.write(audio, wav);
            String text = normalize(runner.run(wav, language, cfg));
            metrics.recordTranscription(NAME, System.nanoTime() - start, text.isEmpty() ? "empty" : "text");
            LOG.debug("Whisper transcribed {} ms of audio (lang={}, chars={})",
                    audio.duration().toMillis(), language, text.length());
            return TranscriptionResult.of(text, Objects.requireNonNullElse(languageHint, language), NAME);
        } catch (IOException e) {
            metrics.recordTranscription(NAME, System.nanoTime() - start, "error");
            throw new TranscriptionServiceUnavailableException("Could not write temporary WAV: " + e.getMessage(),
                    NAME, e);
        } catch (TranscriptionServiceUnavailableException e) {
            metrics.recordTranscription(NAME, System.nanoTime() - start, "error");
            throw e;
        } finally {
            permits.release();
            deleteQuietly(wav);
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isHealthy() {
        return Files.isExecutable(Path.of(cfg.binaryPath())) && Files.isReadable(Path.of(cfg.modelPath()));
    }

    /**
     * Maps a BCP-47 tag to a whisper language code: {@code en-GB -> en}, {@code fil-PH -> tl}.
     *
     * @param languageHint BCP-47 tag, null or blank for auto-detection
     * @return whisper language code, {@code auto} when no hint is given
     */
    static String toWhisperLanguage(String languageHint) {
        if (languageHint == null || languageHint.isBlank()) {
            return "auto";
        }
        String primary = languageHint.split("[-_]", 2)[0].toLowerCase(Locale.ROOT);
        return WHISPER_CODES.getOrDefault(primary, primary);
    }

    /** Joins whisper's line-per-segment output into one line and drops non-speech markers. */
    static String normalize(String stdout) {
        if (stdout == null) {
            return "";
        }
        String text = stdout
                .replaceAll("\\[[^\\]]*\\]", " ")  // [BLANK_AUDIO], [MUSIC]
                .replaceAll("\\([^)]*\\)", " ")    // (wind blowing)
                .replaceAll("\\s+", " ")
                .trim();
        return text;
    }

    private void acquire() {
        try {
            if (!permits.tryAcquire(cfg.timeoutSeconds(), TimeUnit.SECONDS)) {
                throw new TranscriptionServiceUnavailableException(
                        "Concurrency limit reached after " + cfg.timeoutSeconds() + "s wait", NAME);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionServiceUnavailableException("Interrupted while waiting for a permit", NAME, e);
        }
    }

    private static void deleteQuietly(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.debug("Could not delete temporary WAV {}: {}", wav, e.toString());
        }
    }
}
