package com.phillippitts.talkback.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the whisper.cpp speech recognizer.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>Example application.yml:
 * <pre>
 * stt:
 *   whisper:
 *     binary-path: tools/whisper.cpp/main
 *     model-path: models/ggml-base.bin
 *     timeout-seconds: 10
 *     threads: 4
 *     max-stdout-bytes: 1048576
 *     max-concurrent: 1
 * </pre>
 *
 * @param binaryPath Path to the whisper.cpp binary executable
 * @param modelPath Path to the GGML model file (.bin); must be multilingual for non-English hints
 * @param timeoutSeconds Maximum time to wait for one transcription
 * @param threads Number of CPU threads to use for transcription
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 * @param maxConcurrent Maximum number of whisper processes running at once
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperProperties(
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @Positive(message = "Thread count must be positive")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes,

        @Positive(message = "Max concurrent must be positive")
        int maxConcurrent
) {
}
