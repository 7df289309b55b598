package com.phillippitts.talkback.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Utterance assembly settings.
 *
 * <p>Example application.yml:
 * <pre>
 * assembler:
 *   max-attempts: 3
 *   retry-pause: 200ms
 *   default-hints: [en-US, en-GB, en-AU]
 *   intl-hints: [fil-PH, en-US]
 *   repairs:
 *     - { from: "tagalog", to: "filipino" }
 * </pre>
 *
 * @param maxAttempts  primary-strategy attempts before falling back to per-chunk transcription
 * @param retryPause   pause between primary attempts
 * @param defaultHints ordered language hints for every mode except the international game
 * @param intlHints    ordered language hints for the international game
 * @param repairs      ordered literal substitutions applied to the assembled text
 */
@Validated
@ConfigurationProperties(prefix = "assembler")
public record AssemblerProperties(
        @Min(value = 1, message = "At least one attempt is required")
        Integer maxAttempts,

        Duration retryPause,

        List<String> defaultHints,

        List<String> intlHints,

        @Valid
        List<Repair> repairs
) {

    public AssemblerProperties {
        maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        retryPause = retryPause == null ? Duration.ofMillis(200) : retryPause;
        defaultHints = defaultHints == null || defaultHints.isEmpty()
                ? List.of("en-US", "en-GB", "en-AU") : List.copyOf(defaultHints);
        intlHints = intlHints == null || intlHints.isEmpty()
                ? List.of("fil-PH", "en-US") : List.copyOf(intlHints);
        repairs = repairs == null ? List.of() : List.copyOf(repairs);
    }

    /**
     * One literal substitution.
     *
     * @param from text to replace (matched case-insensitively)
     * @param to   replacement
     */
    public record Repair(@NotBlank String from, String to) {
        public Repair {
            to = to == null ? "" : to;
        }
    }
}
