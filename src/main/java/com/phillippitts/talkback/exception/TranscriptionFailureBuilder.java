package com.phillippitts.talkback.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TranscriptionServiceUnavailableException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw TranscriptionFailureBuilder.create("whisper process failed")
 *         .recognizer("whisper")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .detail("languageHint", "en-US")
 *         .detail("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class TranscriptionFailureBuilder {

    private final String message;
    private String recognizerName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> details = new LinkedHashMap<>();

    private TranscriptionFailureBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static TranscriptionFailureBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionFailureBuilder(message);
    }

    public TranscriptionFailureBuilder recognizer(String recognizerName) {
        this.recognizerName = recognizerName;
        return this;
    }

    public TranscriptionFailureBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionFailureBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public TranscriptionFailureBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value detail to the message. Null keys or values are ignored.
     *
     * @param key detail name
     * @param value detail value
     * @return this builder for chaining
     */
    public TranscriptionFailureBuilder detail(String key, Object value) {
        if (key != null && value != null) {
            details.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The message format is
     * {@code {message} (exitCode={code}, durationMs={ms}, {key}={value}, ...)}.
     *
     * @return constructed exception
     */
    public TranscriptionServiceUnavailableException build() {
        String detailed = detailedMessage();
        String recognizer = recognizerName != null ? recognizerName : "unknown";
        if (cause != null) {
            return new TranscriptionServiceUnavailableException(detailed, recognizer, cause);
        }
        return new TranscriptionServiceUnavailableException(detailed, recognizer);
    }

    private String detailedMessage() {
        Map<String, String> parts = new LinkedHashMap<>();
        if (exitCode != null) {
            parts.put("exitCode", String.valueOf(exitCode));
        }
        if (durationMs != null) {
            parts.put("durationMs", String.valueOf(durationMs));
        }
        parts.putAll(details);
        if (parts.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : parts.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
