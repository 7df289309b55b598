package com.phillippitts.talkback.service.stt;

import com.phillippitts.talkback.domain.AudioSegment;
import com.phillippitts.talkback.domain.TranscriptionResult;
import com.phillippitts.talkback.exception.TranscriptionServiceUnavailableException;

/**
 * Contract for speech-to-text services.
 *
 * <p>An empty result text means no speech was recognized. That is a normal outcome, not an
 * error. Implementations must be thread-safe: the capture loop and the interrupt monitor may
 * call {@link #transcribe} concurrently.
 *
 * <p>Audio Format: implementations accept PCM16LE audio as carried by {@link AudioSegment}.
 *
 * @see TranscriptionResult
 * @see TranscriptionServiceUnavailableException
 */
public interface SpeechRecognizer {

    /**
     * Transcribes one segment of audio.
     *
     * @param audio        audio to transcribe (must not be empty)
     * @param languageHint BCP-47 language tag such as {@code en-US} or {@code fil-PH}
     * @return result with possibly empty text
     * @throws TranscriptionServiceUnavailableException if the service fails
     * @throws IllegalArgumentException if audio is null or empty
     */
    TranscriptionResult transcribe(AudioSegment audio, String languageHint);

    /**
     * Returns the name of this recognizer for logging and metrics.
     *
     * @return recognizer name (e.g., "whisper")
     */
    String getName();

    /**
     * Checks whether the recognizer can currently serve requests.
     *
     * @return true if operational
     */
    default boolean isHealthy() {
        return true;
    }
}
