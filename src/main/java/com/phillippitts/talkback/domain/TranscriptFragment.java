package com.phillippitts.talkback.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Text recognized from a single retained chunk.
 *
 * @param text    non-blank transcription of {@code source}
 * @param source  the segment the text was recognized from
 * @param offset  elapsed capture time at which {@code source} started, relative to the listen call
 */
public record TranscriptFragment(String text, AudioSegment source, Duration offset) {

    public TranscriptFragment {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(offset, "offset must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Fragment text must not be blank");
        }
    }
}
