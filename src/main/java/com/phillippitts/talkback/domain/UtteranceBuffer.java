package com.phillippitts.talkback.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered collection of the chunks retained for one utterance.
 *
 * <p><b>Lifecycle:</b>
 * <pre>
 * CAPTURING → FROZEN (via freeze)
 * FROZEN → CONSUMED (via consume, exactly once)
 * </pre>
 *
 * <p>Not thread-safe. A buffer belongs to the single capture task that created it.
 */
public final class UtteranceBuffer {

    private final List<TranscriptFragment> fragments = new ArrayList<>();
    private boolean frozen;
    private boolean consumed;

    /**
     * Appends a retained fragment and its source segment.
     *
     * @param fragment fragment to retain
     * @throws IllegalStateException if the buffer has been frozen
     */
    public void append(TranscriptFragment fragment) {
        Objects.requireNonNull(fragment, "fragment must not be null");
        if (frozen) {
            throw new IllegalStateException("Utterance buffer is frozen");
        }
        fragments.add(fragment);
    }

    /** Freezes the buffer. Idempotent. */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    public int size() {
        return fragments.size();
    }

    public Optional<TranscriptFragment> lastFragment() {
        return fragments.isEmpty() ? Optional.empty() : Optional.of(fragments.get(fragments.size() - 1));
    }

    /** Read-only view of the retained fragments in capture order. */
    public List<TranscriptFragment> fragments() {
        return List.copyOf(fragments);
    }

    /**
     * Hands the retained segments to the assembler. Allowed once, after {@link #freeze()}.
     *
     * @return retained segments in chronological order
     * @throws IllegalStateException if the buffer is not frozen or was already consumed
     */
    public List<AudioSegment> consume() {
        if (!frozen) {
            throw new IllegalStateException("Utterance buffer must be frozen before it is consumed");
        }
        if (consumed) {
            throw new IllegalStateException("Utterance buffer was already consumed");
        }
        consumed = true;
        List<AudioSegment> segments = new ArrayList<>(fragments.size());
        for (TranscriptFragment fragment : fragments) {
            segments.add(fragment.source());
        }
        return List.copyOf(segments);
    }
}
