package com.phillippitts.talkback.service.capture;

/**
 * Classification of one captured chunk.
 *
 * @param kind what the chunk turned out to be
 * @param text recognized text for {@link Kind#HUMAN}, otherwise null
 */
public record ChunkOutcome(Kind kind, String text) {

    public enum Kind {
        /** Below the energy gate; the recognizer was not called. */
        GATED,
        /** The recognizer heard nothing. */
        EMPTY,
        /** The recognizer failed; treated like {@link #EMPTY}. */
        ERROR,
        /** Text that the self-speech filter attributed to the assistant. */
        SELF_SPEECH,
        /** Text attributed to a person. */
        HUMAN
    }

    static ChunkOutcome of(Kind kind) {
        return new ChunkOutcome(kind, null);
    }

    static ChunkOutcome human(String text) {
        return new ChunkOutcome(Kind.HUMAN, text);
    }

    public boolean isHuman() {
        return kind == Kind.HUMAN;
    }
}
