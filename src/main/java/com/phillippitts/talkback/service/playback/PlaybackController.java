package com.phillippitts.talkback.service.playback;

/**
 * Control surface of the text-to-speech playback collaborator.
 *
 * <p>Playback itself reports its state through
 * {@link com.phillippitts.talkback.service.state.InteractionState#beginSpeaking(String)} and
 * {@link com.phillippitts.talkback.service.state.InteractionState#finishSpeaking()}.
 */
public interface PlaybackController {

    /**
     * Stops any audio currently playing. Must return promptly and be safe to call when idle.
     */
    void stopImmediately();
}
