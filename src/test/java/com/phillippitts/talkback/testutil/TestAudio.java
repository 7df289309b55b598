package com.phillippitts.talkback.testutil;

import com.phillippitts.talkback.domain.AudioSegment;

import java.time.Duration;

/**
 * Builders for 16 kHz mono PCM16LE test segments.
 */
public final class TestAudio {

    public static final int SAMPLE_RATE = 16_000;

    /** Amplitude of {@link #loud(Duration)} samples; also their RMS level. */
    public static final int LOUD_AMPLITUDE = 3000;

    private TestAudio() {}

    /** Square wave at {@link #LOUD_AMPLITUDE}, well above every energy gate. */
    public static AudioSegment loud(Duration duration) {
        return tone(duration, LOUD_AMPLITUDE);
    }

    /** Digital silence (RMS 0). */
    public static AudioSegment silent(Duration duration) {
        return tone(duration, 0);
    }

    public static AudioSegment tone(Duration duration, int amplitude) {
        int samples = (int) (SAMPLE_RATE * duration.toMillis() / 1000);
        byte[] pcm = new byte[samples * 2];
        for (int i = 0; i < samples; i++) {
            int value = (i % 2 == 0) ? amplitude : -amplitude;
            pcm[2 * i] = (byte) (value & 0xFF);
            pcm[2 * i + 1] = (byte) ((value >> 8) & 0xFF);
        }
        return AudioSegment.of(pcm, SAMPLE_RATE, 1);
    }
}
