package com.phillippitts.talkback.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * One fixed-duration slice of raw 16-bit signed little-endian PCM audio.
 *
 * <p>Segments are ephemeral: owned by the capture engine until they are transcribed or
 * discarded. The byte array is not copied; callers must not modify it after construction.
 *
 * @param pcm        raw PCM16LE samples (interleaved when {@code channels > 1})
 * @param sampleRate sample rate in Hz
 * @param channels   channel count
 * @param duration   playback duration of {@code pcm}
 */
public record AudioSegment(byte[] pcm, int sampleRate, int channels, Duration duration) {

    private static final int BYTES_PER_SAMPLE = 2;

    public AudioSegment {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive, got: " + channels);
        }
    }

    /**
     * Creates a segment whose duration is derived from the PCM length.
     *
     * @param pcm        raw PCM16LE samples
     * @param sampleRate sample rate in Hz
     * @param channels   channel count
     * @return new segment
     */
    public static AudioSegment of(byte[] pcm, int sampleRate, int channels) {
        long bytesPerSecond = (long) sampleRate * channels * BYTES_PER_SAMPLE;
        long millis = bytesPerSecond == 0 ? 0 : (pcm.length * 1000L) / bytesPerSecond;
        return new AudioSegment(pcm, sampleRate, channels, Duration.ofMillis(millis));
    }

    /** Bytes of PCM per second at this segment's format. */
    public int byteRate() {
        return sampleRate * channels * BYTES_PER_SAMPLE;
    }

    public boolean isEmpty() {
        return pcm.length == 0;
    }

    /**
     * Checks whether another segment can be concatenated with this one.
     *
     * @param other segment to compare
     * @return true when sample rate and channel count match
     */
    public boolean sameFormatAs(AudioSegment other) {
        return other != null && sampleRate == other.sampleRate && channels == other.channels;
    }

    @Override
    public String toString() {
        return "AudioSegment[bytes=" + pcm.length + ", sampleRate=" + sampleRate
                + ", channels=" + channels + ", duration=" + duration.toMillis() + "ms]";
    }
}
