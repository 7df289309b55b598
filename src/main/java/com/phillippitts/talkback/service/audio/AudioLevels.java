package com.phillippitts.talkback.service.audio;

import com.phillippitts.talkback.domain.AudioSegment;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.List;

/**
 * Energy measurement and concatenation of PCM16LE audio.
 *
 * <p>RMS values are on the 16-bit sample scale (0-32767). Multi-channel audio is measured
 * across all interleaved samples.
 *
 * @since 1.0
 */
public final class AudioLevels {

    private AudioLevels() {
        // Utility class
    }

    /**
     * Calculates RMS (Root Mean Square) amplitude of a segment.
     *
     * @param segment PCM16LE audio
     * @return RMS amplitude, 0 for empty audio
     */
    public static double rms(AudioSegment segment) {
        return rms(segment.pcm(), 0, segment.pcm().length);
    }

    /**
     * Calculates RMS amplitude for a window of a PCM16LE buffer.
     *
     * @param pcmData PCM16LE audio buffer
     * @param offset starting byte position
     * @param length number of bytes to analyze
     * @return RMS amplitude (0-32767 range for 16-bit PCM)
     */
    public static double rms(byte[] pcmData, int offset, int length) {
        long sumSquares = 0;
        int sampleCount = 0;

        for (int i = offset; i + 1 < offset + length && i + 1 < pcmData.length; i += 2) {
            // little-endian signed 16-bit
            int sample = (pcmData[i] & 0xFF) | (pcmData[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }

        if (sampleCount == 0) {
            return 0;
        }
        return Math.sqrt((double) sumSquares / sampleCount);
    }

    /**
     * Concatenates segments in order into one segment.
     *
     * @param segments non-empty list of segments sharing one format
     * @return concatenated segment whose duration is the sum of the parts
     * @throws IllegalArgumentException if the list is empty or formats differ
     */
    public static AudioSegment concat(List<AudioSegment> segments) {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("segments must not be empty");
        }
        AudioSegment first = segments.get(0);
        if (segments.size() == 1) {
            return first;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Duration total = Duration.ZERO;
        for (AudioSegment segment : segments) {
            if (!first.sameFormatAs(segment)) {
                throw new IllegalArgumentException("Cannot concatenate segments with different formats: "
                        + first + " vs " + segment);
            }
            out.writeBytes(segment.pcm());
            total = total.plus(segment.duration());
        }
        return new AudioSegment(out.toByteArray(), first.sampleRate(), first.channels(), total);
    }
}
