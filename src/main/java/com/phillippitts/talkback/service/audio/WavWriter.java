package com.phillippitts.talkback.service.audio;

import com.phillippitts.talkback.domain.AudioSegment;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes minimal PCM WAV files for a segment's own sample rate and channel count.
 *
 * <p>Samples are always 16-bit signed little-endian.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Writes {@code segment} as a 44-byte-header PCM WAV file.
     *
     * @param segment audio to write
     * @param wavPath output file path (will be created or overwritten)
     * @throws IOException if the file cannot be written
     */
    public static void write(AudioSegment segment, Path wavPath) throws IOException {
        Objects.requireNonNull(segment, "segment must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            writeTo(segment, os);
        }
    }

    static void writeTo(AudioSegment segment, OutputStream os) throws IOException {
        byte[] pcm = segment.pcm();
        int blockAlign = segment.channels() * (AudioFormat.REQUIRED_BITS_PER_SAMPLE / 8);

        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + pcm.length);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, 16);
        writeLEShort(os, (short) 1); // PCM
        writeLEShort(os, (short) segment.channels());
        writeLEInt(os, segment.sampleRate());
        writeLEInt(os, segment.byteRate());
        writeLEShort(os, (short) blockAlign);
        writeLEShort(os, (short) AudioFormat.REQUIRED_BITS_PER_SAMPLE);

        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, pcm.length);
        os.write(pcm);
        os.flush();
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
