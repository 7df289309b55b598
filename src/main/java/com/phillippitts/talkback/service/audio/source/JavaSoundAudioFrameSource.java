package com.phillippitts.talkback.service.audio.source;

import com.phillippitts.talkback.config.properties.AudioCaptureProperties;
import com.phillippitts.talkback.domain.AudioSegment;
import com.phillippitts.talkback.exception.AudioSourceUnavailableException;
import com.phillippitts.talkback.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;

import jakarta.annotation.PostConstruct;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound based microphone source that produces raw PCM16LE mono @16kHz.
 *
 * <p>Registered as a bean by {@link com.phillippitts.talkback.config.AudioSourceConfig} when no
 * other {@link AudioFrameSource} exists, so tests and embedders can supply their own.
 */
public class JavaSoundAudioFrameSource implements AudioFrameSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioFrameSource.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final DataLineProvider provider;

    @Autowired
    public JavaSoundAudioFrameSource(AudioCaptureProperties props) {
        this(props, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioFrameSource(AudioCaptureProperties props, DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    public void logSystemInfo() {
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";
        LOG.info("Audio source initialized: OS={}, arch={}, device='{}', available-mixers={}",
                System.getProperty("os.name"), System.getProperty("os.arch"), device,
                AudioSystem.getMixerInfo().length);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public AudioFrameStream open() {
        javax.sound.sampled.AudioFormat fmt = new javax.sound.sampled.AudioFormat(
                AudioFormat.REQUIRED_SAMPLE_RATE,
                AudioFormat.REQUIRED_BITS_PER_SAMPLE,
                AudioFormat.REQUIRED_CHANNELS,
                AudioFormat.REQUIRED_SIGNED,
                AudioFormat.REQUIRED_BIG_ENDIAN
        );
        String device = deviceLabel();
        try {
            TargetDataLine line = provider.open(fmt, Optional.ofNullable(props.getDeviceName()));
            line.start();
            LOG.debug("Opened capture line on device '{}'", device);
            return new LineStream(line, device);
        } catch (LineUnavailableException e) {
            throw new AudioSourceUnavailableException("Microphone unavailable", device, e);
        } catch (SecurityException | IllegalArgumentException e) {
            throw new AudioSourceUnavailableException("Microphone access denied", device, e);
        }
    }

    private String deviceLabel() {
        return props.getDeviceName() != null ? props.getDeviceName() : "default";
    }

    private static final class LineStream implements AudioFrameStream {

        private final TargetDataLine line;
        private final String device;
        private boolean closed;

        LineStream(TargetDataLine line, String device) {
            this.line = line;
            this.device = device;
        }

        @Override
        public AudioSegment read(Duration duration) {
            if (closed) {
                throw new IllegalStateException("Stream is closed");
            }
            int wanted = AudioFormat.bytesFor(duration.toMillis(),
                    AudioFormat.REQUIRED_BYTE_RATE, AudioFormat.REQUIRED_BLOCK_ALIGN);
            byte[] buf = new byte[wanted];
            int filled = 0;
            while (filled < wanted) {
                int n = line.read(buf, filled, wanted - filled);
                if (n <= 0) {
                    if (!line.isOpen()) {
                        throw new AudioSourceUnavailableException("Capture line closed during read", device);
                    }
                    if (Thread.currentThread().isInterrupted()) {
                        throw new AudioSourceUnavailableException("Capture read interrupted", device);
                    }
                    continue;
                }
                filled += n;
            }
            return new AudioSegment(buf, AudioFormat.REQUIRED_SAMPLE_RATE, AudioFormat.REQUIRED_CHANNELS, duration);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                line.stop();
                line.close();
            } catch (RuntimeException e) {
                LOG.debug("Error closing capture line on device '{}': {}", device, e.toString());
            }
        }
    }
}
