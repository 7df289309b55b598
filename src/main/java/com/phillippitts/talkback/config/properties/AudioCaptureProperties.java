package com.phillippitts.talkback.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Required format (enforced by the source): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(String deviceName) {
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public String getDeviceName() { return deviceName; }
}
