package com.phillippitts.talkback.service.profile;

import java.util.Optional;

/**
 * Read-only view of the host facts used for classification.
 */
public interface EnvironmentProbe {

    /** Operating system name, e.g. {@code "Linux"} or {@code "Mac OS X"}. */
    String osName();

    /** CPU architecture, e.g. {@code "aarch64"} or {@code "amd64"}. */
    String osArch();

    /**
     * Board model string, if the host publishes one.
     *
     * @return model string such as {@code "Raspberry Pi 5 Model B Rev 1.0"}, or empty
     */
    Optional<String> boardModel();
}
