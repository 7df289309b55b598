package com.phillippitts.talkback.service.profile;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads host facts from JVM system properties and the device-tree model file.
 */
public class SystemEnvironmentProbe implements EnvironmentProbe {

    private static final Logger LOG = LogManager.getLogger(SystemEnvironmentProbe.class);

    private final Path boardModelPath;

    public SystemEnvironmentProbe(Path boardModelPath) {
        this.boardModelPath = boardModelPath;
    }

    @Override
    public String osName() {
        return System.getProperty("os.name", "");
    }

    @Override
    public String osArch() {
        return System.getProperty("os.arch", "");
    }

    @Override
    public Optional<String> boardModel() {
        if (!Files.isReadable(boardModelPath)) {
            return Optional.empty();
        }
        try {
            // device-tree strings are NUL-terminated
            String model = Files.readString(boardModelPath, StandardCharsets.UTF_8).replace("\0", "").trim();
            return model.isEmpty() ? Optional.empty() : Optional.of(model);
        } catch (IOException | SecurityException e) {
            LOG.debug("Could not read board model from {}: {}", boardModelPath, e.toString());
            return Optional.empty();
        }
    }
}
