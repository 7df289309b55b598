package com.phillippitts.talkback.service.profile;

import com.phillippitts.talkback.config.properties.EnvironmentProperties;
import com.phillippitts.talkback.domain.EnvironmentCategory;
import com.phillippitts.talkback.domain.EnvironmentProfile;
import com.phillippitts.talkback.domain.ListenMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Classifies the host once and hands out the same {@link EnvironmentProfile} forever after.
 *
 * <p>Classification never fails: any fact that cannot be read is treated as unknown, and a host
 * that matches nothing is {@link EnvironmentCategory#GENERIC}. Thread-safe.
 */
public class EnvironmentProfileResolver {

    private static final Logger LOG = LogManager.getLogger(EnvironmentProfileResolver.class);

    private final EnvironmentProbe probe;
    private final EnvironmentProperties properties;
    private volatile EnvironmentProfile resolved;

    public EnvironmentProfileResolver(EnvironmentProbe probe, EnvironmentProperties properties) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Returns the profile for this host, computing it on first use.
     *
     * @return memoized profile; never null
     */
    public EnvironmentProfile probe() {
        EnvironmentProfile profile = resolved;
        if (profile != null) {
            return profile;
        }
        synchronized (this) {
            if (resolved == null) {
                EnvironmentCategory category = properties.getCategory() != null
                        ? properties.getCategory()
                        : classify();
                resolved = category.toProfile();
                LOG.info("Environment profile resolved: category={}, base-threshold={}, normal={}, interrupt-check={}{}",
                        category, resolved.baseEnergyThreshold(),
                        resolved.effectiveThreshold(ListenMode.NORMAL),
                        resolved.effectiveThreshold(ListenMode.INTERRUPT_CHECK),
                        properties.getCategory() != null ? " (configured)" : "");
            }
            return resolved;
        }
    }

    EnvironmentCategory classify() {
        String model = safe(() -> probe.boardModel().orElse(""));
        if (model.contains("Raspberry Pi 5")) {
            return EnvironmentCategory.SMALL_BOARD_GEN5;
        }
        if (model.contains("Raspberry Pi")) {
            return EnvironmentCategory.SMALL_BOARD;
        }

        String os = safe(probe::osName).toLowerCase(Locale.ROOT);
        String arch = safe(probe::osArch).toLowerCase(Locale.ROOT);

        if (os.contains("linux") && (arch.startsWith("arm") || arch.equals("aarch64"))) {
            return EnvironmentCategory.SMALL_BOARD;
        }
        if (os.contains("mac") || os.contains("darwin")) {
            return EnvironmentCategory.DESKTOP_MACOS;
        }
        if (os.contains("linux") || os.contains("bsd") || os.contains("sunos")
                || os.contains("solaris") || os.contains("aix")) {
            return EnvironmentCategory.DESKTOP_POSIX;
        }
        return EnvironmentCategory.GENERIC;
    }

    private static String safe(Supplier<String> fact) {
        try {
            String value = fact.get();
            return value == null ? "" : value;
        } catch (RuntimeException e) {
            LOG.debug("Host fact unavailable: {}", e.toString());
            return "";
        }
    }
}
