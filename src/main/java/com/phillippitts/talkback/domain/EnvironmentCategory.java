package com.phillippitts.talkback.domain;

import java.time.Duration;

/**
 * Host categories with their tuned capture defaults.
 *
 * <p>Values are literal tuning results for each class of device; see
 * {@link EnvironmentProfile#effectiveThreshold(ListenMode)} for how they combine.
 */
public enum EnvironmentCategory {

    /** Fifth-generation single-board computer with a dedicated audio HAT. */
    SMALL_BOARD_GEN5(150, 1200, 1.2, 1.3, ModeMultipliers.of(1.0, 0.8, 1.1, 0.6)),

    /** Any other single-board or ARM Linux device. */
    SMALL_BOARD(120, 1000, 1.0, 1.2, ModeMultipliers.of(1.0, 0.7, 1.2, 0.5)),

    /** macOS desktop or laptop. */
    DESKTOP_MACOS(300, 800, 1.0, 1.0, ModeMultipliers.of(1.0, 0.83, 1.0, 0.67)),

    /** Linux or other POSIX desktop. */
    DESKTOP_POSIX(200, 1000, 1.1, 1.1, ModeMultipliers.of(1.0, 0.75, 1.15, 0.6)),

    /** Unrecognized host. */
    GENERIC(250, 800, 1.0, 1.0, ModeMultipliers.of(1.0, 0.8, 1.1, 0.65));

    private final int baseEnergyThreshold;
    private final long calibrationMillis;
    private final double chunkDurationMultiplier;
    private final double silenceToleranceMultiplier;
    private final ModeMultipliers modeMultipliers;

    EnvironmentCategory(int baseEnergyThreshold,
                        long calibrationMillis,
                        double chunkDurationMultiplier,
                        double silenceToleranceMultiplier,
                        ModeMultipliers modeMultipliers) {
        this.baseEnergyThreshold = baseEnergyThreshold;
        this.calibrationMillis = calibrationMillis;
        this.chunkDurationMultiplier = chunkDurationMultiplier;
        this.silenceToleranceMultiplier = silenceToleranceMultiplier;
        this.modeMultipliers = modeMultipliers;
    }

    /**
     * Builds the immutable profile for this category.
     *
     * @return profile carrying this category's defaults
     */
    public EnvironmentProfile toProfile() {
        return new EnvironmentProfile(
                this,
                baseEnergyThreshold,
                Duration.ofMillis(calibrationMillis),
                chunkDurationMultiplier,
                silenceToleranceMultiplier,
                modeMultipliers
        );
    }
}
