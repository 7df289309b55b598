package com.phillippitts.talkback.domain;

import com.phillippitts.talkback.util.TimeUtils;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable capture tuning for the current host, resolved once per process.
 *
 * @param category                    host category the values were taken from
 * @param baseEnergyThreshold         RMS level below which a chunk is treated as silence (16-bit PCM scale)
 * @param calibrationDuration         how long to sample ambient noise before a listen call
 * @param chunkDurationMultiplier     scales the per-mode base chunk duration
 * @param silenceToleranceMultiplier  scales the caller's silence threshold
 * @param modeMultipliers             per-mode scale applied to {@code baseEnergyThreshold}
 */
public record EnvironmentProfile(
        EnvironmentCategory category,
        int baseEnergyThreshold,
        Duration calibrationDuration,
        double chunkDurationMultiplier,
        double silenceToleranceMultiplier,
        ModeMultipliers modeMultipliers
) {

    public EnvironmentProfile {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(calibrationDuration, "calibrationDuration must not be null");
        Objects.requireNonNull(modeMultipliers, "modeMultipliers must not be null");
        if (baseEnergyThreshold <= 0) {
            throw new IllegalArgumentException("baseEnergyThreshold must be positive, got: " + baseEnergyThreshold);
        }
        if (chunkDurationMultiplier <= 0.0 || silenceToleranceMultiplier <= 0.0) {
            throw new IllegalArgumentException("Duration multipliers must be positive");
        }
    }

    /**
     * Returns the energy threshold for a mode, rounded half up.
     *
     * @param mode capture mode
     * @return {@code round(baseEnergyThreshold * modeMultiplier)}
     */
    public int effectiveThreshold(ListenMode mode) {
        return (int) Math.round(baseEnergyThreshold * modeMultipliers.get(mode));
    }

    /**
     * Scales a base chunk duration by this profile's chunk multiplier.
     *
     * @param baseChunk per-mode base duration
     * @return chunk duration to request from the audio source
     */
    public Duration scaleChunk(Duration baseChunk) {
        return TimeUtils.scale(baseChunk, chunkDurationMultiplier);
    }

    /**
     * Scales the caller's silence threshold by this profile's tolerance multiplier.
     *
     * @param silenceThreshold silence requested by the caller
     * @return silence that must accumulate before an utterance is finalized
     */
    public Duration scaleSilence(Duration silenceThreshold) {
        return TimeUtils.scale(silenceThreshold, silenceToleranceMultiplier);
    }
}
