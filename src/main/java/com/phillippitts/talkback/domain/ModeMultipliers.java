package com.phillippitts.talkback.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-mode energy threshold multipliers, one entry for every {@link ListenMode}.
 *
 * <p>Construction fails if a mode is missing, so a new mode cannot be added without a value
 * for every environment category.
 */
public final class ModeMultipliers {

    private final Map<ListenMode, Double> values;

    private ModeMultipliers(EnumMap<ListenMode, Double> values) {
        for (ListenMode mode : ListenMode.values()) {
            Double value = values.get(mode);
            if (value == null) {
                throw new IllegalArgumentException("Missing multiplier for mode " + mode);
            }
            if (value <= 0.0) {
                throw new IllegalArgumentException("Multiplier for " + mode + " must be positive, got: " + value);
            }
        }
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Creates a table from the four mode values.
     *
     * @param normal multiplier for {@link ListenMode#NORMAL}
     * @param wordGame multiplier for {@link ListenMode#WORD_GAME}
     * @param intlGame multiplier for {@link ListenMode#INTL_GAME}
     * @param interruptCheck multiplier for {@link ListenMode#INTERRUPT_CHECK}
     * @return immutable multiplier table
     */
    public static ModeMultipliers of(double normal, double wordGame, double intlGame, double interruptCheck) {
        EnumMap<ListenMode, Double> map = new EnumMap<>(ListenMode.class);
        map.put(ListenMode.NORMAL, normal);
        map.put(ListenMode.WORD_GAME, wordGame);
        map.put(ListenMode.INTL_GAME, intlGame);
        map.put(ListenMode.INTERRUPT_CHECK, interruptCheck);
        return new ModeMultipliers(map);
    }

    public double get(ListenMode mode) {
        return values.get(Objects.requireNonNull(mode, "mode"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModeMultipliers other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ModeMultipliers" + values;
    }
}
