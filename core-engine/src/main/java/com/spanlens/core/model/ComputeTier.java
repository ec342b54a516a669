package com.spanlens.core.model;

import java.util.Locale;

/**
 * Processing budget supplied by the caller. Higher tiers fit richer models.
 *
 * <p>
 * The engine treats the tier as an opaque, ordered parameter and never inspects
 * the hardware. Unrecognised names or ordinals resolve to {@link #STANDARD}.
 * </p>
 *
 * @since 1.0.0
 */
public enum ComputeTier {

    /** AR(1) from lag-1 correlation, fixed MA coefficient. */
    MINIMAL,

    /** AR(2) via Yule-Walker. */
    STANDARD,

    /** AR(3) via Yule-Walker. */
    ADVANCED,

    /** AR(4)+MA(1) refined by Levenberg-Marquardt. */
    EXPERT;

    /**
     * Resolve a tier by name, case-insensitively.
     *
     * @param name tier name; may be {@code null}
     * @return matching tier, or {@link #STANDARD} if unknown
     */
    public static ComputeTier parse(String name) {
        if (name == null || name.isBlank()) {
            return STANDARD;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return STANDARD;
        }
    }

    /**
     * Resolve a tier by ordinal.
     *
     * @param ordinal tier ordinal
     * @return matching tier, or {@link #STANDARD} if out of range
     */
    public static ComputeTier fromOrdinal(int ordinal) {
        ComputeTier[] tiers = values();
        return ordinal >= 0 && ordinal < tiers.length ? tiers[ordinal] : STANDARD;
    }

    /**
     * @return the next simpler tier, or {@code MINIMAL} for {@code MINIMAL}
     */
    public ComputeTier lower() {
        return this == MINIMAL ? MINIMAL : values()[ordinal() - 1];
    }
}
