package com.spanlens.core.model;

/**
 * Strength bucket of a cascade relationship, assigned from data-driven
 * quantile cut points rather than fixed constants.
 *
 * @since 1.0.0
 */
public enum CascadeStrength {

    /** Below the lower-quartile cut point of the run. */
    WEAK,

    /** Between the lower and upper cut points. */
    MODERATE,

    /** At or above the upper-quartile cut point. */
    STRONG
}
