package com.spanlens.core.model;

/**
 * Timing tag of a cascade, independent of its strength bucket.
 *
 * @since 1.0.0
 */
public enum CascadeTiming {

    /** The target opened shortly after the trigger (below the immediate threshold). */
    IMMEDIATE,

    /** Every other delay inside the cascade window. */
    DELAYED
}
