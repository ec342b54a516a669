package com.spanlens.core;

import java.io.Serializable;

/**
 * Cooperative cancellation check polled by the long-running engine loops.
 *
 * <p>
 * Engines never block on the token; they read it at regular intervals and
 * return partial or empty results once it reports cancellation.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellationToken extends Serializable {

    /** A token that is never cancelled. */
    CancellationToken NONE = () -> false;

    /**
     * @return {@code true} once the caller no longer needs the result
     */
    boolean isCancelled();
}
