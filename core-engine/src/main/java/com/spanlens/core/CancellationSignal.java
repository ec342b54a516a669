package com.spanlens.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Thread-safe {@link CancellationToken} that a caller flips from another
 * thread.
 *
 * @since 1.0.0
 */
public final class CancellationSignal implements CancellationToken {

    private static final long serialVersionUID = 1L;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Request cancellation. Idempotent.
     */
    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
