package com.trendscope.core.concurrent;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation point for long model loops.
 *
 * <p>
 * {@link AnalysisExecutor} interrupts a worker whose task exceeded its time
 * budget. Fitting loops call {@link #checkpoint()} between iterations so the
 * interrupt actually stops the work instead of being ignored.
 * </p>
 *
 * @since 1.0.0
 */
public final class Cancellation {

    private Cancellation() {
        // utility class, not instantiable
    }

    /**
     * @throws CancellationException if the current thread has been interrupted
     */
    public static void checkpoint() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Analysis task cancelled");
        }
    }
}
