package com.sitepilot.orchestrator.session;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation points for request threads.
 *
 * A superseded request is cancelled with {@code Future.cancel(true)}; the
 * interrupt is observed here and at every remote call.
 */
public final class Cancellation {

    private Cancellation() {}

    /** Throw if the current thread has been interrupted. The flag stays set. */
    public static void checkpoint() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Request cancelled");
        }
    }

    /** Sleep, translating an interrupt into a {@link CancellationException}. */
    public static void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            checkpoint();
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Request cancelled while waiting");
        }
    }

    /**
     * Run {@code action} with the interrupt flag temporarily cleared, so that
     * clean-up I/O (restoring backups, terminating a sandbox) can complete
     * after a cancellation was observed. The flag is restored afterwards.
     */
    public static void uninterruptibly(Runnable action) {
        boolean interrupted = Thread.interrupted();
        try {
            action.run();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
