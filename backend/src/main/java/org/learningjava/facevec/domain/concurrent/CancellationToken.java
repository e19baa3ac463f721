package org.learningjava.facevec.domain.concurrent;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation signal. A token also reports cancellation when the
 * calling thread has been interrupted.
 */
public final class CancellationToken {

    /** A token that is never cancelled explicitly; still honours thread interruption. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private volatile boolean cancelled;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    public void cancel() {
        if (!cancellable) throw new UnsupportedOperationException("NONE token cannot be cancelled");
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Operation cancelled");
        }
    }
}
