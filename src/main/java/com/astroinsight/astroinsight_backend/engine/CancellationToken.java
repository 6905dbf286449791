package com.astroinsight.astroinsight_backend.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to long-running work (code execution).
 * One token per session; cancelling is sticky until {@link #reset()}.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(true);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean       immutable;

    public CancellationToken() {
        this(false);
    }

    private CancellationToken(boolean immutable) {
        this.immutable = immutable;
    }

    /** A token that can never be cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (!immutable) cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void reset() {
        cancelled.set(false);
    }
}
