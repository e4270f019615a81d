package com.spreadsheet.calc.services;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a calculation pass. The engine checks it
 * between levels and between sweeps of an iterative cycle.
 */
public class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The shared token cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
