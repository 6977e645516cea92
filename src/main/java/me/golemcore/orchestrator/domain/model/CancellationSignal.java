package me.golemcore.orchestrator.domain.model;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag threaded through the tool context. Tools that
 * hold external resources poll it; nothing in the dispatch pipeline stops a
 * running tool on its own.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Operation cancelled");
        }
    }
}
