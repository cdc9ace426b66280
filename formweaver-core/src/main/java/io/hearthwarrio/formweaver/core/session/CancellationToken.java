package io.hearthwarrio.formweaver.core.session;

/**
 * Cooperative cancellation flag, checked once per row or task.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
