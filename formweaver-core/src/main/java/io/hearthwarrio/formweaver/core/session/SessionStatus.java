package io.hearthwarrio.formweaver.core.session;

/**
 * Session lifecycle.
 * <p>
 * {@code IDLE -> RUNNING -> PAUSED | COMPLETED | ABORTED}, {@code PAUSED -> RUNNING | ABORTED}.
 * COMPLETED and ABORTED are terminal: a new session needs a new state.
 */
public enum SessionStatus {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }
}
