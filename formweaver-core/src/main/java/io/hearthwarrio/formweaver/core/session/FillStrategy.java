package io.hearthwarrio.formweaver.core.session;

/**
 * How source rows are paired with page rows.
 * <p>
 * Both methods return when the session pauses, runs out of rows, or is cancelled; the caller tells these apart
 * through the session state and the cancellation token.
 */
public interface FillStrategy {

    /**
     * Starts filling from the state's current position.
     */
    void execute(FillContext context);

    /**
     * Carries on after a pause, including after a manual page turn.
     */
    void continueFill(FillContext context);
}
