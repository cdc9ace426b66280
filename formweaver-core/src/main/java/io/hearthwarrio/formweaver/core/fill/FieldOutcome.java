package io.hearthwarrio.formweaver.core.fill;

import io.hearthwarrio.formweaver.core.FailureKind;
import io.hearthwarrio.formweaver.core.model.Locator;

import java.util.Optional;

/**
 * Result of writing one field.
 */
public final class FieldOutcome {

    public enum Status {
        /** Rich write through the primary target. */
        FILLED,
        /** Plain write through an alternative locator. */
        FILLED_BY_FALLBACK,
        /** Written after relocating the control by nearby text. */
        HEALED,
        /** The field has no control for this row (group or table shorter than the offset). */
        NO_TARGET,
        FAILED
    }

    private final Status status;
    private final Locator locator;
    private final FailureKind failure;
    private final String message;

    private FieldOutcome(Status status, Locator locator, FailureKind failure, String message) {
        this.status = status;
        this.locator = locator;
        this.failure = failure;
        this.message = message == null ? "" : message;
    }

    static FieldOutcome filled(Status status, Locator locator) {
        return new FieldOutcome(status, locator, null, "");
    }

    static FieldOutcome noTarget(String message) {
        return new FieldOutcome(Status.NO_TARGET, null, null, message);
    }

    static FieldOutcome failed(FailureKind failure, String message) {
        return new FieldOutcome(Status.FAILED, null, failure, message);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFilled() {
        return status == Status.FILLED || status == Status.FILLED_BY_FALLBACK || status == Status.HEALED;
    }

    public boolean isHealed() {
        return status == Status.HEALED;
    }

    public Optional<Locator> getLocator() {
        return Optional.ofNullable(locator);
    }

    public Optional<FailureKind> getFailure() {
        return Optional.ofNullable(failure);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "FieldOutcome{" + status +
                (locator == null ? "" : ", " + locator) +
                (failure == null ? "" : ", " + failure) +
                (message.isEmpty() ? "" : ", '" + message + '\'') +
                '}';
    }
}
