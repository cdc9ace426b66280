package io.hearthwarrio.formweaver.core;

import java.util.Objects;

/**
 * Base type of all FormWeaver runtime failures.
 */
public class FormWeaverException extends RuntimeException {

    private final FailureKind kind;

    public FormWeaverException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public FormWeaverException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public FailureKind getKind() {
        return kind;
    }
}
