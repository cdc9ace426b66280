package io.hearthwarrio.formweaver.core;

/**
 * Thrown when a browser-side probe script fails or returns something unreadable.
 */
public class ProbeException extends FormWeaverException {
    public ProbeException(String message) {
        super(FailureKind.ELEMENT_NOT_FOUND, message);
    }

    public ProbeException(String message, Throwable cause) {
        super(FailureKind.ELEMENT_NOT_FOUND, message, cause);
    }
}
