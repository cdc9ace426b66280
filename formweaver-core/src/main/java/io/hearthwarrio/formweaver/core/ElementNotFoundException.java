package io.hearthwarrio.formweaver.core;

/**
 * Thrown by browser handles when no control matches a locator.
 */
public class ElementNotFoundException extends FormWeaverException {
    public ElementNotFoundException(String message) {
        super(FailureKind.ELEMENT_NOT_FOUND, message);
    }

    public ElementNotFoundException(String message, Throwable cause) {
        super(FailureKind.ELEMENT_NOT_FOUND, message, cause);
    }
}
