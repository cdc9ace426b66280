package io.hearthwarrio.formweaver.core;

/**
 * Thrown when a page never produced a usable control snapshot within the scan budget.
 */
public class ScanTimeoutException extends FormWeaverException {
    public ScanTimeoutException(String message) {
        super(FailureKind.SCAN_TIMEOUT, message);
    }
}
