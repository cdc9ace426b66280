package io.hearthwarrio.formweaver.core;

/**
 * Thrown when the browser refuses to switch into a nested document
 * (detached frame, cross-origin restriction and similar).
 */
public class FrameUnreachableException extends FormWeaverException {
    public FrameUnreachableException(String message) {
        super(FailureKind.FRAME_UNREACHABLE, message);
    }

    public FrameUnreachableException(String message, Throwable cause) {
        super(FailureKind.FRAME_UNREACHABLE, message, cause);
    }
}
