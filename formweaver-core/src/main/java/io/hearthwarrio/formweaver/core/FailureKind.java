package io.hearthwarrio.formweaver.core;

/**
 * Failure taxonomy shared by every stage of a fill session.
 * <p>
 * Only {@link #CONFIGURATION_ERROR} is fatal, and only before a session starts. Everything else
 * is absorbed where it happens and recorded as a skipped, partial or failed outcome:
 * <ul>
 *   <li>{@link #ELEMENT_NOT_FOUND}, {@link #PARTIAL_FIELD_FAILURE}, {@link #ANCHOR_VALUE_NOT_FOUND} are recorded per row</li>
 *   <li>{@link #SCAN_TIMEOUT} switches the scanner to its simplified fallback</li>
 *   <li>{@link #NAVIGATION_STALLED} is read as "end of data"</li>
 *   <li>{@link #FRAME_UNREACHABLE} skips the frame (scan) or the field (fill)</li>
 * </ul>
 */
public enum FailureKind {
    ELEMENT_NOT_FOUND,
    FRAME_UNREACHABLE,
    ANCHOR_VALUE_NOT_FOUND,
    NAVIGATION_STALLED,
    PARTIAL_FIELD_FAILURE,
    SCAN_TIMEOUT,
    CONFIGURATION_ERROR
}
