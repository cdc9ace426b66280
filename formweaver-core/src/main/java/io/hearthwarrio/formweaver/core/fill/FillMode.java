package io.hearthwarrio.formweaver.core.fill;

/**
 * Shape of the destination page.
 */
public enum FillMode {
    /** One form, one record at a time. Self-healing is enabled. */
    SINGLE_RECORD,
    /** Repeated table rows, many records per page. No self-healing. */
    BATCH_TABLE
}
