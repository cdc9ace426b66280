package io.hearthwarrio.formweaver.core.session;

public enum PaginationMode {
    /** Pause after each page; the user turns the page and continues. */
    MANUAL,
    /** Click the next-page control and carry on. */
    AUTO
}
