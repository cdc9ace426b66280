package io.hearthwarrio.formweaver.core.model;

/**
 * Selector families, declared in the order they are tried.
 */
public enum LocatorKind {
    /** Element id. */
    ID,
    /** Structural path from the document root. */
    XPATH,
    /** Class-based CSS selector. */
    CSS,
    /** Accessibility label. */
    ARIA,
    /** Visible text. */
    TEXT
}
