package io.hearthwarrio.formweaver.core.model;

/**
 * How a value is assigned to a control.
 */
public enum ControlKind {
    /** Free text: input, textarea. */
    TEXT,
    /** Option list: select. */
    CHOICE,
    /** Checkbox or radio. */
    BOOLEAN,
    /** Contenteditable region or ARIA text box. */
    RICH_TEXT
}
