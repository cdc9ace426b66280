package io.hearthwarrio.formweaver.core.browser;

import java.util.List;
import java.util.Objects;

/**
 * A column of the main data table on the page.
 * <p>
 * Read-only columns show text (candidates for anchors); input columns hold editable controls.
 */
public final class WebColumn {

    private final String label;
    private final String xpath;
    private final boolean readOnly;
    private final boolean input;
    private final List<String> samples;

    /**
     * @param label    header text
     * @param xpath    row-generic XPath of the column's cells (or of the controls inside them)
     * @param readOnly true when the cells carry plain text only
     * @param input    true when the cells hold editable controls
     * @param samples  a few cell values from the first rows
     */
    public WebColumn(String label, String xpath, boolean readOnly, boolean input, List<String> samples) {
        this.label = label == null ? "" : label.trim();
        this.xpath = Objects.requireNonNull(xpath, "xpath must not be null");
        this.readOnly = readOnly;
        this.input = input;
        this.samples = samples == null ? List.of() : List.copyOf(samples);
    }

    public String getLabel() {
        return label;
    }

    public String getXpath() {
        return xpath;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public boolean isInput() {
        return input;
    }

    public List<String> getSamples() {
        return samples;
    }

    @Override
    public String toString() {
        return "WebColumn{'" + label + "', " + (readOnly ? "read-only" : "input") + ", xpath=" + xpath + '}';
    }
}
