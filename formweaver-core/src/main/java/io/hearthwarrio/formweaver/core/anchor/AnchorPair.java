package io.hearthwarrio.formweaver.core.anchor;

import java.util.Objects;

/**
 * Correlating key: a source field and the page column showing the same value.
 */
public final class AnchorPair {

    private final String sourceField;
    private final String columnXPath;
    private final String columnLabel;
    private final boolean enabled;
    private final double similarity;

    public AnchorPair(String sourceField, String columnXPath, String columnLabel, boolean enabled, double similarity) {
        this.sourceField = Objects.requireNonNull(sourceField, "sourceField must not be null");
        this.columnXPath = columnXPath == null ? "" : columnXPath;
        this.columnLabel = columnLabel == null ? "" : columnLabel;
        this.enabled = enabled;
        this.similarity = similarity;
    }

    public String getSourceField() {
        return sourceField;
    }

    /**
     * Row-generic XPath of the column cells.
     */
    public String getColumnXPath() {
        return columnXPath;
    }

    public String getColumnLabel() {
        return columnLabel;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public double getSimilarity() {
        return similarity;
    }

    public AnchorPair withEnabled(boolean enabled) {
        return new AnchorPair(sourceField, columnXPath, columnLabel, enabled, similarity);
    }

    @Override
    public String toString() {
        return "AnchorPair{'" + sourceField + "' <-> '" + columnLabel + "'" + (enabled ? "" : ", disabled") + '}';
    }
}
