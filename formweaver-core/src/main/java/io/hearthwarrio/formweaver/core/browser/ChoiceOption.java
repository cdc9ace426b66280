package io.hearthwarrio.formweaver.core.browser;

/**
 * One option of a choice control.
 */
public final class ChoiceOption {

    private final int index;
    private final String value;
    private final String label;

    public ChoiceOption(int index, String value, String label) {
        this.index = index;
        this.value = value == null ? "" : value.trim();
        this.label = label == null ? "" : label.trim();
    }

    public int getIndex() {
        return index;
    }

    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return "ChoiceOption{" + index + ", value='" + value + "', label='" + label + "'}";
    }
}
