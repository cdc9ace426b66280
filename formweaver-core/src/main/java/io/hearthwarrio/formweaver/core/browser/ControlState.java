package io.hearthwarrio.formweaver.core.browser;

/**
 * Raw interactivity signals of one control (typically a pagination button).
 */
public final class ControlState {

    private final String disabledAttribute;
    private final String ariaDisabled;
    private final String classes;
    private final String pointerEvents;
    private final double opacity;
    private final String text;

    /**
     * @param disabledAttribute value of the {@code disabled} attribute, or null when the attribute is absent
     * @param ariaDisabled      value of {@code aria-disabled}, or null
     * @param classes           raw {@code class} attribute
     * @param pointerEvents     computed {@code pointer-events}
     * @param opacity           computed opacity, 1.0 when unknown
     * @param text              visible text
     */
    public ControlState(
            String disabledAttribute,
            String ariaDisabled,
            String classes,
            String pointerEvents,
            double opacity,
            String text
    ) {
        this.disabledAttribute = disabledAttribute;
        this.ariaDisabled = ariaDisabled;
        this.classes = classes == null ? "" : classes;
        this.pointerEvents = pointerEvents == null ? "" : pointerEvents;
        this.opacity = opacity;
        this.text = text == null ? "" : text;
    }

    public static ControlState enabled(String text) {
        return new ControlState(null, null, "", "auto", 1.0, text);
    }

    public String getDisabledAttribute() {
        return disabledAttribute;
    }

    public String getAriaDisabled() {
        return ariaDisabled;
    }

    public String getClasses() {
        return classes;
    }

    public String getPointerEvents() {
        return pointerEvents;
    }

    public double getOpacity() {
        return opacity;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "ControlState{" +
                "disabled=" + disabledAttribute +
                ", ariaDisabled=" + ariaDisabled +
                ", classes='" + classes + '\'' +
                ", pointerEvents='" + pointerEvents + '\'' +
                ", opacity=" + opacity +
                '}';
    }
}
