package io.hearthwarrio.formweaver.core.browser;

/**
 * DOM events dispatched around a value assignment, in firing order.
 */
public enum DomEvent {
    FOCUS("focus"),
    FOCUS_IN("focusin"),
    INPUT("input"),
    CHANGE("change"),
    BLUR("blur"),
    FOCUS_OUT("focusout");

    private final String domName;

    DomEvent(String domName) {
        this.domName = domName;
    }

    public String getDomName() {
        return domName;
    }
}
