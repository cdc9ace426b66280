package io.hearthwarrio.formweaver.core.browser;

import io.hearthwarrio.formweaver.core.model.Locator;

import java.util.Objects;

/**
 * A clickable element that looks like a "next page" control.
 */
public final class NavigationCandidate {

    private final String text;
    private final String tag;
    private final Locator locator;

    public NavigationCandidate(String text, String tag, Locator locator) {
        this.text = text == null ? "" : text.trim();
        this.tag = tag == null ? "" : tag;
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
    }

    public String getText() {
        return text;
    }

    public String getTag() {
        return tag;
    }

    public Locator getLocator() {
        return locator;
    }

    @Override
    public String toString() {
        return "NavigationCandidate{text='" + text + "', tag=" + tag + ", locator=" + locator + '}';
    }
}
