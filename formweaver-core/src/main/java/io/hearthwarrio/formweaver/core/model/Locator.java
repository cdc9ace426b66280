package io.hearthwarrio.formweaver.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One candidate selector for a control.
 * <p>
 * The expression is interpreted according to {@link #getKind()} by the browser handle:
 * a bare id, an XPath, a CSS selector, an {@code aria-label} value or visible text.
 */
public final class Locator {

    private final LocatorKind kind;
    private final String value;

    public Locator(LocatorKind kind, String value) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    public static Locator id(String id) {
        return new Locator(LocatorKind.ID, id);
    }

    public static Locator xpath(String xpath) {
        return new Locator(LocatorKind.XPATH, xpath);
    }

    public static Locator css(String css) {
        return new Locator(LocatorKind.CSS, css);
    }

    public static Locator aria(String ariaLabel) {
        return new Locator(LocatorKind.ARIA, ariaLabel);
    }

    public static Locator text(String text) {
        return new Locator(LocatorKind.TEXT, text);
    }

    public LocatorKind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Locator other)) {
            return false;
        }
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + value;
    }
}
