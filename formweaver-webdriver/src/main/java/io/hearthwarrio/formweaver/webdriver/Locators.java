package io.hearthwarrio.formweaver.webdriver;

import io.hearthwarrio.formweaver.core.model.Locator;
import org.openqa.selenium.By;

import java.util.Objects;

/**
 * Conversion of FormWeaver locators to Selenium {@link By} instances.
 */
public final class Locators {

    private Locators() {
        // utility class
    }

    public static By toBy(Locator locator) {
        Objects.requireNonNull(locator, "locator must not be null");
        String value = locator.getValue();
        switch (locator.getKind()) {
            case ID:
                return By.id(value);
            case XPATH:
                return By.xpath(value);
            case CSS:
                return By.cssSelector(value);
            case ARIA:
                return By.cssSelector("[aria-label=" + cssAttrLiteral(value) + "]");
            case TEXT:
                return By.xpath("//*[normalize-space(.)=" + xpathLiteral(value.trim()) + "]");
            default:
                throw new IllegalArgumentException("Unsupported locator kind: " + locator.getKind());
        }
    }

    /**
     * Quotes a value for use inside an XPath expression, switching to {@code concat()} when it holds both quote kinds.
     */
    static String xpathLiteral(String value) {
        if (value == null) {
            return "''";
        }
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }

        String[] parts = value.split("'", -1);
        StringBuilder sb = new StringBuilder("concat(");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(", \"'\", ");
            }
            sb.append("'").append(parts[i]).append("'");
        }
        sb.append(")");
        return sb.toString();
    }

    static String cssAttrLiteral(String value) {
        String v = value == null ? "" : value;
        v = v.replace("\\", "\\\\").replace("'", "\\'");
        return "'" + v + "'";
    }

    static String cssEscapeIdentifier(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean ok = Character.isLetterOrDigit(ch) || ch == '-' || ch == '_';
            if (ok) {
                sb.append(ch);
            } else {
                sb.append('\\').append(ch);
            }
        }
        return sb.toString();
    }
}
