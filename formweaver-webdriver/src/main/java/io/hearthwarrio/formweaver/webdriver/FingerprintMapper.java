package io.hearthwarrio.formweaver.webdriver;

import io.hearthwarrio.formweaver.core.model.BoundingBox;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.Locator;
import io.hearthwarrio.formweaver.core.model.TableContext;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps probe script output and Selenium {@link WebElement}s to {@link ElementFingerprint} snapshots.
 * <p>
 * Locators are derived from what the element carries: its id, its absolute XPath, a name or class based
 * CSS selector and its {@code aria-label}.
 */
public final class FingerprintMapper {

    /**
     * Maps one entry of the {@code scan-controls} result.
     *
     * @param raw JSON-like map returned by the browser
     * @return fingerprint, or null when the entry has no usable XPath
     */
    public ElementFingerprint fromProbe(Map<?, ?> raw) {
        if (raw == null) {
            return null;
        }
        String xpath = str(raw.get("xpath"));
        if (xpath.isBlank()) {
            return null;
        }
        String tag = str(raw.get("tag")).toLowerCase(Locale.ROOT);
        String id = str(raw.get("id"));
        String name = str(raw.get("name"));
        String ariaLabel = str(raw.get("ariaLabel"));

        ElementFingerprint.Builder b = ElementFingerprint.builder()
                .tag(tag.isBlank() ? "input" : tag)
                .type(str(raw.get("type")).toLowerCase(Locale.ROOT))
                .id(id)
                .name(name)
                .classes(splitClasses(str(raw.get("classes"))))
                .label(str(raw.get("label")))
                .formLabel(str(raw.get("formLabel")))
                .placeholder(str(raw.get("placeholder")))
                .ariaLabel(ariaLabel)
                .nearbyText(str(raw.get("nearbyText")));

        addLocators(b, tag, id, name, ariaLabel, xpath, str(raw.get("css")));

        Object rect = raw.get("rect");
        if (rect instanceof Map) {
            Map<?, ?> r = (Map<?, ?>) rect;
            b.bounds(new BoundingBox(num(r.get("x")), num(r.get("y")), num(r.get("width")), num(r.get("height"))));
        }

        Object table = raw.get("table");
        if (table instanceof Map) {
            Map<?, ?> t = (Map<?, ?>) table;
            b.table(new TableContext(
                    num(t.get("row")),
                    num(t.get("column")),
                    str(t.get("tableId")),
                    str(t.get("header"))
            ));
        }
        return b.build();
    }

    /**
     * Maps a list of {@code scan-controls} entries, dropping unusable ones.
     */
    public List<ElementFingerprint> fromProbe(List<?> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyList();
        }
        List<ElementFingerprint> out = new ArrayList<>(raw.size());
        for (Object o : raw) {
            if (o instanceof Map) {
                ElementFingerprint fp = fromProbe((Map<?, ?>) o);
                if (fp != null) {
                    out.add(fp);
                }
            }
        }
        return out;
    }

    /**
     * Minimal mapping used by the fallback scan.
     * <p>
     * The label is the nearest column header, then the wrapping label, then the placeholder or name.
     *
     * @param element Selenium element
     * @param context result of the {@code element-context} script for the element
     */
    public ElementFingerprint fromElement(WebElement element, Map<?, ?> context) {
        String tag = safe(element.getTagName()).toLowerCase(Locale.ROOT);
        String id = attr(element, "id");
        String name = attr(element, "name");
        String placeholder = attr(element, "placeholder");
        String ariaLabel = attr(element, "aria-label");

        String header = context == null ? "" : str(context.get("header"));
        String wrapping = context == null ? "" : str(context.get("label"));
        String xpath = context == null ? "" : str(context.get("xpath"));

        String label = header;
        if (label.isBlank()) {
            label = wrapping;
        }
        if (label.isBlank()) {
            label = placeholder.isBlank() ? name : placeholder;
        }

        ElementFingerprint.Builder b = ElementFingerprint.builder()
                .tag(tag.isBlank() ? "input" : tag)
                .type(attr(element, "type").toLowerCase(Locale.ROOT))
                .id(id)
                .name(name)
                .classes(splitClasses(attr(element, "class")))
                .label(label)
                .placeholder(placeholder)
                .ariaLabel(ariaLabel);

        addLocators(b, tag, id, name, ariaLabel, xpath, "");
        return b.build();
    }

    private void addLocators(
            ElementFingerprint.Builder b,
            String tag,
            String id,
            String name,
            String ariaLabel,
            String xpath,
            String css
    ) {
        if (!id.isBlank()) {
            b.locator(Locator.id(id));
        }
        if (!xpath.isBlank()) {
            b.locator(Locator.xpath(xpath));
        }
        if (!name.isBlank()) {
            b.locator(Locator.css((tag.isBlank() ? "" : tag) + "[name=" + Locators.cssAttrLiteral(name) + "]"));
        } else if (!css.isBlank()) {
            b.locator(Locator.css(css));
        }
        if (!ariaLabel.isBlank()) {
            b.locator(Locator.aria(ariaLabel));
        }
    }

    private static List<String> splitClasses(String raw) {
        if (raw.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.asList(raw.trim().split("\\s+"));
    }

    static String str(Object v) {
        return v == null ? "" : String.valueOf(v).trim();
    }

    static int num(Object v) {
        if (v instanceof Number) {
            return (int) Math.round(((Number) v).doubleValue());
        }
        if (v instanceof String) {
            try {
                return (int) Math.round(Double.parseDouble(((String) v).trim()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static String safe(String v) {
        return v == null ? "" : v;
    }

    private static String attr(WebElement element, String name) {
        try {
            String v = element.getAttribute(name);
            return v == null ? "" : v.trim();
        } catch (RuntimeException e) {
            return "";
        }
    }
}
