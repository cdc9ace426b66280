package io.hearthwarrio.formweaver.core.fill;

import io.hearthwarrio.formweaver.core.ElementNotFoundException;
import io.hearthwarrio.formweaver.core.browser.ChoiceOption;
import io.hearthwarrio.formweaver.core.browser.DomEvent;
import io.hearthwarrio.formweaver.core.browser.DomWriter;
import io.hearthwarrio.formweaver.core.model.ControlKind;
import io.hearthwarrio.formweaver.core.model.Locator;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Writes a value the way a user would, so reactive front ends notice it.
 * <p>
 * Sequence: focus, focusin, type-aware assignment, input, change, blur, focusout.
 * Assignment depends on the control:
 * <ul>
 *   <li>text: clear, then assign</li>
 *   <li>choice: option whose value or label equals the value, else the first one containing it</li>
 *   <li>boolean: toggled only when its checked state differs from the value</li>
 * </ul>
 */
public final class ValueWriter {

    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "y", "on", "checked", "是", "√");

    private final DomWriter writer;

    public ValueWriter(DomWriter writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    /**
     * @throws RuntimeException when the page rejects any step
     */
    public void write(Locator locator, String value, ControlKind kind) {
        writer.focus(locator);
        writer.dispatch(locator, DomEvent.FOCUS);
        writer.dispatch(locator, DomEvent.FOCUS_IN);

        switch (kind) {
            case CHOICE:
                writer.selectOption(locator, chooseOption(writer.readOptions(locator), value));
                break;
            case BOOLEAN:
                if (writer.isChecked(locator) != isTruthy(value)) {
                    writer.toggle(locator);
                }
                break;
            default:
                writer.clear(locator);
                writer.assignValue(locator, value);
                break;
        }

        writer.dispatch(locator, DomEvent.INPUT);
        writer.dispatch(locator, DomEvent.CHANGE);
        writer.dispatch(locator, DomEvent.BLUR);
        writer.dispatch(locator, DomEvent.FOCUS_OUT);
    }

    static int chooseOption(List<ChoiceOption> options, String value) {
        String v = value == null ? "" : value.trim();
        for (ChoiceOption o : options) {
            if (o.getValue().equals(v) || o.getLabel().equals(v)) {
                return o.getIndex();
            }
        }
        if (!v.isEmpty()) {
            for (ChoiceOption o : options) {
                if (o.getLabel().contains(v) || o.getValue().contains(v)) {
                    return o.getIndex();
                }
            }
        }
        throw new ElementNotFoundException("No option matches '" + v + "'");
    }

    static boolean isTruthy(String value) {
        return value != null && TRUTHY.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
