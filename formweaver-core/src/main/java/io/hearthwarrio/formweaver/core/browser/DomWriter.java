package io.hearthwarrio.formweaver.core.browser;

import io.hearthwarrio.formweaver.core.model.Locator;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Mutating operations on controls of the current browsing context.
 * <p>
 * Each operation throws {@link io.hearthwarrio.formweaver.core.ElementNotFoundException} when the locator
 * matches nothing, and may throw other runtime exceptions when the page rejects the interaction.
 */
public interface DomWriter {

    /**
     * Waits up to {@code timeout} for the locator to match an element.
     */
    boolean isPresent(Locator locator, Duration timeout);

    void focus(Locator locator);

    void clear(Locator locator);

    /**
     * Assigns the value programmatically (no key events).
     */
    void assignValue(Locator locator, String value);

    void dispatch(Locator locator, DomEvent event);

    List<ChoiceOption> readOptions(Locator locator);

    void selectOption(Locator locator, int optionIndex);

    boolean isChecked(Locator locator);

    void toggle(Locator locator);

    /**
     * Native clear followed by typed input.
     */
    void clearAndType(Locator locator, String value);

    void click(Locator locator);

    /**
     * Bounded relocation: finds an editable control positioned next to visible text containing {@code text}.
     *
     * @param maxCandidates maximum number of text nodes examined
     */
    Optional<Locator> locateNearText(String text, int maxCandidates);

    /**
     * Briefly outlines the control so a user can see it.
     */
    void highlight(Locator locator);
}
