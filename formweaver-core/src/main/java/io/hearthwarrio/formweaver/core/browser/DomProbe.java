package io.hearthwarrio.formweaver.core.browser;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.Locator;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the current browsing context.
 * <p>
 * All methods act on the document the handle is currently switched into (top document or a frame).
 * Implementations report script failures as {@link io.hearthwarrio.formweaver.core.ProbeException}.
 */
public interface DomProbe {

    /**
     * Snapshot of data-entry controls (text inputs, textareas, selects, contenteditable and ARIA text boxes).
     * Buttons, hidden and file inputs are excluded.
     */
    ProbeResult probeControls();

    /**
     * Simplified snapshot using plain tag queries and minimal label inference:
     * nearest table header, associated label, then placeholder or name.
     */
    List<ElementFingerprint> probeControlsFallback();

    List<FrameDescriptor> listChildFrames();

    String currentUrl();

    boolean isLoadingIndicatorVisible();

    /**
     * Number of visible body rows in the main data table, 0 when there is none.
     */
    int countTableRows();

    int countInteractiveControls();

    /**
     * Text (or value, for controls) of every element matched by the XPath, in document order.
     */
    List<String> readColumnValues(String xpath);

    /**
     * Trimmed text of the first visible element matched by any of the CSS selectors, tried in order.
     *
     * @return text, or an empty string when nothing matches
     */
    String firstText(List<String> cssSelectors);

    /**
     * @return value of the first control matched by the CSS selector, or an empty string
     */
    String firstInputValue(String cssSelector);

    /**
     * @return interactivity signals, empty when the locator matches nothing
     */
    Optional<ControlState> inspectControl(Locator locator);

    /**
     * Clickable elements whose text equals or contains one of the keywords.
     */
    List<NavigationCandidate> listNavigationCandidates(List<String> keywords);

    /**
     * Columns of the main data table.
     */
    List<WebColumn> listTableColumns();
}
