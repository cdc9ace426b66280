package io.hearthwarrio.formweaver.core.pagination;

import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.PollingClock;
import io.hearthwarrio.formweaver.core.browser.BrowserHandle;
import io.hearthwarrio.formweaver.core.browser.ControlState;
import io.hearthwarrio.formweaver.core.model.Locator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Advances to the next page and confirms that navigation really happened.
 * <p>
 * Before clicking, the next control is checked for disabled signals; any signal means "no more pages" and no
 * click is made. After each click the controller waits for the address or the content fingerprint to change.
 * When nothing changes after all attempts, {@link #nextPage()} returns false: running out of pages is a normal
 * outcome, not an error.
 * <p>
 * Not thread-safe; used from the session worker.
 */
public final class PaginationController {

    private final BrowserHandle handle;
    private final PaginationSettings settings;
    private final PollingClock clock;
    private final FillLogSink log;
    private final List<PageChangeListener> listeners = new CopyOnWriteArrayList<>();

    private Locator nextControl;
    private int currentPage = 1;

    public PaginationController(BrowserHandle handle, PaginationSettings settings, PollingClock clock, FillLogSink log) {
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    public PaginationController withNextControl(Locator nextControl) {
        this.nextControl = nextControl;
        return this;
    }

    public Optional<Locator> getNextControl() {
        return Optional.ofNullable(nextControl);
    }

    public PaginationController addListener(PageChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
        return this;
    }

    public int getCurrentPage() {
        return currentPage;
    }

    /**
     * Aligns the page counter with a restored session.
     */
    public void setCurrentPage(int currentPage) {
        if (currentPage < 1) {
            throw new IllegalArgumentException("currentPage must be at least 1");
        }
        this.currentPage = currentPage;
    }

    /**
     * @return true when there is no next control, it cannot be inspected, or it carries any disabled signal
     */
    public boolean isNextDisabled() {
        if (nextControl == null) {
            return true;
        }
        Optional<ControlState> state;
        try {
            state = handle.inspectControl(nextControl);
        } catch (RuntimeException e) {
            log.warning("Pagination: cannot inspect " + nextControl + ": " + e.getMessage());
            return true;
        }
        if (state.isEmpty()) {
            log.info("Pagination: next control not found");
            return true;
        }
        List<String> signals = disabledSignals(state.get(), settings.getDisabledClasses());
        if (!signals.isEmpty()) {
            log.info("Pagination: next control disabled (" + String.join(", ", signals) + ")");
            return true;
        }
        return false;
    }

    /**
     * Clicks the next control and waits for a new page.
     *
     * @return true when a new page was detected; false when there are no more pages
     */
    public boolean nextPage() {
        if (isNextDisabled()) {
            return false;
        }

        for (int attempt = 1; attempt <= settings.getMaxRetries(); attempt++) {
            PageState before;
            try {
                before = capture();
                handle.click(nextControl);
            } catch (RuntimeException e) {
                log.warning("Pagination: attempt " + attempt + "/" + settings.getMaxRetries() + " failed: " + e.getMessage());
                continue;
            }
            clock.sleep(settings.getSettleDelay());

            Optional<PageState> after = awaitChange(before);
            if (after.isPresent()) {
                currentPage++;
                log.success("Page " + currentPage);
                for (PageChangeListener l : listeners) {
                    l.onPageChanged(currentPage, after.get());
                }
                return true;
            }
            log.warning("Pagination: no page change after click " + attempt + "/" + settings.getMaxRetries());
        }
        log.warning("Pagination stalled on page " + currentPage + ", treating as end of data");
        return false;
    }

    /**
     * Polls until no loading overlay is visible.
     *
     * @return true when the page is ready, false on timeout or when the overlay cannot be checked
     */
    public boolean waitForPageReady() {
        long deadline = clock.millis() + settings.getReadyTimeout().toMillis();
        while (true) {
            boolean loading;
            try {
                loading = handle.isLoadingIndicatorVisible();
            } catch (RuntimeException e) {
                log.warning("Pagination: loading check failed: " + e.getMessage());
                return false;
            }
            if (!loading) {
                return true;
            }
            if (clock.millis() >= deadline) {
                log.warning("Page still loading after " + settings.getReadyTimeout().toMillis() + " ms");
                return false;
            }
            clock.sleep(settings.getReadyPoll());
        }
    }

    public PageState capture() {
        String url = handle.currentUrl();
        return new PageState(
                currentPage,
                url,
                contentFingerprint(url),
                handle.countInteractiveControls(),
                Instant.ofEpochMilli(clock.millis())
        );
    }

    private Optional<PageState> awaitChange(PageState before) {
        long deadline = clock.millis() + settings.getChangeTimeout().toMillis();
        while (true) {
            PageState now;
            try {
                now = capture();
            } catch (RuntimeException e) {
                // the document is being replaced
                now = null;
            }
            if (now != null && now.differsFrom(before)) {
                return Optional.of(now);
            }
            if (clock.millis() >= deadline) {
                return Optional.empty();
            }
            clock.sleep(settings.getChangePoll());
        }
    }

    private String contentFingerprint(String url) {
        String indicator = handle.firstText(settings.getIndicatorSelectors());
        if (!indicator.isBlank()) {
            return "page:" + indicator;
        }
        String firstRow = handle.firstText(settings.getFirstRowSelectors());
        if (!firstRow.isBlank()) {
            return "row:" + firstRow;
        }
        String input = handle.firstInputValue(settings.getTableInputSelector());
        if (!input.isBlank()) {
            return "input:" + input;
        }
        return "time:" + url + ":" + clock.millis();
    }

    static List<String> disabledSignals(ControlState state, List<String> disabledClasses) {
        List<String> signals = new ArrayList<>();

        String disabled = state.getDisabledAttribute();
        if (disabled != null && !"false".equalsIgnoreCase(disabled.trim())) {
            signals.add("disabled attribute");
        }
        String aria = state.getAriaDisabled();
        if (aria != null && "true".equalsIgnoreCase(aria.trim())) {
            signals.add("aria-disabled");
        }
        List<String> tokens = List.of(state.getClasses().toLowerCase(Locale.ROOT).trim().split("\\s+"));
        for (String c : disabledClasses) {
            if (tokens.contains(c.toLowerCase(Locale.ROOT))) {
                signals.add("class " + c);
                break;
            }
        }
        if ("none".equalsIgnoreCase(state.getPointerEvents().trim())) {
            signals.add("pointer-events none");
        }
        if (state.getOpacity() < 0.5) {
            signals.add("opacity " + state.getOpacity());
        }
        return signals;
    }
}
