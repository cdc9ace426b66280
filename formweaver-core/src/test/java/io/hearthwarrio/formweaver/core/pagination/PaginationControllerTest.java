package io.hearthwarrio.formweaver.core.pagination;

import io.hearthwarrio.formweaver.core.FakeBrowser;
import io.hearthwarrio.formweaver.core.FakeClock;
import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.LogLevel;
import io.hearthwarrio.formweaver.core.RecordingLogSink;
import io.hearthwarrio.formweaver.core.browser.BrowserHandle;
import io.hearthwarrio.formweaver.core.browser.ControlState;
import io.hearthwarrio.formweaver.core.model.Locator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class PaginationControllerTest {

    private final Locator next = Locator.css("button.next");
    private final FakeClock clock = new FakeClock();

    private PaginationController controller(BrowserHandle handle) {
        return new PaginationController(handle, PaginationSettings.defaults(), clock, FillLogSink.discarding())
                .withNextControl(next);
    }

    @Test
    void stalledNavigationReturnsFalseAfterThreeClicks() {
        FakeBrowser browser = new FakeBrowser().present(next).indicator("Page 1 of 4");
        PaginationController pagination = controller(browser);

        assertFalse(pagination.nextPage());
        assertEquals(3, browser.count("click"));
        assertEquals(1, pagination.getCurrentPage());
    }

    @Test
    void contentChangeAdvancesPageAndNotifiesListeners() {
        FakeBrowser browser = new FakeBrowser().present(next).indicator("Page 1 of 4");
        browser.onClick(next, b -> b.indicator("Page 2 of 4"));
        List<Integer> pages = new ArrayList<>();
        PaginationController pagination = controller(browser).addListener((page, state) -> pages.add(page));

        assertTrue(pagination.nextPage());
        assertEquals(2, pagination.getCurrentPage());
        assertEquals(List.of(2), pages);
        assertEquals(1, browser.count("click"));
    }

    @Test
    void urlChangeCountsAsNavigation() {
        FakeBrowser browser = new FakeBrowser().present(next).indicator("same");
        browser.onClick(next, b -> b.url("http://localhost/form?page=2"));

        assertTrue(controller(browser).nextPage());
    }

    @Test
    void disabledControlIsNeverClicked() {
        BrowserHandle handle = mock(BrowserHandle.class);
        when(handle.inspectControl(next)).thenReturn(Optional.of(
                new ControlState(null, "true", "btn", "auto", 1.0, "Next")));
        PaginationController pagination = controller(handle);

        assertFalse(pagination.nextPage());
        verify(handle, never()).click(any());
        assertEquals(1, pagination.getCurrentPage());
    }

    @Test
    void missingControlMeansNoMorePages() {
        FakeBrowser browser = new FakeBrowser();

        assertTrue(controller(browser).isNextDisabled());
        assertTrue(new PaginationController(browser, PaginationSettings.defaults(), clock, FillLogSink.discarding())
                .isNextDisabled());
    }

    @Test
    void eachDisabledSignalIsDetected() {
        List<String> classes = PaginationSettings.DEFAULT_DISABLED_CLASSES;

        assertEquals(List.of("disabled attribute"), PaginationController.disabledSignals(
                new ControlState("", null, "", "auto", 1.0, ""), classes));
        assertTrue(PaginationController.disabledSignals(
                new ControlState("false", null, "", "auto", 1.0, ""), classes).isEmpty());
        assertEquals(List.of("aria-disabled"), PaginationController.disabledSignals(
                new ControlState(null, "TRUE", "", "auto", 1.0, ""), classes));
        assertEquals(List.of("class ant-pagination-disabled"), PaginationController.disabledSignals(
                new ControlState(null, null, "ant-pagination-next ant-pagination-disabled", "auto", 1.0, ""), classes));
        assertEquals(List.of("pointer-events none"), PaginationController.disabledSignals(
                new ControlState(null, null, "", "none", 1.0, ""), classes));
        assertEquals(List.of("opacity 0.3"), PaginationController.disabledSignals(
                new ControlState(null, null, "", "auto", 0.3, ""), classes));
    }

    @Test
    void waitForPageReadyPollsUntilOverlayIsGone() {
        FakeBrowser browser = new FakeBrowser().loading(true, true, false);

        assertTrue(controller(browser).waitForPageReady());
        assertEquals(2, clock.getSleeps());
    }

    @Test
    void unreadablePageBeforeClickIsAFailedAttemptNotAnError() {
        FakeBrowser browser = new FakeBrowser().present(next)
                .failUrlWith(new IllegalStateException("browser window closed"));
        RecordingLogSink log = new RecordingLogSink();
        PaginationController pagination =
                new PaginationController(browser, PaginationSettings.defaults(), clock, log).withNextControl(next);

        assertFalse(pagination.nextPage());
        assertEquals(0, browser.count("click"));
        assertEquals(1, pagination.getCurrentPage());
        assertTrue(log.contains(LogLevel.WARNING, "Pagination: attempt 3/3 failed: browser window closed"));
        assertTrue(log.contains(LogLevel.WARNING, "Pagination stalled on page 1"));
    }

    @Test
    void failingLoadingCheckEndsTheReadyWait() {
        FakeBrowser browser = new FakeBrowser().failLoadingCheckWith(new IllegalStateException("no such window"));

        assertFalse(controller(browser).waitForPageReady());
        assertEquals(0, clock.getSleeps());
    }
}
