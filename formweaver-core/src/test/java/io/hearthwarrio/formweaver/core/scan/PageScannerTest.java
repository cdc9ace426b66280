package io.hearthwarrio.formweaver.core.scan;

import io.hearthwarrio.formweaver.core.FakeBrowser;
import io.hearthwarrio.formweaver.core.FakeClock;
import io.hearthwarrio.formweaver.core.browser.ProbeResult;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.Locator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PageScannerTest {

    private final FakeClock clock = new FakeClock();
    private final PageScanner scanner = new PageScanner(clock);

    static List<ElementFingerprint> controls(int n) {
        List<ElementFingerprint> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(ElementFingerprint.builder().locator(Locator.id("f" + i)).build());
        }
        return out;
    }

    @Test
    void returnsFiveAfterCountsSettle() {
        FakeBrowser browser = new FakeBrowser().probes(
                ProbeResult.of(controls(3)),
                ProbeResult.of(controls(5)),
                ProbeResult.of(controls(5)),
                ProbeResult.of(controls(5))
        );

        StableSnapshot snapshot = scanner.awaitStable(browser,
                StabilityBudget.timed(Duration.ofSeconds(15), Duration.ofMillis(800), 2));

        assertTrue(snapshot.isStable());
        assertEquals(5, snapshot.getElements().size());
        assertEquals(4, snapshot.getPolls());
    }

    @Test
    void loadingPollResetsStreak() {
        FakeBrowser browser = new FakeBrowser().probes(
                ProbeResult.of(controls(4)),
                ProbeResult.of(controls(4)),
                ProbeResult.loading(),
                ProbeResult.of(controls(4)),
                ProbeResult.of(controls(4)),
                ProbeResult.of(controls(4))
        );

        StableSnapshot snapshot = scanner.awaitStable(browser,
                StabilityBudget.timed(Duration.ofSeconds(15), Duration.ofMillis(800), 2));

        assertTrue(snapshot.isStable());
        assertEquals(6, snapshot.getPolls());
    }

    @Test
    void keepsBestSnapshotWhenNeverStable() {
        FakeBrowser browser = new FakeBrowser().probes(
                ProbeResult.of(controls(1)),
                ProbeResult.of(controls(6)),
                ProbeResult.of(controls(2)),
                ProbeResult.of(controls(3))
        );

        StableSnapshot snapshot = scanner.awaitStable(browser,
                new StabilityBudget(Duration.ofSeconds(15), Duration.ofMillis(100), 2, 4));

        assertFalse(snapshot.isStable());
        assertEquals(6, snapshot.getElements().size());
    }

    @Test
    void stopsAtDeadline() {
        FakeBrowser browser = new FakeBrowser().probes(ProbeResult.loading());

        StableSnapshot snapshot = scanner.awaitStable(browser,
                StabilityBudget.timed(Duration.ofSeconds(2), Duration.ofMillis(500), 3));

        assertFalse(snapshot.isStable());
        assertTrue(snapshot.getElements().isEmpty());
        assertEquals(5, snapshot.getPolls());
        assertTrue(clock.millis() >= 2000);
    }

    @Test
    void emptyPageNeverCountsAsStable() {
        FakeBrowser browser = new FakeBrowser().probes(ProbeResult.of(List.of()));

        StableSnapshot snapshot = scanner.awaitStable(browser,
                new StabilityBudget(Duration.ofSeconds(15), Duration.ofMillis(100), 1, 5));

        assertFalse(snapshot.isStable());
        assertEquals(5, snapshot.getPolls());
    }
}
