package io.hearthwarrio.formweaver.core;

import java.time.Duration;

/**
 * Time source for the synchronous probe-then-sleep loops (scan stability, page readiness, page change).
 * <p>
 * Tests plug in a virtual clock so polling budgets can be exercised without real waiting.
 */
public interface PollingClock {

    long millis();

    void sleep(Duration duration);

    static PollingClock system() {
        return SystemPollingClock.INSTANCE;
    }
}
