package io.hearthwarrio.formweaver.core;

import java.time.Duration;

/**
 * Virtual clock: sleeping advances time instantly.
 */
public final class FakeClock implements PollingClock {

    private long now;
    private int sleeps;

    @Override
    public synchronized long millis() {
        return now;
    }

    @Override
    public synchronized void sleep(Duration duration) {
        now += duration.toMillis();
        sleeps++;
    }

    public synchronized int getSleeps() {
        return sleeps;
    }
}
