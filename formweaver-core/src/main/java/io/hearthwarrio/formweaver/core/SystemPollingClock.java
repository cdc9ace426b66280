package io.hearthwarrio.formweaver.core;

import java.time.Duration;

final class SystemPollingClock implements PollingClock {

    static final SystemPollingClock INSTANCE = new SystemPollingClock();

    private SystemPollingClock() {
    }

    @Override
    public long millis() {
        return System.currentTimeMillis();
    }

    @Override
    public void sleep(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while polling", e);
        }
    }
}
