package io.hearthwarrio.formweaver.core.scan;

import java.time.Duration;
import java.util.Objects;

/**
 * Polling budget of one stability loop.
 * <p>
 * The loop stops at whichever comes first: the element count repeated {@code stableThreshold} times,
 * {@code maxPolls} probes taken, or {@code maxWait} elapsed.
 */
public final class StabilityBudget {

    private final Duration maxWait;
    private final Duration pollInterval;
    private final int stableThreshold;
    private final int maxPolls;

    public StabilityBudget(Duration maxWait, Duration pollInterval, int stableThreshold, int maxPolls) {
        this.maxWait = Objects.requireNonNull(maxWait, "maxWait must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (stableThreshold < 0) {
            throw new IllegalArgumentException("stableThreshold must not be negative");
        }
        if (maxPolls < 1) {
            throw new IllegalArgumentException("maxPolls must be at least 1");
        }
        this.stableThreshold = stableThreshold;
        this.maxPolls = maxPolls;
    }

    /**
     * Budget bounded by time only.
     */
    public static StabilityBudget timed(Duration maxWait, Duration pollInterval, int stableThreshold) {
        return new StabilityBudget(maxWait, pollInterval, stableThreshold, Integer.MAX_VALUE);
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public int getStableThreshold() {
        return stableThreshold;
    }

    public int getMaxPolls() {
        return maxPolls;
    }

    @Override
    public String toString() {
        return "StabilityBudget{" +
                "maxWait=" + maxWait +
                ", poll=" + pollInterval +
                ", stableThreshold=" + stableThreshold +
                (maxPolls == Integer.MAX_VALUE ? "" : ", maxPolls=" + maxPolls) +
                '}';
    }
}
