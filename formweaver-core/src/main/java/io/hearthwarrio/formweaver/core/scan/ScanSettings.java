package io.hearthwarrio.formweaver.core.scan;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scanner configuration.
 * <p>
 * Defaults:
 * <ul>
 *   <li>main document: up to 15 s, polling every 800 ms, stable after 3 repeated counts</li>
 *   <li>frames: depth up to 3, frames smaller than 50 px in either dimension are ignored</li>
 *   <li>business frames: 5 polls every second, stable after 1 repeated count</li>
 *   <li>other frames: a single fast pass</li>
 * </ul>
 */
public final class ScanSettings {

    public static final List<String> DEFAULT_BUSINESS_KEYWORDS = List.of(
            "ifarmedj", "tps-local", "trade", "record", "invoice", "form", "entry", "business"
    );

    private final Duration maxWait;
    private final Duration pollInterval;
    private final int stableThreshold;
    private final int maxFrameDepth;
    private final int minFrameSize;
    private final List<String> businessKeywords;
    private final int businessMaxPolls;
    private final Duration businessPollInterval;
    private final int businessStableThreshold;
    private final int genericMaxPolls;
    private final Duration genericPollInterval;

    private ScanSettings(Builder b) {
        this.maxWait = b.maxWait;
        this.pollInterval = b.pollInterval;
        this.stableThreshold = b.stableThreshold;
        this.maxFrameDepth = b.maxFrameDepth;
        this.minFrameSize = b.minFrameSize;
        this.businessKeywords = List.copyOf(b.businessKeywords);
        this.businessMaxPolls = b.businessMaxPolls;
        this.businessPollInterval = b.businessPollInterval;
        this.businessStableThreshold = b.businessStableThreshold;
        this.genericMaxPolls = b.genericMaxPolls;
        this.genericPollInterval = b.genericPollInterval;
    }

    public static ScanSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxWait(maxWait)
                .pollInterval(pollInterval)
                .stableThreshold(stableThreshold)
                .maxFrameDepth(maxFrameDepth)
                .minFrameSize(minFrameSize)
                .businessKeywords(businessKeywords)
                .businessMaxPolls(businessMaxPolls)
                .businessPollInterval(businessPollInterval)
                .businessStableThreshold(businessStableThreshold)
                .genericMaxPolls(genericMaxPolls)
                .genericPollInterval(genericPollInterval);
    }

    public StabilityBudget mainBudget() {
        return StabilityBudget.timed(maxWait, pollInterval, stableThreshold);
    }

    public StabilityBudget frameBudget(String frameSource) {
        if (isBusinessFrame(frameSource)) {
            return new StabilityBudget(maxWait, businessPollInterval, businessStableThreshold, businessMaxPolls);
        }
        return new StabilityBudget(maxWait, genericPollInterval, 0, genericMaxPolls);
    }

    public boolean isBusinessFrame(String frameSource) {
        if (frameSource == null || frameSource.isBlank()) {
            return false;
        }
        String src = frameSource.toLowerCase(Locale.ROOT);
        for (String keyword : businessKeywords) {
            if (src.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
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

    public int getMaxFrameDepth() {
        return maxFrameDepth;
    }

    public int getMinFrameSize() {
        return minFrameSize;
    }

    public List<String> getBusinessKeywords() {
        return businessKeywords;
    }

    public static final class Builder {
        private Duration maxWait = Duration.ofSeconds(15);
        private Duration pollInterval = Duration.ofMillis(800);
        private int stableThreshold = 3;
        private int maxFrameDepth = 3;
        private int minFrameSize = 50;
        private List<String> businessKeywords = DEFAULT_BUSINESS_KEYWORDS;
        private int businessMaxPolls = 5;
        private Duration businessPollInterval = Duration.ofSeconds(1);
        private int businessStableThreshold = 1;
        private int genericMaxPolls = 1;
        private Duration genericPollInterval = Duration.ofMillis(200);

        private Builder() {
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = Objects.requireNonNull(maxWait, "maxWait must not be null");
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
            return this;
        }

        public Builder stableThreshold(int stableThreshold) {
            this.stableThreshold = stableThreshold;
            return this;
        }

        public Builder maxFrameDepth(int maxFrameDepth) {
            this.maxFrameDepth = maxFrameDepth;
            return this;
        }

        public Builder minFrameSize(int minFrameSize) {
            this.minFrameSize = minFrameSize;
            return this;
        }

        public Builder businessKeywords(List<String> businessKeywords) {
            this.businessKeywords = Objects.requireNonNull(businessKeywords, "businessKeywords must not be null");
            return this;
        }

        public Builder businessMaxPolls(int businessMaxPolls) {
            this.businessMaxPolls = businessMaxPolls;
            return this;
        }

        public Builder businessPollInterval(Duration businessPollInterval) {
            this.businessPollInterval = Objects.requireNonNull(businessPollInterval, "businessPollInterval must not be null");
            return this;
        }

        public Builder businessStableThreshold(int businessStableThreshold) {
            this.businessStableThreshold = businessStableThreshold;
            return this;
        }

        public Builder genericMaxPolls(int genericMaxPolls) {
            this.genericMaxPolls = genericMaxPolls;
            return this;
        }

        public Builder genericPollInterval(Duration genericPollInterval) {
            this.genericPollInterval = Objects.requireNonNull(genericPollInterval, "genericPollInterval must not be null");
            return this;
        }

        public ScanSettings build() {
            if (stableThreshold < 0) {
                throw new IllegalArgumentException("stableThreshold must not be negative");
            }
            if (maxFrameDepth < 0) {
                throw new IllegalArgumentException("maxFrameDepth must not be negative");
            }
            if (businessMaxPolls < 1 || genericMaxPolls < 1) {
                throw new IllegalArgumentException("frame poll budgets must be at least 1");
            }
            return new ScanSettings(this);
        }
    }
}
