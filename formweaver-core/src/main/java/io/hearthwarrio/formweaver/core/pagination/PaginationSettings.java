package io.hearthwarrio.formweaver.core.pagination;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Pagination configuration.
 * <p>
 * Defaults: 3 click attempts, 1.5 s settle delay after each click, then polling every 300 ms for up to 5 s
 * for the page to change; readiness waits poll every 200 ms for up to 5 s.
 */
public final class PaginationSettings {

    public static final List<String> DEFAULT_INDICATOR_SELECTORS = List.of(
            "#current-page-display",
            ".current-page-display",
            ".page-num.current",
            ".pagination .active",
            ".ant-pagination-item-active",
            ".el-pager .active"
    );

    public static final List<String> DEFAULT_FIRST_ROW_SELECTORS = List.of(
            ".row-num",
            "table tbody tr td:first-child"
    );

    public static final List<String> DEFAULT_DISABLED_CLASSES = List.of(
            "disabled",
            "ant-pagination-disabled",
            "el-button--disabled",
            "btn-disabled",
            "is-disabled",
            "pagination-disabled"
    );

    public static final List<String> DEFAULT_NEXT_KEYWORDS = List.of(
            "下一页", "Next", "next", "»", ">>", ">", "→", "›"
    );

    private final int maxRetries;
    private final Duration settleDelay;
    private final Duration changeTimeout;
    private final Duration changePoll;
    private final Duration readyTimeout;
    private final Duration readyPoll;
    private final List<String> indicatorSelectors;
    private final List<String> firstRowSelectors;
    private final String tableInputSelector;
    private final List<String> disabledClasses;
    private final List<String> nextKeywords;

    private PaginationSettings(Builder b) {
        this.maxRetries = b.maxRetries;
        this.settleDelay = b.settleDelay;
        this.changeTimeout = b.changeTimeout;
        this.changePoll = b.changePoll;
        this.readyTimeout = b.readyTimeout;
        this.readyPoll = b.readyPoll;
        this.indicatorSelectors = List.copyOf(b.indicatorSelectors);
        this.firstRowSelectors = List.copyOf(b.firstRowSelectors);
        this.tableInputSelector = b.tableInputSelector;
        this.disabledClasses = List.copyOf(b.disabledClasses);
        this.nextKeywords = List.copyOf(b.nextKeywords);
    }

    public static PaginationSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .maxRetries(maxRetries)
                .settleDelay(settleDelay)
                .changeTimeout(changeTimeout)
                .changePoll(changePoll)
                .readyTimeout(readyTimeout)
                .readyPoll(readyPoll)
                .indicatorSelectors(indicatorSelectors)
                .firstRowSelectors(firstRowSelectors)
                .tableInputSelector(tableInputSelector)
                .disabledClasses(disabledClasses)
                .nextKeywords(nextKeywords);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getSettleDelay() {
        return settleDelay;
    }

    public Duration getChangeTimeout() {
        return changeTimeout;
    }

    public Duration getChangePoll() {
        return changePoll;
    }

    public Duration getReadyTimeout() {
        return readyTimeout;
    }

    public Duration getReadyPoll() {
        return readyPoll;
    }

    public List<String> getIndicatorSelectors() {
        return indicatorSelectors;
    }

    public List<String> getFirstRowSelectors() {
        return firstRowSelectors;
    }

    public String getTableInputSelector() {
        return tableInputSelector;
    }

    public List<String> getDisabledClasses() {
        return disabledClasses;
    }

    public List<String> getNextKeywords() {
        return nextKeywords;
    }

    public static final class Builder {
        private int maxRetries = 3;
        private Duration settleDelay = Duration.ofMillis(1500);
        private Duration changeTimeout = Duration.ofSeconds(5);
        private Duration changePoll = Duration.ofMillis(300);
        private Duration readyTimeout = Duration.ofSeconds(5);
        private Duration readyPoll = Duration.ofMillis(200);
        private List<String> indicatorSelectors = DEFAULT_INDICATOR_SELECTORS;
        private List<String> firstRowSelectors = DEFAULT_FIRST_ROW_SELECTORS;
        private String tableInputSelector = "table input";
        private List<String> disabledClasses = DEFAULT_DISABLED_CLASSES;
        private List<String> nextKeywords = DEFAULT_NEXT_KEYWORDS;

        private Builder() {
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 1) {
                throw new IllegalArgumentException("maxRetries must be at least 1");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder settleDelay(Duration settleDelay) {
            this.settleDelay = Objects.requireNonNull(settleDelay, "settleDelay must not be null");
            return this;
        }

        public Builder changeTimeout(Duration changeTimeout) {
            this.changeTimeout = Objects.requireNonNull(changeTimeout, "changeTimeout must not be null");
            return this;
        }

        public Builder changePoll(Duration changePoll) {
            this.changePoll = Objects.requireNonNull(changePoll, "changePoll must not be null");
            return this;
        }

        public Builder readyTimeout(Duration readyTimeout) {
            this.readyTimeout = Objects.requireNonNull(readyTimeout, "readyTimeout must not be null");
            return this;
        }

        public Builder readyPoll(Duration readyPoll) {
            this.readyPoll = Objects.requireNonNull(readyPoll, "readyPoll must not be null");
            return this;
        }

        public Builder indicatorSelectors(List<String> indicatorSelectors) {
            this.indicatorSelectors = Objects.requireNonNull(indicatorSelectors, "indicatorSelectors must not be null");
            return this;
        }

        public Builder firstRowSelectors(List<String> firstRowSelectors) {
            this.firstRowSelectors = Objects.requireNonNull(firstRowSelectors, "firstRowSelectors must not be null");
            return this;
        }

        public Builder tableInputSelector(String tableInputSelector) {
            this.tableInputSelector = Objects.requireNonNull(tableInputSelector, "tableInputSelector must not be null");
            return this;
        }

        public Builder disabledClasses(List<String> disabledClasses) {
            this.disabledClasses = Objects.requireNonNull(disabledClasses, "disabledClasses must not be null");
            return this;
        }

        public Builder nextKeywords(List<String> nextKeywords) {
            this.nextKeywords = Objects.requireNonNull(nextKeywords, "nextKeywords must not be null");
            return this;
        }

        public PaginationSettings build() {
            return new PaginationSettings(this);
        }
    }
}
