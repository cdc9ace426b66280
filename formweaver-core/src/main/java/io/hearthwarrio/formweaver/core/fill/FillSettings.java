package io.hearthwarrio.formweaver.core.fill;

import java.time.Duration;
import java.util.Objects;

/**
 * Fill engine configuration.
 * <p>
 * Defaults: 300 ms per fallback locator, 5 text nodes examined when relocating a control,
 * and up to 1 s waiting for a loading overlay before each batch.
 */
public final class FillSettings {

    private final Duration elementTimeout;
    private final int healMaxCandidates;
    private final Duration loadingWait;
    private final Duration loadingPoll;

    public FillSettings(Duration elementTimeout, int healMaxCandidates, Duration loadingWait, Duration loadingPoll) {
        this.elementTimeout = Objects.requireNonNull(elementTimeout, "elementTimeout must not be null");
        this.loadingWait = Objects.requireNonNull(loadingWait, "loadingWait must not be null");
        this.loadingPoll = Objects.requireNonNull(loadingPoll, "loadingPoll must not be null");
        if (healMaxCandidates < 1) {
            throw new IllegalArgumentException("healMaxCandidates must be at least 1");
        }
        this.healMaxCandidates = healMaxCandidates;
    }

    public static FillSettings defaults() {
        return new FillSettings(Duration.ofMillis(300), 5, Duration.ofSeconds(1), Duration.ofMillis(100));
    }

    public FillSettings withElementTimeout(Duration elementTimeout) {
        return new FillSettings(elementTimeout, healMaxCandidates, loadingWait, loadingPoll);
    }

    public FillSettings withHealMaxCandidates(int healMaxCandidates) {
        return new FillSettings(elementTimeout, healMaxCandidates, loadingWait, loadingPoll);
    }

    public Duration getElementTimeout() {
        return elementTimeout;
    }

    public int getHealMaxCandidates() {
        return healMaxCandidates;
    }

    public Duration getLoadingWait() {
        return loadingWait;
    }

    public Duration getLoadingPoll() {
        return loadingPoll;
    }

    @Override
    public String toString() {
        return "FillSettings{" +
                "elementTimeout=" + elementTimeout +
                ", healMaxCandidates=" + healMaxCandidates +
                ", loadingWait=" + loadingWait +
                '}';
    }
}
