package io.hearthwarrio.formweaver.core.scan;

import io.hearthwarrio.formweaver.core.PollingClock;
import io.hearthwarrio.formweaver.core.browser.DomProbe;
import io.hearthwarrio.formweaver.core.browser.ProbeResult;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.List;
import java.util.Objects;

/**
 * Runs the control snapshot probe until the page stops changing.
 * <p>
 * A snapshot is accepted once its non-zero element count has repeated {@code stableThreshold} times in a
 * row. When the budget runs out first, the largest snapshot seen is returned. Polls that report a visible
 * loading overlay reset the stability streak and never count as a sample.
 */
public final class PageScanner {

    private final PollingClock clock;

    public PageScanner(PollingClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Scans the current document with a time-bounded budget.
     */
    public List<ElementFingerprint> scan(DomProbe probe, ScanSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return awaitStable(probe, settings.mainBudget()).getElements();
    }

    public StableSnapshot awaitStable(DomProbe probe, StabilityBudget budget) {
        Objects.requireNonNull(probe, "probe must not be null");
        Objects.requireNonNull(budget, "budget must not be null");

        long deadline = clock.millis() + budget.getMaxWait().toMillis();
        List<ElementFingerprint> best = List.of();
        int lastCount = -1;
        int streak = 0;
        int polls = 0;

        while (true) {
            ProbeResult result = probe.probeControls();
            polls++;

            if (result.isLoading()) {
                streak = 0;
                lastCount = -1;
            } else {
                int count = result.size();
                if (count > best.size()) {
                    best = result.getElements();
                }
                if (count > 0 && count == lastCount) {
                    streak++;
                } else {
                    streak = 0;
                }
                lastCount = count;

                if (count > 0 && streak >= budget.getStableThreshold()) {
                    return new StableSnapshot(best, true, polls);
                }
            }

            if (polls >= budget.getMaxPolls() || clock.millis() >= deadline) {
                return new StableSnapshot(best, false, polls);
            }
            clock.sleep(budget.getPollInterval());
        }
    }
}
