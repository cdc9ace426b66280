package io.hearthwarrio.formweaver.core.scan;

import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.PollingClock;
import io.hearthwarrio.formweaver.core.ScanTimeoutException;
import io.hearthwarrio.formweaver.core.browser.BrowserHandle;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for discovering the controls of a page.
 * <p>
 * Scans the top document with the stability loop, then every nested frame. When the full scan fails, or
 * yields nothing before the budget runs out, a simplified single-document scan is used instead.
 */
public final class FormScanner {

    private final ScanSettings settings;
    private final PageScanner pageScanner;
    private final FrameScanner frameScanner;
    private final FillLogSink log;

    public FormScanner(ScanSettings settings, PollingClock clock, FillLogSink log) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
        this.pageScanner = new PageScanner(clock);
        this.frameScanner = new FrameScanner(pageScanner, settings, log);
    }

    public List<ElementFingerprint> scan(BrowserHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");

        List<ElementFingerprint> result;
        try {
            result = fullScan(handle);
        } catch (ScanTimeoutException e) {
            log.warning(e.getMessage() + ", using simplified scan");
            result = fallbackScan(handle);
        } catch (RuntimeException e) {
            log.error("Scan failed: " + e.getMessage() + ", using simplified scan");
            result = fallbackScan(handle);
        }

        log.info("Scan: " + ScanStatistics.of(result));
        return result;
    }

    private List<ElementFingerprint> fullScan(BrowserHandle handle) {
        handle.leaveFrames();
        StableSnapshot main = pageScanner.awaitStable(handle, settings.mainBudget());
        if (!main.isStable() && !main.getElements().isEmpty()) {
            log.warning("Page did not settle within " + settings.getMaxWait().toMillis()
                    + " ms, keeping best snapshot of " + main.getElements().size() + " controls");
        }

        List<ElementFingerprint> all = new ArrayList<>(main.getElements());
        all.addAll(frameScanner.scanFrames(handle));

        if (all.isEmpty()) {
            throw new ScanTimeoutException("No controls found within " + settings.getMaxWait().toMillis() + " ms");
        }
        return all;
    }

    private List<ElementFingerprint> fallbackScan(BrowserHandle handle) {
        try {
            handle.leaveFrames();
            return List.copyOf(handle.probeControlsFallback());
        } catch (RuntimeException e) {
            log.error("Simplified scan failed: " + e.getMessage());
            return List.of();
        }
    }
}
