package io.hearthwarrio.formweaver.core.fill;

import io.hearthwarrio.formweaver.core.FailureKind;
import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.FormWeaverException;
import io.hearthwarrio.formweaver.core.PollingClock;
import io.hearthwarrio.formweaver.core.anchor.FillTask;
import io.hearthwarrio.formweaver.core.browser.BrowserHandle;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.Locator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes field values through a chain of increasingly tolerant strategies.
 * <p>
 * For one field:
 * <ol>
 *   <li>enter the control's frame (always left again afterwards)</li>
 *   <li>pick the target: a group sibling by row offset, the table row locator, or the best locator</li>
 *   <li>rich write with the full event sequence</li>
 *   <li>plain clear-and-type through every other locator of the control, each with a short timeout</li>
 *   <li>single-record mode only: one bounded relocation by label text, then nearby text</li>
 * </ol>
 * Failures are returned as outcomes and never thrown; a failed call leaves no state behind, so repeating it
 * fails the same way.
 */
public final class SelfHealingFillEngine {

    private final BrowserHandle handle;
    private final FillSettings settings;
    private final PollingClock clock;
    private final FillLogSink log;
    private final ValueWriter valueWriter;
    private final ValueTransformer transformer = new ValueTransformer();

    public SelfHealingFillEngine(BrowserHandle handle, FillSettings settings, PollingClock clock, FillLogSink log) {
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
        this.valueWriter = new ValueWriter(handle);
    }

    /**
     * @param rowOffset 0-based row within the current page (or within the group)
     */
    public FieldOutcome fillField(ElementFingerprint fingerprint, String value, int rowOffset, FillMode mode) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        String v = transformer.transform(fingerprint, value);
        try (FrameScope ignored = FrameScope.enter(handle, fingerprint.getFrame())) {
            Optional<Locator> target = resolveTarget(fingerprint, rowOffset, mode);
            if (target.isEmpty()) {
                return FieldOutcome.noTarget("no control for row " + rowOffset);
            }
            return write(fingerprint, target.get(), v, rowOffset, mode);
        } catch (FormWeaverException e) {
            return FieldOutcome.failed(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            return FieldOutcome.failed(FailureKind.ELEMENT_NOT_FOUND, describe(e));
        }
    }

    /**
     * Writes every mapped field of a task.
     * <p>
     * Blank values are skipped. The key field, when given, is only read for correlation and never written.
     * Fields without a control for this row are ignored unless no field of the row had one, in which
     * case they all count as failed.
     */
    public RowOutcome fillRow(
            FillTask task,
            Map<String, ElementFingerprint> mappings,
            String keyField,
            int rowOffset,
            FillMode mode
    ) {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(mappings, "mappings must not be null");

        int attempted = 0;
        int filled = 0;
        int healed = 0;
        Map<String, String> written = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();
        List<String> unreachable = new ArrayList<>();

        for (Map.Entry<String, ElementFingerprint> e : mappings.entrySet()) {
            String field = e.getKey();
            if (field.equals(keyField)) {
                continue;
            }
            String value = task.value(field);
            if (value.isBlank()) {
                continue;
            }

            FieldOutcome outcome = fillField(e.getValue(), value, rowOffset, mode);
            if (outcome.getStatus() == FieldOutcome.Status.NO_TARGET) {
                unreachable.add(field + ": " + outcome.getMessage());
                continue;
            }
            attempted++;
            if (outcome.isFilled()) {
                filled++;
                written.put(field, value);
                if (outcome.isHealed()) {
                    healed++;
                    log.warning("Field '" + field + "' relocated by nearby text: " + outcome.getLocator().orElse(null));
                }
            } else {
                failures.add(field + ": " + outcome.getMessage());
            }
        }
        // values were there but no control could take them: the row is past the end of the table
        if (attempted == 0 && !unreachable.isEmpty()) {
            attempted = unreachable.size();
            failures.addAll(unreachable);
        }
        return new RowOutcome(attempted, filled, healed, written, failures);
    }

    /**
     * Waits briefly for a loading overlay to disappear.
     *
     * @return true when no overlay is visible
     */
    public boolean awaitQuietPage() {
        long deadline = clock.millis() + settings.getLoadingWait().toMillis();
        while (true) {
            boolean loading;
            try {
                loading = handle.isLoadingIndicatorVisible();
            } catch (RuntimeException e) {
                log.warning("Loading check failed: " + describe(e));
                return false;
            }
            if (!loading) {
                return true;
            }
            if (clock.millis() >= deadline) {
                return false;
            }
            clock.sleep(settings.getLoadingPoll());
        }
    }

    /**
     * Outlines a control in its frame.
     */
    public void highlight(ElementFingerprint fingerprint) {
        Optional<Locator> best = fingerprint.bestLocator();
        if (best.isEmpty()) {
            return;
        }
        try (FrameScope ignored = FrameScope.enter(handle, fingerprint.getFrame())) {
            handle.highlight(best.get());
        }
    }

    static Optional<Locator> resolveTarget(ElementFingerprint fp, int rowOffset, FillMode mode) {
        if (rowOffset < 0) {
            return Optional.empty();
        }
        if (fp.isGroup()) {
            if (rowOffset == 0) {
                return fp.bestLocator();
            }
            List<Locator> siblings = fp.getSiblings();
            return rowOffset <= siblings.size() ? Optional.of(siblings.get(rowOffset - 1)) : Optional.empty();
        }
        if (fp.isInTable()) {
            Optional<Locator> row = fp.rowLocator(rowOffset);
            if (row.isPresent()) {
                return row;
            }
        }
        if (rowOffset == 0 || mode == FillMode.SINGLE_RECORD) {
            return fp.bestLocator();
        }
        return Optional.empty();
    }

    private FieldOutcome write(ElementFingerprint fp, Locator target, String value, int rowOffset, FillMode mode) {
        String lastError = "";

        try {
            if (handle.isPresent(target, settings.getElementTimeout())) {
                valueWriter.write(target, value, fp.controlKind());
                return FieldOutcome.filled(FieldOutcome.Status.FILLED, target);
            }
            lastError = "not found: " + target;
        } catch (RuntimeException e) {
            lastError = describe(e);
        }

        // alternative locators point at the scanned control, which is the target only for its own row
        if (!fp.isGroup() && (rowOffset == 0 || !fp.isInTable())) {
            for (Locator alt : fp.getLocators()) {
                if (alt.equals(target)) {
                    continue;
                }
                try {
                    if (handle.isPresent(alt, settings.getElementTimeout())) {
                        handle.clearAndType(alt, value);
                        return FieldOutcome.filled(FieldOutcome.Status.FILLED_BY_FALLBACK, alt);
                    }
                } catch (RuntimeException e) {
                    lastError = describe(e);
                }
            }
        }

        if (mode == FillMode.SINGLE_RECORD) {
            Optional<FieldOutcome> healed = heal(fp, value);
            if (healed.isPresent()) {
                return healed.get();
            }
        }
        return FieldOutcome.failed(FailureKind.ELEMENT_NOT_FOUND, fp.displayName() + " " + lastError);
    }

    private Optional<FieldOutcome> heal(ElementFingerprint fp, String value) {
        for (String text : List.of(fp.getLabel(), fp.getNearbyText())) {
            if (text.isBlank()) {
                continue;
            }
            try {
                Optional<Locator> near = handle.locateNearText(text, settings.getHealMaxCandidates());
                if (near.isPresent()) {
                    valueWriter.write(near.get(), value, fp.controlKind());
                    return Optional.of(FieldOutcome.filled(FieldOutcome.Status.HEALED, near.get()));
                }
            } catch (RuntimeException e) {
                log.warning("Relocation by '" + text + "' failed: " + describe(e));
            }
        }
        return Optional.empty();
    }

    private static String describe(RuntimeException e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            return e.getClass().getSimpleName();
        }
        int nl = m.indexOf('\n');
        return nl > 0 ? m.substring(0, nl) : m;
    }
}
