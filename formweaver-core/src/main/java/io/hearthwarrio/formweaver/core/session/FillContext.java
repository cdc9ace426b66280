package io.hearthwarrio.formweaver.core.session;

import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.FillProgressSink;
import io.hearthwarrio.formweaver.core.PollingClock;
import io.hearthwarrio.formweaver.core.anchor.AnchorResolver;
import io.hearthwarrio.formweaver.core.anchor.FillTask;
import io.hearthwarrio.formweaver.core.browser.BrowserHandle;
import io.hearthwarrio.formweaver.core.fill.FillMode;
import io.hearthwarrio.formweaver.core.fill.RowOutcome;
import io.hearthwarrio.formweaver.core.fill.SelfHealingFillEngine;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.SourceRow;
import io.hearthwarrio.formweaver.core.pagination.PaginationController;
import io.hearthwarrio.formweaver.core.progress.FillProgressManager;
import io.hearthwarrio.formweaver.core.progress.FillRecord;
import io.hearthwarrio.formweaver.core.progress.RecordStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Everything a {@link FillStrategy} works with during one session.
 * <p>
 * Owned by the session worker. Mappings may be re-pointed after a page turn, so strategies read them through
 * {@link #mappings()} on every row instead of keeping a copy.
 */
public final class FillContext {

    private final FillSessionState state;
    private final FillSessionConfig config;
    private final List<SourceRow> rows;
    private final Map<String, ElementFingerprint> mappings;
    private final String keyField;
    private ElementFingerprint keyFingerprint;

    private final BrowserHandle handle;
    private final SelfHealingFillEngine engine;
    private final PaginationController pagination;
    private final AnchorResolver resolver;
    private final Supplier<List<ElementFingerprint>> rescan;

    private final FillLogSink log;
    private final FillProgressSink progressSink;
    private final FillProgressManager progress;
    private final PollingClock clock;

    private final CancellationToken token;
    private final PauseGate gate;
    private final AtomicBoolean pauseRequested = new AtomicBoolean();
    private final AtomicBoolean finishRequested = new AtomicBoolean();
    private final AtomicBoolean pausedHere = new AtomicBoolean();

    FillContext(
            FillSessionState state,
            FillSessionConfig config,
            List<SourceRow> rows,
            Map<String, ElementFingerprint> mappings,
            String keyField,
            ElementFingerprint keyFingerprint,
            BrowserHandle handle,
            SelfHealingFillEngine engine,
            PaginationController pagination,
            Supplier<List<ElementFingerprint>> rescan,
            FillLogSink log,
            FillProgressSink progressSink,
            FillProgressManager progress,
            PollingClock clock,
            CancellationToken token,
            PauseGate gate
    ) {
        this.state = state;
        this.config = config;
        this.rows = List.copyOf(rows);
        this.mappings = mappings;
        this.keyField = keyField;
        this.keyFingerprint = keyFingerprint;
        this.handle = handle;
        this.engine = engine;
        this.pagination = pagination;
        this.resolver = new AnchorResolver();
        this.rescan = rescan;
        this.log = log;
        this.progressSink = progressSink;
        this.progress = progress;
        this.clock = clock;
        this.token = token;
        this.gate = gate;
    }

    public FillSessionState state() {
        return state;
    }

    public FillSessionConfig config() {
        return config;
    }

    public FillMode fillMode() {
        return config.getFillMode();
    }

    public List<SourceRow> rows() {
        return rows;
    }

    public Map<String, ElementFingerprint> mappings() {
        return Collections.unmodifiableMap(mappings);
    }

    public Optional<String> keyField() {
        return Optional.ofNullable(keyField);
    }

    public Optional<ElementFingerprint> keyFingerprint() {
        return Optional.ofNullable(keyFingerprint);
    }

    public BrowserHandle handle() {
        return handle;
    }

    public SelfHealingFillEngine engine() {
        return engine;
    }

    public AnchorResolver resolver() {
        return resolver;
    }

    public FillLogSink log() {
        return log;
    }

    boolean isAnchorMode() {
        return keyFingerprint != null;
    }

    void requestPause() {
        pauseRequested.set(true);
    }

    void requestFinish() {
        finishRequested.set(true);
    }

    boolean isFinishRequested() {
        return finishRequested.get();
    }

    /**
     * @return true once after each {@link #pauseHere(String)}, even when the session was resumed in between
     */
    boolean consumePause() {
        return pausedHere.getAndSet(false);
    }

    CancellationToken token() {
        return token;
    }

    PauseGate gate() {
        return gate;
    }

    /**
     * Checked once per row or task.
     *
     * @return true when the strategy must return now, because of cancellation or a pause request
     */
    public boolean shouldStop() {
        if (token.isCancelled()) {
            return true;
        }
        if (pauseRequested.getAndSet(false)) {
            pauseHere("paused by user");
            return true;
        }
        return false;
    }

    /**
     * Closes the pause gate, then reports the pause. The worker waits on the gate once the strategy returns.
     */
    public void pauseHere(String reason) {
        gate.close();
        pausedHere.set(true);
        state.pause(reason);
        log.info("Paused: " + reason);
        if (progress != null) {
            progress.pause(cursor());
        }
    }

    /**
     * Position persisted for resuming: next row in sequential mode, handled row count in anchor mode.
     */
    int cursor() {
        return isAnchorMode() ? state.getProcessedCount() : state.getCurrentIndex();
    }

    /**
     * Books a filled task: counters, task status, log line, progress record.
     */
    public void recordRow(FillTask task, RowOutcome outcome) {
        int rowNumber = task.getSourceIndex() + 1;
        RecordStatus status;
        String error = "";
        if (outcome.isFailed()) {
            error = String.join("; ", outcome.getFailures());
            String message = "Row " + rowNumber + ": " + error;
            state.recordError(task.getSourceIndex(), message);
            task.markError(error);
            log.error(message);
            status = RecordStatus.FAILED;
        } else {
            state.recordSuccess(task.getSourceIndex(), outcome.getHealed());
            task.markSuccess(outcome.summary());
            if (outcome.isPartial()) {
                error = String.join("; ", outcome.getFailures());
                log.warning("Row " + rowNumber + " partially filled: " + outcome.summary());
            } else if (outcome.getAttempted() == 0) {
                log.info("Row " + rowNumber + ": nothing to write");
            } else {
                log.success("Row " + rowNumber + " -> page " + state.getCurrentPage() + " row "
                        + (task.getDestinationIndex() + 1) + ": " + outcome.summary());
            }
            status = RecordStatus.SUCCESS;
        }
        persist(task, status, error);
        progressSink.onProgress(state.getProcessedCount(), rows.size(), state.getCurrentPage());
    }

    /**
     * Books a source row that never got a destination.
     */
    void recordSkipped(FillTask task, String reason) {
        state.recordSkipped(task.getSourceIndex());
        if (task.isPending()) {
            task.markSkipped(reason);
        }
        log.warning("Row " + (task.getSourceIndex() + 1) + " skipped: " + reason);
        persist(task, RecordStatus.SKIPPED, reason);
    }

    private void persist(FillTask task, RecordStatus status, String error) {
        if (progress == null) {
            return;
        }
        FillRecord record = new FillRecord(
                task.getSourceIndex() + 1,
                state.getCurrentPage(),
                task.getDestinationIndex(),
                task.getValues(),
                status,
                Instant.ofEpochMilli(clock.millis()),
                error,
                task.getAnchorValue()
        );
        progress.recordRow(record, cursor());
    }

    /**
     * Clicks through to the next page.
     *
     * @return false when there is no next page or no next-page control
     */
    public boolean turnPage() {
        if (pagination.getNextControl().isEmpty()) {
            log.warning("No next-page control set up, cannot continue on another page");
            return false;
        }
        if (!pagination.nextPage()) {
            return false;
        }
        onNewPage(pagination.getCurrentPage());
        return true;
    }

    /**
     * Called on continue after the user turned the page.
     */
    public void acceptManualPageTurn() {
        int page = state.getCurrentPage() + 1;
        pagination.setCurrentPage(page);
        onNewPage(page);
    }

    private void onNewPage(int page) {
        state.setCurrentPage(page);
        state.setAwaitingPageTurn(false);
        if (progress != null) {
            progress.onPageTurn(page);
        }
        pagination.waitForPageReady();
        rebindMappings();
    }

    /**
     * Re-points mappings (and the key control) at a fresh scan of the current page.
     */
    public void rebindMappings() {
        if (!config.isRebindAfterPageTurn()) {
            return;
        }
        List<ElementFingerprint> fresh;
        try {
            fresh = rescan.get();
        } catch (RuntimeException e) {
            log.warning("Rescan after page turn failed, keeping previous mappings: " + e.getMessage());
            return;
        }
        if (fresh.isEmpty()) {
            log.warning("Rescan after page turn found no controls, keeping previous mappings");
            return;
        }
        int replaced = MappingRebinder.rebind(mappings, fresh);
        if (keyFingerprint != null) {
            keyFingerprint = MappingRebinder.find(keyFingerprint, fresh).orElse(keyFingerprint);
        }
        log.info("Rebound " + replaced + " of " + mappings.size() + " mapping(s) on page " + state.getCurrentPage());
    }

    /**
     * Rows the current page can take: largest group size, else the table's row count in batch mode, else no limit.
     */
    public int pageCapacity() {
        int group = 0;
        for (ElementFingerprint fp : mappings.values()) {
            if (fp.isGroup()) {
                group = Math.max(group, fp.groupSize());
            }
        }
        if (group > 0) {
            return group;
        }
        if (config.getFillMode() == FillMode.BATCH_TABLE) {
            try {
                int tableRows = handle.countTableRows();
                if (tableRows > 0) {
                    return tableRows;
                }
            } catch (RuntimeException e) {
                log.warning("Counting table rows failed: " + e.getMessage());
            }
        }
        return Integer.MAX_VALUE;
    }
}
