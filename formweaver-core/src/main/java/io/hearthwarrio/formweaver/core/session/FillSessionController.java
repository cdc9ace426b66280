package io.hearthwarrio.formweaver.core.session;

import io.hearthwarrio.formweaver.core.ConfigurationException;
import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.FillProgressSink;
import io.hearthwarrio.formweaver.core.FormWeaverSettings;
import io.hearthwarrio.formweaver.core.PollingClock;
import io.hearthwarrio.formweaver.core.StdOutFillLogSink;
import io.hearthwarrio.formweaver.core.anchor.AnchorAutoMatcher;
import io.hearthwarrio.formweaver.core.anchor.AnchorConfig;
import io.hearthwarrio.formweaver.core.anchor.AnchorPair;
import io.hearthwarrio.formweaver.core.anchor.FillTask;
import io.hearthwarrio.formweaver.core.browser.BrowserHandle;
import io.hearthwarrio.formweaver.core.browser.NavigationCandidate;
import io.hearthwarrio.formweaver.core.fill.SelfHealingFillEngine;
import io.hearthwarrio.formweaver.core.match.FieldMatcher;
import io.hearthwarrio.formweaver.core.match.FuzzyFieldScorer;
import io.hearthwarrio.formweaver.core.match.MatchResult;
import io.hearthwarrio.formweaver.core.match.TextNormalizer;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.Locator;
import io.hearthwarrio.formweaver.core.model.SourceRow;
import io.hearthwarrio.formweaver.core.model.TableContext;
import io.hearthwarrio.formweaver.core.pagination.PaginationController;
import io.hearthwarrio.formweaver.core.pagination.PaginationDetector;
import io.hearthwarrio.formweaver.core.progress.FillProgress;
import io.hearthwarrio.formweaver.core.progress.FillProgressManager;
import io.hearthwarrio.formweaver.core.progress.FillRecord;
import io.hearthwarrio.formweaver.core.progress.RecordStatus;
import io.hearthwarrio.formweaver.core.scan.FormScanner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point of the fill pipeline: scan the page, match source fields to controls, then fill rows in a
 * background session that can be paused, resumed and aborted.
 * <p>
 * Typical use:
 * <pre>{@code
 * FillSessionController controller = new FillSessionController(handle)
 *         .withProgressManager(new FillProgressManager(dir, log));
 * controller.scan();
 * controller.applyMatch(controller.match(List.of("Name", "Qty")));
 * CompletableFuture<SessionSummary> done = controller.start(rows, FillSessionConfig.builder()
 *         .fillMode(FillMode.BATCH_TABLE)
 *         .paginationMode(PaginationMode.AUTO)
 *         .build());
 * }</pre>
 * Configuration methods are meant to be called before {@link #start}; one session runs at a time.
 */
public final class FillSessionController {

    private final BrowserHandle handle;

    private FillLogSink log = new StdOutFillLogSink();
    private FillProgressSink progressSink = FillProgressSink.discarding();
    private FillProgressManager progressManager;
    private FormWeaverSettings settings = FormWeaverSettings.defaults();
    private PollingClock clock = PollingClock.system();

    private final Map<String, ElementFingerprint> mappings = new LinkedHashMap<>();
    private List<ElementFingerprint> lastScan = List.of();
    private Locator nextControl;

    private volatile FillSessionState state = new FillSessionState();
    private volatile FillContext context;

    public FillSessionController(BrowserHandle handle) {
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
    }

    public FillSessionController withLogSink(FillLogSink log) {
        this.log = Objects.requireNonNull(log, "log must not be null");
        return this;
    }

    public FillSessionController withProgressSink(FillProgressSink progressSink) {
        this.progressSink = Objects.requireNonNull(progressSink, "progressSink must not be null");
        return this;
    }

    /**
     * Enables progress files; without a manager nothing is persisted.
     */
    public FillSessionController withProgressManager(FillProgressManager progressManager) {
        this.progressManager = progressManager;
        return this;
    }

    public FillSessionController withSettings(FormWeaverSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        return this;
    }

    public FillSessionController withClock(PollingClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        return this;
    }

    // ---------- preparation ----------

    /**
     * Scans the page (and its frames) for fillable controls.
     */
    public List<ElementFingerprint> scan() {
        lastScan = List.copyOf(newScanner().scan(handle));
        return lastScan;
    }

    public List<ElementFingerprint> getLastScan() {
        return lastScan;
    }

    /**
     * Matches field names against the last scan, scanning first when there is none.
     */
    public MatchResult match(List<String> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        if (lastScan.isEmpty()) {
            scan();
        }
        MatchResult result = new FieldMatcher(new FuzzyFieldScorer(), settings.match()).match(fields, lastScan);
        log.info("Matched " + result.getMatchedCount() + " of " + fields.size() + " field(s)"
                + (result.getUnmatchedFields().isEmpty() ? "" : ", unmatched: " + result.getUnmatchedFields()));
        return result;
    }

    /**
     * Replaces the mappings with the matches of {@code result}.
     */
    public FillSessionController applyMatch(MatchResult result) {
        return setMappings(result.mappings());
    }

    public FillSessionController setMappings(Map<String, ElementFingerprint> mappings) {
        Objects.requireNonNull(mappings, "mappings must not be null");
        this.mappings.clear();
        this.mappings.putAll(mappings);
        return this;
    }

    public FillSessionController putMapping(String field, ElementFingerprint fingerprint) {
        mappings.put(
                Objects.requireNonNull(field, "field must not be null"),
                Objects.requireNonNull(fingerprint, "fingerprint must not be null")
        );
        return this;
    }

    public Map<String, ElementFingerprint> getMappings() {
        return Map.copyOf(mappings);
    }

    /**
     * Candidates for the next-page control, at most {@link PaginationDetector#MAX_CANDIDATES}.
     */
    public List<NavigationCandidate> detectPagination() {
        List<NavigationCandidate> candidates = new PaginationDetector(settings.pagination()).detect(handle);
        log.info("Found " + candidates.size() + " pagination candidate(s)");
        return candidates;
    }

    public FillSessionController setupPagination(Locator nextControl) {
        this.nextControl = Objects.requireNonNull(nextControl, "nextControl must not be null");
        log.info("Next-page control: " + nextControl);
        return this;
    }

    /**
     * Outlines a control on the page so the user can check a mapping.
     */
    public void highlight(ElementFingerprint fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        newEngine().highlight(fingerprint);
    }

    /**
     * Builds an anchor configuration from the page table's columns.
     */
    public AnchorConfig autoMatchAnchors(List<String> sourceFields) {
        return new AnchorAutoMatcher(log).autoMatch(sourceFields, handle.listTableColumns());
    }

    // ---------- session ----------

    /**
     * Starts a session in the background.
     *
     * @throws ConfigurationException when there are no rows or no mappings, or the key column has no usable
     *                                locator
     * @throws IllegalStateException  when a session is still running or paused
     */
    public synchronized CompletableFuture<SessionSummary> start(List<SourceRow> rows, FillSessionConfig config) {
        return launch(rows, config, null, null);
    }

    /**
     * Continues a saved session from its persisted cursor. Rows recorded as filled or failed are not
     * processed again.
     *
     * @param file progress file to keep writing to; {@code null} starts a new file
     */
    public synchronized CompletableFuture<SessionSummary> restore(
            FillProgress saved,
            Path file,
            List<SourceRow> rows,
            FillSessionConfig config
    ) {
        Objects.requireNonNull(saved, "saved must not be null");
        if (!saved.isResumable()) {
            throw new IllegalStateException("Saved session is " + saved.getStatus() + " and cannot be resumed");
        }
        return launch(rows, config, saved, file);
    }

    /**
     * Asks the worker to pause after the current row.
     */
    public void pause() {
        FillContext c = context;
        if (c != null && state.isRunning()) {
            c.requestPause();
        }
    }

    /**
     * Resumes a paused session on the same worker.
     */
    public void resume() {
        FillContext c = requireContext();
        state.resume();
        if (progressManager != null) {
            progressManager.resume();
        }
        log.info("Resumed");
        c.gate().open();
    }

    /**
     * Ends a paused session normally; rows not handled yet are recorded as skipped.
     */
    public void finish() {
        FillContext c = requireContext();
        c.requestFinish();
        state.resume();
        c.gate().open();
    }

    /**
     * Stops the session after the current row. The returned future completes with an ABORTED summary.
     */
    public void abort() {
        FillContext c = context;
        if (c == null || !state.getStatus().isActive()) {
            return;
        }
        c.token().cancel();
        c.gate().open();
    }

    public FillSessionState state() {
        return state;
    }

    private FillContext requireContext() {
        FillContext c = context;
        if (c == null) {
            throw new IllegalStateException("No session started");
        }
        return c;
    }

    private CompletableFuture<SessionSummary> launch(
            List<SourceRow> rows,
            FillSessionConfig config,
            FillProgress saved,
            Path savedFile
    ) {
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (state.getStatus().isActive()) {
            throw new IllegalStateException("A session is already " + state.getStatus());
        }
        if (rows.isEmpty()) {
            throw new ConfigurationException("No source rows to fill");
        }

        config.getAnchorConfig().ifPresent(this::applyAnchorConfig);
        if (mappings.isEmpty()) {
            throw new ConfigurationException("No field mappings; run match() or setMappings() first");
        }

        String keyField = config.keyField().orElse(null);
        ElementFingerprint keyFp = keyField == null ? null : keyFingerprint(keyField, config);
        if (keyFp != null && keyFp.genericRowXPath().isEmpty()) {
            throw new ConfigurationException("Key column '" + keyField + "' has no structural locator");
        }
        if (keyField != null && keyFp == null) {
            log.warning("Key field '" + keyField + "' is not mapped, rows are filled by position");
        }

        FillSessionState fresh = new FillSessionState();
        PaginationController pagination = new PaginationController(handle, settings.pagination(), clock, log);
        config.getNextPageControl().or(() -> Optional.ofNullable(nextControl)).ifPresent(pagination::withNextControl);

        FillContext ctx = new FillContext(
                fresh,
                config,
                rows,
                new LinkedHashMap<>(mappings),
                keyField,
                keyFp,
                handle,
                newEngine(),
                pagination,
                () -> newScanner().scan(handle),
                log,
                progressSink,
                progressManager,
                clock,
                new CancellationToken(),
                new PauseGate()
        );

        if (saved != null) {
            restoreState(fresh, saved, pagination);
        }
        fresh.start(rows.size());
        this.state = fresh;
        this.context = ctx;

        if (progressManager != null) {
            if (saved != null && savedFile != null) {
                progressManager.resumeSession(saved, savedFile);
            } else {
                progressManager.startSession(config.getSourceId(), rows.size(), keyField);
            }
        }

        FillStrategy strategy = keyFp != null ? new AnchorFillStrategy() : new NormalFillStrategy();
        log.info("Session started: " + rows.size() + " row(s), " + mappings.size() + " mapping(s), "
                + strategy.getClass().getSimpleName() + ", " + config);

        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "formweaver-session");
            t.setDaemon(true);
            return t;
        });
        CompletableFuture<SessionSummary> future = CompletableFuture.supplyAsync(() -> runSession(ctx, strategy), worker);
        future.whenComplete((summary, error) -> worker.shutdown());
        return future;
    }

    private SessionSummary runSession(FillContext ctx, FillStrategy strategy) {
        FillSessionState s = ctx.state();
        try {
            strategy.execute(ctx);
            while (ctx.consumePause() && !ctx.token().isCancelled()) {
                ctx.gate().awaitOpen();
                if (ctx.token().isCancelled() || ctx.isFinishRequested()) {
                    break;
                }
                strategy.continueFill(ctx);
            }
            if (ctx.token().isCancelled()) {
                return abortSession(ctx);
            }
            return completeSession(ctx);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warning("Session worker interrupted");
            return abortSession(ctx);
        } catch (RuntimeException e) {
            log.error("Session failed: " + e.getMessage());
            if (s.getStatus().isActive()) {
                abortSession(ctx);
            }
            throw e;
        }
    }

    private SessionSummary completeSession(FillContext ctx) {
        FillSessionState s = ctx.state();
        String keyField = ctx.keyField().orElse(null);
        for (SourceRow row : ctx.rows()) {
            if (s.isProcessed(row.getIndex())) {
                continue;
            }
            String reason = s.skipReason(row.getIndex()).orElse("no destination row reached");
            String anchor = keyField == null ? "" : row.value(keyField);
            ctx.recordSkipped(new FillTask(row.getIndex(), FillTask.NO_DESTINATION, row.getValues(), anchor), reason);
        }
        s.complete();
        if (progressManager != null) {
            progressManager.complete(ctx.cursor());
            progressManager.flush();
        }
        SessionSummary summary = s.summary();
        log.success("Session complete: " + summary);
        return summary;
    }

    private SessionSummary abortSession(FillContext ctx) {
        FillSessionState s = ctx.state();
        s.abort();
        if (progressManager != null) {
            progressManager.abort(ctx.cursor());
            progressManager.flush();
        }
        SessionSummary summary = s.summary();
        log.warning("Session aborted: " + summary);
        return summary;
    }

    /**
     * Rebuilds counters, the processed set and the page position from a saved session.
     */
    static void restoreState(FillSessionState s, FillProgress saved, PaginationController pagination) {
        int page = Math.max(1, saved.getCurrentPage());
        s.setCurrentPage(page);
        pagination.setCurrentPage(page);
        s.setCurrentIndex(saved.getCurrentRow());
        s.setPageStartIndex(saved.getCurrentRow());

        for (FillRecord r : saved.getRecords()) {
            int index = r.getSourceRow() - 1;
            if (r.getStatus() == RecordStatus.SUCCESS) {
                s.recordSuccess(index, 0);
            } else if (r.getStatus() == RecordStatus.FAILED) {
                s.recordError(index, "Row " + r.getSourceRow() + ": " + r.getErrorMessage());
            }
            if (r.getPageNumber() == page && r.getDestinationRow() >= 0) {
                s.setPageStartIndex(index - r.getDestinationRow());
            }
        }
    }

    private void applyAnchorConfig(AnchorConfig anchors) {
        if (!anchors.isFrozen()) {
            anchors.freeze();
        }
        for (Map.Entry<String, String> e : anchors.getFillMappings().entrySet()) {
            if (mappings.containsKey(e.getKey())) {
                continue;
            }
            findByColumn(e.getValue()).ifPresent(fp -> mappings.put(e.getKey(), fp));
        }
    }

    private ElementFingerprint keyFingerprint(String keyField, FillSessionConfig config) {
        ElementFingerprint mapped = mappings.get(keyField);
        if (mapped != null) {
            return mapped;
        }
        Optional<AnchorPair> pair = config.getAnchorConfig()
                .flatMap(AnchorConfig::primary)
                .filter(p -> p.getSourceField().equals(keyField));
        if (pair.isPresent() && !pair.get().getColumnXPath().isBlank()) {
            return ElementFingerprint.builder()
                    .locator(Locator.xpath(pair.get().getColumnXPath()))
                    .label(pair.get().getColumnLabel())
                    .tag("td")
                    .build();
        }
        return null;
    }

    private Optional<ElementFingerprint> findByColumn(String columnLabel) {
        String wanted = TextNormalizer.normalize(columnLabel);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        for (ElementFingerprint fp : lastScan) {
            String header = fp.getTable().map(TableContext::getColumnHeader).orElse("");
            if (wanted.equals(TextNormalizer.normalize(header)) || wanted.equals(TextNormalizer.normalize(fp.getLabel()))) {
                return Optional.of(fp);
            }
        }
        return Optional.empty();
    }

    private FormScanner newScanner() {
        return new FormScanner(settings.scan(), clock, log);
    }

    private SelfHealingFillEngine newEngine() {
        return new SelfHealingFillEngine(handle, settings.fill(), clock, log);
    }

    /**
     * Field names of all rows in first-seen order, the usual input for {@link #match(List)}.
     */
    public static List<String> fieldNames(List<SourceRow> rows) {
        List<String> out = new ArrayList<>();
        for (SourceRow r : rows) {
            for (String f : r.getValues().keySet()) {
                if (!out.contains(f)) {
                    out.add(f);
                }
            }
        }
        return out;
    }
}
