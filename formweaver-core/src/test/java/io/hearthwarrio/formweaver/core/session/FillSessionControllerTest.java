package io.hearthwarrio.formweaver.core.session;

import io.hearthwarrio.formweaver.core.ConfigurationException;
import io.hearthwarrio.formweaver.core.FakeBrowser;
import io.hearthwarrio.formweaver.core.FakeClock;
import io.hearthwarrio.formweaver.core.LogLevel;
import io.hearthwarrio.formweaver.core.RecordingLogSink;
import io.hearthwarrio.formweaver.core.fill.FillMode;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.Locator;
import io.hearthwarrio.formweaver.core.model.SourceRow;
import io.hearthwarrio.formweaver.core.model.TableContext;
import io.hearthwarrio.formweaver.core.progress.FillProgress;
import io.hearthwarrio.formweaver.core.progress.FillRecord;
import io.hearthwarrio.formweaver.core.progress.ProgressStatus;
import io.hearthwarrio.formweaver.core.progress.RecordStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class FillSessionControllerTest {

    private static final String KEY_CELL = "//table/tbody/tr[1]/td[1]";
    private static final String KEY_COLUMN = "//table/tbody/tr/td[1]";
    private static final String QTY_CELL = "//table/tbody/tr[1]/td[3]/input";

    private final FakeBrowser browser = new FakeBrowser();
    private final RecordingLogSink log = new RecordingLogSink();
    private final FillSessionController controller = new FillSessionController(browser)
            .withLogSink(log)
            .withClock(new FakeClock());

    private static SourceRow row(int index, String code, String qty) {
        return new SourceRow(index, Map.of("Code", code, "Qty", qty));
    }

    private static List<SourceRow> rows(int n) {
        List<SourceRow> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(new SourceRow(i, Map.of("Qty", String.valueOf(10 + i))));
        }
        return out;
    }

    private static Locator qtyRow(int row) {
        return Locator.xpath("//table/tbody/tr[" + (row + 1) + "]/td[3]/input");
    }

    private static Locator groupMember(int i) {
        return Locator.id("qty" + i);
    }

    /**
     * One logical "Qty" field spread over {@code size} inputs, i.e. a page of {@code size} rows.
     */
    private ElementFingerprint qtyGroup(int size) {
        ElementFingerprint.Builder b = ElementFingerprint.builder().locator(groupMember(0)).label("Qty");
        browser.present(groupMember(0));
        for (int i = 1; i < size; i++) {
            b.sibling(groupMember(i));
            browser.present(groupMember(i));
        }
        return b.build();
    }

    private ElementFingerprint keyCell() {
        return ElementFingerprint.builder().locator(Locator.xpath(KEY_CELL)).tag("td").label("Code").build();
    }

    private ElementFingerprint qtyCell() {
        return ElementFingerprint.builder()
                .locator(Locator.xpath(QTY_CELL))
                .label("Qty")
                .table(new TableContext(0, 2, "items", "Qty"))
                .build();
    }

    private void awaitPaused() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!controller.state().isPaused()) {
            if (System.nanoTime() > deadline) {
                fail("session did not pause: " + controller.state());
            }
            Thread.sleep(10);
        }
    }

    private static SessionSummary done(CompletableFuture<SessionSummary> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void singleRecordKeySessionPausesAfterEachTask() throws Exception {
        browser.columnValues(KEY_COLUMN, List.of("K3", "K1", "K2"))
                .present(qtyRow(0), qtyRow(1), qtyRow(2));
        controller.putMapping("Code", keyCell()).putMapping("Qty", qtyCell());
        List<SourceRow> source = List.of(row(0, "K1", "5"), row(1, "K2", "6"), row(2, "K3", "7"));

        CompletableFuture<SessionSummary> future = controller.start(source, FillSessionConfig.builder()
                .fillMode(FillMode.SINGLE_RECORD)
                .keyField("Code")
                .build());

        awaitPaused();
        assertEquals(1, controller.state().getCurrentIndex());
        assertEquals("task 1 of 3 entered, submit it and continue", controller.state().getPauseReason());
        assertEquals("7", browser.values.get(qtyRow(0)));
        assertFalse(browser.values.containsKey(qtyRow(1)));

        controller.resume();
        awaitPaused();
        assertEquals(2, controller.state().getCurrentIndex());
        assertEquals("5", browser.values.get(qtyRow(1)));

        controller.resume();
        SessionSummary summary = done(future);

        assertEquals(SessionStatus.COMPLETED, summary.getStatus());
        assertEquals(3, summary.getSuccessCount());
        assertEquals("6", browser.values.get(qtyRow(2)));
        assertEquals(0, browser.count("assignValue:xpath:" + KEY_CELL));
    }

    @Test
    void batchManualSessionPausesWhenPageIsFull() throws Exception {
        controller.putMapping("Qty", qtyGroup(5));

        CompletableFuture<SessionSummary> future = controller.start(rows(10), FillSessionConfig.builder()
                .fillMode(FillMode.BATCH_TABLE)
                .paginationMode(PaginationMode.MANUAL)
                .rebindAfterPageTurn(false)
                .build());

        awaitPaused();
        FillSessionState state = controller.state();
        assertEquals(5, state.getCurrentIndex());
        assertTrue(state.isAwaitingPageTurn());
        assertEquals("page 1 is full, turn the page and continue", state.getPauseReason());
        for (int i = 0; i < 5; i++) {
            assertEquals(String.valueOf(10 + i), browser.values.get(groupMember(i)));
        }

        browser.values.clear();
        controller.resume();
        SessionSummary summary = done(future);

        assertEquals(SessionStatus.COMPLETED, summary.getStatus());
        assertEquals(10, summary.getSuccessCount());
        assertEquals(2, summary.getPages());
        for (int i = 0; i < 5; i++) {
            assertEquals(String.valueOf(15 + i), browser.values.get(groupMember(i)));
        }
    }

    @Test
    void batchAutoSessionTurnsPagesItself() throws Exception {
        Locator next = Locator.css("button.next");
        browser.present(next).indicator("1 / 2").onClick(next, b -> b.indicator("2 / 2"));
        controller.putMapping("Qty", qtyGroup(2)).setupPagination(next);

        SessionSummary summary = done(controller.start(rows(3), FillSessionConfig.builder()
                .fillMode(FillMode.BATCH_TABLE)
                .paginationMode(PaginationMode.AUTO)
                .rebindAfterPageTurn(false)
                .build()));

        assertEquals(3, summary.getSuccessCount());
        assertEquals(2, summary.getPages());
        assertEquals("12", browser.values.get(groupMember(0)));
        assertEquals(1, browser.count("click:"));
    }

    @Test
    void missingKeysEndUpSkippedWhenNoPageIsLeft() throws Exception {
        browser.columnValues(KEY_COLUMN, List.of("K1")).present(qtyRow(0));
        controller.putMapping("Code", keyCell()).putMapping("Qty", qtyCell());

        SessionSummary summary = done(controller.start(
                List.of(row(0, "K1", "5"), row(1, "K9", "6")),
                FillSessionConfig.builder()
                        .fillMode(FillMode.BATCH_TABLE)
                        .paginationMode(PaginationMode.AUTO)
                        .keyField("Code")
                        .build()));

        assertEquals(SessionStatus.COMPLETED, summary.getStatus());
        assertEquals(1, summary.getSuccessCount());
        assertEquals(1, summary.getSkippedCount());
        assertTrue(log.contains(LogLevel.WARNING, "Row 2 skipped: K9 not found"));
    }

    @Test
    void batchRowWithoutAnyControlIsNotCountedAsFilled() throws Exception {
        Locator name = Locator.id("name");
        browser.present(name);
        controller.putMapping("Qty", ElementFingerprint.builder().locator(name).label("Qty").build());

        SessionSummary summary = done(controller.start(rows(3), FillSessionConfig.builder()
                .fillMode(FillMode.BATCH_TABLE)
                .paginationMode(PaginationMode.AUTO)
                .rebindAfterPageTurn(false)
                .build()));

        assertEquals(SessionStatus.COMPLETED, summary.getStatus());
        assertEquals(1, browser.count("assignValue:"));
        assertEquals("10", browser.values.get(name));
        assertEquals(1, summary.getSuccessCount());
        assertEquals(2, summary.getSkippedCount());
        assertTrue(log.contains(LogLevel.WARNING, "Row 2 skipped: no destination row reached"));
    }

    @Test
    void pauseWhileRunningFinishesTheCurrentRowFirst() throws Exception {
        controller.putMapping("Qty", qtyGroup(5));
        browser.onAssign(groupMember(1), b -> controller.pause());

        CompletableFuture<SessionSummary> future = controller.start(rows(5), FillSessionConfig.builder()
                .fillMode(FillMode.BATCH_TABLE)
                .build());

        awaitPaused();
        FillSessionState state = controller.state();
        assertEquals(SessionStatus.PAUSED, state.getStatus());
        assertEquals(2, state.getCurrentIndex());
        assertEquals("paused by user", state.getPauseReason());
        assertEquals("11", browser.values.get(groupMember(1)));
        assertFalse(browser.values.containsKey(groupMember(2)));

        controller.resume();
        SessionSummary summary = done(future);

        assertEquals(SessionStatus.COMPLETED, summary.getStatus());
        assertEquals(5, summary.getSuccessCount());
        assertEquals("14", browser.values.get(groupMember(4)));
    }

    @Test
    void abortWhileRunningKeepsRowsFilledSoFar() throws Exception {
        controller.putMapping("Qty", qtyGroup(5));
        browser.onAssign(groupMember(1), b -> controller.abort());

        SessionSummary summary = done(controller.start(rows(5), FillSessionConfig.builder()
                .fillMode(FillMode.BATCH_TABLE)
                .build()));

        assertEquals(SessionStatus.ABORTED, summary.getStatus());
        assertEquals(2, summary.getSuccessCount());
        assertEquals(2, controller.state().getCurrentIndex());
        assertEquals(SessionStatus.ABORTED, controller.state().getStatus());
        assertEquals(2, browser.count("assignValue:"));
        assertFalse(browser.values.containsKey(groupMember(2)));
    }

    @Test
    void abortWhilePausedEndsTheSession() throws Exception {
        controller.putMapping("Qty", qtyGroup(2));
        CompletableFuture<SessionSummary> future = controller.start(rows(4), FillSessionConfig.builder()
                .fillMode(FillMode.BATCH_TABLE)
                .build());

        awaitPaused();
        controller.abort();
        SessionSummary summary = done(future);

        assertEquals(SessionStatus.ABORTED, summary.getStatus());
        assertEquals(2, summary.getSuccessCount());
        assertEquals(SessionStatus.ABORTED, controller.state().getStatus());
    }

    @Test
    void finishWhilePausedSkipsTheRest() throws Exception {
        controller.putMapping("Qty", qtyGroup(2));
        CompletableFuture<SessionSummary> future = controller.start(rows(4), FillSessionConfig.builder()
                .fillMode(FillMode.BATCH_TABLE)
                .build());

        awaitPaused();
        controller.finish();
        SessionSummary summary = done(future);

        assertEquals(SessionStatus.COMPLETED, summary.getStatus());
        assertEquals(2, summary.getSuccessCount());
        assertEquals(2, summary.getSkippedCount());
        assertTrue(log.contains(LogLevel.WARNING, "Row 3 skipped: no destination row reached"));
    }

    @Test
    void secondStartWhileActiveIsRejected() throws Exception {
        controller.putMapping("Qty", qtyGroup(2));
        CompletableFuture<SessionSummary> future = controller.start(rows(4), FillSessionConfig.builder()
                .fillMode(FillMode.BATCH_TABLE)
                .build());
        awaitPaused();

        assertThrows(IllegalStateException.class,
                () -> controller.start(rows(1), FillSessionConfig.builder().build()));

        controller.abort();
        done(future);
    }

    @Test
    void restoredSessionContinuesAtSavedRow() throws Exception {
        Locator qty = Locator.id("qty");
        browser.present(qty);
        controller.putMapping("Qty", ElementFingerprint.builder().locator(qty).label("Qty").build());

        FillProgress saved = new FillProgress();
        saved.setSourceId("orders");
        saved.setTotalRows(3);
        saved.setCurrentRow(2);
        saved.setFilledCount(2);
        saved.setStatus(ProgressStatus.PAUSED);
        saved.setRecords(List.of(
                new FillRecord(1, 1, 0, Map.of("Qty", "10"), RecordStatus.SUCCESS, Instant.EPOCH, "", ""),
                new FillRecord(2, 1, 0, Map.of("Qty", "11"), RecordStatus.SUCCESS, Instant.EPOCH, "", "")
        ));

        SessionSummary summary = done(controller.restore(saved, null, rows(3), FillSessionConfig.builder()
                .fillMode(FillMode.SINGLE_RECORD)
                .build()));

        assertEquals(SessionStatus.COMPLETED, summary.getStatus());
        assertEquals(3, summary.getSuccessCount());
        assertEquals("12", browser.values.get(qty));
        assertEquals(1, browser.count("assignValue:id:qty") + browser.count("clearAndType:id:qty"));
    }

    @Test
    void finishedSessionCannotBeRestored() {
        FillProgress saved = new FillProgress();
        saved.setTotalRows(3);
        saved.setCurrentRow(3);
        saved.setStatus(ProgressStatus.COMPLETED);

        assertThrows(IllegalStateException.class,
                () -> controller.restore(saved, null, rows(3), FillSessionConfig.builder().build()));
    }

    @Test
    void startWithoutRowsIsAConfigurationError() {
        controller.putMapping("Qty", qtyGroup(2));

        assertThrows(ConfigurationException.class,
                () -> controller.start(List.of(), FillSessionConfig.builder().build()));
    }

    @Test
    void startWithoutMappingsIsAConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> controller.start(rows(1), FillSessionConfig.builder().build()));
    }

    @Test
    void keyControlWithoutXPathIsAConfigurationError() {
        controller.putMapping("Code", ElementFingerprint.builder().locator(Locator.id("code")).build())
                .putMapping("Qty", qtyGroup(2));

        assertThrows(ConfigurationException.class, () -> controller.start(
                List.of(row(0, "K1", "1")), FillSessionConfig.builder().keyField("Code").build()));
    }

    @Test
    void unmappedKeyFallsBackToPositionalFilling() throws Exception {
        Locator qty = Locator.id("qty");
        browser.present(qty);
        controller.putMapping("Qty", ElementFingerprint.builder().locator(qty).build());

        SessionSummary summary = done(controller.start(List.of(row(0, "K1", "5")),
                FillSessionConfig.builder().keyField("Code").build()));

        assertEquals(1, summary.getSuccessCount());
        assertTrue(log.contains(LogLevel.WARNING, "Key field 'Code' is not mapped"));
    }

    @Test
    void fieldNamesKeepFirstSeenOrder() {
        List<SourceRow> source = List.of(
                new SourceRow(0, new LinkedHashMap<>(Map.of("A", "1"))),
                new SourceRow(1, new LinkedHashMap<>(Map.of("B", "2"))),
                new SourceRow(2, new LinkedHashMap<>(Map.of("A", "3")))
        );

        assertEquals(List.of("A", "B"), FillSessionController.fieldNames(source));
    }
}
