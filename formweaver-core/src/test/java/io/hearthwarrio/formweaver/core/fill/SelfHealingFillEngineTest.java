package io.hearthwarrio.formweaver.core.fill;

import io.hearthwarrio.formweaver.core.FailureKind;
import io.hearthwarrio.formweaver.core.FakeBrowser;
import io.hearthwarrio.formweaver.core.FakeClock;
import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.anchor.FillTask;
import io.hearthwarrio.formweaver.core.browser.BrowserHandle;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.FrameContext;
import io.hearthwarrio.formweaver.core.model.Locator;
import io.hearthwarrio.formweaver.core.model.TableContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class SelfHealingFillEngineTest {

    private final FakeBrowser browser = new FakeBrowser();
    private final SelfHealingFillEngine engine =
            new SelfHealingFillEngine(browser, FillSettings.defaults(), new FakeClock(), FillLogSink.discarding());

    @Test
    void writesThroughBestLocator() {
        Locator id = Locator.id("name");
        browser.present(id);
        ElementFingerprint fp = ElementFingerprint.builder().locator(id).label("Name").build();

        FieldOutcome outcome = engine.fillField(fp, "Alice", 0, FillMode.SINGLE_RECORD);

        assertEquals(FieldOutcome.Status.FILLED, outcome.getStatus());
        assertEquals("Alice", browser.values.get(id));
    }

    @Test
    void unreachableControlFailsTheSameWayTwice() {
        BrowserHandle handle = mock(BrowserHandle.class);
        when(handle.isPresent(any(), any())).thenReturn(false);
        when(handle.locateNearText(any(), anyInt())).thenReturn(Optional.empty());
        SelfHealingFillEngine mocked =
                new SelfHealingFillEngine(handle, FillSettings.defaults(), new FakeClock(), FillLogSink.discarding());
        ElementFingerprint fp = ElementFingerprint.builder().locator(Locator.id("gone")).build();

        FieldOutcome first = mocked.fillField(fp, "x", 0, FillMode.BATCH_TABLE);
        FieldOutcome second = mocked.fillField(fp, "x", 0, FillMode.BATCH_TABLE);

        assertFalse(first.isFilled());
        assertFalse(second.isFilled());
        assertEquals(FailureKind.ELEMENT_NOT_FOUND, first.getFailure().orElseThrow());
        assertEquals(first.getMessage(), second.getMessage());
        verify(handle, times(2)).isPresent(Locator.id("gone"), Duration.ofMillis(300));
        verify(handle, never()).clearAndType(any(), any());
    }

    @Test
    void fallsBackToAlternativeLocator() {
        Locator css = Locator.css("input[name='email']");
        browser.present(css);
        ElementFingerprint fp = ElementFingerprint.builder()
                .locator(Locator.id("email-old"))
                .locator(css)
                .build();

        FieldOutcome outcome = engine.fillField(fp, "a@b.c", 0, FillMode.BATCH_TABLE);

        assertEquals(FieldOutcome.Status.FILLED_BY_FALLBACK, outcome.getStatus());
        assertEquals(css, outcome.getLocator().orElseThrow());
        assertEquals("a@b.c", browser.values.get(css));
    }

    @Test
    void healsByLabelInSingleRecordMode() {
        Locator relocated = Locator.xpath("//form/div[3]/input");
        browser.present(relocated).nearText("Phone", relocated);
        ElementFingerprint fp = ElementFingerprint.builder().locator(Locator.id("phone")).label("Phone").build();

        FieldOutcome outcome = engine.fillField(fp, "555", 0, FillMode.SINGLE_RECORD);

        assertTrue(outcome.isHealed());
        assertEquals("555", browser.values.get(relocated));
    }

    @Test
    void neverHealsInBatchMode() {
        Locator relocated = Locator.xpath("//form/div[3]/input");
        browser.present(relocated).nearText("Phone", relocated);
        ElementFingerprint fp = ElementFingerprint.builder().locator(Locator.id("phone")).label("Phone").build();

        FieldOutcome outcome = engine.fillField(fp, "555", 0, FillMode.BATCH_TABLE);

        assertFalse(outcome.isFilled());
        assertEquals(0, browser.count("locateNearText"));
    }

    @Test
    void tableRowOffsetTargetsThatRow() {
        Locator row3 = Locator.xpath("//table/tbody/tr[3]/td[2]/input");
        browser.present(row3);
        ElementFingerprint fp = ElementFingerprint.builder()
                .locator(Locator.xpath("//table/tbody/tr[1]/td[2]/input"))
                .table(new TableContext(0, 1, "", "Qty"))
                .build();

        FieldOutcome outcome = engine.fillField(fp, "7", 2, FillMode.BATCH_TABLE);

        assertEquals(FieldOutcome.Status.FILLED, outcome.getStatus());
        assertEquals("7", browser.values.get(row3));
    }

    @Test
    void groupOffsetSelectsSiblingAndRunsOutOfTargets() {
        ElementFingerprint fp = ElementFingerprint.builder()
                .locator(Locator.xpath("(//input[@class='qty'])[1]"))
                .sibling(Locator.xpath("(//input[@class='qty'])[2]"))
                .build();

        assertEquals(fp.getSiblings().get(0), SelfHealingFillEngine.resolveTarget(fp, 1, FillMode.BATCH_TABLE).orElseThrow());
        assertTrue(SelfHealingFillEngine.resolveTarget(fp, 2, FillMode.BATCH_TABLE).isEmpty());
        assertEquals(FieldOutcome.Status.NO_TARGET, engine.fillField(fp, "1", 2, FillMode.BATCH_TABLE).getStatus());
    }

    @Test
    void plainControlHasTargetOnlyForFirstBatchRow() {
        ElementFingerprint fp = ElementFingerprint.builder().locator(Locator.id("note")).build();

        assertTrue(SelfHealingFillEngine.resolveTarget(fp, 0, FillMode.BATCH_TABLE).isPresent());
        assertTrue(SelfHealingFillEngine.resolveTarget(fp, 1, FillMode.BATCH_TABLE).isEmpty());
        assertTrue(SelfHealingFillEngine.resolveTarget(fp, 1, FillMode.SINGLE_RECORD).isPresent());
    }

    @Test
    void unreachableFrameIsReportedAndHandleReturnsToTop() {
        browser.unreachable(List.of(1));
        ElementFingerprint fp = ElementFingerprint.builder()
                .locator(Locator.id("x"))
                .frame(FrameContext.of(List.of(1)))
                .build();

        FieldOutcome outcome = engine.fillField(fp, "v", 0, FillMode.SINGLE_RECORD);

        assertEquals(FailureKind.FRAME_UNREACHABLE, outcome.getFailure().orElseThrow());
        assertTrue(browser.getCurrentFrame().isEmpty());
    }

    @Test
    void writesInsideFrameThenLeavesIt() {
        Locator id = Locator.id("x");
        browser.present(id);
        ElementFingerprint fp = ElementFingerprint.builder()
                .locator(id)
                .frame(FrameContext.of(List.of(0, 1)))
                .build();

        assertTrue(engine.fillField(fp, "v", 0, FillMode.SINGLE_RECORD).isFilled());
        assertEquals(1, browser.count("enterFrame:[0, 1]"));
        assertTrue(browser.getCurrentFrame().isEmpty());
    }

    @Test
    void dateValuesAreNormalized() {
        Locator id = Locator.id("due");
        browser.present(id);
        ElementFingerprint fp = ElementFingerprint.builder().locator(id).type("date").build();

        engine.fillField(fp, " 2024/05/01 ", 0, FillMode.SINGLE_RECORD);

        assertEquals("2024-05-01", browser.values.get(id));
    }

    @Test
    void rowFailsOnlyWhenEveryFieldFailed() {
        Locator name = Locator.id("name");
        browser.present(name);
        Map<String, ElementFingerprint> mappings = new LinkedHashMap<>();
        mappings.put("Name", ElementFingerprint.builder().locator(name).build());
        mappings.put("City", ElementFingerprint.builder().locator(Locator.id("city")).build());
        mappings.put("Code", ElementFingerprint.builder().locator(Locator.id("code")).build());
        FillTask task = new FillTask(0, 0, Map.of("Name", "Alice", "City", "Oslo", "Code", "K1", "Blank", ""), "K1");

        RowOutcome partial = engine.fillRow(task, mappings, "Code", 0, FillMode.BATCH_TABLE);

        assertEquals(2, partial.getAttempted());
        assertEquals(1, partial.getFilled());
        assertTrue(partial.isPartial());
        assertFalse(partial.isFailed());
        assertFalse(partial.indicatesEndOfTable(FillMode.BATCH_TABLE));
        assertEquals(0, browser.count("isPresent:id:code"));

        browser.remove(name);
        RowOutcome failed = engine.fillRow(task, mappings, "Code", 0, FillMode.BATCH_TABLE);
        assertTrue(failed.isFailed());
        assertTrue(failed.indicatesEndOfTable(FillMode.BATCH_TABLE));
    }

    @Test
    void rowWithValuesButNoControlForItsOffsetFails() {
        Locator note = Locator.id("note");
        Locator qty2 = Locator.xpath("//table/tbody/tr[2]/td[2]/input");
        browser.present(note, qty2);
        Map<String, ElementFingerprint> mappings = new LinkedHashMap<>();
        mappings.put("Note", ElementFingerprint.builder().locator(note).build());
        FillTask task = new FillTask(1, 1, Map.of("Note", "late", "Qty", "3"), "");

        RowOutcome unreachable = engine.fillRow(task, mappings, null, 1, FillMode.BATCH_TABLE);

        assertEquals(1, unreachable.getAttempted());
        assertEquals(0, unreachable.getFilled());
        assertTrue(unreachable.isFailed());
        assertTrue(unreachable.indicatesEndOfTable(FillMode.BATCH_TABLE));
        assertEquals(0, browser.count("assignValue:"));

        mappings.put("Qty", ElementFingerprint.builder()
                .locator(Locator.xpath("//table/tbody/tr[1]/td[2]/input"))
                .table(new TableContext(0, 1, "", "Qty"))
                .build());
        RowOutcome mixed = engine.fillRow(task, mappings, null, 1, FillMode.BATCH_TABLE);

        assertEquals(1, mixed.getAttempted());
        assertEquals(1, mixed.getFilled());
        assertFalse(mixed.isFailed());
        assertEquals("3", browser.values.get(qty2));
    }

    @Test
    void quietPageWaitsForOverlay() {
        browser.loading(true, true, false);

        assertTrue(engine.awaitQuietPage());
    }
}
