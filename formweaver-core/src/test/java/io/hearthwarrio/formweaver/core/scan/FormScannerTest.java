package io.hearthwarrio.formweaver.core.scan;

import io.hearthwarrio.formweaver.core.FakeBrowser;
import io.hearthwarrio.formweaver.core.FakeClock;
import io.hearthwarrio.formweaver.core.LogLevel;
import io.hearthwarrio.formweaver.core.ProbeException;
import io.hearthwarrio.formweaver.core.RecordingLogSink;
import io.hearthwarrio.formweaver.core.browser.FrameDescriptor;
import io.hearthwarrio.formweaver.core.browser.ProbeResult;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static io.hearthwarrio.formweaver.core.scan.PageScannerTest.controls;
import static org.junit.jupiter.api.Assertions.*;

public class FormScannerTest {

    private final RecordingLogSink log = new RecordingLogSink();
    private final ScanSettings settings = ScanSettings.builder()
            .maxWait(Duration.ofSeconds(2))
            .pollInterval(Duration.ofMillis(500))
            .stableThreshold(1)
            .build();
    private final FormScanner scanner = new FormScanner(settings, new FakeClock(), log);

    @Test
    void combinesTopDocumentAndFrames() {
        FakeBrowser browser = new FakeBrowser()
                .controls(controls(2))
                .frames(List.of(), new FrameDescriptor(0, "/entry", 400, 400))
                .frameControls(List.of(0), controls(3));

        List<ElementFingerprint> found = scanner.scan(browser);

        assertEquals(5, found.size());
        assertEquals(0, browser.count("probeControlsFallback"));
        assertTrue(log.contains(LogLevel.INFO, "5 controls"));
    }

    @Test
    void emptyTopDocumentStillScansFrames() {
        FakeBrowser browser = new FakeBrowser()
                .probes(ProbeResult.of(List.of()))
                .frames(List.of(), new FrameDescriptor(0, "/entry", 400, 400))
                .frameControls(List.of(0), controls(1));

        assertEquals(1, scanner.scan(browser).size());
        assertEquals(0, browser.count("probeControlsFallback"));
    }

    @Test
    void fallsBackWhenNothingIsFound() {
        FakeBrowser browser = new FakeBrowser()
                .probes(ProbeResult.loading())
                .fallback(controls(2));

        List<ElementFingerprint> found = scanner.scan(browser);

        assertEquals(2, found.size());
        assertTrue(log.contains(LogLevel.WARNING, "simplified scan"));
    }

    @Test
    void fallsBackWhenProbeFails() {
        FakeBrowser browser = new FakeBrowser()
                .failProbesWith(new ProbeException("script error"))
                .fallback(controls(1));

        assertEquals(1, scanner.scan(browser).size());
        assertTrue(log.contains(LogLevel.ERROR, "script error"));
    }
}
