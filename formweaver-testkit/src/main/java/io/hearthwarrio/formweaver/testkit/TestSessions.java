package io.hearthwarrio.formweaver.testkit;

import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.FormWeaverSettings;
import io.hearthwarrio.formweaver.core.StdOutFillLogSink;
import io.hearthwarrio.formweaver.core.model.SourceRow;
import io.hearthwarrio.formweaver.core.progress.FillProgressManager;
import io.hearthwarrio.formweaver.core.session.FillSessionController;
import io.hearthwarrio.formweaver.webdriver.SeleniumBrowserHandle;
import org.openqa.selenium.WebDriver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Convenience factory methods for creating fill sessions in tests.
 * <p>
 * Keeps test code minimal and consistent.
 * Does not depend on Allure.
 */
public final class TestSessions {

    private TestSessions() {
        // utility class
    }

    /**
     * Creates a controller that logs to stdout and persists nothing.
     */
    public static FillSessionController stdout(WebDriver driver) {
        return withSink(driver, new StdOutFillLogSink());
    }

    /**
     * Creates a controller with the given log sink, for example an Allure one.
     */
    public static FillSessionController withSink(WebDriver driver, FillLogSink sink) {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        return new FillSessionController(new SeleniumBrowserHandle(driver))
                .withSettings(FormWeaverSettings.fromEnvironment())
                .withLogSink(sink);
    }

    /**
     * Creates a stdout controller that writes progress files into {@code progressDir}.
     */
    public static FillSessionController persistent(WebDriver driver, Path progressDir) {
        Objects.requireNonNull(progressDir, "progressDir must not be null");
        FillLogSink sink = new StdOutFillLogSink();
        return withSink(driver, sink)
                .withProgressManager(new FillProgressManager(progressDir, sink));
    }

    /**
     * Builds source rows from a header and value lines, as a spreadsheet would yield them.
     */
    public static List<SourceRow> rows(List<String> header, List<List<String>> lines) {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(lines, "lines must not be null");
        List<SourceRow> out = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            List<String> line = lines.get(i);
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                values.put(header.get(c), c < line.size() ? line.get(c) : "");
            }
            out.add(new SourceRow(i, values));
        }
        return out;
    }
}
