package io.hearthwarrio.formweaver.allure;

import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.LogLevel;
import io.qameta.allure.Allure;
import io.qameta.allure.model.Status;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reports scan and fill log lines as Allure steps.
 * <p>
 * Lives in formweaver-allure to avoid leaking Allure dependency into core/webdriver.
 * Warnings become broken steps and errors become failed steps. With screenshots enabled, each error
 * is followed by a page screenshot attached to the running test.
 */
public final class AllureFillLogSink implements FillLogSink {

    private final WebDriver driver;
    private final boolean screenshotOnError;

    /**
     * @param driver            driver used for screenshots; may be null when screenshots are not wanted
     * @param screenshotOnError attach a screenshot to every error step
     */
    public AllureFillLogSink(WebDriver driver, boolean screenshotOnError) {
        this.driver = driver;
        this.screenshotOnError = screenshotOnError && driver != null;
    }

    @Override
    public void log(String message, LogLevel level) {
        LogLevel l = level == null ? LogLevel.INFO : level;
        String title = "FormWeaver: " + safe(message);

        Allure.step(title, statusOf(l));
        if (l == LogLevel.ERROR && screenshotOnError) {
            attachScreenshot();
        }
    }

    static Status statusOf(LogLevel level) {
        switch (level) {
            case WARNING:
                return Status.BROKEN;
            case ERROR:
                return Status.FAILED;
            default:
                return Status.PASSED;
        }
    }

    boolean screenshotsEnabled() {
        return screenshotOnError;
    }

    void attachScreenshot() {
        if (!(driver instanceof TakesScreenshot ts)) {
            return;
        }
        try {
            byte[] png = ts.getScreenshotAs(OutputType.BYTES);
            Allure.addAttachment("Screenshot", "image/png", new ByteArrayInputStream(png), ".png");
        } catch (WebDriverException e) {
            byte[] txt = ("Screenshot unavailable: " + e.getClass().getSimpleName()).getBytes(StandardCharsets.UTF_8);
            Allure.addAttachment("Screenshot", "text/plain", new ByteArrayInputStream(txt), ".txt");
        }
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
