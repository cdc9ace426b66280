package io.hearthwarrio.formweaver.allure;

import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.session.SessionSummary;
import io.qameta.allure.Allure;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Factory methods for Allure-related FormWeaver sinks.
 * <p>
 * This class lives in the formweaver-allure module to avoid leaking Allure
 * dependencies into formweaver-core or formweaver-webdriver.
 */
public final class FormWeaverAllureLoggers {

    private FormWeaverAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure sink without screenshots.
     */
    public static FillLogSink steps() {
        return new AllureFillLogSink(null, false);
    }

    /**
     * Creates an Allure sink that attaches a screenshot after every error.
     */
    public static FillLogSink steps(WebDriver driver) {
        return new AllureFillLogSink(Objects.requireNonNull(driver, "driver must not be null"), true);
    }

    /**
     * Attaches the final counters and error list of a session to the running test.
     */
    public static void attachSummary(SessionSummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        byte[] txt = describe(summary).getBytes(StandardCharsets.UTF_8);
        Allure.addAttachment("Fill summary", "text/plain", new ByteArrayInputStream(txt), ".txt");
    }

    static String describe(SessionSummary summary) {
        StringBuilder sb = new StringBuilder(256);
        sb.append(summary).append('\n');
        for (String error : summary.getErrors()) {
            sb.append("error: ").append(error).append('\n');
        }
        return sb.toString();
    }
}
