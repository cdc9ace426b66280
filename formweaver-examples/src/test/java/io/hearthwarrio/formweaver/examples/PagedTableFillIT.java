package io.hearthwarrio.formweaver.examples;

import io.hearthwarrio.formweaver.allure.FormWeaverAllureLoggers;
import io.hearthwarrio.formweaver.core.fill.FillMode;
import io.hearthwarrio.formweaver.core.match.MatchResult;
import io.hearthwarrio.formweaver.core.model.Locator;
import io.hearthwarrio.formweaver.core.model.SourceRow;
import io.hearthwarrio.formweaver.core.session.FillSessionConfig;
import io.hearthwarrio.formweaver.core.session.FillSessionController;
import io.hearthwarrio.formweaver.core.session.PaginationMode;
import io.hearthwarrio.formweaver.core.session.SessionStatus;
import io.hearthwarrio.formweaver.core.session.SessionSummary;
import io.hearthwarrio.formweaver.testkit.TestDrivers;
import io.hearthwarrio.formweaver.testkit.TestSessions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PagedTableFillIT {
    private WebDriver driver;

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.quit();
        }
    }

    @Test
    void batchFill_turnsPagesAutomatically() throws Exception {
        driver = TestDrivers.headlessChrome();
        driver.get(Pages.url("paged-orders.html"));

        FillSessionController controller = TestSessions.withSink(driver, FormWeaverAllureLoggers.steps(driver));
        List<SourceRow> rows = TestSessions.rows(
                List.of("Qty"),
                List.of(List.of("1"), List.of("2"), List.of("3"), List.of("4"), List.of("5"), List.of("6"), List.of("7"))
        );

        MatchResult match = controller.match(FillSessionController.fieldNames(rows));
        assertEquals(1, match.getMatchedCount(), "Qty column should be matched");
        controller.applyMatch(match).setupPagination(Locator.id("next-page"));

        SessionSummary summary = controller.start(rows, FillSessionConfig.builder()
                        .fillMode(FillMode.BATCH_TABLE)
                        .paginationMode(PaginationMode.AUTO)
                        .sourceId("orders.xlsx")
                        .build())
                .get(60, TimeUnit.SECONDS);
        FormWeaverAllureLoggers.attachSummary(summary);

        assertEquals(SessionStatus.COMPLETED, summary.getStatus());
        assertEquals(7, summary.getSuccessCount());
        assertEquals(2, summary.getPages());

        Object firstPage = ((JavascriptExecutor) driver).executeScript("return window.saved[1];");
        assertEquals(List.of("1", "2", "3", "4", "5"), firstPage);
        assertEquals(List.of("6", "7", "", "", ""), currentValues());
    }

    private List<String> currentValues() {
        List<String> out = new ArrayList<>();
        for (WebElement input : driver.findElements(By.cssSelector("#lines tbody input"))) {
            out.add(input.getAttribute("value"));
        }
        return out;
    }
}
