package io.hearthwarrio.formweaver.examples;

import io.hearthwarrio.formweaver.core.anchor.AnchorConfig;
import io.hearthwarrio.formweaver.core.fill.FillMode;
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
import org.openqa.selenium.WebDriver;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyedStockFillIT {
    private WebDriver driver;

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.quit();
        }
    }

    @Test
    void anchorFill_findsRowsByCode() throws Exception {
        driver = TestDrivers.headlessChrome();
        driver.get(Pages.url("keyed-stock.html"));

        FillSessionController controller = TestSessions.stdout(driver);
        List<SourceRow> rows = TestSessions.rows(
                List.of("Code", "Counted"),
                List.of(
                        List.of("C-100", "10"),
                        List.of("C-200", "20"),
                        List.of("C-300", "30"),
                        List.of("C-900", "90")
                )
        );

        controller.scan();
        AnchorConfig anchors = controller.autoMatchAnchors(FillSessionController.fieldNames(rows));
        assertTrue(anchors.primary().isPresent(), "Code should be picked as the anchor");
        assertEquals("Code", anchors.primary().get().getSourceField());

        SessionSummary summary = controller.start(rows, FillSessionConfig.builder()
                        .fillMode(FillMode.BATCH_TABLE)
                        .paginationMode(PaginationMode.AUTO)
                        .anchorConfig(anchors)
                        .build())
                .get(60, TimeUnit.SECONDS);

        assertEquals(SessionStatus.COMPLETED, summary.getStatus());
        assertEquals(3, summary.getSuccessCount());
        assertEquals(1, summary.getSkippedCount());

        assertEquals("30", counted(1));
        assertEquals("10", counted(2));
        assertEquals("20", counted(3));
    }

    private String counted(int row) {
        return driver.findElement(By.xpath("//table[@id='stock']/tbody/tr[" + row + "]/td[3]/input")).getAttribute("value");
    }
}
