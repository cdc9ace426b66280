package io.hearthwarrio.formweaver.core.anchor;

import io.hearthwarrio.formweaver.core.ConfigurationException;
import io.hearthwarrio.formweaver.core.FakeBrowser;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.Locator;
import io.hearthwarrio.formweaver.core.model.SourceRow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AnchorResolverTest {

    private static final String KEY_XPATH = "//table/tbody/tr/td[1]";

    private final AnchorResolver resolver = new AnchorResolver();
    private final ElementFingerprint keyColumn = ElementFingerprint.builder()
            .locator(Locator.xpath("//table/tbody/tr[1]/td[1]"))
            .tag("td")
            .build();

    private static SourceRow row(int index, String code) {
        return new SourceRow(index, Map.of("Code", code, "Qty", String.valueOf(index + 1)));
    }

    @Test
    void sequentialPairsRowsByPosition() {
        List<SourceRow> rows = List.of(
                new SourceRow(0, Map.of("Name", "Alice", "ID", "001")),
                new SourceRow(1, Map.of("Name", "Bob", "ID", "002"))
        );

        FillQueue queue = resolver.sequential(rows);

        assertEquals(2, queue.size());
        assertEquals(0, queue.get(0).getDestinationIndex());
        assertEquals("Alice", queue.get(0).value("Name"));
        assertEquals("001", queue.get(0).value("ID"));
        assertEquals(1, queue.get(1).getDestinationIndex());
        assertEquals("Bob", queue.get(1).value("Name"));
        assertEquals("002", queue.get(1).value("ID"));
    }

    @Test
    void resolvesKeysAndSkipsMissingOnes() {
        FakeBrowser page = new FakeBrowser().columnValues(KEY_XPATH, List.of("A100", "A101"));

        FillQueue queue = resolver.resolve(List.of(row(0, "A101"), row(1, "A999")), "Code", keyColumn, page);

        assertEquals(2, queue.size());
        FillTask found = queue.get(0);
        assertEquals(0, found.getSourceIndex());
        assertEquals(1, found.getDestinationIndex());
        assertEquals(TaskStatus.PENDING, found.getStatus());

        FillTask missing = queue.get(1);
        assertEquals(1, missing.getSourceIndex());
        assertEquals(TaskStatus.SKIPPED, missing.getStatus());
        assertEquals("A999 not found", missing.getMessage());
    }

    @Test
    void everyRowYieldsExactlyOneTask() {
        FakeBrowser page = new FakeBrowser().columnValues(KEY_XPATH, List.of("K3", "K1", "K2"));
        List<SourceRow> rows = List.of(row(0, "K1"), row(1, ""), row(2, "K2"), row(3, "K9"), row(4, "K3"));

        FillQueue queue = resolver.resolve(rows, "Code", keyColumn, page);

        assertEquals(rows.size(), queue.size());
        assertEquals(3, queue.count(TaskStatus.PENDING));
        assertEquals(2, queue.count(TaskStatus.SKIPPED));
        for (FillTask t : queue.getTasks()) {
            if (t.getStatus() == TaskStatus.SKIPPED) {
                assertFalse(t.getMessage().isBlank());
            }
        }
    }

    @Test
    void resolvedTasksAreOrderedByPageRow() {
        FakeBrowser page = new FakeBrowser().columnValues(KEY_XPATH, List.of("K3", "K1", "K2"));

        FillQueue queue = resolver.resolve(List.of(row(0, "K1"), row(1, "K2"), row(2, "K3")), "Code", keyColumn, page);

        assertEquals(List.of(2, 0, 1), List.of(
                queue.get(0).getSourceIndex(), queue.get(1).getSourceIndex(), queue.get(2).getSourceIndex()));
        assertEquals(0, queue.get(0).getDestinationIndex());
    }

    @Test
    void emptyKeyIsSkippedWithReason() {
        FakeBrowser page = new FakeBrowser().columnValues(KEY_XPATH, List.of("A100"));

        FillTask task = resolver.resolve(List.of(row(0, "  ")), "Code", keyColumn, page).get(0);

        assertEquals(TaskStatus.SKIPPED, task.getStatus());
        assertEquals("empty Code", task.getMessage());
    }

    @Test
    void numericKeysMatchAcrossFormats() {
        FakeBrowser page = new FakeBrowser().columnValues(KEY_XPATH, List.of("99", "100"));

        FillTask task = resolver.resolve(List.of(row(0, "100.0")), "Code", keyColumn, page).get(0);

        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(1, task.getDestinationIndex());
    }

    @Test
    void duplicatePageValuesResolveToFirstRow() {
        assertEquals(Map.of("A", 0, "B", 1), AnchorResolver.indexValues(List.of(" A ", "B", "A", "")));
    }

    @Test
    void keyColumnWithoutXPathIsAConfigurationError() {
        ElementFingerprint byId = ElementFingerprint.builder().locator(Locator.id("code")).build();

        assertThrows(ConfigurationException.class,
                () -> resolver.resolve(List.of(row(0, "A")), "Code", byId, new FakeBrowser()));
    }
}
