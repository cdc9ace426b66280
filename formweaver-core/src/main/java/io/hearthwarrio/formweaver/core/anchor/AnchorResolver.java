package io.hearthwarrio.formweaver.core.anchor;

import io.hearthwarrio.formweaver.core.ConfigurationException;
import io.hearthwarrio.formweaver.core.browser.DomProbe;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.SourceRow;
import io.hearthwarrio.formweaver.core.progress.AnchorValues;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns source rows into an ordered {@link FillQueue}.
 * <p>
 * Sequential mode pairs rows by position. Anchor mode reads the key column of every page row and pairs each
 * source row with the page row showing the same key. Every source row yields exactly one task; rows whose
 * key is not on the page become {@link TaskStatus#SKIPPED} tasks with a reason.
 */
public final class AnchorResolver {

    /**
     * One task per row, destination index equal to the row's position in {@code rows}.
     */
    public FillQueue sequential(List<SourceRow> rows) {
        Objects.requireNonNull(rows, "rows must not be null");
        List<FillTask> tasks = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            SourceRow row = rows.get(i);
            tasks.add(new FillTask(row.getIndex(), i, row.getValues(), ""));
        }
        return new FillQueue(tasks);
    }

    /**
     * Resolves rows against the key column currently shown on the page.
     * <p>
     * Resolved tasks come first, ordered by destination row; skipped tasks follow in source order.
     *
     * @param keyField       source field holding the key
     * @param keyFingerprint control of the key column, with a structural XPath
     * @throws ConfigurationException when the key control has no structural XPath
     */
    public FillQueue resolve(List<SourceRow> rows, String keyField, ElementFingerprint keyFingerprint, DomProbe probe) {
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(keyField, "keyField must not be null");
        Objects.requireNonNull(keyFingerprint, "keyFingerprint must not be null");
        Objects.requireNonNull(probe, "probe must not be null");

        String columnXPath = keyFingerprint.genericRowXPath()
                .orElseThrow(() -> new ConfigurationException(
                        "Key column '" + keyField + "' has no structural locator"));

        Map<String, Integer> pageRows = indexValues(probe.readColumnValues(columnXPath));

        List<FillTask> resolved = new ArrayList<>();
        List<FillTask> skipped = new ArrayList<>();
        for (SourceRow row : rows) {
            String key = row.value(keyField).trim();
            if (key.isEmpty()) {
                skipped.add(FillTask.skipped(row.getIndex(), row.getValues(), key, "empty " + keyField));
                continue;
            }
            Integer destination = lookup(pageRows, key);
            if (destination == null) {
                skipped.add(FillTask.skipped(row.getIndex(), row.getValues(), key, key + " not found"));
            } else {
                resolved.add(new FillTask(row.getIndex(), destination, row.getValues(), key));
            }
        }

        resolved.sort(Comparator.comparingInt(FillTask::getDestinationIndex));
        List<FillTask> all = new ArrayList<>(resolved);
        all.addAll(skipped);
        return new FillQueue(all);
    }

    /**
     * Page value to row index; on duplicate values the first row wins.
     */
    static Map<String, Integer> indexValues(List<String> values) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            String v = values.get(i) == null ? "" : values.get(i).trim();
            if (!v.isEmpty()) {
                out.putIfAbsent(v, i);
            }
        }
        return out;
    }

    private static Integer lookup(Map<String, Integer> pageRows, String key) {
        Integer exact = pageRows.get(key);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, Integer> e : pageRows.entrySet()) {
            if (AnchorValues.matches(e.getKey(), key)) {
                return e.getValue();
            }
        }
        return null;
    }
}
