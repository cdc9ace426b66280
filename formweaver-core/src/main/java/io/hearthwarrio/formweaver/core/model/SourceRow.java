package io.hearthwarrio.formweaver.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One already-tabulated source record.
 */
public final class SourceRow {

    private final int index;
    private final Map<String, String> values;

    /**
     * @param index  0-based position in the source
     * @param values field name to cell value, in source column order
     */
    public SourceRow(int index, Map<String, String> values) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        Objects.requireNonNull(values, "values must not be null");
        this.index = index;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int getIndex() {
        return index;
    }

    public Map<String, String> getValues() {
        return values;
    }

    /**
     * @return cell value, or an empty string when the field is absent
     */
    public String value(String field) {
        String v = values.get(field);
        return v == null ? "" : v;
    }

    @Override
    public String toString() {
        return "SourceRow{" + index + ", " + values + '}';
    }
}
