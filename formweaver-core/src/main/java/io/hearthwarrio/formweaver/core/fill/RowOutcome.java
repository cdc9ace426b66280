package io.hearthwarrio.formweaver.core.fill;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of writing all mapped fields of one row.
 * <p>
 * A row fails only when every attempted field failed; otherwise failed fields are partial failures.
 */
public final class RowOutcome {

    private final int attempted;
    private final int filled;
    private final int healed;
    private final Map<String, String> writtenValues;
    private final List<String> failures;

    RowOutcome(int attempted, int filled, int healed, Map<String, String> writtenValues, List<String> failures) {
        this.attempted = attempted;
        this.filled = filled;
        this.healed = healed;
        this.writtenValues = new LinkedHashMap<>(writtenValues);
        this.failures = List.copyOf(failures);
    }

    public int getAttempted() {
        return attempted;
    }

    public int getFilled() {
        return filled;
    }

    public int getHealed() {
        return healed;
    }

    /**
     * Field to value for every field that was written.
     */
    public Map<String, String> getWrittenValues() {
        return writtenValues;
    }

    /**
     * One {@code "field: reason"} line per failed field.
     */
    public List<String> getFailures() {
        return failures;
    }

    public boolean isFailed() {
        return attempted > 0 && filled == 0;
    }

    public boolean isPartial() {
        return filled > 0 && !failures.isEmpty();
    }

    /**
     * In a table, a row where nothing could be written most likely lies past the last rendered row.
     * A legitimately unwritable row produces the same signal.
     */
    public boolean indicatesEndOfTable(FillMode mode) {
        return mode == FillMode.BATCH_TABLE && isFailed();
    }

    public String summary() {
        return filled + "/" + attempted + " fields" + (healed > 0 ? ", " + healed + " healed" : "")
                + (failures.isEmpty() ? "" : " | " + String.join("; ", failures));
    }

    @Override
    public String toString() {
        return "RowOutcome{" + summary() + '}';
    }
}
