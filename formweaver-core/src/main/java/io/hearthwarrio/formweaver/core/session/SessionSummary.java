package io.hearthwarrio.formweaver.core.session;

import java.util.List;

/**
 * Final counters of a session.
 */
public final class SessionSummary {

    private final SessionStatus status;
    private final int totalRows;
    private final int successCount;
    private final int errorCount;
    private final int skippedCount;
    private final int healedCount;
    private final int pages;
    private final List<String> errors;

    public SessionSummary(
            SessionStatus status,
            int totalRows,
            int successCount,
            int errorCount,
            int skippedCount,
            int healedCount,
            int pages,
            List<String> errors
    ) {
        this.status = status;
        this.totalRows = totalRows;
        this.successCount = successCount;
        this.errorCount = errorCount;
        this.skippedCount = skippedCount;
        this.healedCount = healedCount;
        this.pages = pages;
        this.errors = List.copyOf(errors);
    }

    public SessionStatus getStatus() {
        return status;
    }

    public int getTotalRows() {
        return totalRows;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    public int getHealedCount() {
        return healedCount;
    }

    public int getPages() {
        return pages;
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return status + ": " + successCount + " filled, " + errorCount + " failed, " + skippedCount
                + " skipped of " + totalRows + " rows across " + pages + " page(s)"
                + (healedCount > 0 ? ", " + healedCount + " field(s) healed" : "");
    }
}
