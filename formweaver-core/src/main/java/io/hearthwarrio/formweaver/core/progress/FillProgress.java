package io.hearthwarrio.formweaver.core.progress;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Session summary plus the append-only list of row records, as persisted.
 * <p>
 * Plain mutable bean for Jackson; {@link FillProgressManager} guards all access.
 */
public class FillProgress {

    private String sourceId = "";
    private int totalRows;
    private int currentRow;
    private int filledCount;
    private int failedCount;
    private int skippedCount;
    private int currentPage = 1;
    private String anchorField = "";
    private ProgressStatus status = ProgressStatus.IDLE;
    private Instant startedAt;
    private Instant updatedAt;
    private List<FillRecord> records = new ArrayList<>();

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId == null ? "" : sourceId;
    }

    public int getTotalRows() {
        return totalRows;
    }

    public void setTotalRows(int totalRows) {
        this.totalRows = totalRows;
    }

    /**
     * Cursor: number of source rows handled so far, which is also the index of the next row.
     */
    public int getCurrentRow() {
        return currentRow;
    }

    public void setCurrentRow(int currentRow) {
        this.currentRow = currentRow;
    }

    public int getFilledCount() {
        return filledCount;
    }

    public void setFilledCount(int filledCount) {
        this.filledCount = filledCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public void setFailedCount(int failedCount) {
        this.failedCount = failedCount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    public void setSkippedCount(int skippedCount) {
        this.skippedCount = skippedCount;
    }

    public int getCurrentPage() {
        return currentPage;
    }

    public void setCurrentPage(int currentPage) {
        this.currentPage = currentPage;
    }

    public String getAnchorField() {
        return anchorField;
    }

    public void setAnchorField(String anchorField) {
        this.anchorField = anchorField == null ? "" : anchorField;
    }

    public ProgressStatus getStatus() {
        return status;
    }

    public void setStatus(ProgressStatus status) {
        this.status = status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public List<FillRecord> getRecords() {
        return records;
    }

    public void setRecords(List<FillRecord> records) {
        this.records = records == null ? new ArrayList<>() : new ArrayList<>(records);
    }

    @JsonIgnore
    public boolean isResumable() {
        return (status == ProgressStatus.PAUSED || status == ProgressStatus.RUNNING) && currentRow < totalRows;
    }

    /**
     * Copy detached from the live instance, for serialization off the session thread.
     */
    FillProgress copy() {
        FillProgress c = new FillProgress();
        c.sourceId = sourceId;
        c.totalRows = totalRows;
        c.currentRow = currentRow;
        c.filledCount = filledCount;
        c.failedCount = failedCount;
        c.skippedCount = skippedCount;
        c.currentPage = currentPage;
        c.anchorField = anchorField;
        c.status = status;
        c.startedAt = startedAt;
        c.updatedAt = updatedAt;
        c.records = new ArrayList<>(records);
        return c;
    }
}
