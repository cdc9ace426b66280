package io.hearthwarrio.formweaver.core.progress;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Durable outcome of one processed source row.
 */
public final class FillRecord {

    private final int sourceRow;
    private final int pageNumber;
    private final int destinationRow;
    private final Map<String, String> fieldValues;
    private final RecordStatus status;
    private final Instant timestamp;
    private final String errorMessage;
    private final String anchorValue;

    /**
     * @param sourceRow      1-based source row number
     * @param pageNumber     1-based destination page
     * @param destinationRow 0-based destination row on that page, -1 when none
     */
    @JsonCreator
    public FillRecord(
            @JsonProperty("sourceRow") int sourceRow,
            @JsonProperty("pageNumber") int pageNumber,
            @JsonProperty("destinationRow") int destinationRow,
            @JsonProperty("fieldValues") Map<String, String> fieldValues,
            @JsonProperty("status") RecordStatus status,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("errorMessage") String errorMessage,
            @JsonProperty("anchorValue") String anchorValue
    ) {
        this.sourceRow = sourceRow;
        this.pageNumber = pageNumber;
        this.destinationRow = destinationRow;
        this.fieldValues = fieldValues == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fieldValues));
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        this.errorMessage = errorMessage == null ? "" : errorMessage;
        this.anchorValue = anchorValue == null ? "" : anchorValue;
    }

    public int getSourceRow() {
        return sourceRow;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public int getDestinationRow() {
        return destinationRow;
    }

    public Map<String, String> getFieldValues() {
        return fieldValues;
    }

    public RecordStatus getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getAnchorValue() {
        return anchorValue;
    }

    @Override
    public String toString() {
        return "FillRecord{" +
                "row=" + sourceRow +
                ", page=" + pageNumber +
                ", destination=" + destinationRow +
                ", status=" + status +
                (anchorValue.isEmpty() ? "" : ", anchor='" + anchorValue + '\'') +
                (errorMessage.isEmpty() ? "" : ", error='" + errorMessage + '\'') +
                '}';
    }
}
