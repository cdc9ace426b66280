package io.hearthwarrio.formweaver.core.anchor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One source row bound to its destination row.
 * <p>
 * Tasks are created once by {@link AnchorResolver} and reused for the whole session; only their status and
 * message change as they are executed.
 */
public final class FillTask {

    /**
     * Destination index of a task whose row could not be located on the page.
     */
    public static final int NO_DESTINATION = -1;

    private final int sourceIndex;
    private final int destinationIndex;
    private final Map<String, String> values;
    private final String anchorValue;
    private TaskStatus status;
    private String message;

    public FillTask(int sourceIndex, int destinationIndex, Map<String, String> values, String anchorValue) {
        this.sourceIndex = sourceIndex;
        this.destinationIndex = destinationIndex;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values must not be null")));
        this.anchorValue = anchorValue == null ? "" : anchorValue;
        this.status = destinationIndex == NO_DESTINATION ? TaskStatus.SKIPPED : TaskStatus.PENDING;
        this.message = "";
    }

    static FillTask skipped(int sourceIndex, Map<String, String> values, String anchorValue, String reason) {
        FillTask task = new FillTask(sourceIndex, NO_DESTINATION, values, anchorValue);
        task.message = reason;
        return task;
    }

    public int getSourceIndex() {
        return sourceIndex;
    }

    public int getDestinationIndex() {
        return destinationIndex;
    }

    public Map<String, String> getValues() {
        return values;
    }

    public String value(String field) {
        String v = values.get(field);
        return v == null ? "" : v;
    }

    public String getAnchorValue() {
        return anchorValue;
    }

    public synchronized TaskStatus getStatus() {
        return status;
    }

    public synchronized String getMessage() {
        return message;
    }

    public boolean isPending() {
        return getStatus() == TaskStatus.PENDING;
    }

    public synchronized void markSuccess(String message) {
        this.status = TaskStatus.SUCCESS;
        this.message = message == null ? "" : message;
    }

    public synchronized void markError(String message) {
        this.status = TaskStatus.ERROR;
        this.message = message == null ? "" : message;
    }

    public synchronized void markSkipped(String reason) {
        this.status = TaskStatus.SKIPPED;
        this.message = reason == null ? "" : reason;
    }

    @Override
    public synchronized String toString() {
        return "FillTask{" +
                "source=" + sourceIndex +
                ", destination=" + destinationIndex +
                ", anchor='" + anchorValue + '\'' +
                ", status=" + status +
                (message.isEmpty() ? "" : ", message='" + message + '\'') +
                '}';
    }
}
