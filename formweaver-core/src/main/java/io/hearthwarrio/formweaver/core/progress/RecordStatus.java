package io.hearthwarrio.formweaver.core.progress;

public enum RecordStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
