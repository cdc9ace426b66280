package io.hearthwarrio.formweaver.core.progress;

public enum ProgressStatus {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    ABORTED
}
