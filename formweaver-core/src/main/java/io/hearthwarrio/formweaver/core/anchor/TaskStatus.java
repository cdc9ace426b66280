package io.hearthwarrio.formweaver.core.anchor;

public enum TaskStatus {
    PENDING,
    SUCCESS,
    ERROR,
    SKIPPED
}
