package io.hearthwarrio.formweaver.core;

public enum LogLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
