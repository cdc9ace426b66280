package io.hearthwarrio.formweaver.core;

/**
 * Receives human-readable log lines from scans and fill sessions.
 * <p>
 * Implementations may log to stdout, Allure, a UI console, etc.
 * Session sinks are invoked from the session worker thread.
 */
@FunctionalInterface
public interface FillLogSink {

    /**
     * @param message log line, never null
     * @param level   severity
     */
    void log(String message, LogLevel level);

    default void info(String message) {
        log(message, LogLevel.INFO);
    }

    default void success(String message) {
        log(message, LogLevel.SUCCESS);
    }

    default void warning(String message) {
        log(message, LogLevel.WARNING);
    }

    default void error(String message) {
        log(message, LogLevel.ERROR);
    }

    /**
     * A sink that drops everything.
     */
    static FillLogSink discarding() {
        return (message, level) -> {
        };
    }
}
