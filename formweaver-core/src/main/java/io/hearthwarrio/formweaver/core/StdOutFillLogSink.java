package io.hearthwarrio.formweaver.core;

import java.util.Objects;

/**
 * Default stdout sink.
 * <p>
 * Lines look like {@code [FormWeaver] WARNING Pagination: next button is disabled}.
 * Levels below the configured minimum are dropped.
 */
public final class StdOutFillLogSink implements FillLogSink {

    private final LogLevel minimum;

    public StdOutFillLogSink() {
        this(LogLevel.INFO);
    }

    public StdOutFillLogSink(LogLevel minimum) {
        this.minimum = Objects.requireNonNull(minimum, "minimum must not be null");
    }

    @Override
    public void log(String message, LogLevel level) {
        LogLevel l = level == null ? LogLevel.INFO : level;
        if (l.ordinal() < minimum.ordinal()) {
            return;
        }
        System.out.println(format(message, l));
    }

    static String format(String message, LogLevel level) {
        StringBuilder sb = new StringBuilder(128);
        sb.append("[FormWeaver] ");
        if (level != LogLevel.INFO) {
            sb.append(level).append(' ');
        }
        sb.append(message == null ? "" : message);
        return sb.toString();
    }
}
