package work.lcod.state.api;

import java.util.Locale;

/**
 * Diagnostic threshold of the command line tool. Comparison trace lines are printed at
 * {@link #DEBUG} and {@link #TRACE}.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return FATAL;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public boolean printsTrace() {
        return this == TRACE || this == DEBUG;
    }
}
