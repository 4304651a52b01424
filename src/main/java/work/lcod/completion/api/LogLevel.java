package work.lcod.completion.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the runner and the CLI.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    static final String SIMPLE_LOGGER_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Value understood by {@code org.slf4j.simpleLogger.defaultLogLevel}.
     */
    public String simpleLoggerLevel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Sets the default threshold of the simple logger binding. Only effective before the first logger is created.
     */
    public void applyToSimpleLogger() {
        System.setProperty(SIMPLE_LOGGER_PROPERTY, simpleLoggerLevel());
    }
}
