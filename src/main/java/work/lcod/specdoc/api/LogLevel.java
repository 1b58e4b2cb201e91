package work.lcod.specdoc.api;

import java.util.Locale;

/**
 * Generator log thresholds. {@link #FATAL} silences logging entirely.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("off");

    static final String SIMPLE_LOGGER_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    private final String simpleLoggerName;

    LogLevel(String simpleLoggerName) {
        this.simpleLoggerName = simpleLoggerName;
    }

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
     * Sets the default threshold of the simple logger binding. Only effective before the first
     * logger is created, so the command line calls it before touching the generator.
     */
    public void install() {
        System.setProperty(SIMPLE_LOGGER_PROPERTY, simpleLoggerName);
    }

    public String simpleLoggerName() {
        return simpleLoggerName;
    }
}
