package com.botscript.common.logging;

import java.util.Locale;
import java.util.Map;

/**
 * Log levels with the numeric scale used by instance and bot log settings.
 *
 * <pre>
 * level | what gets logged
 * 0     | nothing
 * 1     | errors only
 * 2     | errors and warnings
 * 3     | errors, warnings, information
 * 4..9  | debug output
 * 10+   | most verbose
 * </pre>
 */
public enum LogLevel {
    SILENT,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    /** Highest accepted numeric level. */
    public static final int MAX_NUMERIC = 11;

    private static final Map<String, LogLevel> ALIASES = Map.of(
            "silent", SILENT,
            "error", ERROR,
            "warn", WARN,
            "warning", WARN,
            "info", INFO,
            "debug", DEBUG,
            "trace", TRACE);

    /**
     * Normalize an arbitrary string to a LogLevel, falling back to the given
     * default.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        LogLevel resolved = ALIASES.get(level.trim().toLowerCase(Locale.ROOT));
        return resolved != null ? resolved : fallback;
    }

    /**
     * Map a numeric level (0..11) to the most verbose level it enables.
     */
    public static LogLevel fromNumeric(int level) {
        if (level <= 0)
            return SILENT;
        return switch (level) {
            case 1 -> ERROR;
            case 2 -> WARN;
            case 3 -> INFO;
            default -> level >= 10 ? TRACE : DEBUG;
        };
    }

    /**
     * Whether a numeric level is inside the accepted range.
     */
    public static boolean isValidNumeric(int level) {
        return level >= 0 && level <= MAX_NUMERIC;
    }

    /**
     * Numeric priority (lower = more severe). Silent sorts last.
     */
    public int priority() {
        return switch (this) {
            case ERROR -> 1;
            case WARN -> 2;
            case INFO -> 3;
            case DEBUG -> 4;
            case TRACE -> 5;
            case SILENT -> Integer.MAX_VALUE;
        };
    }

    /**
     * Check if this level is enabled given a configured minimum level.
     * A message at level X is enabled if X.priority() <= minLevel.priority().
     */
    public boolean isEnabledFor(LogLevel minLevel) {
        if (minLevel == SILENT || this == SILENT) {
            return false;
        }
        return this.priority() <= minLevel.priority();
    }
}
