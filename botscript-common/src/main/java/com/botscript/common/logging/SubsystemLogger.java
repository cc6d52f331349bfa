package com.botscript.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Logger bound to a slash-separated subsystem path such as
 * {@code instance/main/greeter}. Each path maps onto its own SLF4J logger
 * ({@code botscript.instance.main.greeter}) and is published in the MDC under
 * {@code subsystem} while a line is written.
 *
 * <p>
 * Script loggers carry a threshold supplier read on every call, so a level
 * change on a running instance takes effect for the next line.
 */
public final class SubsystemLogger {

    private static final String MDC_KEY = "subsystem";

    private static volatile List<String> filters = List.of();

    private final String subsystem;
    private final Logger delegate;
    private final Supplier<LogLevel> threshold;

    private SubsystemLogger(String subsystem, Supplier<LogLevel> threshold) {
        this.subsystem = Objects.requireNonNull(subsystem, "subsystem");
        this.threshold = threshold;
        this.delegate = LoggerFactory.getLogger("botscript." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem, null);
    }

    /** Logger for {@code subsystem/name}, sharing this logger's threshold. */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name, threshold);
    }

    public SubsystemLogger withThreshold(Supplier<LogLevel> threshold) {
        return new SubsystemLogger(subsystem, threshold);
    }

    public void debug(String message) {
        log(LogLevel.DEBUG, message, null, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        log(LogLevel.DEBUG, message, meta, null);
    }

    public void info(String message) {
        log(LogLevel.INFO, message, null, null);
    }

    public void info(String message, Map<String, Object> meta) {
        log(LogLevel.INFO, message, meta, null);
    }

    public void warn(String message) {
        log(LogLevel.WARN, message, null, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        log(LogLevel.WARN, message, meta, null);
    }

    public void error(String message) {
        log(LogLevel.ERROR, message, null, null);
    }

    public void error(String message, Throwable cause) {
        log(LogLevel.ERROR, message, null, cause);
    }

    /**
     * Restrict output to the given subsystem prefixes. A prefix matches itself
     * and anything below it. No arguments removes the restriction.
     */
    public static void setSubsystemFilter(String... prefixes) {
        filters = prefixes == null ? List.of()
                : Stream.of(prefixes)
                        .filter(Objects::nonNull)
                        .map(String::trim)
                        .filter(p -> !p.isEmpty())
                        .collect(Collectors.toUnmodifiableList());
    }

    public boolean shouldLog() {
        List<String> active = filters;
        if (active.isEmpty()) {
            return true;
        }
        for (String prefix : active) {
            if (subsystem.equals(prefix) || subsystem.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    public boolean isEnabled(LogLevel level) {
        if (!shouldLog()) {
            return false;
        }
        if (threshold == null) {
            return true;
        }
        LogLevel min = threshold.get();
        return min != null && level.isEnabledFor(min);
    }

    public String getSubsystem() {
        return subsystem;
    }

    public Logger getSlf4jLogger() {
        return delegate;
    }

    private void log(LogLevel level, String message, Map<String, Object> meta, Throwable cause) {
        if (!isEnabled(level)) {
            return;
        }
        String line = formatMessage(message, meta);
        MDC.put(MDC_KEY, subsystem);
        try {
            switch (level) {
                case DEBUG -> delegate.debug(line);
                case WARN -> delegate.warn(line);
                case ERROR -> delegate.error(line, cause);
                default -> delegate.info(line);
            }
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    String formatMessage(String message, Map<String, Object> meta) {
        String head = "[" + subsystem + "] " + message;
        if (meta == null || meta.isEmpty()) {
            return head;
        }
        return meta.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", head + " {", "}"));
    }
}
