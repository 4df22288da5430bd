package net.eventposters.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Lightweight helpers for consistent logging of warnings and errors with optional causes.
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, LogLevel.ERROR, throwable, message, args);
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, LogLevel.WARN, throwable, message, args);
    }

    private static void log(Logger logger, LogLevel level, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }

        Object[] finalArgs = appendCause(args, throwable);
        switch (level) {
            case ERROR -> logger.error(message, finalArgs);
            case WARN -> logger.warn(message, finalArgs);
        }
    }

    private static Object[] appendCause(Object[] args, Throwable throwable) {
        Object[] base = (args == null) ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] withCause = Arrays.copyOf(base, base.length + 1);
        withCause[withCause.length - 1] = throwable;
        return withCause;
    }

    private enum LogLevel {
        ERROR,
        WARN
    }
}
