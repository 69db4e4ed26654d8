package net.deckadvisor.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Helpers for logging recoverable failures with their cause attached as the trailing argument.
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.error(message, withCause(args, throwable));
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.warn(message, withCause(args, throwable));
    }

    /**
     * Logs at WARN with only the cause's message, and the full stack trace at DEBUG.
     * Used for expected transient failures (timeouts, rate limits) that would flood the log.
     */
    public static void warnBrief(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        Object[] briefArgs = Arrays.copyOf(args == null ? new Object[0] : args, (args == null ? 0 : args.length) + 1);
        briefArgs[briefArgs.length - 1] = describe(throwable);
        logger.warn(message + " ({})", briefArgs);
        if (throwable != null && logger.isDebugEnabled()) {
            logger.debug(message, withCause(args, throwable));
        }
    }

    /**
     * Returns the most specific message available for a failure chain.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown cause";
        }
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        String type = current.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }

    private static Object[] withCause(Object[] args, Throwable throwable) {
        Object[] base = args == null ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] finalArgs = Arrays.copyOf(base, base.length + 1);
        finalArgs[finalArgs.length - 1] = throwable;
        return finalArgs;
    }
}
