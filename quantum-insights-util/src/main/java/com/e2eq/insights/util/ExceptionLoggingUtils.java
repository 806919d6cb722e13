package com.e2eq.insights.util;

import io.quarkus.logging.Log;
import org.jboss.logging.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Consistent exception logging for the insights pipeline. Messages are formatted with
 * {@link String#format} style arguments; the exception message and stack trace are appended.
 */
public class ExceptionLoggingUtils {

    public static void logError(Throwable exception, String message, Object... args) {
        log(Logger.Level.ERROR, exception, message, args);
    }

    public static void logWarn(Throwable exception, String message, Object... args) {
        log(Logger.Level.WARN, exception, message, args);
    }

    public static void logDebug(Throwable exception, String message, Object... args) {
        if (!Log.isDebugEnabled()) {
            return;
        }
        log(Logger.Level.DEBUG, exception, message, args);
    }

    private static void log(Logger.Level level, Throwable exception, String message, Object... args) {
        String text = args.length > 0 ? String.format(message, args) : message;
        if (exception == null) {
            Log.log(level, text);
            return;
        }
        Log.logf(level, "%s: %s%n%s", text, describe(exception), getStackTrace(exception));
    }

    /**
     * The exception message, or its class name when there is no message.
     */
    public static String describe(Throwable exception) {
        if (exception == null) {
            return "";
        }
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }

    /**
     * Message of the innermost cause, used in upstream diagnostics that must not leak wrapper detail.
     */
    public static String rootCauseMessage(Throwable exception) {
        Throwable current = exception;
        while (current != null && current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return describe(current);
    }

    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        exception.printStackTrace(pw);
        return sw.toString();
    }
}
