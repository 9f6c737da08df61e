package io.github.yok.toonlink.util;

import io.github.yok.toonlink.parser.ToonParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * Used by the command-line runner, which reports a failed conversion and ends instead of
 * retrying.
 * </p>
 *
 * <ul>
 * <li>Logs the error using SLF4J, with the full stack trace of the cause.</li>
 * <li>Writes a concise message to {@code System.err}; a {@link ToonParseException} cause is shown
 * with its reason and, when known, its line number.</li>
 * <li>Does not terminate the JVM by itself.</li>
 * <li>In tests, callers can switch to throwing an exception via a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the given message and cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + describe(cause));
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    /**
     * Builds the one-line description of a cause shown to the user.
     *
     * @param cause failure cause
     * @return concise description
     */
    static String describe(Throwable cause) {
        Throwable root = ExceptionUtils.getRootCause(cause);
        if (root instanceof ToonParseException) {
            ToonParseException tpe = (ToonParseException) root;
            String where = tpe.getLineNumber() > 0 ? " (line " + tpe.getLineNumber() + ")" : "";
            return tpe.getReason() + where + ": " + tpe.getMessage();
        }
        return root == null ? String.valueOf(cause) : root.getMessage();
    }
}
