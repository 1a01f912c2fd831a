package io.github.yok.flexpanel.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal batch failures: logs them through SLF4J and echoes a one-line summary to
 * {@code System.err}.
 *
 * <p>
 * The handler never terminates the JVM; the caller decides the exit status. Tests can switch the
 * current thread to "throw instead of report" with {@link #disableExitForCurrentThread()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Makes {@code errorAndExit} throw {@link IllegalStateException} on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores reporting behavior on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports a fatal failure together with its root cause.
     *
     * @param message summary of what failed
     * @param cause failure raised by the pipeline
     */
    public static void errorAndExit(String message, Throwable cause) {
        Throwable root = ExceptionUtils.getRootCause(cause);
        log.error("{} ({}: {})", message, cause.getClass().getSimpleName(), cause.getMessage(),
                cause);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + System.lineSeparator() + "  caused by "
                + ExceptionUtils.getMessage(root == null ? cause : root));
    }

    /**
     * Reports a fatal failure that has no underlying exception.
     *
     * @param message summary of what failed
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
