package io.github.yok.mongoclonelink.util;

import io.github.yok.mongoclonelink.core.ReplicationResult;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports errors that end a command-line run before or outside a replication operation.
 *
 * <p>
 * Invalid arguments, unknown connection IDs and unexpected exceptions in {@code Main} end up here.
 * Failures inside clone, dump or restore do not; they are part of the
 * {@link ReplicationResult}.
 * </p>
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error (with stack trace, if a cause is given) using SLF4J.</li>
 * <li>Writes one {@code ERROR:} line to {@code System.err}. Credentials embedded in connection
 * strings are masked.</li>
 * <li>Returns {@link ReplicationResult#FAILURE}, which the caller uses as exit code.</li>
 * <li>In tests, the current thread can be switched to throwing an {@link IllegalStateException}
 * instead.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> THROW_ON_FATAL =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ErrorHandler() {}

    /**
     * Makes {@link #reportFatal} throw on the current thread instead of reporting.
     */
    public static void throwOnFatalForCurrentThread() {
        THROW_ON_FATAL.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting on the current thread.
     */
    public static void resetForCurrentThread() {
        THROW_ON_FATAL.remove();
    }

    /**
     * Reports a fatal error without a cause.
     *
     * @param message error message
     * @return {@link ReplicationResult#FAILURE}
     * @throws IllegalStateException if throwing is enabled for the current thread
     */
    public static int reportFatal(String message) {
        String masked = MaskingLogUtil.maskUri(message);
        log.error(masked);
        if (Boolean.TRUE.equals(THROW_ON_FATAL.get())) {
            throw new IllegalStateException(masked);
        }
        System.err.println("ERROR: " + masked);
        return ReplicationResult.FAILURE;
    }

    /**
     * Reports a fatal error caused by an exception.
     *
     * <p>
     * The stack trace goes to the log only; {@code System.err} gets the root cause message.
     * </p>
     *
     * @param message error message
     * @param cause root cause
     * @return {@link ReplicationResult#FAILURE}
     * @throws IllegalStateException if throwing is enabled for the current thread
     */
    public static int reportFatal(String message, Throwable cause) {
        String masked = MaskingLogUtil.maskUri(message);
        log.error(masked, cause);
        if (Boolean.TRUE.equals(THROW_ON_FATAL.get())) {
            throw new IllegalStateException(masked, cause);
        }
        System.err.println("ERROR: " + masked);
        System.err.println("  cause: "
                + MaskingLogUtil.maskUri(ExceptionUtils.getRootCauseMessage(cause)));
        return ReplicationResult.FAILURE;
    }
}
