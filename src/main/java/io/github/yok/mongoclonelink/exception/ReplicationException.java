package io.github.yok.mongoclonelink.exception;

/**
 * Base class of the failures that abort a clone, dump or restore run.
 *
 * <p>
 * The message is what ends up on the {@code ERROR:} progress line, so subclasses build it to be
 * readable without the stack trace.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ReplicationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message failure description
     */
    public ReplicationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and its cause.
     *
     * @param message failure description
     * @param cause root cause
     */
    public ReplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
