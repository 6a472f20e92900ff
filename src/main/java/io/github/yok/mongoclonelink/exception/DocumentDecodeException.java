package io.github.yok.mongoclonelink.exception;

/**
 * Thrown when one dump line cannot be turned back into a document.
 *
 * @author Yasuharu.Okawauchi
 */
public class DocumentDecodeException extends ReplicationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message failure description
     */
    public DocumentDecodeException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and its cause.
     *
     * @param message failure description
     * @param cause parser failure
     */
    public DocumentDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
