package io.github.yok.mongoclonelink.exception;

/**
 * Thrown when a connection entry cannot be resolved into a reachable database.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConnectionFailedException extends ReplicationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception for the given connection.
     *
     * @param connectionId logical connection ID
     * @param cause driver failure
     */
    public ConnectionFailedException(String connectionId, Throwable cause) {
        super("Failed to connect (connection=" + connectionId + "): " + cause.getMessage(), cause);
    }
}
