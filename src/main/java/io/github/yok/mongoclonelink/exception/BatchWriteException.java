package io.github.yok.mongoclonelink.exception;

import lombok.Getter;

/**
 * Thrown when a bulk upsert reports at least one failed operation.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class BatchWriteException extends ReplicationException {

    private static final long serialVersionUID = 1L;

    // Destination collection of the failed batch
    private final String collectionName;

    // Number of operations the server rejected
    private final int failedCount;

    /**
     * Creates an exception for a failed batch.
     *
     * @param collectionName destination collection
     * @param failedCount number of rejected operations
     * @param cause driver failure
     */
    public BatchWriteException(String collectionName, int failedCount, Throwable cause) {
        super("Bulk upsert into [" + collectionName + "] failed for " + failedCount
                + " operation(s): " + cause.getMessage(), cause);
        this.collectionName = collectionName;
        this.failedCount = failedCount;
    }
}
