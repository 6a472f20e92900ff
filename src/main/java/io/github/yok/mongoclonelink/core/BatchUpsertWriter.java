package io.github.yok.mongoclonelink.core;

import com.google.common.base.Preconditions;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.ReplaceOneModel;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.WriteModel;
import io.github.yok.mongoclonelink.exception.BatchWriteException;
import io.github.yok.mongoclonelink.exception.DocumentDecodeException;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonDocument;
import org.bson.BsonValue;

/**
 * Accumulates upserts for one destination collection and sends them as unordered bulk writes.
 *
 * <p>
 * Every document becomes a {@code replaceOne({_id: <id>}, document, upsert=true)}, so applying the
 * same document again leaves the destination unchanged. Once the number of pending upserts reaches
 * the batch size, they are flushed as one bulk write with {@code ordered=false}: a failing
 * operation does not stop the others in the same batch, but the batch as a whole fails with a
 * {@link BatchWriteException}.
 * </p>
 *
 * <p>
 * Instances are single-use and not thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BatchUpsertWriter {

    // Name of the identity field used as upsert key
    static final String ID_FIELD = "_id";

    private static final BulkWriteOptions UNORDERED = new BulkWriteOptions().ordered(false);

    private static final ReplaceOptions UPSERT = new ReplaceOptions().upsert(true);

    @Getter
    private final String collectionName;

    private final MongoCollection<BsonDocument> collection;

    private final int batchSize;

    private final ProgressSink progress;

    private List<WriteModel<BsonDocument>> pending;

    // Documents flushed so far
    @Getter
    private long total;

    // Bulk writes sent so far
    @Getter
    private int flushCount;

    /**
     * Creates a writer.
     *
     * @param collectionName destination collection name (used in progress lines)
     * @param collection destination collection
     * @param batchSize maximum number of pending upserts
     * @param progress receiver of progress lines
     * @throws IllegalArgumentException if {@code batchSize} is not positive
     */
    public BatchUpsertWriter(String collectionName, MongoCollection<BsonDocument> collection,
            int batchSize, ProgressSink progress) {
        Preconditions.checkArgument(batchSize > 0, "batch size must be positive: %s", batchSize);
        this.collectionName = Preconditions.checkNotNull(collectionName);
        this.collection = Preconditions.checkNotNull(collection);
        this.batchSize = batchSize;
        this.progress = (progress == null) ? ProgressSink.noop() : progress;
        this.pending = new ArrayList<>();
    }

    /**
     * Queues an upsert of the document; flushes when the batch is full.
     *
     * @param document document to upsert
     * @throws DocumentDecodeException if the document has no {@code _id}
     * @throws BatchWriteException if the triggered flush fails
     */
    public void add(BsonDocument document) {
        BsonValue id = document.get(ID_FIELD);
        if (id == null) {
            throw new DocumentDecodeException(
                    "Document without " + ID_FIELD + " cannot be upserted into [" + collectionName
                            + "]");
        }
        pending.add(new ReplaceOneModel<>(new BsonDocument(ID_FIELD, id), document, UPSERT));
        if (pending.size() >= batchSize) {
            flush();
        }
    }

    /**
     * Sends all pending upserts as one unordered bulk write. Does nothing if nothing is pending.
     *
     * @throws BatchWriteException if the server rejected at least one operation
     */
    public void flush() {
        if (pending.isEmpty()) {
            return;
        }
        int size = pending.size();
        try {
            BulkWriteResult result = collection.bulkWrite(pending, UNORDERED);
            if (result != null && result.wasAcknowledged()) {
                log.debug("[{}] Bulk write: matched={}, modified={}, upserted={}", collectionName,
                        result.getMatchedCount(), result.getModifiedCount(),
                        result.getUpserts().size());
            }
        } catch (MongoBulkWriteException e) {
            throw new BatchWriteException(collectionName, e.getWriteErrors().size(), e);
        }
        pending = new ArrayList<>();
        total += size;
        flushCount++;
        progress.accept("  [" + collectionName + "] Processed " + total
                + " documents (upserts)...");
    }

    /**
     * Flushes the remainder and reports the collection as finished.
     *
     * @return total number of documents written
     * @throws BatchWriteException if the final flush fails
     */
    public long finish() {
        flush();
        progress.accept("  Finished " + collectionName + " with " + total + " documents.");
        return total;
    }

    /**
     * Returns the number of upserts waiting for the next flush.
     *
     * @return pending count
     */
    public int getPendingCount() {
        return pending.size();
    }
}
