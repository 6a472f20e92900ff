package io.github.yok.mongoclonelink.db;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonDocument;

/**
 * Open connection to one database, as returned by {@link MongoConnectionFactory}.
 *
 * <p>
 * The handle owns its {@link MongoClient}; closing the handle closes the client. Collections are
 * always accessed with {@link BsonDocument} as document class so that every value keeps its exact
 * BSON type on the way through.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class MongoDatabaseHandle implements AutoCloseable {

    // Logical ID of the connection entry this handle was opened for
    private final String connectionId;

    private final MongoClient client;

    private final MongoDatabase database;

    /**
     * Returns the database name.
     *
     * @return database name
     */
    public String getDatabaseName() {
        return database.getName();
    }

    /**
     * Returns a collection of this database with {@link BsonDocument} as document class.
     *
     * @param name collection name
     * @return collection
     */
    public MongoCollection<BsonDocument> collection(String name) {
        return database.getCollection(name, BsonDocument.class);
    }

    @Override
    public void close() {
        client.close();
        log.debug("[{}] Connection closed", connectionId);
    }
}
