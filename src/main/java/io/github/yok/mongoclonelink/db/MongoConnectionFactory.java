package io.github.yok.mongoclonelink.db;

import com.google.common.base.Preconditions;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import io.github.yok.mongoclonelink.config.ConnectionConfig;
import io.github.yok.mongoclonelink.config.ReplicationConfig;
import io.github.yok.mongoclonelink.exception.ConnectionFailedException;
import io.github.yok.mongoclonelink.util.MaskingLogUtil;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Factory class that resolves a {@link ConnectionConfig.Entry} into an open
 * {@link MongoDatabaseHandle}.
 *
 * <p>
 * Opening is fail-fast: the driver connects lazily, so the factory sends a {@code ping} to the
 * target database before returning. Any failure (invalid connection string, unreachable server,
 * authentication error) is converted into a {@link ConnectionFailedException}; there is no retry.
 * </p>
 *
 * <p>
 * When {@link ReplicationConfig#isNormalizeUri()} is enabled the connection string is passed
 * through {@link ConnectionStringNormalizer} first.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class MongoConnectionFactory {

    private final ReplicationConfig replicationConfig;

    // Creates the driver client; replaceable in tests
    private final Function<MongoClientSettings, MongoClient> clientCreator;

    /**
     * Creates a factory that builds clients with {@link MongoClients#create(MongoClientSettings)}.
     *
     * @param replicationConfig replication settings
     */
    @Autowired
    public MongoConnectionFactory(ReplicationConfig replicationConfig) {
        this(replicationConfig, MongoClients::create);
    }

    /**
     * Creates a factory with a custom client creator.
     *
     * @param replicationConfig replication settings
     * @param clientCreator function that creates a client from settings
     */
    MongoConnectionFactory(ReplicationConfig replicationConfig,
            Function<MongoClientSettings, MongoClient> clientCreator) {
        this.replicationConfig = replicationConfig;
        this.clientCreator = clientCreator;
    }

    /**
     * Opens the database described by the connection entry.
     *
     * @param entry connection entry (URI, database name, timeout)
     * @return open handle; the caller must close it
     * @throws ConnectionFailedException if the database cannot be reached
     */
    public MongoDatabaseHandle open(ConnectionConfig.Entry entry) {
        Preconditions.checkNotNull(entry, "entry must not be null");
        String uri = entry.getUri();
        if (uri != null && replicationConfig.isNormalizeUri()) {
            uri = ConnectionStringNormalizer.normalize(uri);
        }

        MongoClient client = null;
        try {
            MongoClientSettings settings = buildSettings(uri, entry);
            client = clientCreator.apply(settings);
            MongoDatabase database = client.getDatabase(entry.getDatabase());
            database.runCommand(new Document("ping", 1));
            log.info("[{}] Connected ({})", entry.getId(), MaskingLogUtil.maskConnection(entry));
            return new MongoDatabaseHandle(entry.getId(), client, database);
        } catch (MongoException | IllegalArgumentException e) {
            if (client != null) {
                client.close();
            }
            log.error("[{}] Connection failed ({})", entry.getId(),
                    MaskingLogUtil.maskConnection(entry), e);
            throw new ConnectionFailedException(entry.getId(), e);
        }
    }

    /**
     * Builds the driver settings for one entry.
     *
     * @param uri connection string after normalization
     * @param entry connection entry
     * @return driver settings
     * @throws IllegalArgumentException if the connection string or timeout is invalid
     */
    private MongoClientSettings buildSettings(String uri, ConnectionConfig.Entry entry) {
        Preconditions.checkArgument(uri != null && !uri.isBlank(),
                "connections[].uri must not be blank");
        Preconditions.checkArgument(entry.getServerSelectionTimeoutMs() >= 0,
                "server-selection-timeout-ms must not be negative");
        return MongoClientSettings.builder().applyConnectionString(new ConnectionString(uri))
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(
                        entry.getServerSelectionTimeoutMs(), TimeUnit.MILLISECONDS))
                .build();
    }
}
