package io.github.yok.mongoclonelink.config;

import java.util.List;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that manages MongoDB connection settings loaded from
 * {@code application.yml}.<br>
 * Each entry binds a logical ID to a connection string and a database name.
 *
 * <pre>
 * connections:
 *   - id: source
 *     uri: mongodb://localhost:27017
 *     database: source_db
 *     server-selection-timeout-ms: 30000
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections;

    /**
     * Looks up a connection entry by its logical ID.
     *
     * @param id logical connection ID
     * @return matching entry, or empty if no entry has the given ID
     */
    public Optional<Entry> findById(String id) {
        if (connections == null || id == null) {
            return Optional.empty();
        }
        return connections.stream().filter(entry -> id.equals(entry.getId())).findFirst();
    }

    /**
     * Inner class that holds one MongoDB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the connection (e.g., "source")
        private String id;
        // MongoDB connection string (e.g., mongodb://localhost:27017)
        private String uri;
        // Database name within the deployment
        private String database;
        // How long the driver waits for a reachable server before giving up
        private long serverSelectionTimeoutMs = 30_000L;
    }
}
