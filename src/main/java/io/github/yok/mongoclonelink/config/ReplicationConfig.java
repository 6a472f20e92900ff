package io.github.yok.mongoclonelink.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds settings shared by clone, dump and restore.
 *
 * <p>
 * You can specify the following properties in {@code application.yml} or
 * {@code application.properties}.
 * </p>
 * <ul>
 * <li>{@code replication.batch-size}: number of upserts sent per bulk write (default 1000)</li>
 * <li>{@code replication.normalize-uri}: repair a stray {@code .} before the port in connection
 * strings (default {@code true})</li>
 * <li>{@code replication.continue-on-error}: keep processing the remaining collections after a
 * collection fails (default {@code false})</li>
 * <li>{@code replication.exclude-collections}: collection names that are never transferred</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "replication")
@Getter
@Setter
@NoArgsConstructor
public class ReplicationConfig {

    /**
     * Default number of upserts per bulk write.
     */
    public static final int DEFAULT_BATCH_SIZE = 1000;

    /**
     * Maximum number of pending upserts before a bulk write is sent.
     */
    private int batchSize = DEFAULT_BATCH_SIZE;

    /**
     * Whether the {@code ".:"} typo in connection strings is repaired before connecting.
     */
    private boolean normalizeUri = true;

    /**
     * Whether a failed collection is skipped instead of aborting the whole run.
     */
    private boolean continueOnError = false;

    /**
     * List of collection names to exclude from every operation.
     */
    private List<String> excludeCollections = ImmutableList.of();
}
