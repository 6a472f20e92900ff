package io.github.yok.mongoclonelink;

import io.github.yok.mongoclonelink.config.ConnectionConfig;
import io.github.yok.mongoclonelink.config.PathsConfig;
import io.github.yok.mongoclonelink.config.ReplicationConfig;
import io.github.yok.mongoclonelink.core.AsyncProgressSink;
import io.github.yok.mongoclonelink.core.ReplicationEngine;
import io.github.yok.mongoclonelink.core.ReplicationResult;
import io.github.yok.mongoclonelink.db.MongoConnectionFactory;
import io.github.yok.mongoclonelink.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options and invokes the matching {@link ReplicationEngine} operation.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --clone} or {@code -c} copies the database of {@code --source} into the database of
 * {@code --target}.</li>
 * <li>{@code --dump [dir]} or {@code -d [dir]} writes the database of {@code --source} to
 * {@code dir}. If the directory is omitted, {@code <data-path>/dump} is used.</li>
 * <li>{@code --restore [dir]} or {@code -r [dir]} upserts the dump files of {@code dir} into the
 * database of {@code --target}. If the directory is omitted, {@code <data-path>/dump} is used.</li>
 * <li>{@code --source <id>} / {@code -s <id>} and {@code --target <id>} / {@code -t <id>} name
 * connection entries of {@code connections} in {@code application.yml}.</li>
 * </ul>
 *
 * <p>
 * Progress lines are printed to standard output. The process exit code is the status of the
 * operation: {@code 0} on success, {@code 1} on failure or invalid arguments.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PathsConfig
 * @see ConnectionConfig
 * @see ReplicationConfig
 * @see MongoConnectionFactory
 */
@Slf4j
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
@EnableConfigurationProperties({PathsConfig.class, ConnectionConfig.class,
        ReplicationConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;
    private final ReplicationConfig replicationConfig;
    private final MongoConnectionFactory connectionFactory;

    // Status of the last run, reported as process exit code
    private int exitCode = ReplicationResult.SUCCESS;

    /**
     * Bootstraps the application and exits with the operation status.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * <p>
     * Parses arguments, resolves connection entries and runs clone, dump or restore.
     * </p>
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String mode = null;
        String directory = null;
        String sourceId = null;
        String targetId = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--clone":
                case "-c":
                    mode = "clone";
                    break;
                case "--dump":
                case "-d":
                    mode = "dump";
                    if (hasValue(args, i)) {
                        directory = args[++i];
                    }
                    break;
                case "--restore":
                case "-r":
                    mode = "restore";
                    if (hasValue(args, i)) {
                        directory = args[++i];
                    }
                    break;
                case "--source":
                case "-s":
                    sourceId = hasValue(args, i) ? args[++i].trim() : null;
                    break;
                case "--target":
                case "-t":
                    targetId = hasValue(args, i) ? args[++i].trim() : null;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (mode == null) {
            fail("One of --clone, --dump or --restore is required.");
            return;
        }
        boolean needsSource = !"restore".equals(mode);
        boolean needsTarget = !"dump".equals(mode);
        ConnectionConfig.Entry source = needsSource ? resolve("--source", sourceId) : null;
        ConnectionConfig.Entry target = needsTarget ? resolve("--target", targetId) : null;
        if ((needsSource && source == null) || (needsTarget && target == null)) {
            return;
        }

        log.info("Mode: {}, Source: {}, Target: {}, Directory: {}", mode, sourceId, targetId,
                directory);

        // Execute
        try {
            ReplicationEngine engine = new ReplicationEngine(replicationConfig, connectionFactory);
            ReplicationResult result;
            try (AsyncProgressSink sink = new AsyncProgressSink(System.out::println)) {
                if ("clone".equals(mode)) {
                    result = engine.directClone(source, target, sink);
                } else if ("dump".equals(mode)) {
                    result = engine.dumpToFile(source, resolveDirectory(directory), sink);
                } else {
                    result = engine.restoreFromFile(target, resolveDirectory(directory), sink);
                }
            }
            exitCode = result.getStatus();
            log.info("Mode [{}] finished: status={}, documents={}", mode, result.getStatus(),
                    result.getTotalDocuments());
        } catch (Exception e) {
            exitCode = ErrorHandler.reportFatal("Fatal error: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the status of the last run.
     *
     * @return process exit code
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static boolean hasValue(String[] args, int i) {
        return i + 1 < args.length && !args[i + 1].startsWith("-");
    }

    /**
     * Looks up a connection entry; reports a fatal error if it is missing or unknown.
     *
     * @param option option name used in the error message
     * @param id connection ID from the command line
     * @return entry, or {@code null} if it could not be resolved
     */
    private ConnectionConfig.Entry resolve(String option, String id) {
        if (id == null || id.isEmpty()) {
            fail(option + " <connection-id> is required in this mode.");
            return null;
        }
        ConnectionConfig.Entry entry = connectionConfig.findById(id).orElse(null);
        if (entry == null) {
            fail("Unknown connection id: " + id);
        }
        return entry;
    }

    private Path resolveDirectory(String directory) {
        return Paths.get(directory != null ? directory : pathsConfig.getDump());
    }

    private void fail(String message) {
        exitCode = ErrorHandler.reportFatal(message);
    }
}
