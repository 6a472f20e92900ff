package io.github.yok.mongoclonelink.core;

import com.mongodb.client.MongoCursor;
import io.github.yok.mongoclonelink.codec.ExtendedJsonCodec;
import io.github.yok.mongoclonelink.config.ConnectionConfig;
import io.github.yok.mongoclonelink.config.ReplicationConfig;
import io.github.yok.mongoclonelink.db.MongoConnectionFactory;
import io.github.yok.mongoclonelink.db.MongoDatabaseHandle;
import io.github.yok.mongoclonelink.exception.DocumentDecodeException;
import io.github.yok.mongoclonelink.exception.InvalidDumpPathException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.bson.BsonDocument;

/**
 * Core class that copies the collections of one database to another database or to dump files and
 * back.
 *
 * <p>
 * <strong>Operations:</strong>
 * </p>
 * <ul>
 * <li>{@link #directClone}: server to server; every source document is upserted into the
 * same-named destination collection.</li>
 * <li>{@link #dumpToFile}: writes {@code <collection>.json} per collection, one canonical Extended
 * JSON document per line.</li>
 * <li>{@link #restoreFromFile}: upserts every line of every dump file into the collection named
 * after the file.</li>
 * </ul>
 *
 * <p>
 * Collections are streamed one at a time: exactly one cursor or file is open, documents are never
 * collected beyond the current batch, and the cursor or file is closed before the next collection
 * starts. Writes are upserts keyed by {@code _id}, so every operation can simply be run again after
 * a failure or interruption.
 * </p>
 *
 * <p>
 * Each operation has one error boundary. The first failure is emitted as an {@code ERROR:} line and
 * ends the run with {@link ReplicationResult#FAILURE}; collections written before the failure stay
 * in the destination. With {@code replication.continue-on-error} a failing collection is reported
 * and skipped instead, and the run still ends with {@link ReplicationResult#FAILURE}.
 * </p>
 *
 * <p>
 * The engine keeps no per-run state in fields; concurrent invocations are independent.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ReplicationEngine {

    private final ReplicationConfig replicationConfig;

    private final MongoConnectionFactory connectionFactory;

    private final ExtendedJsonCodec codec;

    private final CollectionEnumerator enumerator;

    /**
     * Creates an engine with the default codec.
     *
     * @param replicationConfig replication settings
     * @param connectionFactory resolves connection entries into open databases
     */
    public ReplicationEngine(ReplicationConfig replicationConfig,
            MongoConnectionFactory connectionFactory) {
        this(replicationConfig, connectionFactory, new ExtendedJsonCodec());
    }

    /**
     * Creates an engine with a custom codec.
     *
     * @param replicationConfig replication settings
     * @param connectionFactory resolves connection entries into open databases
     * @param codec line codec for dump files
     */
    ReplicationEngine(ReplicationConfig replicationConfig,
            MongoConnectionFactory connectionFactory, ExtendedJsonCodec codec) {
        this.replicationConfig = replicationConfig;
        this.connectionFactory = connectionFactory;
        this.codec = codec;
        this.enumerator = new CollectionEnumerator(replicationConfig.getExcludeCollections());
    }

    /**
     * Copies every non-system collection of the source database into the destination database.
     *
     * @param source source connection entry
     * @param destination destination connection entry
     * @param sink receiver of progress lines; may be {@code null}
     * @return outcome of the run
     */
    public ReplicationResult directClone(ConnectionConfig.Entry source,
            ConnectionConfig.Entry destination, ProgressSink sink) {
        ProgressRecorder progress = new ProgressRecorder(sink);
        try (MongoDatabaseHandle src = connectionFactory.open(source);
                MongoDatabaseHandle dst = connectionFactory.open(destination)) {
            progress.emit("Starting direct clone from " + src.getDatabaseName() + " to "
                    + dst.getDatabaseName());

            for (String name : enumerator.listCollections(src.getDatabase())) {
                runCollection(progress, () -> cloneCollection(src, dst, name, progress));
            }
            complete(progress, "Direct clone");
        } catch (RuntimeException e) {
            progress.fail(e);
        }
        logCollectionSummary("clone", progress.getCounts());
        return progress.toResult();
    }

    /**
     * Writes every non-system collection of the source database to {@code <collection>.json} files.
     *
     * <p>
     * The output directory is created if missing; existing dump files of the same collections are
     * truncated.
     * </p>
     *
     * @param source source connection entry
     * @param outputDir directory that receives the dump files
     * @param sink receiver of progress lines; may be {@code null}
     * @return outcome of the run
     */
    public ReplicationResult dumpToFile(ConnectionConfig.Entry source, Path outputDir,
            ProgressSink sink) {
        ProgressRecorder progress = new ProgressRecorder(sink);
        try (MongoDatabaseHandle src = connectionFactory.open(source)) {
            progress.emit("Dumping database " + src.getDatabaseName() + " to " + outputDir);
            ensureDirectoryExists(outputDir);

            for (String name : enumerator.listCollections(src.getDatabase())) {
                runCollection(progress, () -> dumpCollection(src, name, outputDir, progress));
            }
            complete(progress, "Dump");
        } catch (RuntimeException e) {
            progress.fail(e);
        }
        logCollectionSummary("dump", progress.getCounts());
        return progress.toResult();
    }

    /**
     * Upserts the content of every {@code <collection>.json} file of a directory into the
     * destination database.
     *
     * @param destination destination connection entry
     * @param inputDir directory holding the dump files
     * @param sink receiver of progress lines; may be {@code null}
     * @return outcome of the run; {@link ReplicationResult#FAILURE} without any write if
     *         {@code inputDir} is not a directory
     */
    public ReplicationResult restoreFromFile(ConnectionConfig.Entry destination, Path inputDir,
            ProgressSink sink) {
        ProgressRecorder progress = new ProgressRecorder(sink);
        try (MongoDatabaseHandle dst = connectionFactory.open(destination)) {
            progress.emit("Restoring database " + dst.getDatabaseName() + " from " + inputDir);
            if (!Files.isDirectory(inputDir)) {
                throw new InvalidDumpPathException(inputDir);
            }

            Map<String, Path> dumpFiles = listDumpFiles(inputDir);
            for (Map.Entry<String, Path> dumpFile : dumpFiles.entrySet()) {
                runCollection(progress, () -> restoreCollection(dst, dumpFile.getKey(),
                        dumpFile.getValue(), progress));
            }
            complete(progress, "Restore");
        } catch (RuntimeException e) {
            progress.fail(e);
        }
        logCollectionSummary("restore", progress.getCounts());
        return progress.toResult();
    }

    /**
     * Streams one source collection into the same-named destination collection.
     */
    private void cloneCollection(MongoDatabaseHandle src, MongoDatabaseHandle dst, String name,
            ProgressRecorder progress) {
        progress.emit("Cloning collection: " + name);
        BatchUpsertWriter writer = new BatchUpsertWriter(name, dst.collection(name),
                replicationConfig.getBatchSize(), progress::emit);
        try (MongoCursor<BsonDocument> cursor = openCursor(src, name)) {
            while (cursor.hasNext()) {
                writer.add(cursor.next());
            }
        }
        progress.recordCount(name, writer.finish());
    }

    /**
     * Streams one source collection into its dump file.
     */
    private void dumpCollection(MongoDatabaseHandle src, String name, Path outputDir,
            ProgressRecorder progress) {
        progress.emit("Exporting collection: " + name);
        Path file = outputDir.resolve(CollectionEnumerator.dumpFileName(name));
        long count = 0;
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                MongoCursor<BsonDocument> cursor = openCursor(src, name)) {
            while (cursor.hasNext()) {
                out.write(codec.encode(cursor.next()));
                out.write('\n');
                count++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write dump file " + file, e);
        }
        progress.emit("  Exported " + count + " documents.");
        progress.recordCount(name, count);
    }

    /**
     * Streams one dump file into the collection named after it.
     */
    private void restoreCollection(MongoDatabaseHandle dst, String name, Path file,
            ProgressRecorder progress) {
        progress.emit("Importing collection: " + name);
        BatchUpsertWriter writer = new BatchUpsertWriter(name, dst.collection(name),
                replicationConfig.getBatchSize(), progress::emit);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (StringUtils.isBlank(line)) {
                    continue;
                }
                writer.add(decodeLine(file, lineNumber, line));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dump file " + file, e);
        }
        progress.recordCount(name, writer.finish());
    }

    private MongoCursor<BsonDocument> openCursor(MongoDatabaseHandle src, String name) {
        return src.collection(name).find().batchSize(replicationConfig.getBatchSize()).cursor();
    }

    /**
     * Decodes one dump line, attaching the file name and line number to decode failures.
     */
    private BsonDocument decodeLine(Path file, long lineNumber, String line) {
        BsonDocument document;
        try {
            document = codec.decode(line);
        } catch (DocumentDecodeException e) {
            throw new DocumentDecodeException(
                    file.getFileName() + " line " + lineNumber + ": " + e.getMessage(), e);
        }
        if (!document.containsKey(BatchUpsertWriter.ID_FIELD)) {
            throw new DocumentDecodeException(file.getFileName() + " line " + lineNumber
                    + ": document has no " + BatchUpsertWriter.ID_FIELD + " field");
        }
        return document;
    }

    /**
     * Runs the work of one collection inside the configured failure boundary.
     *
     * <p>
     * Without {@code continue-on-error} failures propagate to the operation boundary and end the
     * run. With it, the failure is recorded and the caller moves on to the next collection.
     * </p>
     */
    private void runCollection(ProgressRecorder progress, Runnable work) {
        if (!replicationConfig.isContinueOnError()) {
            work.run();
            return;
        }
        try {
            work.run();
        } catch (RuntimeException e) {
            progress.fail(e);
        }
    }

    private void complete(ProgressRecorder progress, String operation) {
        if (progress.isClean()) {
            progress.emit(operation + " completed successfully.");
        } else {
            progress.emit(operation + " completed with errors.");
        }
    }

    private void ensureDirectoryExists(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output directory: "
                    + dir.toAbsolutePath(), e);
        }
    }

    private Map<String, Path> listDumpFiles(Path dir) {
        try {
            return enumerator.listDumpFiles(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list dump directory: " + dir, e);
        }
    }

    /**
     * Logs the document count per collection as a simple aligned table.
     *
     * @param operation operation name shown in the header
     * @param countMap collection name to document count
     */
    private void logCollectionSummary(String operation, Map<String, Long> countMap) {
        if (countMap.isEmpty()) {
            return;
        }
        log.info("===== Summary ({}) =====", operation);

        // Compute the maximum collection-name length
        int maxNameLen = countMap.keySet().stream().mapToInt(String::length).max().orElse(0);

        // Compute the maximum digit width for counts
        int maxCountDigits = countMap.values().stream()
                .mapToInt(count -> String.valueOf(count).length()).max().orElse(0);

        // Example: "  Collection[%-20s] Total=%5d"
        String fmt = "  Collection[%-" + maxNameLen + "s] Total=%" + maxCountDigits + "d";

        countMap.forEach((name, count) -> log.info(String.format(fmt, name, count)));
    }
}
