package io.github.yok.mongoclonelink.core;

import com.google.common.base.Preconditions;
import com.mongodb.client.MongoDatabase;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Lists the collections an operation transfers.
 *
 * <p>
 * For a live database the names come from {@code listCollections}; for a restore they are derived
 * from the dump file names ({@code <collection>.json}). In both cases the following names are
 * skipped:
 * </p>
 * <ul>
 * <li>names starting with the reserved prefix {@value #SYSTEM_PREFIX}</li>
 * <li>names listed in {@code replication.exclude-collections}</li>
 * </ul>
 *
 * <p>
 * Results are sorted by collection name so that runs process collections in a stable order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CollectionEnumerator {

    /**
     * Prefix of collections reserved by the server.
     */
    public static final String SYSTEM_PREFIX = "system.";

    /**
     * File extension of dump files, without the dot.
     */
    public static final String DUMP_EXTENSION = "json";

    // Collection names that are never transferred
    private final List<String> excludeCollections;

    /**
     * Creates an enumerator.
     *
     * @param excludeCollections collection names to skip; {@code null} means none
     */
    public CollectionEnumerator(List<String> excludeCollections) {
        this.excludeCollections =
                (excludeCollections == null) ? List.of() : List.copyOf(excludeCollections);
    }

    /**
     * Returns the dump file name of a collection.
     *
     * @param collectionName collection name
     * @return {@code <collectionName>.json}
     */
    public static String dumpFileName(String collectionName) {
        return collectionName + FilenameUtils.EXTENSION_SEPARATOR + DUMP_EXTENSION;
    }

    /**
     * Lists the transferable collections of a live database.
     *
     * @param database source database
     * @return sorted collection names
     */
    public List<String> listCollections(MongoDatabase database) {
        Preconditions.checkNotNull(database, "database must not be null");
        List<String> names = new ArrayList<>();
        database.listCollectionNames().into(names);
        return filter(names);
    }

    /**
     * Lists the dump files of a directory, keyed by the collection name they restore into.
     *
     * @param dir dump directory
     * @return collection name to dump file, sorted by collection name
     * @throws IOException if the directory cannot be listed
     */
    public Map<String, Path> listDumpFiles(Path dir) throws IOException {
        Preconditions.checkNotNull(dir, "dir must not be null");
        Map<String, Path> byName = new LinkedHashMap<>();
        try (Stream<Path> stream = Files.list(dir)) {
            List<Path> dumpFiles = stream.filter(Files::isRegularFile)
                    .filter(p -> FilenameUtils.isExtension(p.getFileName().toString(),
                            DUMP_EXTENSION))
                    .collect(Collectors.toList());
            for (Path file : dumpFiles) {
                byName.put(FilenameUtils.removeExtension(file.getFileName().toString()), file);
            }
        }
        Map<String, Path> result = new LinkedHashMap<>();
        for (String name : filter(byName.keySet())) {
            result.put(name, byName.get(name));
        }
        return result;
    }

    /**
     * Drops system and excluded names and sorts the rest.
     *
     * @param names candidate collection names
     * @return transferable names in ascending order
     */
    List<String> filter(Iterable<String> names) {
        List<String> result = new ArrayList<>();
        for (String name : names) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                log.debug("Collection [{}] is a system collection; skipping", name);
            } else if (excludeCollections.contains(name)) {
                log.info("Collection [{}] is excluded; skipping", name);
            } else {
                result.add(name);
            }
        }
        result.sort(null);
        return result;
    }
}
