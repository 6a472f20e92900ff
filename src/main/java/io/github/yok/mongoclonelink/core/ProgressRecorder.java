package io.github.yok.mongoclonelink.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Per-invocation accumulator behind {@link ReplicationResult}.
 *
 * <p>
 * Every line is written to the log, kept for the result and forwarded to the caller's sink.
 * </p>
 */
@Slf4j
class ProgressRecorder {

    private final ProgressSink sink;

    private final List<String> lines = new ArrayList<>();

    private final Map<String, Long> counts = new LinkedHashMap<>();

    private final List<String> failures = new ArrayList<>();

    ProgressRecorder(ProgressSink sink) {
        this.sink = (sink == null) ? ProgressSink.noop() : sink;
    }

    /**
     * Emits one progress line.
     *
     * @param line progress line
     */
    void emit(String line) {
        log.debug(line);
        lines.add(line);
        try {
            sink.accept(line);
        } catch (RuntimeException e) {
            log.warn("Progress sink rejected line [{}]", line, e);
        }
    }

    /**
     * Records the document count of a finished collection.
     *
     * @param collection collection name
     * @param count documents transferred
     */
    void recordCount(String collection, long count) {
        counts.put(collection, count);
    }

    /**
     * Records a failure and emits it as an {@code ERROR:} line.
     *
     * @param e failure
     */
    void fail(Throwable e) {
        String message = describe(e);
        log.error("Replication failed: {}", message, e);
        failures.add(message);
        emit("ERROR: " + message);
    }

    /**
     * Returns whether no failure has been recorded yet.
     *
     * @return {@code true} if no failure was recorded
     */
    boolean isClean() {
        return failures.isEmpty();
    }

    /**
     * Returns the counts recorded so far.
     *
     * @return collection name to document count
     */
    Map<String, Long> getCounts() {
        return counts;
    }

    ReplicationResult toResult() {
        return new ReplicationResult(lines, counts, failures);
    }

    private static String describe(Throwable e) {
        return StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
    }
}
