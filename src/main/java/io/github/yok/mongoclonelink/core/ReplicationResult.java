package io.github.yok.mongoclonelink.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one clone, dump or restore invocation.
 *
 * <p>
 * Holds the exit status ({@link #SUCCESS} or {@link #FAILURE}), every progress line emitted during
 * the run in order, the number of documents transferred per collection and the failure messages.
 * A new instance is produced per invocation; nothing is shared between runs.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ReplicationResult {

    /**
     * Status of a run that completed without failure.
     */
    public static final int SUCCESS = 0;

    /**
     * Status of a run that failed.
     */
    public static final int FAILURE = 1;

    private final int status;

    private final List<String> logLines;

    // collection name -> documents transferred, in processing order
    private final Map<String, Long> documentCounts;

    private final List<String> failures;

    /**
     * Creates a result.
     *
     * @param logLines progress lines in emission order
     * @param documentCounts documents per collection
     * @param failures failure messages; empty for a successful run
     */
    public ReplicationResult(List<String> logLines, Map<String, Long> documentCounts,
            List<String> failures) {
        this.logLines = ImmutableList.copyOf(logLines);
        this.documentCounts = ImmutableMap.copyOf(documentCounts);
        this.failures = ImmutableList.copyOf(failures);
        this.status = this.failures.isEmpty() ? SUCCESS : FAILURE;
    }

    /**
     * Returns whether the run succeeded.
     *
     * @return {@code true} if the status is {@link #SUCCESS}
     */
    public boolean isSuccess() {
        return status == SUCCESS;
    }

    /**
     * Returns the total number of documents transferred.
     *
     * @return sum over all collections
     */
    public long getTotalDocuments() {
        return documentCounts.values().stream().mapToLong(Long::longValue).sum();
    }
}
