package io.github.yok.mongoclonelink.db;

import com.google.common.base.Preconditions;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Repairs a common typo in hand-written connection strings.
 *
 * <p>
 * Host names copied from other tools sometimes keep a trailing dot in front of the port, e.g.
 * {@code mongodb://10.0.0.15.:27017}. This class removes every {@code ".:"} sequence so that the
 * string resolves to {@code mongodb://10.0.0.15:27017}.
 * </p>
 *
 * <p>
 * A fully qualified DNS name with a trailing root dot is a legitimate address, which this step
 * rewrites as well; set {@code replication.normalize-uri=false} to connect with the string as
 * written.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ConnectionStringNormalizer {

    private static final String TYPO = ".:";

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ConnectionStringNormalizer() {
        throw new AssertionError(
                "No io.github.yok.mongoclonelink.db.ConnectionStringNormalizer instances for you!");
    }

    /**
     * Removes a stray {@code .} placed directly before a port separator.
     *
     * @param uri connection string as configured
     * @return the repaired connection string, or {@code uri} itself when nothing had to change
     * @throws NullPointerException if {@code uri} is {@code null}
     */
    public static String normalize(String uri) {
        Preconditions.checkNotNull(uri, "uri must not be null");
        if (!uri.contains(TYPO)) {
            return uri;
        }
        String normalized = StringUtils.replace(uri, TYPO, ":");
        log.warn("Removed '.' before port in connection string ({} occurrence(s))",
                StringUtils.countMatches(uri, TYPO));
        return normalized;
    }
}
