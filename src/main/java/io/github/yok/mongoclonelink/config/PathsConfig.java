package io.github.yok.mongoclonelink.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that reads the {@code data-path} property from the application root
 * configuration and composes the default directory used by dump and restore.
 *
 * <p>
 * The {@code data-path} must point to the base directory under which this tool expects a
 * {@code /dump} subdirectory. An explicit directory on the command line takes precedence.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base path that serves as the application's root data directory
    private String dataPath;

    /**
     * Returns the default dump directory.
     *
     * @return the path to the dump directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public String getDump() {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return dataPath.endsWith("/") ? dataPath + "dump" : dataPath + "/dump";
    }
}
