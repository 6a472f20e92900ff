package io.github.yok.mongoclonelink.exception;

import java.nio.file.Path;
import lombok.Getter;

/**
 * Thrown when the restore input path is missing or not a directory.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class InvalidDumpPathException extends ReplicationException {

    private static final long serialVersionUID = 1L;

    // Offending path
    private final transient Path path;

    /**
     * Creates an exception for the given path.
     *
     * @param path path that is not a directory
     */
    public InvalidDumpPathException(Path path) {
        super(path + " is not a directory.");
        this.path = path;
    }
}
