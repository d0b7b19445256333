package com.keypointcensus.core.traversal;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Output for a directory could not be created or written. Stops the traversal
 * of that directory's subtree and propagates to the caller.
 *
 * @since 1.0.0
 */
public class OutputWriteException extends IOException {

    private static final long serialVersionUID = 1L;

    private final Path directory;

    public OutputWriteException(Path directory, String message, Throwable cause) {
        super(message + ": " + directory, cause);
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    /**
     * @return the input directory whose output failed
     */
    public Path getDirectory() {
        return directory;
    }
}
