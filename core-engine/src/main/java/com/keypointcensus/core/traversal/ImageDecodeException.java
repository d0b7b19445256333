package com.keypointcensus.core.traversal;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * An image file could not be decoded: it is missing, unreadable, corrupt or of
 * an unsupported format. Recovered by skipping the file.
 *
 * @since 1.0.0
 */
public class ImageDecodeException extends IOException {

    private static final long serialVersionUID = 1L;

    private final Path path;

    public ImageDecodeException(Path path, String reason) {
        super("Failed to load image: " + path + " (" + reason + ")");
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    public ImageDecodeException(Path path, String reason, Throwable cause) {
        super("Failed to load image: " + path + " (" + reason + ")", cause);
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    public Path getPath() {
        return path;
    }
}
