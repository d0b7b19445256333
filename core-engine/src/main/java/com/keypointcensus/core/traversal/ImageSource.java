package com.keypointcensus.core.traversal;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Decodes image files to grayscale.
 */
@FunctionalInterface
public interface ImageSource {

    /**
     * @param path image file
     * @return decoded image of type {@link BufferedImage#TYPE_BYTE_GRAY}
     * @throws ImageDecodeException if the file is missing or cannot be decoded
     */
    BufferedImage load(Path path) throws ImageDecodeException;
}
