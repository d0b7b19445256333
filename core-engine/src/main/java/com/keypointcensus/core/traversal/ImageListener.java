package com.keypointcensus.core.traversal;

import com.keypointcensus.core.model.Detection;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Observer of per-image results.
 *
 * <p>
 * Callbacks arrive on the traversal thread, in the same order the image rows
 * are written, so implementations need no synchronisation.
 * </p>
 */
public interface ImageListener {

    /**
     * Called once per decoded image, after its rows were written.
     *
     * @param image      the image path
     * @param detections one detection per configured detector, in configured
     *                   order
     * @throws IOException if the listener's own output fails
     */
    void onImage(Path image, List<Detection> detections) throws IOException;

    /**
     * Called once per image that could not be decoded.
     *
     * @param image the image path
     * @param cause why decoding failed
     */
    default void onDecodeFailure(Path image, ImageDecodeException cause) {
    }
}
