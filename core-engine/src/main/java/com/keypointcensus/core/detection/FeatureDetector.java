package com.keypointcensus.core.detection;

import com.keypointcensus.core.model.Keypoint;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Contract for all feature detectors.
 *
 * <p>
 * Implementations must be deterministic for identical pixel data, callable any
 * number of times, and must not modify the image they are given. When the
 * engine runs with more than one worker thread, {@link #detect(BufferedImage)}
 * is called concurrently and implementations must tolerate that.
 * </p>
 */
public interface FeatureDetector {

    /**
     * Detect keypoints in a grayscale image.
     *
     * @param grayImage decoded image of type {@link BufferedImage#TYPE_BYTE_GRAY}
     * @return keypoints in detector order; empty if none were found
     */
    List<Keypoint> detect(BufferedImage grayImage);

    /**
     * Return the identity of this detector.
     *
     * @return detector type
     */
    DetectorType getType();
}
