package com.keypointcensus.core.traversal;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.model.Keypoint;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders detected keypoints for visual inspection. Invoked once per
 * (image, detector) pair when annotation is enabled, possibly from worker
 * threads.
 */
@FunctionalInterface
public interface Annotator {

    /**
     * @param image     path of the source image
     * @param grayImage the decoded image; must not be modified
     * @param detector  detector that produced {@code keypoints}
     * @param keypoints keypoints to draw
     * @throws IOException if the annotation cannot be written
     */
    void annotate(Path image, BufferedImage grayImage, DetectorType detector, List<Keypoint> keypoints)
            throws IOException;
}
