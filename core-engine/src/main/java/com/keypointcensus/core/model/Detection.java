package com.keypointcensus.core.model;

import com.keypointcensus.core.detection.DetectorType;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Result of running one detector on one image.
 *
 * <p>
 * Immutable: the response values are copied on construction and every
 * accessor returns a copy.
 * </p>
 *
 * @since 1.0.0
 */
public final class Detection {

    private final Path imagePath;
    private final DetectorType detector;
    private final float[] responses;

    /**
     * @param imagePath image the detector ran on; must not be {@code null}
     * @param detector  detector identity; must not be {@code null}
     * @param responses keypoint response values in detector order; must not be
     *                  {@code null}
     */
    public Detection(Path imagePath, DetectorType detector, float[] responses) {
        this.imagePath = Objects.requireNonNull(imagePath, "Image path must not be null");
        this.detector = Objects.requireNonNull(detector, "Detector must not be null");
        this.responses = Objects.requireNonNull(responses, "Responses must not be null").clone();
    }

    /**
     * Build a detection from the keypoints a detector returned.
     *
     * @param imagePath image the detector ran on
     * @param detector  detector identity
     * @param keypoints detected keypoints; must not be {@code null}
     * @return a new detection holding the keypoint responses
     */
    public static Detection fromKeypoints(Path imagePath, DetectorType detector, List<Keypoint> keypoints) {
        Objects.requireNonNull(keypoints, "Keypoints must not be null");
        float[] responses = new float[keypoints.size()];
        for (int i = 0; i < responses.length; i++) {
            responses[i] = keypoints.get(i).getResponse();
        }
        return new Detection(imagePath, detector, responses);
    }

    public Path getImagePath() {
        return imagePath;
    }

    public DetectorType getDetector() {
        return detector;
    }

    /**
     * @return a copy of the response values
     */
    public float[] getResponses() {
        return responses.clone();
    }

    /**
     * @return number of keypoints detected
     */
    public int size() {
        return responses.length;
    }

    /** Package-private access for merging without an extra copy. */
    float[] responsesView() {
        return responses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Detection that))
            return false;
        return imagePath.equals(that.imagePath)
                && detector == that.detector
                && Arrays.equals(responses, that.responses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(imagePath, detector, Arrays.hashCode(responses));
    }

    @Override
    public String toString() {
        return "Detection{" +
                "imagePath=" + imagePath +
                ", detector=" + detector +
                ", keypoints=" + responses.length +
                '}';
    }
}
