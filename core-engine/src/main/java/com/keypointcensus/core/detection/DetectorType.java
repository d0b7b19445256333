package com.keypointcensus.core.detection;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Stable identity of every supported feature detector.
 *
 * <p>
 * The canonical name is what appears in the {@code detector} column of every
 * report. Detectors that can also compute descriptors are flagged, since the
 * {@code desc} selection group is built from them.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorType {

    SIFT("SIFT", true),
    BRISK("BRISK", true),
    ORB("ORB", true),
    AKAZE("AKAZE", true),
    MSER("MSER", false),
    FAST("FAST", false),
    SIMPLE_BLOB("SimpleBlobDetector", false),
    AGAST("AgastFeatureDetector", false),
    GFTT("GFTTDetector", false);

    private final String canonicalName;
    private final boolean descriptorCapable;

    DetectorType(String canonicalName, boolean descriptorCapable) {
        this.canonicalName = canonicalName;
        this.descriptorCapable = descriptorCapable;
    }

    /**
     * @return the name written to reports, e.g. {@code SimpleBlobDetector}
     */
    public String canonicalName() {
        return canonicalName;
    }

    /**
     * @return {@code true} if the detector can compute descriptors as well as
     *         keypoints
     */
    public boolean isDescriptorCapable() {
        return descriptorCapable;
    }

    /**
     * Look up a detector by its exact canonical name.
     *
     * @param name canonical name; must not be {@code null}
     * @return the matching type, or empty if none matches
     */
    public static Optional<DetectorType> fromCanonicalName(String name) {
        Objects.requireNonNull(name, "Detector name must not be null");
        return Arrays.stream(values())
                .filter(t -> t.canonicalName.equals(name))
                .findFirst();
    }

    @Override
    public String toString() {
        return canonicalName;
    }
}
