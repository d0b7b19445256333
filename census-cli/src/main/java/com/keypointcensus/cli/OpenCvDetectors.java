package com.keypointcensus.cli;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.detection.FeatureDetector;
import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.features2d.AKAZE;
import org.opencv.features2d.AgastFeatureDetector;
import org.opencv.features2d.BRISK;
import org.opencv.features2d.FastFeatureDetector;
import org.opencv.features2d.Feature2D;
import org.opencv.features2d.GFTTDetector;
import org.opencv.features2d.MSER;
import org.opencv.features2d.ORB;
import org.opencv.features2d.SIFT;
import org.opencv.features2d.SimpleBlobDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Creates OpenCV-backed {@link FeatureDetector}s with the library's default
 * parameters, except ORB which is allowed to return essentially every feature.
 *
 * @since 1.0.0
 */
public final class OpenCvDetectors {

    private static final Logger LOG = LoggerFactory.getLogger(OpenCvDetectors.class);

    /** Feature cap for ORB, high enough to never bind on real images. */
    static final int ORB_MAX_FEATURES = 10_000_000;

    private static boolean nativeLoaded;

    private OpenCvDetectors() {
        // utility class, not instantiable
    }

    /**
     * Load the bundled OpenCV native library once per JVM.
     */
    public static synchronized void loadNativeLibrary() {
        if (!nativeLoaded) {
            OpenCV.loadLocally();
            nativeLoaded = true;
            LOG.info("Loaded OpenCV {}", Core.VERSION);
        }
    }

    /**
     * Create the adapter for one detector kind.
     *
     * @param type detector kind; must not be {@code null}
     * @return the adapter
     */
    public static FeatureDetector create(DetectorType type) {
        Objects.requireNonNull(type, "Detector type must not be null");
        Supplier<Feature2D> factory = switch (type) {
            case SIFT -> SIFT::create;
            case BRISK -> BRISK::create;
            case ORB -> () -> ORB.create(ORB_MAX_FEATURES);
            case AKAZE -> AKAZE::create;
            case MSER -> MSER::create;
            case FAST -> FastFeatureDetector::create;
            case SIMPLE_BLOB -> SimpleBlobDetector::create;
            case AGAST -> AgastFeatureDetector::create;
            case GFTT -> GFTTDetector::create;
        };
        return new OpenCvFeatureDetector(type, factory);
    }

    /**
     * Load the native library and create one adapter per detector kind.
     *
     * @param types detector kinds, in output order
     * @return unmodifiable list of adapters in the same order
     */
    public static List<FeatureDetector> createAll(List<DetectorType> types) {
        Objects.requireNonNull(types, "Detector types must not be null");
        loadNativeLibrary();
        LOG.info("Creating {} OpenCV detector(s): {}", types.size(), types);
        return Collections.unmodifiableList(types.stream()
                .map(OpenCvDetectors::create)
                .toList());
    }
}
