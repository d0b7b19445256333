package com.keypointcensus.cli;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.detection.FeatureDetector;
import com.keypointcensus.core.model.Keypoint;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.features2d.Feature2D;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link FeatureDetector} backed by an OpenCV {@link Feature2D}.
 *
 * <p>
 * Native detectors are not safe for concurrent use, so every calling thread
 * gets its own instance from the supplied factory.
 * </p>
 *
 * @since 1.0.0
 */
public class OpenCvFeatureDetector implements FeatureDetector {

    private final DetectorType type;
    private final ThreadLocal<Feature2D> perThread;

    /**
     * @param type    detector kind reported by {@link #getType()}
     * @param factory creates a configured native detector; called once per
     *                thread
     */
    public OpenCvFeatureDetector(DetectorType type, Supplier<? extends Feature2D> factory) {
        this.type = Objects.requireNonNull(type, "Detector type must not be null");
        Objects.requireNonNull(factory, "Detector factory must not be null");
        this.perThread = ThreadLocal.withInitial(factory);
    }

    @Override
    public List<Keypoint> detect(BufferedImage grayImage) {
        Objects.requireNonNull(grayImage, "Image must not be null");
        Mat mat = toMat(grayImage);
        MatOfKeyPoint found = new MatOfKeyPoint();
        try {
            perThread.get().detect(mat, found);
            org.opencv.core.KeyPoint[] raw = found.toArray();
            List<Keypoint> keypoints = new ArrayList<>(raw.length);
            for (org.opencv.core.KeyPoint kp : raw) {
                keypoints.add(new Keypoint((float) kp.pt.x, (float) kp.pt.y,
                        kp.size, kp.angle, kp.response, kp.octave));
            }
            return keypoints;
        } finally {
            found.release();
            mat.release();
        }
    }

    @Override
    public DetectorType getType() {
        return type;
    }

    @Override
    public String toString() {
        return "OpenCvFeatureDetector{" + type + '}';
    }

    /**
     * Copy an 8-bit gray image into a single-channel {@link Mat}.
     */
    static Mat toMat(BufferedImage grayImage) {
        if (grayImage.getType() != BufferedImage.TYPE_BYTE_GRAY) {
            throw new IllegalArgumentException("Expected TYPE_BYTE_GRAY, got image type " + grayImage.getType());
        }
        int width = grayImage.getWidth();
        int height = grayImage.getHeight();
        byte[] pixels = (byte[]) grayImage.getRaster().getDataElements(0, 0, width, height, null);
        Mat mat = new Mat(height, width, CvType.CV_8UC1);
        mat.put(0, 0, pixels);
        return mat;
    }
}
