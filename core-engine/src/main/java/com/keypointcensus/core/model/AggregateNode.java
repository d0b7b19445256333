package com.keypointcensus.core.model;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.stats.StatisticsFormatter;

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * Running combination of detections for one (scope, detector) pair.
 *
 * <p>
 * Every raw response value ever merged is retained, so statistics computed at
 * any level of the tree equal a recomputation over the full underlying sample
 * set. Memory is proportional to the total number of samples held by the
 * scopes that are open at the same time.
 * </p>
 *
 * <h3>Count semantics</h3>
 * <p>
 * {@link #getCount()} counts contributing images, not samples. Merging a
 * {@link Detection} adds one even when it carries no responses; merging
 * another node adds that node's count.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. All merges into one node
 * must happen on a single thread.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregateNode {

    /** Path segment that marks a row as covering every file in a scope. */
    public static final String SCOPE_MARKER = "**";

    private static final int INITIAL_CAPACITY = 64;

    private final Path scope;
    private final DetectorType detector;

    private float[] samples = new float[INITIAL_CAPACITY];
    private int size;
    private int count;

    /**
     * @param scope    directory this node summarises; must not be {@code null}
     * @param detector detector identity; must not be {@code null}
     */
    public AggregateNode(Path scope, DetectorType detector) {
        this.scope = Objects.requireNonNull(scope, "Scope must not be null");
        this.detector = Objects.requireNonNull(detector, "Detector must not be null");
    }

    // ---------------------------------------------------------------
    // Merge
    // ---------------------------------------------------------------

    /**
     * Merge one image's detection into this node.
     *
     * @param detection detection of the same detector; must not be {@code null}
     * @throws DetectorMismatchException if the detectors differ
     */
    public void merge(Detection detection) {
        Objects.requireNonNull(detection, "Detection must not be null");
        requireSameDetector(detection.getDetector());
        append(detection.responsesView(), detection.size());
        count += 1;
    }

    /**
     * Merge another aggregate (typically a subdirectory's) into this node.
     *
     * @param other aggregate of the same detector; must not be {@code null}
     *              and must not be this node
     * @throws DetectorMismatchException if the detectors differ
     */
    public void merge(AggregateNode other) {
        Objects.requireNonNull(other, "Aggregate must not be null");
        if (other == this) {
            throw new IllegalArgumentException("An aggregate cannot be merged into itself");
        }
        requireSameDetector(other.detector);
        append(other.samples, other.size);
        count += other.count;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public DetectorType getDetector() {
        return detector;
    }

    /**
     * @return number of images that contributed to this node
     */
    public int getCount() {
        return count;
    }

    /**
     * @return total number of response samples held
     */
    public int getSampleCount() {
        return size;
    }

    /**
     * @return a copy of every sample merged so far, in merge order
     */
    public float[] getSamples() {
        return Arrays.copyOf(samples, size);
    }

    /**
     * @return the row label: the scope path with the {@value #SCOPE_MARKER}
     *         segment appended
     */
    public String getScopeLabel() {
        return scopeLabel(scope);
    }

    /**
     * Project this node onto the report columns.
     *
     * @return summary record labelled with {@link #getScopeLabel()}
     */
    public SummaryRecord toSummary() {
        return StatisticsFormatter.format(getScopeLabel(), detector, samples, size, count);
    }

    /**
     * Render the aggregate label of a directory.
     *
     * @param directory the directory
     * @return {@code directory + separator + "**"}
     */
    public static String scopeLabel(Path directory) {
        String dir = directory.toString();
        if (dir.isEmpty() || dir.endsWith(File.separator)) {
            return dir + SCOPE_MARKER;
        }
        return dir + File.separator + SCOPE_MARKER;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void requireSameDetector(DetectorType other) {
        if (other != detector) {
            throw new DetectorMismatchException(detector, other);
        }
    }

    private void append(float[] values, int length) {
        if (length == 0) {
            return;
        }
        int required = size + length;
        if (required > samples.length) {
            samples = Arrays.copyOf(samples, Math.max(required, samples.length * 2));
        }
        System.arraycopy(values, 0, samples, size, length);
        size = required;
    }

    @Override
    public String toString() {
        return "AggregateNode{" +
                "scope=" + scope +
                ", detector=" + detector +
                ", count=" + count +
                ", samples=" + size +
                '}';
    }
}
