package com.keypointcensus.core.stats;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.model.Detection;
import com.keypointcensus.core.model.SummaryRecord;

import java.util.Objects;

/**
 * Projects response samples onto the fixed report columns.
 *
 * <h3>Zero guard</h3>
 * <p>
 * Minimum, maximum, mean and standard deviation are undefined for an empty
 * sample set. In that case every statistic is reported as {@code 0} while
 * {@code d_num} still carries the detection count, so an image with no
 * keypoints shows up as {@code d_num=1} with zero statistics.
 * </p>
 *
 * <h3>Standard deviation</h3>
 * <p>
 * Population standard deviation: the sum of squared differences is divided by
 * {@code N}, not {@code N - 1}.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticsFormatter {

    private StatisticsFormatter() {
        // utility class, not instantiable
    }

    /**
     * Summarise a sample set.
     *
     * @param scopeLabel row label (image path or {@code dir/**})
     * @param detector   detector identity
     * @param samples    response values; must not be {@code null}
     * @param count      number of detections the samples came from
     * @return the summary record
     */
    public static SummaryRecord format(String scopeLabel, DetectorType detector, float[] samples, int count) {
        Objects.requireNonNull(samples, "Samples must not be null");
        return format(scopeLabel, detector, samples, samples.length, count);
    }

    /**
     * Summarise the first {@code length} values of a sample buffer.
     *
     * @param scopeLabel row label
     * @param detector   detector identity
     * @param samples    response buffer; must not be {@code null}
     * @param length     number of valid values at the start of {@code samples}
     * @param count      number of detections the samples came from
     * @return the summary record
     * @throws IllegalArgumentException if {@code length} is out of range or
     *                                  {@code count} is negative
     */
    public static SummaryRecord format(String scopeLabel,
            DetectorType detector,
            float[] samples,
            int length,
            int count) {
        Objects.requireNonNull(scopeLabel, "Scope label must not be null");
        Objects.requireNonNull(detector, "Detector must not be null");
        Objects.requireNonNull(samples, "Samples must not be null");
        if (length < 0 || length > samples.length) {
            throw new IllegalArgumentException(
                    "length must be in [0, " + samples.length + "], got: " + length);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }

        if (length == 0) {
            return SummaryRecord.zero(scopeLabel, detector, count);
        }

        double min = samples[0];
        double max = samples[0];
        for (int i = 1; i < length; i++) {
            min = Math.min(min, samples[i]);
            max = Math.max(max, samples[i]);
        }
        double mean = computeMean(samples, length);
        double stddev = computeStdDev(samples, length, mean);

        // Samples without a contributing detection cannot happen through merge,
        // but a direct caller may pass count=0.
        double featureMean = count > 0 ? (double) length / count : 0;

        return new SummaryRecord(scopeLabel, detector, count, false,
                featureMean, min, max, mean, stddev);
    }

    /**
     * Summarise a single detection, which counts as one image.
     *
     * @param detection  the detection; must not be {@code null}
     * @param scopeLabel row label for the image
     * @return the summary record
     */
    public static SummaryRecord format(Detection detection, String scopeLabel) {
        Objects.requireNonNull(detection, "Detection must not be null");
        return format(scopeLabel, detection.getDetector(), detection.getResponses(), 1);
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    private static double computeMean(float[] samples, int length) {
        double sum = 0;
        for (int i = 0; i < length; i++) {
            sum += samples[i];
        }
        return sum / length;
    }

    private static double computeStdDev(float[] samples, int length, double mean) {
        double sumSquaredDiff = 0;
        for (int i = 0; i < length; i++) {
            double diff = samples[i] - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / length);
    }
}
