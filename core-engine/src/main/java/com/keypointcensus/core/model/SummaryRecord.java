package com.keypointcensus.core.model;

import com.keypointcensus.core.detection.DetectorType;

import java.util.Objects;

/**
 * One report row: the six summary statistics of a detection or an aggregate.
 *
 * <p>
 * Derived on demand by
 * {@link com.keypointcensus.core.stats.StatisticsFormatter} and never stored.
 * A record built from zero samples has every statistic set to {@code 0} and
 * reports {@link #isEmpty()} so writers can render it as literal zeros.
 * </p>
 *
 * @since 1.0.0
 */
public final class SummaryRecord {

    /** Column names, in output order. */
    public static final String[] COLUMNS = {
            "path", "detector", "d_num", "f_mean", "r_min", "r_max", "r_mean", "r_std"
    };

    private final String path;
    private final DetectorType detector;
    private final int detectionCount;
    private final boolean empty;
    private final double featureMean;
    private final double responseMin;
    private final double responseMax;
    private final double responseMean;
    private final double responseStdDev;

    public SummaryRecord(String path,
            DetectorType detector,
            int detectionCount,
            boolean empty,
            double featureMean,
            double responseMin,
            double responseMax,
            double responseMean,
            double responseStdDev) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.detectionCount = detectionCount;
        this.empty = empty;
        this.featureMean = featureMean;
        this.responseMin = responseMin;
        this.responseMax = responseMax;
        this.responseMean = responseMean;
        this.responseStdDev = responseStdDev;
    }

    /**
     * Build the zero-valued record used when no samples were collected.
     *
     * @param path           row label
     * @param detector       detector identity
     * @param detectionCount number of contributing detections (may be non-zero)
     * @return record whose statistics are all zero
     */
    public static SummaryRecord zero(String path, DetectorType detector, int detectionCount) {
        return new SummaryRecord(path, detector, detectionCount, true, 0, 0, 0, 0, 0);
    }

    /** @return the {@code path} column */
    public String getPath() {
        return path;
    }

    public DetectorType getDetector() {
        return detector;
    }

    /** @return the {@code d_num} column */
    public int getDetectionCount() {
        return detectionCount;
    }

    /**
     * @return {@code true} if no response samples contributed to this record
     */
    public boolean isEmpty() {
        return empty;
    }

    /** @return the {@code f_mean} column: samples per detection */
    public double getFeatureMean() {
        return featureMean;
    }

    public double getResponseMin() {
        return responseMin;
    }

    public double getResponseMax() {
        return responseMax;
    }

    public double getResponseMean() {
        return responseMean;
    }

    /** @return the {@code r_std} column: population standard deviation */
    public double getResponseStdDev() {
        return responseStdDev;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SummaryRecord that))
            return false;
        return detectionCount == that.detectionCount
                && empty == that.empty
                && Double.compare(featureMean, that.featureMean) == 0
                && Double.compare(responseMin, that.responseMin) == 0
                && Double.compare(responseMax, that.responseMax) == 0
                && Double.compare(responseMean, that.responseMean) == 0
                && Double.compare(responseStdDev, that.responseStdDev) == 0
                && path.equals(that.path)
                && detector == that.detector;
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, detector, detectionCount, empty,
                featureMean, responseMin, responseMax, responseMean, responseStdDev);
    }

    @Override
    public String toString() {
        return "SummaryRecord{" +
                "path='" + path + '\'' +
                ", detector=" + detector +
                ", d_num=" + detectionCount +
                ", f_mean=" + featureMean +
                ", r_min=" + responseMin +
                ", r_max=" + responseMax +
                ", r_mean=" + responseMean +
                ", r_std=" + responseStdDev +
                '}';
    }
}
