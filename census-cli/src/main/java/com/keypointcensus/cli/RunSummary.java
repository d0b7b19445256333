package com.keypointcensus.cli;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.keypointcensus.core.model.SummaryRecord;
import com.keypointcensus.core.traversal.CensusResult;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * JSON view of a finished census: where it ran, when, how much it saw, and
 * the grand total per detector.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"root", "startedAt", "finishedAt", "elapsedMillis",
        "directoriesVisited", "imagesProcessed", "imagesFailed", "totals"})
public final class RunSummary {

    private final String root;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final int directoriesVisited;
    private final int imagesProcessed;
    private final int imagesFailed;
    private final List<DetectorTotal> totals;

    public RunSummary(CensusResult result) {
        Objects.requireNonNull(result, "Census result must not be null");
        this.root = result.getRoot().toString();
        this.startedAt = result.getStartedAt();
        this.finishedAt = result.getFinishedAt();
        this.directoriesVisited = result.getDirectoriesVisited();
        this.imagesProcessed = result.getImagesProcessed();
        this.imagesFailed = result.getImagesFailed();
        this.totals = result.getTotalSummaries().stream().map(DetectorTotal::new).toList();
    }

    public String getRoot() {
        return root;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public long getElapsedMillis() {
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    public int getDirectoriesVisited() {
        return directoriesVisited;
    }

    public int getImagesProcessed() {
        return imagesProcessed;
    }

    public int getImagesFailed() {
        return imagesFailed;
    }

    public List<DetectorTotal> getTotals() {
        return totals;
    }

    /**
     * Grand total of one detector, mirroring the {@code **} row of the root
     * directory.
     */
    @JsonPropertyOrder({"detector", "d_num", "f_mean", "r_min", "r_max", "r_mean", "r_std"})
    public static final class DetectorTotal {
        private final SummaryRecord record;

        DetectorTotal(SummaryRecord record) {
            this.record = record;
        }

        public String getDetector() {
            return record.getDetector().canonicalName();
        }

        @JsonProperty("d_num")
        public int getDetectionCount() {
            return record.getDetectionCount();
        }

        @JsonProperty("f_mean")
        public double getFeatureMean() {
            return record.getFeatureMean();
        }

        @JsonProperty("r_min")
        public double getResponseMin() {
            return record.getResponseMin();
        }

        @JsonProperty("r_max")
        public double getResponseMax() {
            return record.getResponseMax();
        }

        @JsonProperty("r_mean")
        public double getResponseMean() {
            return record.getResponseMean();
        }

        @JsonProperty("r_std")
        public double getResponseStdDev() {
            return record.getResponseStdDev();
        }
    }
}
