package com.keypointcensus.core.traversal;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.model.AggregateNode;
import com.keypointcensus.core.model.SummaryRecord;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a complete traversal: the grand totals of the root scope plus
 * run counters.
 *
 * @since 1.0.0
 */
public final class CensusResult {

    private final Path root;
    private final Map<DetectorType, AggregateNode> totals;
    private final int directoriesVisited;
    private final int imagesProcessed;
    private final int imagesFailed;
    private final Instant startedAt;
    private final Instant finishedAt;

    public CensusResult(Path root,
            Map<DetectorType, AggregateNode> totals,
            int directoriesVisited,
            int imagesProcessed,
            int imagesFailed,
            Instant startedAt,
            Instant finishedAt) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.totals = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(totals, "totals must not be null")));
        this.directoriesVisited = directoriesVisited;
        this.imagesProcessed = imagesProcessed;
        this.imagesFailed = imagesFailed;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt must not be null");
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @return unmodifiable map of root aggregates, in configured detector order
     */
    public Map<DetectorType, AggregateNode> getTotals() {
        return totals;
    }

    /**
     * @return one grand-total row per detector, in configured order
     */
    public List<SummaryRecord> getTotalSummaries() {
        return totals.values().stream()
                .map(AggregateNode::toSummary)
                .toList();
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

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getElapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return "CensusResult{" +
                "root=" + root +
                ", directories=" + directoriesVisited +
                ", images=" + imagesProcessed +
                ", failed=" + imagesFailed +
                ", elapsed=" + getElapsed() +
                '}';
    }
}
