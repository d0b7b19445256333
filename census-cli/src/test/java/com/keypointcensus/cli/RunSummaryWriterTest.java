package com.keypointcensus.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.model.AggregateNode;
import com.keypointcensus.core.model.Detection;
import com.keypointcensus.core.traversal.CensusResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RunSummaryWriter}.
 */
class RunSummaryWriterTest {

    private static final Instant STARTED = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant FINISHED = Instant.parse("2024-05-01T10:00:02.500Z");

    @TempDir
    Path tmp;

    @Test
    @DisplayName("Should serialize instants as ISO-8601 and keep detector order")
    void shouldSerializeSummary() throws IOException {
        JsonNode json = new ObjectMapper().readTree(new RunSummaryWriter().toJson(result()));

        assertThat(json.get("root").asText()).isEqualTo(Paths.get("data").toString());
        assertThat(json.get("startedAt").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.get("finishedAt").asText()).isEqualTo("2024-05-01T10:00:02.500Z");
        assertThat(json.get("elapsedMillis").asLong()).isEqualTo(2500);
        assertThat(json.get("directoriesVisited").asInt()).isEqualTo(4);
        assertThat(json.get("imagesProcessed").asInt()).isEqualTo(2);
        assertThat(json.get("imagesFailed").asInt()).isEqualTo(1);

        JsonNode totals = json.get("totals");
        assertThat(totals).hasSize(2);
        assertThat(totals.get(0).get("detector").asText()).isEqualTo("GFTTDetector");
        assertThat(totals.get(0).get("d_num").asInt()).isEqualTo(2);
        assertThat(totals.get(0).get("f_mean").asDouble()).isEqualTo(1.5);
        assertThat(totals.get(0).get("r_mean").asDouble()).isEqualTo(2.0);
        assertThat(totals.get(1).get("detector").asText()).isEqualTo("SIFT");
        assertThat(totals.get(1).get("d_num").asInt()).isZero();
        assertThat(totals.get(1).get("r_max").asDouble()).isZero();
    }

    @Test
    @DisplayName("Should create parent directories of the summary file")
    void shouldWriteFile() throws IOException {
        Path file = tmp.resolve("nested").resolve("summary.json");

        new RunSummaryWriter().write(result(), file);

        assertThat(new ObjectMapper().readTree(file.toFile()).get("imagesProcessed").asInt()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static CensusResult result() {
        Path root = Paths.get("data");
        AggregateNode gftt = new AggregateNode(root, DetectorType.GFTT);
        gftt.merge(new Detection(root.resolve("a.jpg"), DetectorType.GFTT, new float[] {1f, 2f}));
        gftt.merge(new Detection(root.resolve("b.jpg"), DetectorType.GFTT, new float[] {3f}));

        Map<DetectorType, AggregateNode> totals = new LinkedHashMap<>();
        totals.put(DetectorType.GFTT, gftt);
        totals.put(DetectorType.SIFT, new AggregateNode(root, DetectorType.SIFT));
        return new CensusResult(root, totals, 4, 2, 1, STARTED, FINISHED);
    }
}
