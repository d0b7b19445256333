package com.keypointcensus.core.report;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.model.Detection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FeatureCountReport}.
 */
class FeatureCountReportTest {

    private static final List<DetectorType> DETECTORS = List.of(DetectorType.SIFT, DetectorType.ORB);

    @TempDir
    Path tmp;

    @Test
    @DisplayName("Should write one count column per detector")
    void shouldWriteCounts() throws IOException {
        StringWriter out = new StringWriter();
        FeatureCountReport report = new FeatureCountReport(out, DETECTORS);
        Path image = Paths.get("train", "BR_encrust", "foo.jpg");

        report.onImage(image, List.of(
                detection(image, DetectorType.SIFT, 3),
                detection(image, DetectorType.ORB, 0)));

        assertThat(out.toString()).isEqualTo("image,patch,SIFT,ORB\nfoo.jpg,BR_encrust,3,0\n");
        assertThat(report.getRowCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject detections that do not match the columns")
    void shouldRejectMismatchedDetections() throws IOException {
        FeatureCountReport report = new FeatureCountReport(new StringWriter(), DETECTORS);
        Path image = Paths.get("x", "y.jpg");

        assertThatThrownBy(() -> report.onImage(image, List.of(detection(image, DetectorType.SIFT, 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 2");
        assertThatThrownBy(() -> report.onImage(image, List.of(
                detection(image, DetectorType.ORB, 1),
                detection(image, DetectorType.SIFT, 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("order mismatch");
        assertThat(report.getRowCount()).isZero();
    }

    @Test
    @DisplayName("Should create the report file and its parent directories")
    void shouldOpenFile() throws IOException {
        Path file = tmp.resolve("reports").resolve("counts.csv");
        Path image = tmp.resolve("patch").resolve("a.jpg");

        try (FeatureCountReport report = FeatureCountReport.open(file, DETECTORS)) {
            report.onImage(image, List.of(
                    detection(image, DetectorType.SIFT, 2),
                    detection(image, DetectorType.ORB, 5)));
        }

        assertThat(Files.readAllLines(file)).containsExactly("image,patch,SIFT,ORB", "a.jpg,patch,2,5");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Detection detection(Path image, DetectorType type, int keypoints) {
        return new Detection(image, type, new float[keypoints]);
    }
}
