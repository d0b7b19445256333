package com.keypointcensus.core.report;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.model.SummaryRecord;
import com.keypointcensus.core.traversal.OutputLayout;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CsvStatsWriter}.
 */
class CsvStatsWriterTest {

    @TempDir
    Path tmp;

    @Test
    @DisplayName("Should write the header on creation")
    void shouldWriteHeader() throws IOException {
        StringWriter out = new StringWriter();
        new CsvStatsWriter(out);

        assertThat(out.toString()).isEqualTo("path,detector,d_num,f_mean,r_min,r_max,r_mean,r_std\n");
    }

    @Test
    @DisplayName("Should render zero-guarded statistics as literal zeros")
    void shouldFormatZeroRow() {
        assertThat(CsvStatsWriter.formatRow(SummaryRecord.zero("x", DetectorType.SIFT, 1)))
                .isEqualTo("x,SIFT,1,0,0,0,0,0");
    }

    @Test
    @DisplayName("Should render statistics with Double.toString")
    void shouldFormatStatistics() {
        SummaryRecord row = new SummaryRecord("img.jpg", DetectorType.AGAST, 2, false,
                1.5, 0.25, 3.0, 1.625, 0.1);

        assertThat(CsvStatsWriter.formatRow(row)).isEqualTo("img.jpg,AgastFeatureDetector,2,1.5,0.25,3.0,1.625,0.1");
    }

    @Test
    @DisplayName("Should quote paths containing delimiters")
    void shouldEscapePath() {
        assertThat(CsvStatsWriter.escape("plain/path.jpg")).isEqualTo("plain/path.jpg");
        assertThat(CsvStatsWriter.escape("a,b.jpg")).isEqualTo("\"a,b.jpg\"");
        assertThat(CsvStatsWriter.escape("say \"hi\".jpg")).isEqualTo("\"say \"\"hi\"\".jpg\"");
    }

    @Test
    @DisplayName("Should flush every row as it is written")
    void shouldFlushRows() throws IOException {
        Path file = tmp.resolve("stats.csv");
        StatsWriter writer = CsvStatsWriter.factory(OutputLayout.inPlace(tmp), "stats.csv").open(tmp);
        try {
            writer.write(SummaryRecord.zero("a.jpg", DetectorType.ORB, 1));
            assertThat(Files.readAllLines(file)).containsExactly(CsvStatsWriter.HEADER, "a.jpg,ORB,1,0,0,0,0,0");
        } finally {
            writer.close();
        }
    }

    @Test
    @DisplayName("Should create the mirrored output directory")
    void shouldCreateMirroredDirectory() throws IOException {
        Path input = tmp.resolve("in");
        Path out = tmp.resolve("out");
        StatsWriterFactory factory = CsvStatsWriter.factory(OutputLayout.mirrored(input, out), "summary.csv");

        try (StatsWriter writer = factory.open(input.resolve("A").resolve("B"))) {
            writer.write(SummaryRecord.zero("row", DetectorType.MSER, 0));
        }

        assertThat(Files.readAllLines(out.resolve("A").resolve("B").resolve("summary.csv")))
                .containsExactly(CsvStatsWriter.HEADER, "row,MSER,0,0,0,0,0,0");
    }
}
