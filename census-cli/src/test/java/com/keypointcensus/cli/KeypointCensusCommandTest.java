package com.keypointcensus.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keypointcensus.core.config.CensusConfig;
import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.detection.FeatureDetector;
import com.keypointcensus.core.model.Keypoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link KeypointCensusCommand}, run with fake detectors so that no
 * native library is needed.
 */
class KeypointCensusCommandTest {

    @TempDir
    Path tmp;

    private Path root;
    private final List<List<DetectorType>> requested = new ArrayList<>();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tmp.resolve("train"));
        writeImage(root.resolve("A").resolve("img1.jpg"));
        writeImage(root.resolve("B").resolve("img2.jpg"));
    }

    @Test
    @DisplayName("Should write statistics for the whole tree and exit 0")
    void shouldRunCensus() throws IOException {
        int exit = execute("-r", "-d", "ORB", root.toString());

        assertThat(exit).isEqualTo(KeypointCensusCommand.EXIT_OK);
        assertThat(requested).containsExactly(List.of(DetectorType.ORB));
        assertThat(lastLine(root.resolve("A").resolve("stats.csv")))
                .isEqualTo(root.resolve("A") + File.separator + "**,ORB,1,2.0,1.0,3.0,2.0,1.0");
        assertThat(lastLine(root.resolve("stats.csv")))
                .isEqualTo(root + File.separator + "**,ORB,2,2.0,1.0,3.0,2.0,1.0");
    }

    @Test
    @DisplayName("Should only process the top directory without --recurse")
    void shouldNotRecurseByDefault() throws IOException {
        int exit = execute("-d", "SIFT", root.toString());

        assertThat(exit).isEqualTo(KeypointCensusCommand.EXIT_OK);
        assertThat(root.resolve("A").resolve("stats.csv")).doesNotExist();
        assertThat(Files.readAllLines(root.resolve("stats.csv"))).containsExactly(
                "path,detector,d_num,f_mean,r_min,r_max,r_mean,r_std",
                root + File.separator + "**,SIFT,0,0,0,0,0,0");
    }

    @Test
    @DisplayName("Should exit 1 when the path is not a directory")
    void shouldRejectNonDirectory() {
        Path file = root.resolve("A").resolve("img1.jpg");

        int exit = execute(file.toString());

        assertThat(exit).isEqualTo(KeypointCensusCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("path must be a directory: " + file);
        assertThat(requested).isEmpty();
    }

    @Test
    @DisplayName("Should exit 1 on an unknown detector")
    void shouldRejectUnknownDetector() {
        int exit = execute("-d", "HOG", root.toString());

        assertThat(exit).isEqualTo(KeypointCensusCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("HOG");
        assertThat(root.resolve("stats.csv")).doesNotExist();
    }

    @Test
    @DisplayName("Should apply command-line options over the config file")
    void shouldMergeOptionsOverConfig() throws IOException {
        Path yml = tmp.resolve("census.yml");
        Files.writeString(yml, String.join("\n",
                "detectors: all",
                "recurse: false",
                "annotate: false",
                "threads: 2",
                "statsFileName: summary.csv",
                ""), StandardCharsets.UTF_8);

        KeypointCensusCommand command = new KeypointCensusCommand(this::fakeDetectors);
        new CommandLine(command).parseArgs(
                "--config", yml.toString(), "-r", "--threads", "3", "--names-only", root.toString());
        CensusConfig config = command.resolveConfig();

        assertThat(config.getDetectors()).isEqualTo("all");
        assertThat(config.isRecurse()).isTrue();
        assertThat(config.isAnnotate()).isFalse();
        assertThat(config.getThreads()).isEqualTo(3);
        assertThat(config.isFullPaths()).isFalse();
        assertThat(config.getStatsFileName()).isEqualTo("summary.csv");
        assertThat(config.hasOutputRoot()).isFalse();
    }

    @Test
    @DisplayName("Should write the counts report, JSON summary and mirrored outputs")
    void shouldWriteOptionalOutputs() throws IOException {
        Files.write(root.resolve("A").resolve("corrupt.jpg"), "garbage".getBytes(StandardCharsets.UTF_8));
        Path out = tmp.resolve("out");
        Path counts = tmp.resolve("reports").resolve("counts.csv");
        Path json = tmp.resolve("reports").resolve("summary.json");

        int exit = execute("-r", "-d", "desc", "-o", out.toString(), "--threads", "2",
                "--counts-file", counts.toString(), "--summary-json", json.toString(), root.toString());

        assertThat(exit).isEqualTo(KeypointCensusCommand.EXIT_OK);
        assertThat(root.resolve("stats.csv")).doesNotExist();
        assertThat(out.resolve("stats.csv")).exists();
        assertThat(out.resolve("B").resolve("stats.csv")).exists();

        List<String> countLines = Files.readAllLines(counts);
        assertThat(countLines.get(0)).isEqualTo("image,patch,SIFT,BRISK,ORB,AKAZE");
        // listing order of A and B is up to the file system
        assertThat(countLines.subList(1, countLines.size()))
                .containsExactlyInAnyOrder("img1.jpg,A,2,2,2,2", "img2.jpg,B,2,2,2,2");

        JsonNode summary = new ObjectMapper().readTree(json.toFile());
        assertThat(summary.get("root").asText()).isEqualTo(root.toString());
        assertThat(summary.get("imagesProcessed").asInt()).isEqualTo(2);
        assertThat(summary.get("imagesFailed").asInt()).isEqualTo(1);
        assertThat(summary.get("directoriesVisited").asInt()).isEqualTo(3);
        assertThat(summary.get("startedAt").asText()).contains("T").endsWith("Z");
        assertThat(summary.get("totals")).hasSize(4);
        JsonNode sift = summary.get("totals").get(0);
        assertThat(sift.get("detector").asText()).isEqualTo("SIFT");
        assertThat(sift.get("d_num").asInt()).isEqualTo(2);
        assertThat(sift.get("r_std").asDouble()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private int execute(String... args) {
        CommandLine cli = new CommandLine(new KeypointCensusCommand(this::fakeDetectors));
        cli.setErr(new PrintWriter(err, true));
        return cli.execute(args);
    }

    /** Every detector reports two keypoints with responses 1 and 3 on any image. */
    private List<FeatureDetector> fakeDetectors(List<DetectorType> types) {
        requested.add(types);
        List<FeatureDetector> detectors = new ArrayList<>();
        for (DetectorType type : types) {
            detectors.add(new FeatureDetector() {
                @Override
                public List<Keypoint> detect(BufferedImage grayImage) {
                    return List.of(responseOnly(1f), responseOnly(3f));
                }

                @Override
                public DetectorType getType() {
                    return type;
                }
            });
        }
        return detectors;
    }

    private static Keypoint responseOnly(float response) {
        return new Keypoint(0f, 0f, 0f, -1f, response, 0);
    }

    private static void writeImage(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        BufferedImage image = new BufferedImage(16, 16, BufferedImage.TYPE_BYTE_GRAY);
        assertThat(ImageIO.write(image, "jpg", file.toFile())).isTrue();
    }

    private static String lastLine(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file);
        return lines.get(lines.size() - 1);
    }
}
