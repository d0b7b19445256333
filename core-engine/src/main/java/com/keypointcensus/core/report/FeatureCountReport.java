package com.keypointcensus.core.report;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.model.Detection;
import com.keypointcensus.core.traversal.ImageListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Wide table of keypoint counts: one row per decoded image, one column per
 * detector.
 *
 * <pre>
 * image,patch,SIFT,BRISK,ORB,AKAZE
 * foo.jpg,BR_encrust,812,140,500,97
 * </pre>
 *
 * <p>
 * {@code patch} is the name of the directory holding the image, which is how
 * training sets are usually organised by class.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureCountReport implements ImageListener, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureCountReport.class);

    private final List<DetectorType> detectors;
    private final Writer out;
    private int rows;

    /**
     * @param out       destination; the header is written immediately
     * @param detectors column order; must match the engine's detectors
     * @throws IOException if the header cannot be written
     */
    public FeatureCountReport(Writer out, List<DetectorType> detectors) throws IOException {
        this.out = Objects.requireNonNull(out, "Writer must not be null");
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "Detectors must not be null"));

        StringBuilder header = new StringBuilder("image,patch");
        for (DetectorType type : this.detectors) {
            header.append(',').append(type.canonicalName());
        }
        out.write(header.toString());
        out.write('\n');
    }

    /**
     * Create a report file, including any missing parent directories.
     *
     * @param file      report file; replaced if it exists
     * @param detectors column order
     * @return the open report
     * @throws IOException if the file cannot be created
     */
    public static FeatureCountReport open(Path file, List<DetectorType> detectors) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        try {
            LOG.info("Writing feature counts to {}", file);
            return new FeatureCountReport(writer, detectors);
        } catch (IOException e) {
            writer.close();
            throw e;
        }
    }

    @Override
    public void onImage(Path image, List<Detection> detections) throws IOException {
        if (detections.size() != detectors.size()) {
            throw new IllegalArgumentException("Expected " + detectors.size()
                    + " detection(s) for " + image + ", got " + detections.size());
        }

        Path parent = image.getParent();
        Path patch = parent != null ? parent.getFileName() : null;

        StringBuilder row = new StringBuilder();
        row.append(CsvStatsWriter.escape(image.getFileName().toString()))
                .append(',')
                .append(patch != null ? CsvStatsWriter.escape(patch.toString()) : "");
        for (int i = 0; i < detectors.size(); i++) {
            Detection detection = detections.get(i);
            if (detection.getDetector() != detectors.get(i)) {
                throw new IllegalArgumentException("Detection order mismatch for " + image
                        + ": expected " + detectors.get(i) + ", got " + detection.getDetector());
            }
            row.append(',').append(detection.size());
        }
        out.write(row.toString());
        out.write('\n');
        rows++;
    }

    /**
     * @return number of image rows written so far
     */
    public int getRowCount() {
        return rows;
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
