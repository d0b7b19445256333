package com.keypointcensus.core.report;

import com.keypointcensus.core.model.SummaryRecord;
import com.keypointcensus.core.traversal.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes summary rows as CSV with the header
 * {@code path,detector,d_num,f_mean,r_min,r_max,r_mean,r_std}.
 *
 * <p>
 * Every row is flushed as soon as it is written. Statistics are rendered with
 * {@link Double#toString(double)}; a zero-guarded record renders its five
 * statistics as a literal {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvStatsWriter implements StatsWriter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvStatsWriter.class);

    /** Header line, without the line terminator. */
    public static final String HEADER = String.join(",", SummaryRecord.COLUMNS);

    private final Writer out;

    /**
     * @param out destination; the header is written immediately
     * @throws IOException if the header cannot be written
     */
    public CsvStatsWriter(Writer out) throws IOException {
        this.out = Objects.requireNonNull(out, "Writer must not be null");
        out.write(HEADER);
        out.write('\n');
        out.flush();
    }

    /**
     * Create the factory that writes {@code fileName} into the output directory
     * the layout assigns to every visited directory.
     *
     * @param layout   input-to-output directory mapping
     * @param fileName file name, e.g. {@code stats.csv}
     * @return the factory
     */
    public static StatsWriterFactory factory(OutputLayout layout, String fileName) {
        Objects.requireNonNull(layout, "Output layout must not be null");
        Objects.requireNonNull(fileName, "File name must not be null");
        return inputDirectory -> {
            Path dir = layout.outputDirectoryFor(inputDirectory);
            Files.createDirectories(dir);
            Path file = dir.resolve(fileName);
            LOG.debug("Opening statistics file {}", file);
            BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
            try {
                return new CsvStatsWriter(writer);
            } catch (IOException e) {
                writer.close();
                throw e;
            }
        };
    }

    @Override
    public void write(SummaryRecord record) throws IOException {
        out.write(formatRow(record));
        out.write('\n');
        out.flush();
    }

    @Override
    public void close() throws IOException {
        out.close();
    }

    /**
     * Render one row without the line terminator.
     *
     * @param record the row; must not be {@code null}
     * @return the CSV line
     */
    public static String formatRow(SummaryRecord record) {
        Objects.requireNonNull(record, "Record must not be null");
        StringBuilder sb = new StringBuilder();
        sb.append(escape(record.getPath())).append(',')
                .append(record.getDetector().canonicalName()).append(',')
                .append(record.getDetectionCount());
        if (record.isEmpty()) {
            sb.append(",0,0,0,0,0");
        } else {
            sb.append(',').append(record.getFeatureMean())
                    .append(',').append(record.getResponseMin())
                    .append(',').append(record.getResponseMax())
                    .append(',').append(record.getResponseMean())
                    .append(',').append(record.getResponseStdDev());
        }
        return sb.toString();
    }

    /**
     * Quote a field if it contains a delimiter, quote or line break.
     *
     * @param field raw field
     * @return field safe to place in a CSV line
     */
    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
