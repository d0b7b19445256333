package com.keypointcensus.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.keypointcensus.core.traversal.CensusResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes a {@link RunSummary} as pretty-printed JSON with ISO-8601 instants.
 *
 * @since 1.0.0
 */
public final class RunSummaryWriter {

    private static final Logger LOG = LoggerFactory.getLogger(RunSummaryWriter.class);

    private final ObjectMapper mapper;

    public RunSummaryWriter() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @param result finished census
     * @return the JSON document
     * @throws IOException if serialization fails
     */
    public String toJson(CensusResult result) throws IOException {
        Objects.requireNonNull(result, "Census result must not be null");
        return mapper.writeValueAsString(new RunSummary(result));
    }

    /**
     * Write the summary, creating missing parent directories.
     *
     * @param result finished census
     * @param file   destination; replaced if it exists
     * @throws IOException if the file cannot be written
     */
    public void write(CensusResult result, Path file) throws IOException {
        Objects.requireNonNull(file, "Summary file must not be null");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(file.toFile(), new RunSummary(result));
        LOG.info("Wrote run summary to {}", file);
    }
}
