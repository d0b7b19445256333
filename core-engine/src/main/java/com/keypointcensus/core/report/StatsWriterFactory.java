package com.keypointcensus.core.report;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens the {@link StatsWriter} of a visited directory.
 */
@FunctionalInterface
public interface StatsWriterFactory {

    /**
     * @param inputDirectory the directory being summarised
     * @return a fresh writer, already carrying its header if it has one
     * @throws IOException if the output cannot be created
     */
    StatsWriter open(Path inputDirectory) throws IOException;
}
