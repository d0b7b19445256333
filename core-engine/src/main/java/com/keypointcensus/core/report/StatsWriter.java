package com.keypointcensus.core.report;

import com.keypointcensus.core.model.SummaryRecord;

import java.io.Closeable;
import java.io.IOException;

/**
 * Output stream of summary rows for one directory.
 *
 * <p>
 * A row passed to {@link #write(SummaryRecord)} must be handed to the
 * underlying storage before the call returns, so a failure later in the
 * directory never loses rows already written.
 * </p>
 */
public interface StatsWriter extends Closeable {

    /**
     * Write and flush one row.
     *
     * @param record the row
     * @throws IOException if the row cannot be written
     */
    void write(SummaryRecord record) throws IOException;
}
