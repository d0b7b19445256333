package com.keypointcensus.core.model;

import com.keypointcensus.core.detection.DetectorType;

/**
 * Thrown when results of two different detectors are merged into one
 * aggregate. This always indicates a bug in the composition logic, never bad
 * input data.
 *
 * @since 1.0.0
 */
public class DetectorMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final DetectorType expected;
    private final DetectorType actual;

    public DetectorMismatchException(DetectorType expected, DetectorType actual) {
        super("Cannot merge " + actual + " results into a " + expected + " aggregate");
        this.expected = expected;
        this.actual = actual;
    }

    public DetectorType getExpected() {
        return expected;
    }

    public DetectorType getActual() {
        return actual;
    }
}
