package com.keypointcensus.core.model;

import java.util.Objects;

/**
 * A single keypoint as reported by a detector.
 *
 * <p>
 * Only {@link #getResponse()} feeds the statistics. Position, size and angle
 * are kept for annotation.
 * </p>
 *
 * @since 1.0.0
 */
public final class Keypoint {

    private final float x;
    private final float y;
    private final float size;
    private final float angle;
    private final float response;
    private final int octave;

    /**
     * @param x        column of the keypoint centre, in pixels
     * @param y        row of the keypoint centre, in pixels
     * @param size     diameter of the meaningful neighbourhood
     * @param angle    orientation in degrees, or {@code -1} if not applicable
     * @param response detector-assigned strength of the keypoint
     * @param octave   pyramid octave the keypoint was extracted from
     */
    public Keypoint(float x, float y, float size, float angle, float response, int octave) {
        this.x = x;
        this.y = y;
        this.size = size;
        this.angle = angle;
        this.response = response;
        this.octave = octave;
    }

    public float getX() {
        return x;
    }

    public float getY() {
        return y;
    }

    public float getSize() {
        return size;
    }

    public float getAngle() {
        return angle;
    }

    public float getResponse() {
        return response;
    }

    public int getOctave() {
        return octave;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Keypoint that))
            return false;
        return Float.compare(x, that.x) == 0
                && Float.compare(y, that.y) == 0
                && Float.compare(size, that.size) == 0
                && Float.compare(angle, that.angle) == 0
                && Float.compare(response, that.response) == 0
                && octave == that.octave;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, size, angle, response, octave);
    }

    @Override
    public String toString() {
        return "Keypoint{x=" + x + ", y=" + y + ", size=" + size
                + ", angle=" + angle + ", response=" + response + ", octave=" + octave + '}';
    }
}
