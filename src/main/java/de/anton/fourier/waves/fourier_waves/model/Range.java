package de.anton.fourier.waves.fourier_waves.model;

/**
 * Immutable closed interval [min, max].
 *
 * @param min Lower bound.
 * @param max Upper bound, must be {@code >= min}.
 */
public record Range(double min, double max) {

    public Range {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("Range bounds cannot be NaN.");
        }
        if (max < min) {
            throw new IllegalArgumentException("Range max must be >= min. Got: [" + min + ", " + max + "]");
        }
    }

    /** Creates the range [-max, max]. */
    public static Range symmetric(double max) {
        return new Range(-max, max);
    }

    public double getLength() {
        return max - min;
    }

    public double getCenter() {
        return (min + max) / 2;
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    /** Clamps value into this range. */
    public double constrain(double value) {
        return Math.max(min, Math.min(max, value));
    }

    /** @return a new range with both bounds multiplied by factor (factor must be positive). */
    public Range times(double factor) {
        if (!(factor > 0)) {
            throw new IllegalArgumentException("Range multiplier must be positive. Got: " + factor);
        }
        return new Range(min * factor, max * factor);
    }
}
