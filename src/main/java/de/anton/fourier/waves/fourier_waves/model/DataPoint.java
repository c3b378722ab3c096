package de.anton.fourier.waves.fourier_waves.model;

/**
 * One sample of a data set. A data set (sample sequence) is a {@code List<DataPoint>} ordered by x.
 */
public record DataPoint(double x, double y) {
}
