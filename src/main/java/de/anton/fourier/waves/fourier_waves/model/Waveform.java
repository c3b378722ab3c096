package de.anton.fourier.waves.fourier_waves.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Preset waveforms for the discrete Fourier series, all with a peak amplitude of 1.
 * <p>
 * TRIANGLE, SQUARE and SAWTOOTH also provide the waveform that an infinite number of harmonics would produce,
 * from base points in multiples of L or T. Those data sets always cover the largest x range.
 */
public enum Waveform {
    SINUSOID("Sinusoid", null),
    TRIANGLE("Triangle", points(
            -11 / 4d, 1, -9 / 4d, -1, -7 / 4d, 1, -5 / 4d, -1, -3 / 4d, 1, -1 / 4d, -1,
            1 / 4d, 1, 3 / 4d, -1, 5 / 4d, 1, 7 / 4d, -1, 9 / 4d, 1, 11 / 4d, -1)),
    SQUARE("Square", points(
            -3, -1, -3, 1, -5 / 2d, 1, -5 / 2d, -1, -2, -1, -2, 1, -3 / 2d, 1, -3 / 2d, -1,
            -1, -1, -1, 1, -1 / 2d, 1, -1 / 2d, -1, 0, -1, 0, 1, 1 / 2d, 1, 1 / 2d, -1,
            1, -1, 1, 1, 3 / 2d, 1, 3 / 2d, -1, 2, -1, 2, 1, 5 / 2d, 1, 5 / 2d, -1, 3, -1, 3, 1)),
    SAWTOOTH("Sawtooth", points(
            -7 / 2d, 1, -7 / 2d, -1, -5 / 2d, 1, -5 / 2d, -1, -3 / 2d, 1, -3 / 2d, -1, -1 / 2d, 1, -1 / 2d, -1,
            1 / 2d, 1, 1 / 2d, -1, 3 / 2d, 1, 3 / 2d, -1, 5 / 2d, 1, 5 / 2d, -1, 7 / 2d, 1, 7 / 2d, -1)),
    WAVE_PACKET("Wave Packet", null),
    CUSTOM("Custom", null);

    // Amplitudes of the WAVE_PACKET preset, indexed by numberOfHarmonics - 1.
    private static final double[][] WAVE_PACKET_AMPLITUDES = {
            { 1.000000 },
            { 0.457833, 0.457833 },
            { 0.249352, 1.000000, 0.249352 },
            { 0.172422, 0.822578, 0.822578, 0.172422 },
            { 0.135335, 0.606531, 1.000000, 0.606531, 0.135335 },
            { 0.114162, 0.457833, 0.916855, 0.916855, 0.457833, 0.114162 },
            { 0.100669, 0.360448, 0.774837, 1.000000, 0.774837, 0.360448, 0.100669 },
            { 0.091394, 0.295023, 0.644389, 0.952345, 0.952345, 0.644389, 0.295023, 0.091394 },
            { 0.084658, 0.249352, 0.539408, 0.856997, 1.000000, 0.856997, 0.539408, 0.249352, 0.084658 },
            { 0.079560, 0.216255, 0.457833, 0.754840, 0.969233, 0.969233, 0.754840, 0.457833, 0.216255, 0.079560 },
            { 0.075574, 0.191495, 0.394652, 0.661515, 0.901851, 1.000000, 0.901851, 0.661515, 0.394652, 0.191495, 0.075574 }
    };

    /** Largest amplitude of any preset: the fundamental of the square wave. */
    public static final double MAX_PRESET_AMPLITUDE = 4 / Math.PI;

    private final String displayName;
    private final List<DataPoint> infiniteHarmonicsBasePoints; // null if not supported

    Waveform(String displayName, List<DataPoint> infiniteHarmonicsBasePoints) {
        this.displayName = displayName;
        this.infiniteHarmonicsBasePoints = infiniteHarmonicsBasePoints;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /**
     * Gets the amplitudes of the harmonics that approximate this waveform.
     *
     * @param numberOfHarmonics Number of harmonics, at least 1.
     * @param seriesType        sin or cos.
     * @return numberOfHarmonics amplitudes, index 0 is order 1.
     * @throws IllegalArgumentException      for a sawtooth made of cosines, or an unsupported numberOfHarmonics.
     * @throws UnsupportedOperationException for CUSTOM.
     */
    public double[] getAmplitudes(int numberOfHarmonics, SeriesType seriesType) {
        Objects.requireNonNull(seriesType, "SeriesType cannot be null");
        if (numberOfHarmonics < 1) {
            throw new IllegalArgumentException("numberOfHarmonics must be >= 1. Got: " + numberOfHarmonics);
        }
        double[] amplitudes = new double[numberOfHarmonics];
        switch (this) {
            case SINUSOID:
                amplitudes[0] = 1;
                break;
            case TRIANGLE:
                for (int n = 1; n <= numberOfHarmonics; n += 2) {
                    double amplitude = 8 / (n * n * Math.PI * Math.PI);
                    amplitudes[n - 1] = (seriesType == SeriesType.SIN) ? alternatingSign(n) * amplitude : amplitude;
                }
                break;
            case SQUARE:
                for (int n = 1; n <= numberOfHarmonics; n += 2) {
                    double amplitude = 4 / (n * Math.PI);
                    amplitudes[n - 1] = (seriesType == SeriesType.SIN) ? amplitude : alternatingSign(n) * amplitude;
                }
                break;
            case SAWTOOTH:
                if (seriesType == SeriesType.COS) {
                    throw new IllegalArgumentException("A sawtooth cannot be made of cosines.");
                }
                for (int n = 1; n <= numberOfHarmonics; n++) {
                    amplitudes[n - 1] = ((n % 2 == 1) ? 1 : -1) * 2 / (n * Math.PI);
                }
                break;
            case WAVE_PACKET:
                if (numberOfHarmonics > WAVE_PACKET_AMPLITUDES.length) {
                    throw new IllegalArgumentException("Wave packet amplitudes are available for up to "
                            + WAVE_PACKET_AMPLITUDES.length + " harmonics. Got: " + numberOfHarmonics);
                }
                amplitudes = WAVE_PACKET_AMPLITUDES[numberOfHarmonics - 1].clone();
                break;
            case CUSTOM:
            default:
                throw new UnsupportedOperationException("Amplitudes are not defined for waveform " + this);
        }
        return amplitudes;
    }

    /** Largest number of harmonics every preset has a recipe for. */
    public static int getMaxPresetHarmonics() {
        return WAVE_PACKET_AMPLITUDES.length;
    }

    public boolean supportsInfiniteHarmonics() {
        return infiniteHarmonicsBasePoints != null;
    }

    /**
     * Creates the data set for an infinite number of harmonics. Base points are scaled by T for the TIME domain
     * and by L otherwise, shifted left a quarter period for cosines, and shifted with t for SPACE_AND_TIME.
     *
     * @return Points ordered by non-decreasing x. Discontinuities appear as two points with the same x.
     * @throws UnsupportedOperationException if this waveform has no infinite harmonics data set.
     */
    public List<DataPoint> getInfiniteHarmonicsDataSet(Domain domain, SeriesType seriesType, double t, double L, double T) {
        if (!supportsInfiniteHarmonics()) {
            throw new UnsupportedOperationException("Infinite harmonics are not supported for waveform " + this);
        }
        Objects.requireNonNull(domain, "Domain cannot be null");
        Objects.requireNonNull(seriesType, "SeriesType cannot be null");

        double x = (domain == Domain.TIME) ? T : L;
        double shiftX = (seriesType == SeriesType.SIN) ? 0 : (-0.25 * x);
        if (domain == Domain.SPACE_AND_TIME) {
            double remainder = (t / T - x / L) % 1;
            shiftX += remainder * x;
        }

        List<DataPoint> dataSet = new ArrayList<>(infiniteHarmonicsBasePoints.size());
        for (DataPoint point : infiniteHarmonicsBasePoints) {
            dataSet.add(new DataPoint(x * point.x() + shiftX, point.y()));
        }
        return Collections.unmodifiableList(dataSet);
    }

    // (-1)^((n-1)/2) for odd n
    private static int alternatingSign(int n) {
        return (((n - 1) / 2) % 2 == 0) ? 1 : -1;
    }

    private static List<DataPoint> points(double... xy) {
        List<DataPoint> points = new ArrayList<>(xy.length / 2);
        for (int i = 0; i < xy.length; i += 2) {
            points.add(new DataPoint(xy[i], xy[i + 1]));
        }
        return Collections.unmodifiableList(points);
    }
}
