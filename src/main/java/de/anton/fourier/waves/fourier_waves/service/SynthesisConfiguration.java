package de.anton.fourier.waves.fourier_waves.service;

import de.anton.fourier.waves.fourier_waves.model.DiscreteAxisDescriptions;
import de.anton.fourier.waves.fourier_waves.model.FourierConstants;
import de.anton.fourier.waves.fourier_waves.model.Waveform;

/**
 * Immutable configuration object holding the numeric parameters of a discrete Fourier series
 * and the point budget of the data sets derived from it.
 */
public record SynthesisConfiguration(
    int maxHarmonics,            // fixed arity of the harmonic list
    double maxAmplitude,         // amplitudes live in [-maxAmplitude, maxAmplitude]
    int maxPointsPerDataSet,     // point budget for a data set spanning the x axis
    double fundamentalFrequency, // Hz
    double fundamentalWavelength // m
) {

    public SynthesisConfiguration {
        if (maxHarmonics <= 0) {
            throw new IllegalArgumentException("maxHarmonics must be positive. Got: " + maxHarmonics);
        }
        if (!(maxAmplitude > 0)) {
            throw new IllegalArgumentException("maxAmplitude must be positive. Got: " + maxAmplitude);
        }
        if (maxPointsPerDataSet < 2) {
            throw new IllegalArgumentException("maxPointsPerDataSet must be at least 2. Got: " + maxPointsPerDataSet);
        }
        if (!(fundamentalFrequency > 0) || !(fundamentalWavelength > 0)) {
            throw new IllegalArgumentException("Fundamental frequency and wavelength must be positive. Got: "
                    + fundamentalFrequency + " Hz, " + fundamentalWavelength + " m");
        }
        // Presets and the sum chart's y axis table are fixed; the configuration must stay within them.
        if (maxHarmonics > Waveform.getMaxPresetHarmonics()) {
            throw new IllegalArgumentException("maxHarmonics must be <= " + Waveform.getMaxPresetHarmonics()
                    + ", the largest number of harmonics with preset amplitudes. Got: " + maxHarmonics);
        }
        if (maxAmplitude < Waveform.MAX_PRESET_AMPLITUDE) {
            throw new IllegalArgumentException("maxAmplitude must be >= " + Waveform.MAX_PRESET_AMPLITUDE
                    + ", the largest preset amplitude. Got: " + maxAmplitude);
        }
        double maxSumAxis = DiscreteAxisDescriptions.Y_AXIS_DESCRIPTIONS.get(0).range().max();
        if (maxHarmonics * maxAmplitude * SumChart.PEAK_MARGIN > maxSumAxis) {
            throw new IllegalArgumentException("The largest possible sum, maxHarmonics * maxAmplitude, exceeds the sum "
                    + "chart's y axis [-" + maxSumAxis + ", " + maxSumAxis + "]. Got: " + maxHarmonics + " * " + maxAmplitude);
        }
    }

    /** The configuration used by the discrete screen. */
    public static SynthesisConfiguration defaults() {
        return new SynthesisConfiguration(
                FourierConstants.MAX_HARMONICS,
                FourierConstants.MAX_AMPLITUDE,
                FourierConstants.MAX_POINTS_PER_DATA_SET,
                FourierConstants.FUNDAMENTAL_FREQUENCY,
                FourierConstants.FUNDAMENTAL_WAVELENGTH);
    }

    /** Period of the fundamental harmonic, in ms. */
    public double fundamentalPeriod() {
        return 1000 / fundamentalFrequency;
    }
}
