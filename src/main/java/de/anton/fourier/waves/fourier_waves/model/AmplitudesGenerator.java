package de.anton.fourier.waves.fourier_waves.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Generates random amplitudes for a Fourier series, used to create challenges.
 * Consecutive sets are kept from being identical, within a limited number of attempts.
 */
public class AmplitudesGenerator {
    private static final Logger logger = LoggerFactory.getLogger(AmplitudesGenerator.class);

    static final int MAX_ATTEMPTS = 10;

    private final int numberOfHarmonics;
    private final double maxAmplitude;
    private final double amplitudeStep;
    private final Random random;

    public AmplitudesGenerator(int numberOfHarmonics, double maxAmplitude) {
        this(numberOfHarmonics, maxAmplitude, FourierConstants.GENERATED_AMPLITUDE_STEP, new Random());
    }

    /**
     * @param numberOfHarmonics Total number of amplitudes.
     * @param maxAmplitude      Largest magnitude of an amplitude.
     * @param amplitudeStep     Amplitudes are rounded to multiples of this step.
     * @param random            Source of randomness, seed it for reproducible amplitudes.
     */
    public AmplitudesGenerator(int numberOfHarmonics, double maxAmplitude, double amplitudeStep, Random random) {
        if (numberOfHarmonics < 1) {
            throw new IllegalArgumentException("numberOfHarmonics must be >= 1. Got: " + numberOfHarmonics);
        }
        if (!(maxAmplitude > 0) || !(amplitudeStep > 0) || amplitudeStep > maxAmplitude) {
            throw new IllegalArgumentException("Require 0 < amplitudeStep <= maxAmplitude. Got: step=" + amplitudeStep
                    + ", max=" + maxAmplitude);
        }
        this.numberOfHarmonics = numberOfHarmonics;
        this.maxAmplitude = maxAmplitude;
        this.amplitudeStep = amplitudeStep;
        this.random = (random != null) ? random : new Random();
    }

    /**
     * Creates amplitudes with numberOfNonZeroHarmonics non-zero values at random positions.
     *
     * @param numberOfNonZeroHarmonics In [1, numberOfHarmonics].
     * @param previousAmplitudes       Amplitudes of the previous challenge, or null.
     */
    public double[] createAmplitudes(int numberOfNonZeroHarmonics, double[] previousAmplitudes) {
        if (numberOfNonZeroHarmonics < 1 || numberOfNonZeroHarmonics > numberOfHarmonics) {
            throw new IllegalArgumentException("numberOfNonZeroHarmonics must be in [1, " + numberOfHarmonics
                    + "]. Got: " + numberOfNonZeroHarmonics);
        }
        if (previousAmplitudes != null && previousAmplitudes.length != numberOfHarmonics) {
            throw new IllegalArgumentException("previousAmplitudes must have " + numberOfHarmonics
                    + " values. Got: " + previousAmplitudes.length);
        }

        double[] amplitudes;
        int attempts = 0;
        do {
            amplitudes = generateRandomAmplitudes(numberOfNonZeroHarmonics);
            attempts++;
        } while (previousAmplitudes != null && attempts < MAX_ATTEMPTS && Arrays.equals(amplitudes, previousAmplitudes));

        if (previousAmplitudes != null && Arrays.equals(amplitudes, previousAmplitudes)) {
            logger.warn("Similar amplitudes were generated {} times in a row: {}", attempts, Arrays.toString(amplitudes));
        }
        logger.debug("Generated amplitudes {} after {} attempt(s)", Arrays.toString(amplitudes), attempts);
        return amplitudes;
    }

    private double[] generateRandomAmplitudes(int numberOfNonZeroHarmonics) {
        List<Integer> indices = new ArrayList<>(numberOfHarmonics);
        for (int i = 0; i < numberOfHarmonics; i++) {
            indices.add(i);
        }
        double[] amplitudes = new double[numberOfHarmonics];
        for (int i = 0; i < numberOfNonZeroHarmonics; i++) {
            int index = indices.remove(random.nextInt(indices.size()));
            double magnitude = roundToStep(random.nextDouble() * maxAmplitude);
            if (magnitude == 0) {
                magnitude = amplitudeStep;
            }
            amplitudes[index] = random.nextBoolean() ? magnitude : -magnitude;
        }
        return amplitudes;
    }

    // k / (1 / step) avoids results like 1.5000000000000002 for k * step.
    private double roundToStep(double value) {
        double rounded = Math.round(value / amplitudeStep) / (1 / amplitudeStep);
        return Math.min(maxAmplitude, rounded);
    }
}
