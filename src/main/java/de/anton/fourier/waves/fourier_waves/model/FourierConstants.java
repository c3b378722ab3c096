package de.anton.fourier.waves.fourier_waves.model;

/**
 * Constants shared by the discrete and wave packet models.
 */
public final class FourierConstants {

    /** Maximum number of harmonics in a discrete Fourier series. */
    public static final int MAX_HARMONICS = 11;

    /** Maximum absolute amplitude of a harmonic. */
    public static final double MAX_AMPLITUDE = 1.5;

    /** Point budget for a data set that spans the whole x axis. */
    public static final int MAX_POINTS_PER_DATA_SET = 1000;

    /** Frequency of the fundamental harmonic, in Hz. */
    public static final double FUNDAMENTAL_FREQUENCY = 440;

    /** Wavelength of the fundamental harmonic, in m. */
    public static final double FUNDAMENTAL_WAVELENGTH = 1;

    /** Amplitude step used when generating random challenge amplitudes. */
    public static final double GENERATED_AMPLITUDE_STEP = 0.1;

    /** Points awarded for a correctly matched game challenge. */
    public static final int POINTS_PER_CHALLENGE = 1;

    public static final int NUMBER_OF_GAME_LEVELS = 5;

    /** Score at which a game level earns its reward. */
    public static final int REWARD_SCORE = 5;

    private FourierConstants() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }
}
