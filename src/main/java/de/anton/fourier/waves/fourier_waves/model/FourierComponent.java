package de.anton.fourier.waves.fourier_waves.model;

/**
 * One component of a wave packet's finite decomposition.
 *
 * @param waveNumber Spatial wave number k (rad/m) or angular frequency omega (rad/ms), at least 0.
 * @param amplitude  Amplitude, at least 0.
 */
public record FourierComponent(double waveNumber, double amplitude) {

    public FourierComponent {
        if (!(waveNumber >= 0)) {
            throw new IllegalArgumentException("waveNumber must be >= 0. Got: " + waveNumber);
        }
        if (!(amplitude >= 0)) {
            throw new IllegalArgumentException("amplitude must be >= 0. Got: " + amplitude);
        }
    }
}
