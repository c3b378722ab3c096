package de.anton.fourier.waves.fourier_waves.algorithms;

/**
 * The six closed-form harmonic amplitude functions. Use {@link AmplitudeFunction#of} to select one.
 */
final class AmplitudeFunctions {

    private static final double TWO_PI = 2 * Math.PI;

    private AmplitudeFunctions() { throw new IllegalStateException("Utility class"); }

    static double spaceSine(double A, int n, double x, double t, double L, double T) {
        checkFundamentals(L, T);
        return A * Math.sin(TWO_PI * n * x / L);
    }

    static double spaceCosine(double A, int n, double x, double t, double L, double T) {
        checkFundamentals(L, T);
        return A * Math.cos(TWO_PI * n * x / L);
    }

    static double timeSine(double A, int n, double x, double t, double L, double T) {
        checkFundamentals(L, T);
        return A * Math.sin(TWO_PI * n * x / T);
    }

    static double timeCosine(double A, int n, double x, double t, double L, double T) {
        checkFundamentals(L, T);
        return A * Math.cos(TWO_PI * n * x / T);
    }

    static double spaceAndTimeSine(double A, int n, double x, double t, double L, double T) {
        checkFundamentals(L, T);
        return A * Math.sin(TWO_PI * n * (x / L - t / T));
    }

    static double spaceAndTimeCosine(double A, int n, double x, double t, double L, double T) {
        checkFundamentals(L, T);
        return A * Math.cos(TWO_PI * n * (x / L - t / T));
    }

    private static void checkFundamentals(double L, double T) {
        if (!(L > 0)) {
            throw new IllegalArgumentException("Wavelength L must be positive. Got: " + L);
        }
        if (!(T > 0)) {
            throw new IllegalArgumentException("Period T must be positive. Got: " + T);
        }
    }
}
