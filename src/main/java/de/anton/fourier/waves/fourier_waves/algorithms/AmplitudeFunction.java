package de.anton.fourier.waves.fourier_waves.algorithms;

import de.anton.fourier.waves.fourier_waves.model.Domain;
import de.anton.fourier.waves.fourier_waves.model.SeriesType;

import java.util.Objects;

/**
 * Computes the contribution of a single harmonic at a point.
 * There is one function for each (Domain, SeriesType) pair, obtained via {@link #of(Domain, SeriesType)}.
 *
 * <pre>
 * SPACE:          A sin|cos( 2 pi n x / L )
 * TIME:           A sin|cos( 2 pi n x / T )
 * SPACE_AND_TIME: A sin|cos( 2 pi n ( x / L - t / T ) )
 * </pre>
 */
@FunctionalInterface
public interface AmplitudeFunction {

    /**
     * @param A amplitude
     * @param n order of the harmonic, numbered from 1
     * @param x position, in m for SPACE and SPACE_AND_TIME, in ms for TIME
     * @param t time, in ms
     * @param L wavelength of the fundamental harmonic, must be positive
     * @param T period of the fundamental harmonic, must be positive
     * @return the amplitude at x (and t)
     */
    double evaluate(double A, int n, double x, double t, double L, double T);

    /**
     * Looks up the amplitude function for a domain and series type.
     *
     * @throws NullPointerException if either argument is null.
     */
    static AmplitudeFunction of(Domain domain, SeriesType seriesType) {
        Objects.requireNonNull(domain, "Domain cannot be null");
        Objects.requireNonNull(seriesType, "SeriesType cannot be null");
        switch (domain) {
            case SPACE:
                return (seriesType == SeriesType.SIN) ? AmplitudeFunctions::spaceSine : AmplitudeFunctions::spaceCosine;
            case TIME:
                return (seriesType == SeriesType.SIN) ? AmplitudeFunctions::timeSine : AmplitudeFunctions::timeCosine;
            case SPACE_AND_TIME:
                return (seriesType == SeriesType.SIN) ? AmplitudeFunctions::spaceAndTimeSine : AmplitudeFunctions::spaceAndTimeCosine;
            default:
                throw new IllegalArgumentException("Unsupported domain: " + domain);
        }
    }
}
