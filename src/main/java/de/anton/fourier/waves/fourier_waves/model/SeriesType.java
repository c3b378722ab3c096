package de.anton.fourier.waves.fourier_waves.model;

/**
 * The trigonometric basis used for every term of a Fourier series.
 */
public enum SeriesType {
    SIN("sin"),
    COS("cos");

    private final String symbol;

    SeriesType(String symbol) {
        this.symbol = symbol;
    }

    /** @return the basis function name as it appears in equations. */
    public String getSymbol() {
        return symbol;
    }

    /** @return the other basis, 90 degrees out of phase with this one. */
    public SeriesType opposite() {
        return (this == SIN) ? COS : SIN;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
