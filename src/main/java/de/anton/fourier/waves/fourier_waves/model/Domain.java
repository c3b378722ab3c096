package de.anton.fourier.waves.fourier_waves.model;

/**
 * Enumeration of the independent variable(s) that a waveform is plotted against.
 */
public enum Domain {
    SPACE("Space", "F(x)"),                   // plotted against x, in m
    TIME("Time", "F(t)"),                     // plotted against t, in ms
    SPACE_AND_TIME("Space & Time", "F(x,t)"); // plotted against x while t advances

    private final String displayName;
    private final String functionOf;

    Domain(String displayName, String functionOf) {
        this.displayName = displayName;
        this.functionOf = functionOf;
    }

    /**
     * Returns the function notation for this domain, e.g. "F(x)".
     * @return The function notation.
     */
    public String getFunctionOf() {
        return functionOf;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
