package de.anton.fourier.waves.fourier_waves.model;

/**
 * Format of the x-axis tick labels.
 */
public enum TickLabelFormat {
    NUMERIC,  // e.g. 0.5
    SYMBOLIC; // e.g. L/2

    /** Tick labels are numeric only while the equation is hidden. */
    public static TickLabelFormat forEquationForm(EquationForm equationForm) {
        return (equationForm == EquationForm.HIDDEN) ? NUMERIC : SYMBOLIC;
    }
}
