package de.anton.fourier.waves.fourier_waves.model;

import java.util.List;

/**
 * Zoom-level tables for the Harmonics and Sum charts of the discrete Fourier series.
 * Tables are ordered from most zoomed-out to most zoomed-in and validated when this class is initialized.
 */
public final class DiscreteAxisDescriptions {

    /**
     * X axis zoom levels. Values are multipliers of L (SPACE, SPACE_AND_TIME) or T (TIME).
     * Every range is at least 1/2 long, so that the wavelength or period of the highest harmonic stays visible.
     */
    public static final List<AxisDescription> X_AXIS_DESCRIPTIONS = AxisDescription.validateTable(
            "DiscreteAxisDescriptions.X_AXIS_DESCRIPTIONS",
            List.of(
                    new AxisDescription(Range.symmetric(2), 1 / 8d, 1 / 4d, 1 / 2d),
                    new AxisDescription(Range.symmetric(3 / 2d), 1 / 8d, 1 / 4d, 1 / 2d),
                    new AxisDescription(Range.symmetric(1), 1 / 8d, 1 / 4d, 1 / 4d),
                    new AxisDescription(Range.symmetric(3 / 4d), 1 / 8d, 1 / 4d, 1 / 4d),
                    new AxisDescription(Range.symmetric(1 / 2d), 1 / 8d, 1 / 4d, 1 / 4d)),
            true, 0.5);

    public static final AxisDescription DEFAULT_X_AXIS_DESCRIPTION = X_AXIS_DESCRIPTIONS.get(4);

    /**
     * Y axis zoom levels for the Sum chart. The first entry bounds the largest possible sum,
     * MAX_HARMONICS * MAX_AMPLITUDE, plus headroom.
     */
    public static final List<AxisDescription> Y_AXIS_DESCRIPTIONS = AxisDescription.validateTable(
            "DiscreteAxisDescriptions.Y_AXIS_DESCRIPTIONS",
            List.of(
                    new AxisDescription(Range.symmetric(20), 5, 5, 10),
                    new AxisDescription(Range.symmetric(5), 1, 5, 5),
                    new AxisDescription(Range.symmetric(4), 1, 2, 2),
                    new AxisDescription(Range.symmetric(2), 1, 1, 1),
                    new AxisDescription(Range.symmetric(FourierConstants.MAX_AMPLITUDE), 0.5, 0.5, 0.5)),
            true, 0);

    public static final AxisDescription DEFAULT_Y_AXIS_DESCRIPTION =
            Y_AXIS_DESCRIPTIONS.get(Y_AXIS_DESCRIPTIONS.size() - 1);

    static {
        if (X_AXIS_DESCRIPTIONS.get(0).range().max() != 2) {
            throw new IllegalStateException("The most zoomed-out x range must be [-2, 2], so that the infinite "
                    + "harmonics overlays are fully visible. Got: " + X_AXIS_DESCRIPTIONS.get(0).range());
        }
        if (DEFAULT_Y_AXIS_DESCRIPTION.range().max() != FourierConstants.MAX_AMPLITUDE) {
            throw new IllegalStateException("The default y range must match the amplitude range. Got: "
                    + DEFAULT_Y_AXIS_DESCRIPTION.range());
        }
        double maxSum = FourierConstants.MAX_HARMONICS * FourierConstants.MAX_AMPLITUDE * 1.05;
        if (Y_AXIS_DESCRIPTIONS.get(0).range().max() < maxSum) {
            throw new IllegalStateException("The most zoomed-out y range must bound the largest sum " + maxSum
                    + ". Got: " + Y_AXIS_DESCRIPTIONS.get(0).range());
        }
    }

    private DiscreteAxisDescriptions() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }
}
