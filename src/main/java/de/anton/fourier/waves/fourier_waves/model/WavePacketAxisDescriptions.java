package de.anton.fourier.waves.fourier_waves.model;

import java.util.List;

/**
 * Zoom-level tables for the charts of the wave packet. The model uses L = T = 1, so x values are used as-is.
 */
public final class WavePacketAxisDescriptions {

    /** x axis of the Components and Sum charts. */
    public static final List<AxisDescription> X_AXIS_DESCRIPTIONS = AxisDescription.validateTable(
            "WavePacketAxisDescriptions.X_AXIS_DESCRIPTIONS",
            List.of(
                    new AxisDescription(Range.symmetric(8), 1, 1, 1),
                    new AxisDescription(Range.symmetric(4), 1, 0.5, 1),
                    new AxisDescription(Range.symmetric(2), 0.5, 0.5, 0.5),
                    new AxisDescription(Range.symmetric(1), 0.5, 0.1, 0.5),
                    new AxisDescription(Range.symmetric(0.5), 0.1, 0.1, 0.1)),
            true, 0);

    public static final AxisDescription DEFAULT_X_AXIS_DESCRIPTION = X_AXIS_DESCRIPTIONS.get(2);

    /** x axis of the Amplitudes chart, in multiples of pi. There is a single zoom level. */
    public static final AxisDescription AMPLITUDES_X_AXIS_DESCRIPTION =
            new AxisDescription(new Range(0, 24), 24, 1, 2);

    /** y axis of the Amplitudes chart. The best fit follows the peak amplitude. */
    public static final List<AxisDescription> AMPLITUDES_Y_AXIS_DESCRIPTIONS = AxisDescription.validateTable(
            "WavePacketAxisDescriptions.AMPLITUDES_Y_AXIS_DESCRIPTIONS",
            List.of(
                    new AxisDescription(new Range(0, 1), 1, 0.5, 1),
                    new AxisDescription(new Range(0, 0.5), 0.2, 0.1, 0.2),
                    new AxisDescription(new Range(0, 0.05), 0.05, 0.01, 0.05),
                    new AxisDescription(new Range(0, 0.02), 0.01, 0.005, 0.01),
                    new AxisDescription(new Range(0, 0.01), 0.005, 0.001, 0.005)),
            false, 0);

    /** y axis of the Sum chart, fixed. */
    public static final AxisDescription SUM_Y_AXIS_DESCRIPTION = new AxisDescription(Range.symmetric(1.1), 1, 1, 1);

    private WavePacketAxisDescriptions() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }
}
