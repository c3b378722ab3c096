package de.anton.fourier.waves.fourier_waves.service;

import de.anton.fourier.waves.fourier_waves.model.AxisDescription;
import de.anton.fourier.waves.fourier_waves.model.Domain;
import de.anton.fourier.waves.fourier_waves.model.SeriesType;

import java.util.Objects;

/**
 * Immutable snapshot of the inputs shared by the charts of one screen, taken when a batch of changes is flushed.
 */
public record ChartContext(
    Domain domain,
    SeriesType seriesType,
    double t,                        // ms, only advances for SPACE_AND_TIME
    AxisDescription xAxisDescription // selected x zoom level
) {

    public ChartContext {
        Objects.requireNonNull(domain, "Domain cannot be null");
        Objects.requireNonNull(seriesType, "SeriesType cannot be null");
        Objects.requireNonNull(xAxisDescription, "xAxisDescription cannot be null");
        if (!(t >= 0)) {
            throw new IllegalArgumentException("t must be >= 0. Got: " + t);
        }
    }
}
