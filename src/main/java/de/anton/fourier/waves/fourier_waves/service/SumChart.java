package de.anton.fourier.waves.fourier_waves.service;

import de.anton.fourier.waves.fourier_waves.algorithms.DataSetUtils;
import de.anton.fourier.waves.fourier_waves.model.AxisDescription;
import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import de.anton.fourier.waves.fourier_waves.model.FourierSeries;
import de.anton.fourier.waves.fourier_waves.model.Range;
import de.anton.fourier.waves.fourier_waves.model.Waveform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Plots the sum of the harmonics of a Fourier series. The y axis is the best fit for the peak of the sum,
 * never smaller than the amplitude range. Optionally overlays the waveform that an infinite number of harmonics
 * would produce, for the preset waveforms that support it.
 * <p>
 * Fires "sumDataSet", "yAxisDescription" and "infiniteHarmonicsDataSet".
 */
public class SumChart extends DomainChart {
    private static final Logger logger = LoggerFactory.getLogger(SumChart.class);

    public static final String PROPERTY_SUM_DATA_SET = "sumDataSet";
    public static final String PROPERTY_Y_AXIS_DESCRIPTION = "yAxisDescription";
    public static final String PROPERTY_INFINITE_HARMONICS_DATA_SET = "infiniteHarmonicsDataSet";

    // Headroom above the peak of the sum.
    static final double PEAK_MARGIN = 1.05;

    private final FourierSeries fourierSeries;
    private final List<AxisDescription> yAxisDescriptions;
    private final Supplier<Waveform> waveformSupplier;

    private boolean infiniteHarmonicsVisible = false;
    private List<DataPoint> sumDataSet = Collections.emptyList();
    private Range yAxisRange;
    private AxisDescription yAxisDescription;
    private List<DataPoint> infiniteHarmonicsDataSet = Collections.emptyList();

    /**
     * @param fourierSeries     The series to sum.
     * @param yAxisDescriptions Table for the y axis best fit.
     * @param waveformSupplier  Supplies the selected preset waveform.
     * @param context           Initial inputs.
     */
    public SumChart(FourierSeries fourierSeries, List<AxisDescription> yAxisDescriptions,
                    Supplier<Waveform> waveformSupplier, ChartContext context) {
        super(fourierSeries.getL(), fourierSeries.getT());
        this.fourierSeries = fourierSeries;
        this.yAxisDescriptions = Objects.requireNonNull(yAxisDescriptions, "yAxisDescriptions cannot be null");
        this.waveformSupplier = Objects.requireNonNull(waveformSupplier, "waveformSupplier cannot be null");
        update(context);
    }

    @Override
    protected void recompute() {
        ChartContext context = getContext();
        List<DataPoint> oldSumDataSet = this.sumDataSet;
        this.sumDataSet = fourierSeries.createSumDataSet(context.xAxisDescription(), context.domain(), context.seriesType(), context.t());

        double peakAmplitude = DataSetUtils.maxY(sumDataSet);
        double maxY = Math.max(fourierSeries.getAmplitudeRange().max(), peakAmplitude * PEAK_MARGIN);
        this.yAxisRange = Range.symmetric(maxY);
        AxisDescription oldYAxisDescription = this.yAxisDescription;
        this.yAxisDescription = AxisDescription.getBestFit(yAxisRange, yAxisDescriptions);
        logger.trace("Sum chart recomputed: peak={}, y axis {}", peakAmplitude, yAxisDescription.range());

        support.firePropertyChange(PROPERTY_SUM_DATA_SET, oldSumDataSet, sumDataSet);
        support.firePropertyChange(PROPERTY_Y_AXIS_DESCRIPTION, oldYAxisDescription, yAxisDescription);
        updateInfiniteHarmonicsDataSet(context);
    }

    private void updateInfiniteHarmonicsDataSet(ChartContext context) {
        Waveform waveform = waveformSupplier.get();
        List<DataPoint> oldDataSet = this.infiniteHarmonicsDataSet;
        if (infiniteHarmonicsVisible && waveform != null && waveform.supportsInfiniteHarmonics()) {
            this.infiniteHarmonicsDataSet = waveform.getInfiniteHarmonicsDataSet(context.domain(), context.seriesType(),
                    context.t(), fourierSeries.getL(), fourierSeries.getT());
        } else {
            this.infiniteHarmonicsDataSet = Collections.emptyList();
        }
        support.firePropertyChange(PROPERTY_INFINITE_HARMONICS_DATA_SET, oldDataSet, infiniteHarmonicsDataSet);
    }

    public boolean isInfiniteHarmonicsVisible() { return infiniteHarmonicsVisible; }

    /** Shows or hides the infinite harmonics. Takes effect with the next {@link #update(ChartContext)}. */
    public void setInfiniteHarmonicsVisible(boolean infiniteHarmonicsVisible) {
        if (this.infiniteHarmonicsVisible != infiniteHarmonicsVisible) {
            this.infiniteHarmonicsVisible = infiniteHarmonicsVisible;
            logger.info("Infinite harmonics {}", infiniteHarmonicsVisible ? "shown" : "hidden");
        }
    }

    public List<DataPoint> getSumDataSet() { return sumDataSet; }
    public Range getYAxisRange() { return yAxisRange; }
    public AxisDescription getYAxisDescription() { return yAxisDescription; }

    /** Empty unless infinite harmonics are visible and the waveform supports them. */
    public List<DataPoint> getInfiniteHarmonicsDataSet() { return infiniteHarmonicsDataSet; }

    public FourierSeries getFourierSeries() { return fourierSeries; }

    /** Restores the defaults. Takes effect with the next {@link #update(ChartContext)}. */
    public void reset() {
        setInfiniteHarmonicsVisible(false);
    }
}
