package de.anton.fourier.waves.fourier_waves.service;

import de.anton.fourier.waves.fourier_waves.algorithms.DataSetUtils;
import de.anton.fourier.waves.fourier_waves.model.AxisDescription;
import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import de.anton.fourier.waves.fourier_waves.model.Range;
import de.anton.fourier.waves.fourier_waves.model.SeriesType;
import de.anton.fourier.waves.fourier_waves.model.WavePacket;
import de.anton.fourier.waves.fourier_waves.model.WavePacketAxisDescriptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Plots the sum of a wave packet's components, or the closed-form packet when it has infinite components,
 * and optionally the envelope of that waveform. The y axis is fixed.
 * <p>
 * Fires "sumDataSet" and "waveformEnvelopeDataSet".
 */
public class WavePacketSumChart extends DomainChart {
    private static final Logger logger = LoggerFactory.getLogger(WavePacketSumChart.class);

    public static final String PROPERTY_SUM_DATA_SET = "sumDataSet";
    public static final String PROPERTY_WAVEFORM_ENVELOPE_DATA_SET = "waveformEnvelopeDataSet";

    // Height at which the packet falls to exp(-1/2) of its peak, one sigma from the center.
    private static final DataPoint WIDTH_INDICATOR_POSITION = new DataPoint(0, 1 / Math.sqrt(Math.E));

    private final WavePacketComponentsChart componentsChart;
    private final WavePacket wavePacket;
    private final int maxPointsPerDataSet;

    private boolean waveformEnvelopeVisible = true;
    private List<DataPoint> sumDataSet = Collections.emptyList();
    private List<DataPoint> waveformEnvelopeDataSet = Collections.emptyList();

    /**
     * @param componentsChart     Provides the component data sets. It must be updated before this chart.
     * @param maxPointsPerDataSet Point budget for the closed-form packet.
     * @param context             Initial inputs.
     */
    public WavePacketSumChart(WavePacketComponentsChart componentsChart, int maxPointsPerDataSet, ChartContext context) {
        super(WavePacket.L, WavePacket.T);
        this.componentsChart = Objects.requireNonNull(componentsChart, "componentsChart cannot be null");
        this.wavePacket = componentsChart.getWavePacket();
        this.maxPointsPerDataSet = maxPointsPerDataSet;
        update(context);
    }

    @Override
    protected void recompute() {
        ChartContext context = getContext();
        Range xRange = getXRange();
        List<DataPoint> oldSumDataSet = this.sumDataSet;
        List<DataPoint> oldEnvelopeDataSet = this.waveformEnvelopeDataSet;

        if (wavePacket.hasInfiniteComponents()) {
            double center = wavePacket.getCenter();
            double conjugateStandardDeviation = wavePacket.getConjugateStandardDeviation();
            this.sumDataSet = createWavePacketDataSet(center, conjugateStandardDeviation, context.seriesType(), xRange, maxPointsPerDataSet);
            if (waveformEnvelopeVisible) {
                List<DataPoint> sinDataSet = createWavePacketDataSet(center, conjugateStandardDeviation, SeriesType.SIN, xRange, maxPointsPerDataSet);
                List<DataPoint> cosDataSet = createWavePacketDataSet(center, conjugateStandardDeviation, SeriesType.COS, xRange, maxPointsPerDataSet);
                this.waveformEnvelopeDataSet = DataSetUtils.envelope(sinDataSet, cosDataSet);
            } else {
                this.waveformEnvelopeDataSet = Collections.emptyList();
            }
        } else {
            List<List<DataPoint>> componentDataSets = componentsChart.getComponentDataSets();
            this.sumDataSet = DataSetUtils.sum(componentDataSets);
            if (waveformEnvelopeVisible) {
                // The sum in the other series type is 90 degrees out of phase with the actual sum.
                List<List<DataPoint>> otherComponentDataSets = WavePacketComponentsChart.createComponentsDataSets(
                        wavePacket.getComponents(), wavePacket.getComponentSpacing(), context.domain(),
                        context.seriesType().opposite(), xRange, componentsChart.getPointsPerDataSet());
                this.waveformEnvelopeDataSet = DataSetUtils.envelope(sumDataSet, DataSetUtils.sum(otherComponentDataSets));
            } else {
                this.waveformEnvelopeDataSet = Collections.emptyList();
            }
        }
        logger.trace("Wave packet sum chart recomputed: {} points, envelope {} points", sumDataSet.size(),
                waveformEnvelopeDataSet.size());

        support.firePropertyChange(PROPERTY_SUM_DATA_SET, oldSumDataSet, sumDataSet);
        support.firePropertyChange(PROPERTY_WAVEFORM_ENVELOPE_DATA_SET, oldEnvelopeDataSet, waveformEnvelopeDataSet);
    }

    /**
     * Samples the closed-form packet exp(-x^2 / (2 sigmaX^2)) * sin|cos(center * x) at maxPointsPerDataSet + 1
     * points, starting at xRange.min with dx = xRange.length / (maxPointsPerDataSet + 1).
     */
    public static List<DataPoint> createWavePacketDataSet(double center, double conjugateStandardDeviation,
                                                          SeriesType seriesType, Range xRange, int maxPointsPerDataSet) {
        if (!(center > 0) || !(conjugateStandardDeviation > 0)) {
            throw new IllegalArgumentException("center and conjugateStandardDeviation must be positive. Got: "
                    + center + ", " + conjugateStandardDeviation);
        }
        Objects.requireNonNull(seriesType, "SeriesType cannot be null");
        Objects.requireNonNull(xRange, "xRange cannot be null");

        int numberOfPoints = maxPointsPerDataSet + 1;
        double dx = xRange.getLength() / numberOfPoints;
        List<DataPoint> dataSet = new ArrayList<>(numberOfPoints);
        for (int i = 0; i < numberOfPoints; i++) {
            double x = xRange.min() + i * dx;
            double sinCosTerm = (seriesType == SeriesType.SIN) ? Math.sin(center * x) : Math.cos(center * x);
            double y = Math.exp(-(x * x) / (2 * conjugateStandardDeviation * conjugateStandardDeviation)) * sinCosTerm;
            dataSet.add(new DataPoint(x, y));
        }
        return Collections.unmodifiableList(dataSet);
    }

    public List<DataPoint> getSumDataSet() { return sumDataSet; }

    /** Empty when the envelope is hidden. */
    public List<DataPoint> getWaveformEnvelopeDataSet() { return waveformEnvelopeDataSet; }

    public AxisDescription getYAxisDescription() {
        return WavePacketAxisDescriptions.SUM_Y_AXIS_DESCRIPTION;
    }

    /** Width of the indicator, 2 sigmaX. */
    public double getWidthIndicatorWidth() {
        return 2 * wavePacket.getConjugateStandardDeviation();
    }

    public DataPoint getWidthIndicatorPosition() {
        return WIDTH_INDICATOR_POSITION;
    }

    public boolean isWaveformEnvelopeVisible() { return waveformEnvelopeVisible; }

    /** Shows or hides the envelope. Takes effect with the next {@link #update(ChartContext)}. */
    public void setWaveformEnvelopeVisible(boolean waveformEnvelopeVisible) {
        if (this.waveformEnvelopeVisible != waveformEnvelopeVisible) {
            this.waveformEnvelopeVisible = waveformEnvelopeVisible;
            logger.info("Waveform envelope {}", waveformEnvelopeVisible ? "shown" : "hidden");
        }
    }

    /** Restores the defaults. Takes effect with the next {@link #update(ChartContext)}. */
    public void reset() {
        setWaveformEnvelopeVisible(true);
    }
}
