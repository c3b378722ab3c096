package de.anton.fourier.waves.fourier_waves.service;

import de.anton.fourier.waves.fourier_waves.algorithms.DataSetUtils;
import de.anton.fourier.waves.fourier_waves.model.AxisDescription;
import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import de.anton.fourier.waves.fourier_waves.model.Domain;
import de.anton.fourier.waves.fourier_waves.model.FourierComponent;
import de.anton.fourier.waves.fourier_waves.model.Harmonic;
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
 * Plots each component of a wave packet's finite decomposition. Empty when the packet has infinite components.
 * Fires "componentDataSets". The y axis is scaled to the largest component, with 10% padding.
 */
public class WavePacketComponentsChart extends DomainChart {
    private static final Logger logger = LoggerFactory.getLogger(WavePacketComponentsChart.class);

    public static final String PROPERTY_COMPONENT_DATA_SETS = "componentDataSets";

    private final WavePacket wavePacket;
    private final int pointsPerDataSet;
    private List<List<DataPoint>> componentDataSets = Collections.emptyList();
    private double maxComponentAmplitude;

    public WavePacketComponentsChart(WavePacket wavePacket, int pointsPerDataSet, ChartContext context) {
        super(WavePacket.L, WavePacket.T);
        this.wavePacket = Objects.requireNonNull(wavePacket, "wavePacket cannot be null");
        if (pointsPerDataSet < 2) {
            throw new IllegalArgumentException("pointsPerDataSet must be >= 2. Got: " + pointsPerDataSet);
        }
        this.pointsPerDataSet = pointsPerDataSet;
        update(context);
    }

    @Override
    protected void recompute() {
        ChartContext context = getContext();
        List<FourierComponent> components = wavePacket.getComponents();
        List<List<DataPoint>> oldDataSets = this.componentDataSets;
        if (components.isEmpty()) {
            this.componentDataSets = Collections.emptyList();
        } else {
            this.componentDataSets = createComponentsDataSets(components, wavePacket.getComponentSpacing(),
                    context.domain(), context.seriesType(), getXRange(), pointsPerDataSet);
        }
        double max = 0;
        for (List<DataPoint> dataSet : componentDataSets) {
            max = Math.max(max, DataSetUtils.maxY(dataSet));
        }
        this.maxComponentAmplitude = max;
        logger.trace("Components chart recomputed: {} data sets, max amplitude {}", componentDataSets.size(), max);
        support.firePropertyChange(PROPERTY_COMPONENT_DATA_SETS, oldDataSets, componentDataSets);
    }

    /**
     * Creates one data set per component, all sampled at the same x values. Component i is plotted as the
     * harmonic of order i + 1 of a fundamental with L = T = 2 pi / componentSpacing, at t = 0.
     *
     * @param components       Finite decomposition, not empty.
     * @param componentSpacing Spacing of the decomposition, must be positive.
     * @param domain           Domain of the plot.
     * @param seriesType       sin or cos.
     * @param xRange           Range of x.
     * @param pointsPerDataSet Points in each data set.
     */
    public static List<List<DataPoint>> createComponentsDataSets(List<FourierComponent> components, double componentSpacing,
                                                                 Domain domain, SeriesType seriesType, Range xRange,
                                                                 int pointsPerDataSet) {
        Objects.requireNonNull(components, "components cannot be null");
        if (components.isEmpty()) {
            throw new IllegalArgumentException("At least one component is required.");
        }
        if (!(componentSpacing > 0)) {
            throw new IllegalArgumentException("Component spacing must be positive for a finite decomposition. Got: " + componentSpacing);
        }
        double L = 2 * Math.PI / componentSpacing;
        double T = L; // the wave packet uses the same formula for space and time
        double t = 0; // no animation

        List<List<DataPoint>> dataSets = new ArrayList<>(components.size());
        for (int order = 1; order <= components.size(); order++) {
            double amplitude = components.get(order - 1).amplitude();
            dataSets.add(Harmonic.createDataSet(order, amplitude, pointsPerDataSet, L, T, xRange, domain, seriesType, t));
        }
        return Collections.unmodifiableList(dataSets);
    }

    public List<List<DataPoint>> getComponentDataSets() { return componentDataSets; }

    /** Largest y over all component data sets, 0 when there are none. */
    public double getMaxComponentAmplitude() { return maxComponentAmplitude; }

    /**
     * Range [-1.1 max, 1.1 max] with ticks and grid lines at the largest amplitude.
     * Without components (infinite decomposition) nothing is plotted and the Sum chart's axis is used.
     */
    public AxisDescription getYAxisDescription() {
        if (maxComponentAmplitude > 0) {
            return new AxisDescription(Range.symmetric(1.1 * maxComponentAmplitude),
                    maxComponentAmplitude, maxComponentAmplitude, maxComponentAmplitude);
        }
        return WavePacketAxisDescriptions.SUM_Y_AXIS_DESCRIPTION;
    }

    public WavePacket getWavePacket() { return wavePacket; }

    public int getPointsPerDataSet() { return pointsPerDataSet; }
}
