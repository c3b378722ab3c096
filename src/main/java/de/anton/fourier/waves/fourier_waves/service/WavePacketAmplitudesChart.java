package de.anton.fourier.waves.fourier_waves.service;

import de.anton.fourier.waves.fourier_waves.algorithms.DataSetUtils;
import de.anton.fourier.waves.fourier_waves.model.AxisDescription;
import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import de.anton.fourier.waves.fourier_waves.model.FourierComponent;
import de.anton.fourier.waves.fourier_waves.model.Range;
import de.anton.fourier.waves.fourier_waves.model.WavePacket;
import de.anton.fourier.waves.fourier_waves.model.WavePacketAxisDescriptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Amplitudes of a wave packet's components, plotted against wave number. The x axis is fixed, in multiples of pi.
 * <p>
 * Fires "finiteComponentsDataSet", "continuousWaveformDataSet", "infiniteComponentsDataSet",
 * "yAxisDescription" and "widthIndicator".
 */
public class WavePacketAmplitudesChart extends DomainChart {
    private static final Logger logger = LoggerFactory.getLogger(WavePacketAmplitudesChart.class);

    public static final String PROPERTY_FINITE_COMPONENTS_DATA_SET = "finiteComponentsDataSet";
    public static final String PROPERTY_CONTINUOUS_WAVEFORM_DATA_SET = "continuousWaveformDataSet";
    public static final String PROPERTY_INFINITE_COMPONENTS_DATA_SET = "infiniteComponentsDataSet";
    public static final String PROPERTY_Y_AXIS_DESCRIPTION = "yAxisDescription";
    public static final String PROPERTY_WIDTH_INDICATOR = "widthIndicator";
    public static final String PROPERTY_CONTINUOUS_WAVEFORM_VISIBLE = "continuousWaveformVisible";

    private static final double X_AXIS_MULTIPLIER = Math.PI;

    private final WavePacket wavePacket;

    private boolean continuousWaveformVisible = true;
    private List<DataPoint> finiteComponentsDataSet = Collections.emptyList();
    private List<DataPoint> continuousWaveformDataSet = Collections.emptyList();
    private List<DataPoint> infiniteComponentsDataSet = Collections.emptyList();
    private double peakAmplitude;
    private AxisDescription yAxisDescription;
    private double widthIndicatorWidth;
    private DataPoint widthIndicatorPosition;

    public WavePacketAmplitudesChart(WavePacket wavePacket, ChartContext context) {
        super(X_AXIS_MULTIPLIER, X_AXIS_MULTIPLIER);
        this.wavePacket = Objects.requireNonNull(wavePacket, "wavePacket cannot be null");
        update(context);
    }

    @Override
    protected void recompute() {
        List<DataPoint> oldFinite = this.finiteComponentsDataSet;
        List<DataPoint> oldContinuous = this.continuousWaveformDataSet;
        List<DataPoint> oldInfinite = this.infiniteComponentsDataSet;
        AxisDescription oldYAxisDescription = this.yAxisDescription;
        DataPoint oldWidthIndicatorPosition = this.widthIndicatorPosition;

        List<FourierComponent> components = wavePacket.getComponents();
        List<DataPoint> finite = new ArrayList<>(components.size());
        for (FourierComponent component : components) {
            finite.add(new DataPoint(component.waveNumber(), component.amplitude()));
        }
        this.finiteComponentsDataSet = Collections.unmodifiableList(finite);
        this.continuousWaveformDataSet = wavePacket.createContinuousWaveformDataSet();
        this.infiniteComponentsDataSet = wavePacket.hasInfiniteComponents() ? continuousWaveformDataSet : Collections.emptyList();

        this.peakAmplitude = DataSetUtils.maxY(continuousWaveformDataSet);
        this.yAxisDescription = AxisDescription.getBestFit(new Range(0, peakAmplitude),
                WavePacketAxisDescriptions.AMPLITUDES_Y_AXIS_DESCRIPTIONS);

        this.widthIndicatorWidth = wavePacket.getWidth();
        double center = wavePacket.getCenter();
        double y = wavePacket.getComponentAmplitude(center + wavePacket.getStandardDeviation());
        if (!wavePacket.hasInfiniteComponents()) {
            y *= wavePacket.getComponentSpacing();
        }
        this.widthIndicatorPosition = new DataPoint(center, y);
        logger.trace("Amplitudes chart recomputed: {} components, peak={}, y axis {}", components.size(),
                peakAmplitude, yAxisDescription.range());

        support.firePropertyChange(PROPERTY_FINITE_COMPONENTS_DATA_SET, oldFinite, finiteComponentsDataSet);
        support.firePropertyChange(PROPERTY_CONTINUOUS_WAVEFORM_DATA_SET, oldContinuous, continuousWaveformDataSet);
        support.firePropertyChange(PROPERTY_INFINITE_COMPONENTS_DATA_SET, oldInfinite, infiniteComponentsDataSet);
        support.firePropertyChange(PROPERTY_Y_AXIS_DESCRIPTION, oldYAxisDescription, yAxisDescription);
        support.firePropertyChange(PROPERTY_WIDTH_INDICATOR, oldWidthIndicatorPosition, widthIndicatorPosition);
    }

    public List<DataPoint> getFiniteComponentsDataSet() { return finiteComponentsDataSet; }
    public List<DataPoint> getContinuousWaveformDataSet() { return continuousWaveformDataSet; }

    /** The continuous waveform when the packet has infinite components, otherwise empty. */
    public List<DataPoint> getInfiniteComponentsDataSet() { return infiniteComponentsDataSet; }

    public double getPeakAmplitude() { return peakAmplitude; }
    public AxisDescription getYAxisDescription() { return yAxisDescription; }

    /** Width of the indicator, 2 sigma. */
    public double getWidthIndicatorWidth() { return widthIndicatorWidth; }

    /** Position of the indicator: at the center, at the height of the waveform one sigma away. */
    public DataPoint getWidthIndicatorPosition() { return widthIndicatorPosition; }

    public boolean isContinuousWaveformVisible() { return continuousWaveformVisible; }

    public void setContinuousWaveformVisible(boolean continuousWaveformVisible) {
        if (this.continuousWaveformVisible != continuousWaveformVisible) {
            this.continuousWaveformVisible = continuousWaveformVisible;
            logger.info("Continuous waveform {}", continuousWaveformVisible ? "shown" : "hidden");
            support.firePropertyChange(PROPERTY_CONTINUOUS_WAVEFORM_VISIBLE, !continuousWaveformVisible, continuousWaveformVisible);
        }
    }

    public void reset() {
        setContinuousWaveformVisible(true);
    }
}
