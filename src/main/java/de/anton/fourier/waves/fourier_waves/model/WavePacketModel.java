package de.anton.fourier.waves.fourier_waves.model;

import de.anton.fourier.waves.fourier_waves.service.ChartContext;
import de.anton.fourier.waves.fourier_waves.service.SynthesisConfiguration;
import de.anton.fourier.waves.fourier_waves.service.WavePacketAmplitudesChart;
import de.anton.fourier.waves.fourier_waves.service.WavePacketComponentsChart;
import de.anton.fourier.waves.fourier_waves.service.WavePacketSumChart;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The model for a wave packet: the packet itself, the domain (space or time) and series type it is plotted in,
 * and the Amplitudes, Components and Sum charts. Batching works as in {@link DiscreteModel}.
 */
public class WavePacketModel {
    private static final Logger logger = LoggerFactory.getLogger(WavePacketModel.class);

    public static final String PROPERTY_DOMAIN = "domain";
    public static final String PROPERTY_SERIES_TYPE = "seriesType";
    public static final String PROPERTY_WIDTH_INDICATORS_VISIBLE = "widthIndicatorsVisible";
    public static final String PROPERTY_CHARTS_UPDATED = "chartsUpdated";

    private Domain domain = Domain.SPACE;
    private SeriesType seriesType = SeriesType.SIN;
    private boolean widthIndicatorsVisible = false;

    private final WavePacket wavePacket;
    private final ZoomLevel xZoomLevel;
    private final WavePacketAmplitudesChart amplitudesChart;
    private final WavePacketComponentsChart componentsChart;
    private final WavePacketSumChart sumChart;

    private int batchDepth = 0;
    private boolean chartsDirty = false;

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    public WavePacketModel() {
        this(SynthesisConfiguration.defaults());
    }

    public WavePacketModel(SynthesisConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration cannot be null");
        this.wavePacket = new WavePacket();
        this.xZoomLevel = new ZoomLevel("Wave packet x axis", WavePacketAxisDescriptions.X_AXIS_DESCRIPTIONS,
                WavePacketAxisDescriptions.DEFAULT_X_AXIS_DESCRIPTION);

        ChartContext context = createChartContext();
        this.amplitudesChart = new WavePacketAmplitudesChart(wavePacket,
                new ChartContext(domain, seriesType, 0, WavePacketAxisDescriptions.AMPLITUDES_X_AXIS_DESCRIPTION));
        this.componentsChart = new WavePacketComponentsChart(wavePacket, configuration.maxPointsPerDataSet(), context);
        this.sumChart = new WavePacketSumChart(componentsChart, configuration.maxPointsPerDataSet(), context);

        wavePacket.addPropertyChangeListener(evt -> markChartsDirty());
        xZoomLevel.addPropertyChangeListener(evt -> markChartsDirty());
        logger.info("WavePacketModel created: {} {}, {} components", domain, seriesType, wavePacket.getNumberOfComponents());
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }
    public void addPropertyChangeListener(String propertyName, PropertyChangeListener pcl) { support.addPropertyChangeListener(propertyName, pcl); }

    /**
     * Applies a group of changes. Chart recomputation is deferred until the outermost call returns, then happens once.
     */
    public void applyChanges(Runnable changes) {
        Objects.requireNonNull(changes, "changes cannot be null");
        batchDepth++;
        try {
            changes.run();
        } finally {
            batchDepth--;
            if (batchDepth == 0 && chartsDirty) {
                updateCharts();
            }
        }
    }

    // --- Getters ---
    public Domain getDomain() { return domain; }
    public SeriesType getSeriesType() { return seriesType; }
    public boolean isWidthIndicatorsVisible() { return widthIndicatorsVisible; }
    public WavePacket getWavePacket() { return wavePacket; }
    public ZoomLevel getXZoomLevel() { return xZoomLevel; }
    public WavePacketAmplitudesChart getAmplitudesChart() { return amplitudesChart; }
    public WavePacketComponentsChart getComponentsChart() { return componentsChart; }
    public WavePacketSumChart getSumChart() { return sumChart; }

    // --- Setters ---

    /**
     * @throws IllegalArgumentException for SPACE_AND_TIME, which a wave packet does not support.
     */
    public void setDomain(Domain domain) {
        Objects.requireNonNull(domain, "Domain cannot be null");
        if (domain == Domain.SPACE_AND_TIME) {
            throw new IllegalArgumentException("A wave packet can be plotted in space or time only. Got: " + domain);
        }
        applyChanges(() -> {
            if (this.domain != domain) {
                Domain oldDomain = this.domain;
                this.domain = domain;
                logger.info("WavePacketModel: Domain set to {}", domain);
                support.firePropertyChange(PROPERTY_DOMAIN, oldDomain, domain);
                markChartsDirty();
            }
        });
    }

    public void setSeriesType(SeriesType seriesType) {
        Objects.requireNonNull(seriesType, "SeriesType cannot be null");
        applyChanges(() -> {
            if (this.seriesType != seriesType) {
                SeriesType oldSeriesType = this.seriesType;
                this.seriesType = seriesType;
                logger.info("WavePacketModel: Series type set to {}", seriesType);
                support.firePropertyChange(PROPERTY_SERIES_TYPE, oldSeriesType, seriesType);
                markChartsDirty();
            }
        });
    }

    public void setWidthIndicatorsVisible(boolean widthIndicatorsVisible) {
        if (this.widthIndicatorsVisible != widthIndicatorsVisible) {
            this.widthIndicatorsVisible = widthIndicatorsVisible;
            logger.info("WavePacketModel: Width indicators {}", widthIndicatorsVisible ? "shown" : "hidden");
            support.firePropertyChange(PROPERTY_WIDTH_INDICATORS_VISIBLE, !widthIndicatorsVisible, widthIndicatorsVisible);
        }
    }

    public void setComponentSpacing(double componentSpacing) {
        applyChanges(() -> wavePacket.setComponentSpacing(componentSpacing));
    }

    public void setCenter(double center) {
        applyChanges(() -> wavePacket.setCenter(center));
    }

    public void setStandardDeviation(double standardDeviation) {
        applyChanges(() -> wavePacket.setStandardDeviation(standardDeviation));
    }

    public void setConjugateStandardDeviation(double conjugateStandardDeviation) {
        applyChanges(() -> wavePacket.setConjugateStandardDeviation(conjugateStandardDeviation));
    }

    public void setWaveformEnvelopeVisible(boolean waveformEnvelopeVisible) {
        applyChanges(() -> {
            if (sumChart.isWaveformEnvelopeVisible() != waveformEnvelopeVisible) {
                sumChart.setWaveformEnvelopeVisible(waveformEnvelopeVisible);
                markChartsDirty();
            }
        });
    }

    /** Shows or hides the continuous waveform on the Amplitudes chart. Its data set is always computed. */
    public void setContinuousWaveformVisible(boolean continuousWaveformVisible) {
        amplitudesChart.setContinuousWaveformVisible(continuousWaveformVisible);
    }

    /** Restores the initial state, recomputing the charts once. */
    public void reset() {
        logger.info("WavePacketModel: Reset");
        applyChanges(() -> {
            setDomain(Domain.SPACE);
            setSeriesType(SeriesType.SIN);
            setWidthIndicatorsVisible(false);
            xZoomLevel.reset();
            wavePacket.reset();
            amplitudesChart.reset();
            sumChart.reset();
            markChartsDirty();
        });
    }

    // --- Internals ---

    private void markChartsDirty() {
        chartsDirty = true;
        if (batchDepth == 0) {
            // A change from outside a batch, e.g. the wave packet changed directly.
            applyChanges(() -> { });
        }
    }

    private ChartContext createChartContext() {
        return new ChartContext(domain, seriesType, 0, xZoomLevel.getAxisDescription());
    }

    private void updateCharts() {
        chartsDirty = false;
        ChartContext context = createChartContext();
        logger.debug("Updating charts: {} {} x axis {}, spacing={}, center={}, standardDeviation={}", context.domain(),
                context.seriesType(), context.xAxisDescription().range(), wavePacket.getComponentSpacing(),
                wavePacket.getCenter(), wavePacket.getStandardDeviation());
        amplitudesChart.update(new ChartContext(domain, seriesType, 0, WavePacketAxisDescriptions.AMPLITUDES_X_AXIS_DESCRIPTION));
        // Components first, the sum chart reads its data sets.
        componentsChart.update(context);
        sumChart.update(context);
        support.firePropertyChange(PROPERTY_CHARTS_UPDATED, null, context);
    }
}
