package de.anton.fourier.waves.fourier_waves.controller;

import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import de.anton.fourier.waves.fourier_waves.model.Domain;
import de.anton.fourier.waves.fourier_waves.model.WavePacket;
import de.anton.fourier.waves.fourier_waves.model.WavePacketModel;
import de.anton.fourier.waves.fourier_waves.service.WavePacketAmplitudesChart;
import de.anton.fourier.waves.fourier_waves.service.WavePacketComponentsChart;
import de.anton.fourier.waves.fourier_waves.service.WavePacketSumChart;
import de.anton.fourier.waves.fourier_waves.view.ChartDatasets;

import org.jfree.chart.axis.NumberAxis;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeEvent;
import java.beans.PropertyChangeListener;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mirrors a {@link WavePacketModel} into JFreeChart datasets and axes for the Amplitudes, Components and Sum charts.
 * Hidden overlays (continuous waveform, width indicators) are kept as empty series so series indices stay stable.
 */
public class WavePacketChartController implements PropertyChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(WavePacketChartController.class);

    public static final String COMPONENTS_SERIES_KEY = "Components";
    public static final String CONTINUOUS_WAVEFORM_SERIES_KEY = "Continuous waveform";
    public static final String INFINITE_COMPONENTS_SERIES_KEY = "Infinite components";
    public static final String AMPLITUDES_WIDTH_SERIES_KEY = "Width (k)";
    public static final String COMPONENT_SERIES_KEY_PREFIX = "Component ";
    public static final String SUM_SERIES_KEY = "Sum";
    public static final String ENVELOPE_SERIES_KEY = "Envelope";
    public static final String SUM_WIDTH_SERIES_KEY = "Width (x)";

    private final WavePacketModel model;

    private final XYSeries componentsSeries = new XYSeries(COMPONENTS_SERIES_KEY, false, true);
    private final XYSeries continuousWaveformSeries = new XYSeries(CONTINUOUS_WAVEFORM_SERIES_KEY, false, true);
    private final XYSeries infiniteComponentsSeries = new XYSeries(INFINITE_COMPONENTS_SERIES_KEY, false, true);
    private final XYSeries amplitudesWidthSeries = new XYSeries(AMPLITUDES_WIDTH_SERIES_KEY, false, true);
    private final XYSeriesCollection amplitudesDataset = new XYSeriesCollection();
    private final XYSeriesCollection componentsDataset = new XYSeriesCollection();
    private final XYSeries sumSeries = new XYSeries(SUM_SERIES_KEY, false, true);
    private final XYSeries envelopeSeries = new XYSeries(ENVELOPE_SERIES_KEY, false, true);
    private final XYSeries sumWidthSeries = new XYSeries(SUM_WIDTH_SERIES_KEY, false, true);
    private final XYSeriesCollection sumDataset = new XYSeriesCollection();

    private final NumberAxis amplitudesXAxis = new NumberAxis();
    private final NumberAxis amplitudesYAxis = new NumberAxis("Amplitude");
    private final NumberAxis componentsXAxis = new NumberAxis();
    private final NumberAxis componentsYAxis = new NumberAxis("Amplitude");
    private final NumberAxis sumXAxis = new NumberAxis();
    private final NumberAxis sumYAxis = new NumberAxis("Amplitude");

    public WavePacketChartController(WavePacketModel model) {
        this.model = Objects.requireNonNull(model);
        amplitudesDataset.addSeries(componentsSeries);
        amplitudesDataset.addSeries(continuousWaveformSeries);
        amplitudesDataset.addSeries(infiniteComponentsSeries);
        amplitudesDataset.addSeries(amplitudesWidthSeries);
        sumDataset.addSeries(sumSeries);
        sumDataset.addSeries(envelopeSeries);
        sumDataset.addSeries(sumWidthSeries);
        this.model.addPropertyChangeListener(this);
        this.model.getAmplitudesChart().addPropertyChangeListener(WavePacketAmplitudesChart.PROPERTY_CONTINUOUS_WAVEFORM_VISIBLE, this);
        refreshCharts();
        logger.debug("WavePacketChartController initialized.");
    }

    @Override
    public void propertyChange(PropertyChangeEvent evt) {
        String propName = evt.getPropertyName();
        logger.debug("Controller received PropertyChangeEvent: Name='{}'", propName);
        DiscreteChartController.runOnEventDispatchThread(() -> {
            switch (propName) {
                case WavePacketModel.PROPERTY_CHARTS_UPDATED:
                    refreshCharts();
                    break;
                case WavePacketModel.PROPERTY_WIDTH_INDICATORS_VISIBLE:
                    refreshWidthIndicators();
                    break;
                case WavePacketAmplitudesChart.PROPERTY_CONTINUOUS_WAVEFORM_VISIBLE:
                    refreshContinuousWaveform();
                    break;
                case WavePacketModel.PROPERTY_DOMAIN:
                case WavePacketModel.PROPERTY_SERIES_TYPE:
                    logger.trace("Property change handled/ignored: {}", propName);
                    break;
                default:
                    logger.warn("Unhandled property change event in Controller: {}", propName);
                    break;
            }
        });
    }

    /** Stops following the model. */
    public void dispose() {
        model.removePropertyChangeListener(this);
        model.getAmplitudesChart().removePropertyChangeListener(WavePacketAmplitudesChart.PROPERTY_CONTINUOUS_WAVEFORM_VISIBLE, this);
        logger.debug("WavePacketChartController disposed.");
    }

    private void refreshCharts() {
        String xAxisLabel = getXAxisLabel();

        // Amplitudes
        WavePacketAmplitudesChart amplitudesChart = model.getAmplitudesChart();
        ChartDatasets.replaceSeries(componentsSeries, amplitudesChart.getFiniteComponentsDataSet());
        ChartDatasets.replaceSeries(infiniteComponentsSeries, amplitudesChart.getInfiniteComponentsDataSet());
        refreshContinuousWaveform();
        amplitudesXAxis.setLabel(model.getDomain() == Domain.TIME
                ? "ω (rad/ms)" : "k (rad/m)");
        ChartDatasets.applyAxisDescription(amplitudesXAxis, amplitudesChart.getXAxisDescription(), amplitudesChart.getSpaceMultiplier());
        ChartDatasets.applyAxisDescription(amplitudesYAxis, amplitudesChart.getYAxisDescription());

        // Components
        WavePacketComponentsChart componentsChart = model.getComponentsChart();
        ChartDatasets.replaceSeriesCollection(componentsDataset, COMPONENT_SERIES_KEY_PREFIX, componentsChart.getComponentDataSets());
        componentsXAxis.setLabel(xAxisLabel);
        ChartDatasets.applyAxisDescription(componentsXAxis, componentsChart.getXAxisDescription(), WavePacket.L);
        ChartDatasets.applyAxisDescription(componentsYAxis, componentsChart.getYAxisDescription());

        // Sum
        WavePacketSumChart sumChart = model.getSumChart();
        ChartDatasets.replaceSeries(sumSeries, sumChart.getSumDataSet());
        ChartDatasets.replaceSeries(envelopeSeries, sumChart.getWaveformEnvelopeDataSet());
        sumXAxis.setLabel(xAxisLabel);
        ChartDatasets.applyAxisDescription(sumXAxis, sumChart.getXAxisDescription(), WavePacket.L);
        ChartDatasets.applyAxisDescription(sumYAxis, sumChart.getYAxisDescription());

        refreshWidthIndicators();
        logger.debug("Wave packet charts refreshed: {} components, {} sum points", componentsDataset.getSeriesCount(),
                sumSeries.getItemCount());
    }

    private void refreshContinuousWaveform() {
        WavePacketAmplitudesChart amplitudesChart = model.getAmplitudesChart();
        List<DataPoint> dataSet = amplitudesChart.isContinuousWaveformVisible()
                ? amplitudesChart.getContinuousWaveformDataSet() : Collections.emptyList();
        ChartDatasets.replaceSeries(continuousWaveformSeries, dataSet);
    }

    /** A width indicator is drawn as a horizontal segment of the given width, centered on its position. */
    private void refreshWidthIndicators() {
        if (model.isWidthIndicatorsVisible()) {
            WavePacketAmplitudesChart amplitudesChart = model.getAmplitudesChart();
            WavePacketSumChart sumChart = model.getSumChart();
            ChartDatasets.replaceSeries(amplitudesWidthSeries,
                    createWidthIndicator(amplitudesChart.getWidthIndicatorPosition(), amplitudesChart.getWidthIndicatorWidth()));
            ChartDatasets.replaceSeries(sumWidthSeries,
                    createWidthIndicator(sumChart.getWidthIndicatorPosition(), sumChart.getWidthIndicatorWidth()));
        } else {
            ChartDatasets.replaceSeries(amplitudesWidthSeries, Collections.emptyList());
            ChartDatasets.replaceSeries(sumWidthSeries, Collections.emptyList());
        }
    }

    static List<DataPoint> createWidthIndicator(DataPoint position, double width) {
        return List.of(new DataPoint(position.x() - width / 2, position.y()),
                new DataPoint(position.x() + width / 2, position.y()));
    }

    private String getXAxisLabel() {
        return DiscreteChartController.getXAxisLabel(model.getDomain());
    }

    // --- Getters for chart panels ---
    public WavePacketModel getModel() { return model; }
    public XYSeriesCollection getAmplitudesDataset() { return amplitudesDataset; }
    public XYSeriesCollection getComponentsDataset() { return componentsDataset; }
    public XYSeriesCollection getSumDataset() { return sumDataset; }
    public XYSeries getComponentsSeries() { return componentsSeries; }
    public XYSeries getContinuousWaveformSeries() { return continuousWaveformSeries; }
    public XYSeries getInfiniteComponentsSeries() { return infiniteComponentsSeries; }
    public XYSeries getAmplitudesWidthSeries() { return amplitudesWidthSeries; }
    public XYSeries getSumSeries() { return sumSeries; }
    public XYSeries getEnvelopeSeries() { return envelopeSeries; }
    public XYSeries getSumWidthSeries() { return sumWidthSeries; }
    public NumberAxis getAmplitudesXAxis() { return amplitudesXAxis; }
    public NumberAxis getAmplitudesYAxis() { return amplitudesYAxis; }
    public NumberAxis getComponentsXAxis() { return componentsXAxis; }
    public NumberAxis getComponentsYAxis() { return componentsYAxis; }
    public NumberAxis getSumXAxis() { return sumXAxis; }
    public NumberAxis getSumYAxis() { return sumYAxis; }
}
