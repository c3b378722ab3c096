package de.anton.fourier.waves.fourier_waves.controller;

import de.anton.fourier.waves.fourier_waves.model.DiscreteModel;
import de.anton.fourier.waves.fourier_waves.model.Domain;
import de.anton.fourier.waves.fourier_waves.model.Range;
import de.anton.fourier.waves.fourier_waves.service.SumChart;
import de.anton.fourier.waves.fourier_waves.view.ChartDatasets;

import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.axis.NumberTickUnit;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.SwingUtilities;
import java.beans.PropertyChangeEvent;
import java.beans.PropertyChangeListener;
import java.util.Objects;

/**
 * Mirrors a {@link DiscreteModel} into JFreeChart datasets and axes for the Amplitudes, Harmonics and Sum charts.
 * Datasets are refreshed once per model batch, on the Swing event dispatch thread.
 */
public class DiscreteChartController implements PropertyChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(DiscreteChartController.class);

    public static final String AMPLITUDES_SERIES_KEY = "Amplitudes";
    public static final String HARMONIC_SERIES_KEY_PREFIX = "Harmonic ";
    public static final String SUM_SERIES_KEY = "Sum";
    public static final String INFINITE_HARMONICS_SERIES_KEY = "Infinite harmonics";

    private final DiscreteModel model;

    private final XYSeries amplitudesSeries = new XYSeries(AMPLITUDES_SERIES_KEY, false, true);
    private final XYSeriesCollection amplitudesDataset = new XYSeriesCollection(amplitudesSeries);
    private final XYSeriesCollection harmonicsDataset = new XYSeriesCollection();
    private final XYSeries sumSeries = new XYSeries(SUM_SERIES_KEY, false, true);
    private final XYSeries infiniteHarmonicsSeries = new XYSeries(INFINITE_HARMONICS_SERIES_KEY, false, true);
    private final XYSeriesCollection sumDataset = new XYSeriesCollection();

    private final NumberAxis amplitudesXAxis = new NumberAxis("Harmonic");
    private final NumberAxis amplitudesYAxis = new NumberAxis("Amplitude");
    private final NumberAxis harmonicsXAxis = new NumberAxis();
    private final NumberAxis harmonicsYAxis = new NumberAxis("Amplitude");
    private final NumberAxis sumXAxis = new NumberAxis();
    private final NumberAxis sumYAxis = new NumberAxis("Amplitude");

    public DiscreteChartController(DiscreteModel model) {
        this.model = Objects.requireNonNull(model);
        sumDataset.addSeries(sumSeries);
        sumDataset.addSeries(infiniteHarmonicsSeries);
        this.model.addPropertyChangeListener(this);
        refreshCharts();
        logger.debug("DiscreteChartController initialized.");
    }

    @Override
    public void propertyChange(PropertyChangeEvent evt) {
        String propName = evt.getPropertyName();
        logger.debug("Controller received PropertyChangeEvent: Name='{}'", propName);
        runOnEventDispatchThread(() -> {
            switch (propName) {
                case DiscreteModel.PROPERTY_CHARTS_UPDATED:
                    refreshCharts();
                    break;
                case DiscreteModel.EVENT_SAWTOOTH_WITH_COSINES_REJECTED:
                    logger.info("Sawtooth cannot be made of cosines, showing sines instead.");
                    break;
                case DiscreteModel.PROPERTY_PLAYING:
                case DiscreteModel.PROPERTY_T:
                case DiscreteModel.PROPERTY_WAVEFORM:
                case DiscreteModel.PROPERTY_SERIES_TYPE:
                case DiscreteModel.PROPERTY_DOMAIN:
                case DiscreteModel.PROPERTY_EQUATION_FORM:
                    // the charts follow with chartsUpdated
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
        logger.debug("DiscreteChartController disposed.");
    }

    private void refreshCharts() {
        Domain domain = model.getDomain();
        double multiplier = (domain == Domain.TIME) ? model.getFourierSeries().getT() : model.getFourierSeries().getL();
        String xAxisLabel = getXAxisLabel(domain);

        // Amplitudes
        ChartDatasets.replaceSeries(amplitudesSeries, model.getAmplitudesChart().getAmplitudesDataSet());
        Range amplitudesXRange = model.getAmplitudesChart().getXRange();
        amplitudesXAxis.setAutoRange(false);
        amplitudesXAxis.setRange(amplitudesXRange.min(), amplitudesXRange.max());
        amplitudesXAxis.setTickUnit(new NumberTickUnit(1));
        Range amplitudesYRange = model.getAmplitudesChart().getYRange();
        amplitudesYAxis.setAutoRange(false);
        amplitudesYAxis.setRange(amplitudesYRange.min(), amplitudesYRange.max());

        // Harmonics
        ChartDatasets.replaceSeriesCollection(harmonicsDataset, HARMONIC_SERIES_KEY_PREFIX,
                model.getHarmonicsChart().getHarmonicDataSets());
        harmonicsXAxis.setLabel(xAxisLabel);
        ChartDatasets.applyAxisDescription(harmonicsXAxis, model.getHarmonicsChart().getXAxisDescription(), multiplier);
        ChartDatasets.applyAxisDescription(harmonicsYAxis, model.getHarmonicsChart().getYAxisDescription());

        // Sum
        SumChart sumChart = model.getSumChart();
        ChartDatasets.replaceSeries(sumSeries, sumChart.getSumDataSet());
        ChartDatasets.replaceSeries(infiniteHarmonicsSeries, sumChart.getInfiniteHarmonicsDataSet());
        sumXAxis.setLabel(xAxisLabel);
        ChartDatasets.applyAxisDescription(sumXAxis, sumChart.getXAxisDescription(), multiplier);
        ChartDatasets.applyAxisDescription(sumYAxis, sumChart.getYAxisDescription());

        logger.debug("Discrete charts refreshed: {} harmonics, {} sum points, y axis {}", harmonicsDataset.getSeriesCount(),
                sumSeries.getItemCount(), sumChart.getYAxisDescription().range());
    }

    static String getXAxisLabel(Domain domain) {
        return (domain == Domain.TIME) ? "t (ms)" : "x (m)";
    }

    static void runOnEventDispatchThread(Runnable runnable) {
        if (SwingUtilities.isEventDispatchThread()) {
            runnable.run();
        } else {
            SwingUtilities.invokeLater(runnable);
        }
    }

    // --- Getters for chart panels ---
    public DiscreteModel getModel() { return model; }
    public XYSeriesCollection getAmplitudesDataset() { return amplitudesDataset; }
    public XYSeriesCollection getHarmonicsDataset() { return harmonicsDataset; }
    public XYSeriesCollection getSumDataset() { return sumDataset; }
    public XYSeries getSumSeries() { return sumSeries; }
    public XYSeries getInfiniteHarmonicsSeries() { return infiniteHarmonicsSeries; }
    public NumberAxis getAmplitudesXAxis() { return amplitudesXAxis; }
    public NumberAxis getAmplitudesYAxis() { return amplitudesYAxis; }
    public NumberAxis getHarmonicsXAxis() { return harmonicsXAxis; }
    public NumberAxis getHarmonicsYAxis() { return harmonicsYAxis; }
    public NumberAxis getSumXAxis() { return sumXAxis; }
    public NumberAxis getSumYAxis() { return sumYAxis; }
}
