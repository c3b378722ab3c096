package de.anton.fourier.waves.fourier_waves.model;

import de.anton.fourier.waves.fourier_waves.service.ChartContext;
import de.anton.fourier.waves.fourier_waves.service.DiscreteAmplitudesChart;
import de.anton.fourier.waves.fourier_waves.service.HarmonicsChart;
import de.anton.fourier.waves.fourier_waves.service.SumChart;
import de.anton.fourier.waves.fourier_waves.service.SynthesisConfiguration;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The model for a discrete Fourier series: preset or custom amplitudes, the domain and series type they are
 * plotted in, time for the space-and-time domain, measurement tools and the Amplitudes, Harmonics and Sum charts.
 * <p>
 * Changes are applied in batches ({@link #applyChanges(Runnable)}, nestable). Every public setter is its own batch.
 * When the outermost batch ends, the charts are recomputed once and "chartsUpdated" is fired once.
 */
public class DiscreteModel {
    private static final Logger logger = LoggerFactory.getLogger(DiscreteModel.class);

    public static final String PROPERTY_PLAYING = "playing";
    public static final String PROPERTY_T = "t";
    public static final String PROPERTY_WAVEFORM = "waveform";
    public static final String PROPERTY_SERIES_TYPE = "seriesType";
    public static final String PROPERTY_DOMAIN = "domain";
    public static final String PROPERTY_EQUATION_FORM = "equationForm";
    public static final String PROPERTY_CHARTS_UPDATED = "chartsUpdated";
    public static final String EVENT_SAWTOOTH_WITH_COSINES_REJECTED = "sawtoothWithCosinesRejected";

    // Scales real time to model time, so that the space-and-time animation is slow enough to follow.
    public static final double TIME_SCALE = 0.001;

    // Step button advances this many ms of real time.
    public static final double STEP_DT = 50;

    private boolean playing = true;
    private double t = 0; // ms
    private Waveform waveform = Waveform.SINUSOID;
    private SeriesType seriesType = SeriesType.SIN;
    private Domain domain = Domain.SPACE;
    private EquationForm equationForm = EquationForm.HIDDEN;

    private final SynthesisConfiguration configuration;
    private final DiscreteFourierSeries fourierSeries;
    private final ZoomLevel xZoomLevel;
    private final MeasurementTool wavelengthTool;
    private final MeasurementTool periodTool;

    private final DiscreteAmplitudesChart amplitudesChart;
    private final HarmonicsChart harmonicsChart;
    private final SumChart sumChart;

    private int batchDepth = 0;
    private boolean chartsDirty = false;

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    public DiscreteModel() {
        this(SynthesisConfiguration.defaults());
    }

    public DiscreteModel(SynthesisConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.fourierSeries = new DiscreteFourierSeries(configuration);
        this.xZoomLevel = new ZoomLevel("Discrete x axis", DiscreteAxisDescriptions.X_AXIS_DESCRIPTIONS,
                DiscreteAxisDescriptions.DEFAULT_X_AXIS_DESCRIPTION);
        this.wavelengthTool = new MeasurementTool("λ", fourierSeries.getNumberOfHarmonics());
        this.periodTool = new MeasurementTool("T", fourierSeries.getNumberOfHarmonics());

        applyPresetAmplitudes();
        ChartContext context = createChartContext();
        this.amplitudesChart = new DiscreteAmplitudesChart(fourierSeries);
        this.harmonicsChart = new HarmonicsChart(fourierSeries, context);
        this.sumChart = new SumChart(fourierSeries, DiscreteAxisDescriptions.Y_AXIS_DESCRIPTIONS, this::getWaveform, context);

        fourierSeries.addPropertyChangeListener(evt -> {
            if (FourierSeries.PROPERTY_AMPLITUDES.equals(evt.getPropertyName())) {
                markChartsDirty();
            }
        });
        xZoomLevel.addPropertyChangeListener(evt -> markChartsDirty());
        logger.info("DiscreteModel created: {} harmonics, waveform {}, {} {}", fourierSeries.getNumberOfHarmonics(),
                waveform, domain, seriesType);
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
        fourierSeries.beginBatch();
        try {
            changes.run();
        } finally {
            // Ends the series batch first, so that its single "amplitudes" event arrives inside this batch.
            fourierSeries.endBatch();
            batchDepth--;
            if (batchDepth == 0 && chartsDirty) {
                updateCharts();
            }
        }
    }

    // --- Getters ---
    public SynthesisConfiguration getConfiguration() { return configuration; }
    public boolean isPlaying() { return playing; }
    public double getT() { return t; }
    public Waveform getWaveform() { return waveform; }
    public SeriesType getSeriesType() { return seriesType; }
    public Domain getDomain() { return domain; }
    public EquationForm getEquationForm() { return equationForm; }
    public TickLabelFormat getXAxisTickLabelFormat() { return TickLabelFormat.forEquationForm(equationForm); }
    public int getNumberOfHarmonics() { return fourierSeries.getNumberOfHarmonics(); }
    public DiscreteFourierSeries getFourierSeries() { return fourierSeries; }
    public ZoomLevel getXZoomLevel() { return xZoomLevel; }
    public MeasurementTool getWavelengthTool() { return wavelengthTool; }
    public MeasurementTool getPeriodTool() { return periodTool; }
    public DiscreteAmplitudesChart getAmplitudesChart() { return amplitudesChart; }
    public HarmonicsChart getHarmonicsChart() { return harmonicsChart; }
    public SumChart getSumChart() { return sumChart; }

    /** Wavelength measured by the wavelength tool, in m. */
    public double getMeasuredWavelength() { return wavelengthTool.getMeasuredValue(fourierSeries.getL()); }

    /** Period measured by the period tool, in ms. */
    public double getMeasuredPeriod() { return periodTool.getMeasuredValue(fourierSeries.getT()); }

    // --- Setters ---
    public void setPlaying(boolean playing) {
        if (this.playing != playing) {
            this.playing = playing;
            logger.info("Model: {}", playing ? "playing" : "paused");
            support.firePropertyChange(PROPERTY_PLAYING, !playing, playing);
        }
    }

    public void setNumberOfHarmonics(int numberOfHarmonics) {
        applyChanges(() -> {
            fourierSeries.setNumberOfHarmonics(numberOfHarmonics);
            wavelengthTool.setNumberOfHarmonics(numberOfHarmonics);
            periodTool.setNumberOfHarmonics(numberOfHarmonics);
            applyPresetAmplitudes();
            markChartsDirty();
        });
    }

    public void setWaveform(Waveform waveform) {
        Objects.requireNonNull(waveform, "Waveform cannot be null");
        applyChanges(() -> {
            if (setWaveformInternal(waveform)) {
                applyPresetAmplitudes();
            }
        });
    }

    public void setSeriesType(SeriesType seriesType) {
        Objects.requireNonNull(seriesType, "SeriesType cannot be null");
        applyChanges(() -> {
            if (setSeriesTypeInternal(seriesType)) {
                applyPresetAmplitudes();
            }
        });
    }

    public void setDomain(Domain domain) {
        Objects.requireNonNull(domain, "Domain cannot be null");
        applyChanges(() -> {
            if (this.domain != domain) {
                Domain oldDomain = this.domain;
                this.domain = domain;
                logger.info("Model: Domain set to {}", domain);
                support.firePropertyChange(PROPERTY_DOMAIN, oldDomain, domain);
                resetT();
                if (equationForm != EquationForm.MODE) {
                    setEquationForm(EquationForm.HIDDEN);
                }
                markChartsDirty();
            }
        });
    }

    /**
     * @throws IllegalArgumentException if the form is not supported by the current domain.
     */
    public void setEquationForm(EquationForm equationForm) {
        Objects.requireNonNull(equationForm, "EquationForm cannot be null");
        if (!equationForm.supports(domain)) {
            throw new IllegalArgumentException("Equation form " + equationForm + " is not supported for domain " + domain);
        }
        if (this.equationForm != equationForm) {
            EquationForm oldEquationForm = this.equationForm;
            this.equationForm = equationForm;
            logger.info("Model: Equation form set to {}", equationForm);
            support.firePropertyChange(PROPERTY_EQUATION_FORM, oldEquationForm, equationForm);
        }
    }

    /**
     * Sets the amplitude of one relevant harmonic. The waveform becomes CUSTOM.
     *
     * @param order     In [1, numberOfHarmonics].
     * @param amplitude In the amplitude range.
     */
    public void setHarmonicAmplitude(int order, double amplitude) {
        if (order < 1 || order > fourierSeries.getNumberOfHarmonics()) {
            throw new IllegalArgumentException("Order must be in [1, " + fourierSeries.getNumberOfHarmonics()
                    + "]. Got: " + order);
        }
        applyChanges(() -> {
            setWaveformInternal(Waveform.CUSTOM);
            fourierSeries.getHarmonic(order).setAmplitude(amplitude);
        });
    }

    /** Replaces all amplitudes, e.g. with generated ones. The waveform becomes CUSTOM. */
    public void setAmplitudes(double[] amplitudes) {
        applyChanges(() -> {
            setWaveformInternal(Waveform.CUSTOM);
            fourierSeries.setAmplitudes(amplitudes);
        });
    }

    public void setInfiniteHarmonicsVisible(boolean infiniteHarmonicsVisible) {
        applyChanges(() -> {
            if (sumChart.isInfiniteHarmonicsVisible() != infiniteHarmonicsVisible) {
                sumChart.setInfiniteHarmonicsVisible(infiniteHarmonicsVisible);
                markChartsDirty();
            }
        });
    }

    /**
     * Advances time, only while playing in the space-and-time domain.
     *
     * @param dt Elapsed real time, in seconds.
     */
    public void step(double dt) {
        if (playing && domain == Domain.SPACE_AND_TIME) {
            setT(t + dt * 1000 * TIME_SCALE);
        }
    }

    /** Advances time by one step, regardless of domain and playing state. */
    public void stepOnce() {
        setT(t + STEP_DT * TIME_SCALE);
    }

    /** Restores the initial state, recomputing the charts once. */
    public void reset() {
        logger.info("Model: Reset");
        applyChanges(() -> {
            setPlaying(true);
            resetT();
            setWaveformInternal(Waveform.SINUSOID);
            setSeriesTypeInternal(SeriesType.SIN);
            if (domain != Domain.SPACE) {
                Domain oldDomain = this.domain;
                this.domain = Domain.SPACE;
                support.firePropertyChange(PROPERTY_DOMAIN, oldDomain, domain);
            }
            setEquationForm(EquationForm.HIDDEN);
            xZoomLevel.reset();
            fourierSeries.reset();
            wavelengthTool.setNumberOfHarmonics(fourierSeries.getNumberOfHarmonics());
            periodTool.setNumberOfHarmonics(fourierSeries.getNumberOfHarmonics());
            wavelengthTool.reset();
            periodTool.reset();
            sumChart.reset();
            applyPresetAmplitudes();
            markChartsDirty();
        });
    }

    // --- Internals ---

    private boolean setWaveformInternal(Waveform waveform) {
        if (this.waveform == waveform) {
            return false;
        }
        Waveform oldWaveform = this.waveform;
        this.waveform = waveform;
        logger.info("Model: Waveform set to {}", waveform);
        support.firePropertyChange(PROPERTY_WAVEFORM, oldWaveform, waveform);
        resetT();
        markChartsDirty();
        return true;
    }

    private boolean setSeriesTypeInternal(SeriesType seriesType) {
        if (this.seriesType == seriesType) {
            return false;
        }
        SeriesType oldSeriesType = this.seriesType;
        this.seriesType = seriesType;
        logger.info("Model: Series type set to {}", seriesType);
        support.firePropertyChange(PROPERTY_SERIES_TYPE, oldSeriesType, seriesType);
        markChartsDirty();
        return true;
    }

    private void setT(double t) {
        applyChanges(() -> {
            if (this.t != t) {
                double oldT = this.t;
                this.t = t;
                support.firePropertyChange(PROPERTY_T, oldT, t);
                markChartsDirty();
            }
        });
    }

    private void resetT() {
        setT(0);
    }

    /**
     * Sets the amplitudes of the series to match the preset waveform. A sawtooth cannot be made of cosines:
     * that combination zeroes all amplitudes, switches to sines and applies the sine recipe.
     */
    private void applyPresetAmplitudes() {
        fourierSeries.beginBatch();
        try {
            if (waveform == Waveform.SAWTOOTH && seriesType == SeriesType.COS) {
                logger.warn("A sawtooth cannot be made of cosines, switching to sines.");
                fourierSeries.setAllAmplitudes(0);
                support.firePropertyChange(EVENT_SAWTOOTH_WITH_COSINES_REJECTED, false, true);
                setSeriesTypeInternal(SeriesType.SIN);
            }
            if (waveform != Waveform.CUSTOM) {
                double[] presetAmplitudes = waveform.getAmplitudes(fourierSeries.getNumberOfHarmonics(), seriesType);
                double[] amplitudes = Arrays.copyOf(presetAmplitudes, fourierSeries.getMaxNumberOfHarmonics());
                fourierSeries.setAmplitudes(amplitudes);
            }
        } finally {
            fourierSeries.endBatch();
        }
    }

    private void markChartsDirty() {
        chartsDirty = true;
        if (batchDepth == 0) {
            // A change from outside a batch, e.g. a harmonic's amplitude set directly.
            applyChanges(() -> { });
        }
    }

    private ChartContext createChartContext() {
        return new ChartContext(domain, seriesType, t, xZoomLevel.getAxisDescription());
    }

    private void updateCharts() {
        chartsDirty = false;
        ChartContext context = createChartContext();
        logger.debug("Updating charts: {} {} t={} x axis {}", context.domain(), context.seriesType(), context.t(),
                context.xAxisDescription().range());
        amplitudesChart.update();
        harmonicsChart.update(context);
        sumChart.update(context);
        support.firePropertyChange(PROPERTY_CHARTS_UPDATED, null, context);
    }
}
