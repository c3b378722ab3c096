package de.anton.fourier.waves.fourier_waves.model;

import de.anton.fourier.waves.fourier_waves.algorithms.AmplitudeFunction;
import de.anton.fourier.waves.fourier_waves.service.SynthesisConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A Fourier series: a fixed number of harmonics sharing a fundamental wavelength L and period T.
 * <p>
 * The amplitude vector of all harmonics is derived from the harmonics and recomputed when an amplitude changes.
 * Between {@link #beginBatch()} and {@link #endBatch()} the recompute is deferred, so that a bulk change
 * notifies listeners of "amplitudes" (double[]) exactly once.
 */
public class FourierSeries {
    private static final Logger logger = LoggerFactory.getLogger(FourierSeries.class);

    public static final String PROPERTY_AMPLITUDES = "amplitudes";

    private final double fundamentalFrequency; // Hz
    private final double L;                    // fundamental wavelength, m
    private final double T;                    // fundamental period, ms
    private final Range amplitudeRange;
    private final int maxPointsPerDataSet;
    private final double[] defaultAmplitudes;
    private final List<Harmonic> harmonics;

    private double[] amplitudes;
    private int batchDepth = 0;
    private boolean amplitudesDirty = false;

    protected final PropertyChangeSupport support = new PropertyChangeSupport(this);

    /**
     * Creates a series with configuration.maxHarmonics() harmonics, all with amplitude 0.
     */
    public FourierSeries(SynthesisConfiguration configuration) {
        this(configuration, new double[configuration.maxHarmonics()]);
    }

    /**
     * @param configuration     Numeric parameters of the series.
     * @param defaultAmplitudes Initial amplitudes, one per harmonic, restored by {@link #reset()}.
     */
    public FourierSeries(SynthesisConfiguration configuration, double[] defaultAmplitudes) {
        Objects.requireNonNull(configuration, "configuration cannot be null");
        Objects.requireNonNull(defaultAmplitudes, "defaultAmplitudes cannot be null");
        if (defaultAmplitudes.length != configuration.maxHarmonics()) {
            throw new IllegalArgumentException("An amplitude is required for each of the " + configuration.maxHarmonics()
                    + " harmonics. Got: " + defaultAmplitudes.length);
        }
        this.fundamentalFrequency = configuration.fundamentalFrequency();
        this.L = configuration.fundamentalWavelength();
        this.T = configuration.fundamentalPeriod();
        this.amplitudeRange = Range.symmetric(configuration.maxAmplitude());
        this.maxPointsPerDataSet = configuration.maxPointsPerDataSet();
        this.defaultAmplitudes = defaultAmplitudes.clone();

        List<Harmonic> list = new ArrayList<>(configuration.maxHarmonics());
        for (int order = 1; order <= configuration.maxHarmonics(); order++) {
            Harmonic harmonic = new Harmonic(order, fundamentalFrequency, L, amplitudeRange, defaultAmplitudes[order - 1]);
            harmonic.addPropertyChangeListener(evt -> harmonicAmplitudeChanged());
            list.add(harmonic);
        }
        this.harmonics = Collections.unmodifiableList(list);
        this.amplitudes = computeAmplitudes();
        logger.debug("FourierSeries created: {} harmonics, L={} m, T={} ms, amplitudes in {}",
                harmonics.size(), L, T, amplitudeRange);
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    public List<Harmonic> getHarmonics() { return harmonics; }
    public Harmonic getHarmonic(int order) {
        if (order < 1 || order > harmonics.size()) {
            throw new IllegalArgumentException("Order must be in [1, " + harmonics.size() + "]. Got: " + order);
        }
        return harmonics.get(order - 1);
    }
    public double getFundamentalFrequency() { return fundamentalFrequency; }
    public double getL() { return L; }
    public double getT() { return T; }
    public Range getAmplitudeRange() { return amplitudeRange; }
    public int getMaxPointsPerDataSet() { return maxPointsPerDataSet; }

    /** @return a copy of the amplitudes of all harmonics, index 0 is order 1. */
    public double[] getAmplitudes() { return amplitudes.clone(); }

    /** Defers recomputation of the amplitudes until the matching {@link #endBatch()}. Batches nest. */
    public void beginBatch() {
        batchDepth++;
    }

    /** Ends a batch. The outermost end recomputes the amplitudes and notifies once if any amplitude changed. */
    public void endBatch() {
        if (batchDepth == 0) {
            throw new IllegalStateException("endBatch called without a matching beginBatch.");
        }
        batchDepth--;
        if (batchDepth == 0 && amplitudesDirty) {
            updateAmplitudes();
        }
    }

    public boolean isBatching() {
        return batchDepth > 0;
    }

    /**
     * Sets the amplitudes of all harmonics, notifying once.
     *
     * @param amplitudes One amplitude per harmonic, each in the amplitude range.
     */
    public void setAmplitudes(double[] amplitudes) {
        Objects.requireNonNull(amplitudes, "amplitudes cannot be null");
        if (amplitudes.length != harmonics.size()) {
            throw new IllegalArgumentException("An amplitude is required for each of the " + harmonics.size()
                    + " harmonics. Got: " + amplitudes.length);
        }
        for (double amplitude : amplitudes) {
            if (!amplitudeRange.contains(amplitude)) {
                throw new IllegalArgumentException("Amplitudes must be in " + amplitudeRange + ". Got: " + Arrays.toString(amplitudes));
            }
        }
        beginBatch();
        try {
            for (int i = 0; i < amplitudes.length; i++) {
                harmonics.get(i).setAmplitude(amplitudes[i]);
            }
        } finally {
            endBatch();
        }
    }

    /** Sets every harmonic to the same amplitude, notifying once. */
    public void setAllAmplitudes(double amplitude) {
        double[] values = new double[harmonics.size()];
        Arrays.fill(values, amplitude);
        setAmplitudes(values);
    }

    /** Restores the default amplitudes, notifying once. */
    public void reset() {
        setAmplitudes(defaultAmplitudes);
    }

    /**
     * Creates the data set for the sum of the harmonics. Every harmonic is evaluated at the same x values,
     * maxPointsPerDataSet + 1 points from xRange.min to xRange.max inclusive. Zero-amplitude harmonics are skipped.
     *
     * @param xAxisDescription Provides the x range, scaled by L or T.
     * @param domain           Domain of the plot.
     * @param seriesType       sin or cos.
     * @param t                Time, in ms, at least 0.
     * @return An unmodifiable data set ordered by increasing x.
     */
    public List<DataPoint> createSumDataSet(AxisDescription xAxisDescription, Domain domain, SeriesType seriesType, double t) {
        Objects.requireNonNull(xAxisDescription, "xAxisDescription cannot be null");
        if (!(t >= 0)) {
            throw new IllegalArgumentException("t must be >= 0. Got: " + t);
        }
        AmplitudeFunction amplitudeFunction = AmplitudeFunction.of(domain, seriesType);
        Range xRange = xAxisDescription.createRangeForDomain(domain, L, T);
        double dx = xRange.getLength() / maxPointsPerDataSet;
        List<Harmonic> nonZeroHarmonics = getNonZeroHarmonics();

        List<DataPoint> sumDataSet = new ArrayList<>(maxPointsPerDataSet + 1);
        for (int i = 0; i <= maxPointsPerDataSet; i++) {
            double x = (i == maxPointsPerDataSet) ? xRange.max() : xRange.min() + i * dx;
            double y = 0;
            for (Harmonic harmonic : nonZeroHarmonics) {
                y += amplitudeFunction.evaluate(harmonic.getAmplitude(), harmonic.getOrder(), x, t, L, T);
            }
            sumDataSet.add(new DataPoint(x, y));
        }
        logger.trace("Sum data set: {} points over {}, {} non-zero harmonics", sumDataSet.size(), xRange, nonZeroHarmonics.size());
        return Collections.unmodifiableList(sumDataSet);
    }

    public List<Harmonic> getZeroHarmonics() {
        return harmonics.stream().filter(harmonic -> harmonic.getAmplitude() == 0).collect(Collectors.toUnmodifiableList());
    }

    public List<Harmonic> getNonZeroHarmonics() {
        return harmonics.stream().filter(harmonic -> harmonic.getAmplitude() != 0).collect(Collectors.toUnmodifiableList());
    }

    public int getNumberOfNonZeroHarmonics() {
        return (int) harmonics.stream().filter(harmonic -> harmonic.getAmplitude() != 0).count();
    }

    private void harmonicAmplitudeChanged() {
        if (batchDepth > 0) {
            amplitudesDirty = true;
        } else {
            updateAmplitudes();
        }
    }

    private void updateAmplitudes() {
        amplitudesDirty = false;
        double[] oldAmplitudes = this.amplitudes;
        this.amplitudes = computeAmplitudes();
        logger.debug("Amplitudes recomputed: {}", Arrays.toString(amplitudes));
        support.firePropertyChange(PROPERTY_AMPLITUDES, oldAmplitudes, getAmplitudes());
    }

    private double[] computeAmplitudes() {
        double[] values = new double[harmonics.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = harmonics.get(i).getAmplitude();
        }
        return values;
    }
}
