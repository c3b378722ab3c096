package de.anton.fourier.waves.fourier_waves.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A Gaussian wave packet. The model uses L = T = 1 for both the space and time domains; the domain only changes
 * symbols and units.
 * <p>
 * The standard deviation is stored; the conjugate standard deviation is always 1 / standardDeviation.
 * Fires "componentSpacing", "center" and "standardDeviation" (Double) on change.
 */
public class WavePacket {
    private static final Logger logger = LoggerFactory.getLogger(WavePacket.class);

    public static final String PROPERTY_COMPONENT_SPACING = "componentSpacing";
    public static final String PROPERTY_CENTER = "center";
    public static final String PROPERTY_STANDARD_DEVIATION = "standardDeviation";
    public static final String PROPERTY_RESET = "reset";

    /** Returned by {@link #getNumberOfComponents()} when the spacing is 0. */
    public static final int INFINITE_COMPONENTS = Integer.MAX_VALUE;

    /** Valid component spacings, ascending. 0 means an infinite number of components. */
    public static final List<Double> COMPONENT_SPACING_VALUES = List.of(0d, Math.PI / 4, Math.PI / 2, Math.PI);

    public static final double L = 1;
    public static final double T = 1;

    public static final Range WAVE_NUMBER_RANGE = new Range(0, 24 * Math.PI);
    public static final Range CENTER_RANGE = new Range(9 * Math.PI, 15 * Math.PI);
    public static final Range STANDARD_DEVIATION_RANGE = new Range(Math.PI, 4 * Math.PI);
    public static final Range CONJUGATE_STANDARD_DEVIATION_RANGE =
            new Range(1 / STANDARD_DEVIATION_RANGE.max(), 1 / STANDARD_DEVIATION_RANGE.min());

    private static final double DEFAULT_COMPONENT_SPACING = Math.PI;
    private static final double DEFAULT_CENTER = 12 * Math.PI;
    private static final double DEFAULT_STANDARD_DEVIATION = 3 * Math.PI;

    // Step for the continuous waveform, fine enough to look smooth.
    private static final double CONTINUOUS_WAVEFORM_STEP = Math.PI / 10;

    // Absorbs rounding in the quotient, e.g. 24 pi / (pi / 4) must give 96.
    private static final double COMPONENT_COUNT_EPSILON = 1e-9;

    private double componentSpacing = DEFAULT_COMPONENT_SPACING;
    private double center = DEFAULT_CENTER;
    private double standardDeviation = DEFAULT_STANDARD_DEVIATION;

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    public WavePacket() {
        logger.debug("WavePacket created: spacing={}, center={}, standardDeviation={}", componentSpacing, center, standardDeviation);
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    public double getComponentSpacing() { return componentSpacing; }
    public double getCenter() { return center; }
    public double getStandardDeviation() { return standardDeviation; }

    /** sigma_x (space) or sigma_t (time). */
    public double getConjugateStandardDeviation() {
        return 1 / standardDeviation;
    }

    /** Width in k (or omega) space, 2 sigma. */
    public double getWidth() {
        return 2 * standardDeviation;
    }

    /** Wavelength (or period) of the first component, infinite for spacing 0. */
    public double getLength() {
        return (componentSpacing == 0) ? Double.POSITIVE_INFINITY : 2 * Math.PI / componentSpacing;
    }

    public void setComponentSpacing(double componentSpacing) {
        if (!COMPONENT_SPACING_VALUES.contains(componentSpacing)) {
            throw new IllegalArgumentException("Component spacing must be one of " + COMPONENT_SPACING_VALUES
                    + ". Got: " + componentSpacing);
        }
        if (this.componentSpacing != componentSpacing) {
            double oldComponentSpacing = this.componentSpacing;
            this.componentSpacing = componentSpacing;
            logger.info("WavePacket: component spacing set to {}", componentSpacing);
            support.firePropertyChange(PROPERTY_COMPONENT_SPACING, oldComponentSpacing, componentSpacing);
        }
    }

    public void setCenter(double center) {
        if (!CENTER_RANGE.contains(center)) {
            throw new IllegalArgumentException("Center must be in " + CENTER_RANGE + ". Got: " + center);
        }
        if (this.center != center) {
            double oldCenter = this.center;
            this.center = center;
            logger.info("WavePacket: center set to {}", center);
            support.firePropertyChange(PROPERTY_CENTER, oldCenter, center);
        }
    }

    public void setStandardDeviation(double standardDeviation) {
        if (!STANDARD_DEVIATION_RANGE.contains(standardDeviation)) {
            throw new IllegalArgumentException("Standard deviation must be in " + STANDARD_DEVIATION_RANGE
                    + ". Got: " + standardDeviation);
        }
        if (this.standardDeviation != standardDeviation) {
            double oldStandardDeviation = this.standardDeviation;
            this.standardDeviation = standardDeviation;
            logger.info("WavePacket: standard deviation set to {} (conjugate {})", standardDeviation, getConjugateStandardDeviation());
            support.firePropertyChange(PROPERTY_STANDARD_DEVIATION, oldStandardDeviation, standardDeviation);
        }
    }

    /**
     * Sets the standard deviation to 1 / conjugateStandardDeviation.
     */
    public void setConjugateStandardDeviation(double conjugateStandardDeviation) {
        if (!CONJUGATE_STANDARD_DEVIATION_RANGE.contains(conjugateStandardDeviation)) {
            throw new IllegalArgumentException("Conjugate standard deviation must be in " + CONJUGATE_STANDARD_DEVIATION_RANGE
                    + ". Got: " + conjugateStandardDeviation);
        }
        // 1 / (1 / 4pi) may round to just outside the range.
        setStandardDeviation(STANDARD_DEVIATION_RANGE.constrain(1 / conjugateStandardDeviation));
    }

    public boolean hasInfiniteComponents() {
        return componentSpacing == 0;
    }

    /**
     * @return {@link #INFINITE_COMPONENTS} if the spacing is 0, otherwise floor(waveNumberRange.length / spacing) + 1.
     */
    public int getNumberOfComponents() {
        if (componentSpacing == 0) {
            return INFINITE_COMPONENTS;
        }
        return (int) Math.floor(WAVE_NUMBER_RANGE.getLength() / componentSpacing + COMPONENT_COUNT_EPSILON) + 1;
    }

    /**
     * Normalized Gaussian density at a wave number.
     */
    public double getComponentAmplitude(double waveNumber) {
        double sigma = standardDeviation;
        return Math.exp(-((waveNumber - center) * (waveNumber - center)) / (2 * sigma * sigma))
                / (sigma * Math.sqrt(2 * Math.PI));
    }

    /**
     * Decomposes the packet into components at wave numbers i * spacing, each with amplitude
     * getComponentAmplitude(waveNumber) * spacing.
     *
     * @return The components, or an empty list if the number of components is infinite.
     */
    public List<FourierComponent> getComponents() {
        if (hasInfiniteComponents()) {
            return Collections.emptyList();
        }
        int numberOfComponents = getNumberOfComponents();
        List<FourierComponent> components = new ArrayList<>(numberOfComponents);
        for (int i = 0; i < numberOfComponents; i++) {
            double waveNumber = i * componentSpacing;
            components.add(new FourierComponent(waveNumber, getComponentAmplitude(waveNumber) * componentSpacing));
        }
        return Collections.unmodifiableList(components);
    }

    /**
     * Samples the Gaussian every pi/10 from the start of the wave number range to one step past its end.
     * Amplitudes are multiplied by the component spacing unless it is 0.
     */
    public List<DataPoint> createContinuousWaveformDataSet() {
        double maxWaveNumber = WAVE_NUMBER_RANGE.max() + CONTINUOUS_WAVEFORM_STEP;
        int numberOfPoints = (int) Math.floor((maxWaveNumber - WAVE_NUMBER_RANGE.min()) / CONTINUOUS_WAVEFORM_STEP
                + COMPONENT_COUNT_EPSILON) + 1;
        List<DataPoint> dataSet = new ArrayList<>(numberOfPoints);
        for (int i = 0; i < numberOfPoints; i++) {
            double waveNumber = WAVE_NUMBER_RANGE.min() + i * CONTINUOUS_WAVEFORM_STEP;
            double amplitude = getComponentAmplitude(waveNumber);
            if (componentSpacing != 0) {
                amplitude *= componentSpacing;
            }
            dataSet.add(new DataPoint(waveNumber, amplitude));
        }
        return Collections.unmodifiableList(dataSet);
    }

    /** Restores the defaults, notifying once with {@link #PROPERTY_RESET} if anything changed. */
    public void reset() {
        boolean changed = componentSpacing != DEFAULT_COMPONENT_SPACING || center != DEFAULT_CENTER
                || standardDeviation != DEFAULT_STANDARD_DEVIATION;
        if (changed) {
            componentSpacing = DEFAULT_COMPONENT_SPACING;
            center = DEFAULT_CENTER;
            standardDeviation = DEFAULT_STANDARD_DEVIATION;
            logger.info("WavePacket: reset to spacing={}, center={}, standardDeviation={}", componentSpacing, center, standardDeviation);
            support.firePropertyChange(PROPERTY_RESET, false, true);
        }
    }
}
