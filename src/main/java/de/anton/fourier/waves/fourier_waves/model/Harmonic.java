package de.anton.fourier.waves.fourier_waves.model;

import de.anton.fourier.waves.fourier_waves.algorithms.AmplitudeFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One term of a discrete Fourier series. Only the amplitude is mutable; it fires "amplitude" (Double) on change.
 */
public class Harmonic {
    private static final Logger logger = LoggerFactory.getLogger(Harmonic.class);

    public static final String PROPERTY_AMPLITUDE = "amplitude";

    private final int order;            // numbered from 1
    private final double frequency;     // Hz
    private final double wavelength;    // m
    private final double period;        // ms
    private final Range amplitudeRange;
    private final String colorTag;
    private double amplitude;

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    /**
     * @param order                 Order of the harmonic, at least 1.
     * @param fundamentalFrequency  Frequency of the first harmonic, in Hz.
     * @param fundamentalWavelength Wavelength of the first harmonic, in m.
     * @param amplitudeRange        Range of the amplitude, symmetric about zero.
     * @param amplitude             Initial amplitude.
     */
    public Harmonic(int order, double fundamentalFrequency, double fundamentalWavelength, Range amplitudeRange, double amplitude) {
        if (order < 1) {
            throw new IllegalArgumentException("Harmonic order must be >= 1. Got: " + order);
        }
        if (!(fundamentalFrequency > 0) || !(fundamentalWavelength > 0)) {
            throw new IllegalArgumentException("Fundamental frequency and wavelength must be positive. Got: "
                    + fundamentalFrequency + " Hz, " + fundamentalWavelength + " m");
        }
        Objects.requireNonNull(amplitudeRange, "amplitudeRange cannot be null");
        if (amplitudeRange.getCenter() != 0) {
            throw new IllegalArgumentException("Amplitude range must be symmetric about zero. Got: " + amplitudeRange);
        }
        this.order = order;
        this.frequency = fundamentalFrequency * order;
        this.wavelength = fundamentalWavelength / order;
        this.period = 1000 / frequency;
        this.amplitudeRange = amplitudeRange;
        this.colorTag = "harmonic" + order + "Color";
        checkAmplitude(amplitude);
        this.amplitude = amplitude;
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    public int getOrder() { return order; }
    public double getFrequency() { return frequency; }
    public double getWavelength() { return wavelength; }
    public double getPeriod() { return period; }
    public Range getAmplitudeRange() { return amplitudeRange; }

    /** Key of this harmonic's slot in the color palette. */
    public String getColorTag() { return colorTag; }

    public double getAmplitude() { return amplitude; }

    public void setAmplitude(double amplitude) {
        checkAmplitude(amplitude);
        if (this.amplitude != amplitude) {
            double oldAmplitude = this.amplitude;
            this.amplitude = amplitude;
            logger.trace("Harmonic {}: amplitude {} -> {}", order, oldAmplitude, amplitude);
            support.firePropertyChange(PROPERTY_AMPLITUDE, oldAmplitude, amplitude);
        }
    }

    /**
     * Creates the data set for this harmonic, over the x range of an axis description.
     *
     * @see #createDataSet(int, double, int, double, double, Range, Domain, SeriesType, double)
     */
    public List<DataPoint> createDataSet(int numberOfPoints, double L, double T, AxisDescription xAxisDescription,
                                         Domain domain, SeriesType seriesType, double t) {
        Objects.requireNonNull(xAxisDescription, "xAxisDescription cannot be null");
        Range xRange = xAxisDescription.createRangeForDomain(domain, L, T);
        return createDataSet(order, amplitude, numberOfPoints, L, T, xRange, domain, seriesType, t);
    }

    /**
     * Creates the data set for a harmonic. Points are evenly spaced, the first at xRange.min and the last
     * exactly at xRange.max. A single point is placed at xRange.min.
     *
     * @param order          Order of the harmonic, at least 1.
     * @param amplitude      Amplitude of the harmonic.
     * @param numberOfPoints Number of points, at least 1.
     * @param L              Wavelength of the fundamental harmonic, in m.
     * @param T              Period of the fundamental harmonic, in ms.
     * @param xRange         Range of x.
     * @param domain         Domain of the plot.
     * @param seriesType     sin or cos.
     * @param t              Time, in ms, at least 0.
     * @return An unmodifiable data set with exactly numberOfPoints points, ordered by increasing x.
     */
    public static List<DataPoint> createDataSet(int order, double amplitude, int numberOfPoints, double L, double T,
                                                Range xRange, Domain domain, SeriesType seriesType, double t) {
        if (order < 1) {
            throw new IllegalArgumentException("Harmonic order must be >= 1. Got: " + order);
        }
        if (numberOfPoints < 1) {
            throw new IllegalArgumentException("numberOfPoints must be >= 1. Got: " + numberOfPoints);
        }
        if (!(L > 0) || !(T > 0)) {
            throw new IllegalArgumentException("L and T must be positive. Got: L=" + L + ", T=" + T);
        }
        if (!(t >= 0)) {
            throw new IllegalArgumentException("t must be >= 0. Got: " + t);
        }
        Objects.requireNonNull(xRange, "xRange cannot be null");
        AmplitudeFunction amplitudeFunction = AmplitudeFunction.of(domain, seriesType);

        List<DataPoint> dataSet = new ArrayList<>(numberOfPoints);
        if (numberOfPoints == 1) {
            double x = xRange.min();
            dataSet.add(new DataPoint(x, amplitudeFunction.evaluate(amplitude, order, x, t, L, T)));
        } else {
            double dx = xRange.getLength() / (numberOfPoints - 1);
            for (int i = 0; i < numberOfPoints; i++) {
                double x = (i == numberOfPoints - 1) ? xRange.max() : xRange.min() + i * dx;
                dataSet.add(new DataPoint(x, amplitudeFunction.evaluate(amplitude, order, x, t, L, T)));
            }
        }
        return Collections.unmodifiableList(dataSet);
    }

    private void checkAmplitude(double amplitude) {
        if (!amplitudeRange.contains(amplitude)) {
            throw new IllegalArgumentException("Amplitude of harmonic " + order + " must be in " + amplitudeRange
                    + ". Got: " + amplitude);
        }
    }

    @Override
    public String toString() {
        return "Harmonic{order=" + order + ", amplitude=" + amplitude + "}";
    }
}
