package de.anton.fourier.waves.fourier_waves.service;

import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import de.anton.fourier.waves.fourier_waves.model.DiscreteFourierSeries;
import de.anton.fourier.waves.fourier_waves.model.Harmonic;
import de.anton.fourier.waves.fourier_waves.model.Range;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * (order, amplitude) points for the relevant harmonics of a discrete Fourier series.
 * Fires "amplitudesDataSet".
 */
public class DiscreteAmplitudesChart {

    public static final String PROPERTY_AMPLITUDES_DATA_SET = "amplitudesDataSet";

    private final DiscreteFourierSeries fourierSeries;
    private List<DataPoint> amplitudesDataSet = Collections.emptyList();

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    public DiscreteAmplitudesChart(DiscreteFourierSeries fourierSeries) {
        this.fourierSeries = Objects.requireNonNull(fourierSeries, "fourierSeries cannot be null");
        update();
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    public void update() {
        List<Harmonic> harmonics = fourierSeries.getHarmonics();
        List<DataPoint> dataSet = new ArrayList<>(fourierSeries.getNumberOfHarmonics());
        for (int i = 0; i < fourierSeries.getNumberOfHarmonics(); i++) {
            Harmonic harmonic = harmonics.get(i);
            dataSet.add(new DataPoint(harmonic.getOrder(), harmonic.getAmplitude()));
        }
        List<DataPoint> oldDataSet = this.amplitudesDataSet;
        this.amplitudesDataSet = Collections.unmodifiableList(dataSet);
        support.firePropertyChange(PROPERTY_AMPLITUDES_DATA_SET, oldDataSet, amplitudesDataSet);
    }

    public List<DataPoint> getAmplitudesDataSet() { return amplitudesDataSet; }

    /** x axis spans the orders of all harmonics, with half a slot of margin on each side. */
    public Range getXRange() {
        return new Range(0.5, fourierSeries.getMaxNumberOfHarmonics() + 0.5);
    }

    public Range getYRange() {
        return fourierSeries.getAmplitudeRange();
    }
}
