package de.anton.fourier.waves.fourier_waves.service;

import de.anton.fourier.waves.fourier_waves.model.AxisDescription;
import de.anton.fourier.waves.fourier_waves.model.Range;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.Objects;

/**
 * Base class for charts plotted against a {@link de.anton.fourier.waves.fourier_waves.model.Domain}.
 * A chart recomputes all of its data sets when {@link #update(ChartContext)} is called, then fires one
 * property change per data set that changed. Subclasses call update from their constructor.
 */
public abstract class DomainChart {

    protected final PropertyChangeSupport support = new PropertyChangeSupport(this);

    private final double spaceMultiplier; // multiplies the x range for SPACE and SPACE_AND_TIME
    private final double timeMultiplier;  // multiplies the x range for TIME
    private ChartContext context;

    protected DomainChart(double spaceMultiplier, double timeMultiplier) {
        if (!(spaceMultiplier > 0) || !(timeMultiplier > 0)) {
            throw new IllegalArgumentException("Multipliers must be positive. Got: space=" + spaceMultiplier
                    + ", time=" + timeMultiplier);
        }
        this.spaceMultiplier = spaceMultiplier;
        this.timeMultiplier = timeMultiplier;
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }
    public void addPropertyChangeListener(String propertyName, PropertyChangeListener pcl) { support.addPropertyChangeListener(propertyName, pcl); }
    public void removePropertyChangeListener(String propertyName, PropertyChangeListener pcl) { support.removePropertyChangeListener(propertyName, pcl); }

    /**
     * Recomputes the chart for new inputs.
     */
    public final void update(ChartContext context) {
        this.context = Objects.requireNonNull(context, "ChartContext cannot be null");
        recompute();
    }

    /** Recomputes every data set from {@link #getContext()} and fires changes. */
    protected abstract void recompute();

    public ChartContext getContext() { return context; }
    public double getSpaceMultiplier() { return spaceMultiplier; }
    public double getTimeMultiplier() { return timeMultiplier; }

    public AxisDescription getXAxisDescription() {
        return context.xAxisDescription();
    }

    /** The x range in model units, i.e. the x axis description scaled for the current domain. */
    public Range getXRange() {
        return context.xAxisDescription().createRangeForDomain(context.domain(), spaceMultiplier, timeMultiplier);
    }
}
