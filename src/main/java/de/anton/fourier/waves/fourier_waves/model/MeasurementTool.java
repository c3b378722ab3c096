package de.anton.fourier.waves.fourier_waves.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.Objects;

/**
 * Tool that measures the wavelength or period of one harmonic. The measured order is bounded by the number of
 * relevant harmonics. Fires "selected" (Boolean) and "order" (Integer) on change.
 */
public class MeasurementTool {
    private static final Logger logger = LoggerFactory.getLogger(MeasurementTool.class);

    public static final String PROPERTY_SELECTED = "selected";
    public static final String PROPERTY_ORDER = "order";

    private final String symbol; // e.g. "λ" or "T"
    private boolean selected = false;
    private int order = 1;
    private int maxOrder;

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    public MeasurementTool(String symbol, int numberOfHarmonics) {
        this.symbol = Objects.requireNonNull(symbol, "symbol cannot be null");
        if (numberOfHarmonics < 1) {
            throw new IllegalArgumentException("numberOfHarmonics must be >= 1. Got: " + numberOfHarmonics);
        }
        this.maxOrder = numberOfHarmonics;
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    public String getSymbol() { return symbol; }
    public boolean isSelected() { return selected; }
    public int getOrder() { return order; }
    public Range getOrderRange() { return new Range(1, maxOrder); }

    public void setSelected(boolean selected) {
        if (this.selected != selected) {
            this.selected = selected;
            logger.debug("{} tool {}", symbol, selected ? "selected" : "deselected");
            support.firePropertyChange(PROPERTY_SELECTED, !selected, selected);
        }
    }

    public void setOrder(int order) {
        if (order < 1 || order > maxOrder) {
            throw new IllegalArgumentException("Order for the " + symbol + " tool must be in [1, " + maxOrder + "]. Got: " + order);
        }
        if (this.order != order) {
            int oldOrder = this.order;
            this.order = order;
            logger.debug("{} tool measures harmonic {}", symbol, order);
            support.firePropertyChange(PROPERTY_ORDER, oldOrder, order);
        }
    }

    /**
     * Follows a change in the number of relevant harmonics. If the measured harmonic is no longer relevant,
     * the tool is deselected and moved to the highest relevant harmonic.
     */
    public void setNumberOfHarmonics(int numberOfHarmonics) {
        if (numberOfHarmonics < 1) {
            throw new IllegalArgumentException("numberOfHarmonics must be >= 1. Got: " + numberOfHarmonics);
        }
        this.maxOrder = numberOfHarmonics;
        if (order > numberOfHarmonics) {
            setSelected(false);
            setOrder(numberOfHarmonics);
        }
    }

    /**
     * @param fundamental L for the wavelength tool, T for the period tool.
     * @return the wavelength or period of the measured harmonic.
     */
    public double getMeasuredValue(double fundamental) {
        return fundamental / order;
    }

    public void reset() {
        setSelected(false);
        setOrder(1);
    }
}
