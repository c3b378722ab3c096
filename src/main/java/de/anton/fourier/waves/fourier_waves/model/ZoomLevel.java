package de.anton.fourier.waves.fourier_waves.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.List;
import java.util.Objects;

/**
 * Selected zoom level of an axis, as an index into a table of {@link AxisDescription}s.
 * The index is the only stored state; the AxisDescription is derived from it, so the two can never disagree.
 * Setting the current value is a no-op and fires nothing, so listeners may write back without recursion.
 * Fires "zoomLevel" (Integer) on change.
 */
public class ZoomLevel {
    private static final Logger logger = LoggerFactory.getLogger(ZoomLevel.class);

    public static final String PROPERTY_ZOOM_LEVEL = "zoomLevel";

    private final String name;
    private final List<AxisDescription> axisDescriptions;
    private final int defaultZoomLevel;
    private int zoomLevel;

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    /**
     * @param name                     Name used in log messages, e.g. "Harmonics x axis".
     * @param axisDescriptions         Validated table, most zoomed-out first.
     * @param defaultAxisDescription   Initial selection, must be in the table.
     */
    public ZoomLevel(String name, List<AxisDescription> axisDescriptions, AxisDescription defaultAxisDescription) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(axisDescriptions, "axisDescriptions cannot be null");
        if (axisDescriptions.isEmpty()) {
            throw new IllegalArgumentException("axisDescriptions cannot be empty.");
        }
        this.axisDescriptions = List.copyOf(axisDescriptions);
        this.defaultZoomLevel = indexOf(defaultAxisDescription);
        this.zoomLevel = defaultZoomLevel;
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    public int getZoomLevel() { return zoomLevel; }
    public int getNumberOfZoomLevels() { return axisDescriptions.size(); }
    public List<AxisDescription> getAxisDescriptions() { return axisDescriptions; }

    public AxisDescription getAxisDescription() {
        return axisDescriptions.get(zoomLevel);
    }

    public void setZoomLevel(int zoomLevel) {
        if (zoomLevel < 0 || zoomLevel >= axisDescriptions.size()) {
            throw new IllegalArgumentException("Zoom level for " + name + " must be in [0, "
                    + (axisDescriptions.size() - 1) + "]. Got: " + zoomLevel);
        }
        if (this.zoomLevel != zoomLevel) {
            int oldZoomLevel = this.zoomLevel;
            this.zoomLevel = zoomLevel;
            logger.info("{}: zoom level set to {} (range {})", name, zoomLevel, getAxisDescription().range());
            support.firePropertyChange(PROPERTY_ZOOM_LEVEL, oldZoomLevel, zoomLevel);
        }
    }

    /** Selects an AxisDescription, which must be one of the table's entries. */
    public void setAxisDescription(AxisDescription axisDescription) {
        setZoomLevel(indexOf(axisDescription));
    }

    // Higher index means more zoomed-in.
    public boolean canZoomIn() { return zoomLevel < axisDescriptions.size() - 1; }
    public boolean canZoomOut() { return zoomLevel > 0; }

    public void zoomIn() {
        if (canZoomIn()) {
            setZoomLevel(zoomLevel + 1);
        }
    }

    public void zoomOut() {
        if (canZoomOut()) {
            setZoomLevel(zoomLevel - 1);
        }
    }

    public void reset() {
        setZoomLevel(defaultZoomLevel);
    }

    private int indexOf(AxisDescription axisDescription) {
        Objects.requireNonNull(axisDescription, "axisDescription cannot be null");
        int index = axisDescriptions.indexOf(axisDescription);
        if (index < 0) {
            throw new IllegalArgumentException("AxisDescription is not a zoom level of " + name + ". Got: " + axisDescription);
        }
        return index;
    }
}
