package de.anton.fourier.waves.fourier_waves.view;

import de.anton.fourier.waves.fourier_waves.model.AxisDescription;
import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import de.anton.fourier.waves.fourier_waves.model.Range;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.axis.NumberTickUnit;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Converts data sets and axis descriptions into JFreeChart datasets and axis settings.
 * Series are created unsorted and allow duplicate x values, so that polylines with vertical
 * segments (e.g. the square wave) keep their point order.
 */
public final class ChartDatasets {
    private static final Logger logger = LoggerFactory.getLogger(ChartDatasets.class);

    private ChartDatasets() {
        throw new IllegalStateException("Utility class");
    }

    public static XYSeries toXYSeries(Comparable<?> key, List<DataPoint> dataSet) {
        Objects.requireNonNull(key, "Series key cannot be null");
        XYSeries series = new XYSeries(key, false, true);
        replaceSeries(series, dataSet);
        return series;
    }

    /** One series per data set, keyed by prefix + (index + 1), e.g. "Harmonic 1". */
    public static XYSeriesCollection toSeriesCollection(String keyPrefix, List<List<DataPoint>> dataSets) {
        Objects.requireNonNull(dataSets, "dataSets cannot be null");
        XYSeriesCollection collection = new XYSeriesCollection();
        for (int i = 0; i < dataSets.size(); i++) {
            collection.addSeries(toXYSeries(keyPrefix + (i + 1), dataSets.get(i)));
        }
        return collection;
    }

    /**
     * Replaces the content of a series, with a single change notification to its listeners.
     */
    public static void replaceSeries(XYSeries series, List<DataPoint> dataSet) {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(dataSet, "dataSet cannot be null");
        boolean notify = series.getNotify();
        series.setNotify(false);
        try {
            series.clear();
            for (DataPoint point : dataSet) {
                series.add(point.x(), point.y(), false);
            }
        } finally {
            // Re-enabling notification fires the single change event.
            series.setNotify(notify);
        }
        logger.trace("Series '{}' replaced with {} points", series.getKey(), dataSet.size());
    }

    /**
     * Makes a collection hold exactly one series per data set, reusing series that already exist.
     */
    public static void replaceSeriesCollection(XYSeriesCollection collection, String keyPrefix, List<List<DataPoint>> dataSets) {
        Objects.requireNonNull(collection, "collection cannot be null");
        Objects.requireNonNull(dataSets, "dataSets cannot be null");
        while (collection.getSeriesCount() > dataSets.size()) {
            collection.removeSeries(collection.getSeriesCount() - 1);
        }
        for (int i = 0; i < dataSets.size(); i++) {
            if (i < collection.getSeriesCount()) {
                replaceSeries(collection.getSeries(i), dataSets.get(i));
            } else {
                collection.addSeries(toXYSeries(keyPrefix + (i + 1), dataSets.get(i)));
            }
        }
    }

    /** Fixed range and tick units from an AxisDescription; x axes are scaled by the domain's L or T first. */
    public static void applyAxisDescription(NumberAxis axis, AxisDescription axisDescription, double multiplier) {
        Objects.requireNonNull(axis, "axis cannot be null");
        Objects.requireNonNull(axisDescription, "axisDescription cannot be null");
        Range range = axisDescription.range().times(multiplier);
        axis.setAutoRange(false);
        axis.setRange(range.min(), range.max());
        axis.setTickUnit(new NumberTickUnit(axisDescription.tickLabelSpacing() * multiplier));
        int minorTickCount = (int) Math.round(axisDescription.tickLabelSpacing() / axisDescription.tickMarkSpacing());
        axis.setMinorTickCount(Math.max(minorTickCount, 1));
        axis.setMinorTickMarksVisible(minorTickCount > 1);
        logger.trace("Axis '{}' set to {} (tick unit {})", axis.getLabel(), range, axisDescription.tickLabelSpacing() * multiplier);
    }

    public static void applyAxisDescription(NumberAxis axis, AxisDescription axisDescription) {
        applyAxisDescription(axis, axisDescription, 1);
    }
}
