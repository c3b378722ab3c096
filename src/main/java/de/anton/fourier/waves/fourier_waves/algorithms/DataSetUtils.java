package de.anton.fourier.waves.fourier_waves.algorithms;

import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Utility class for combining data sets (ordered lists of {@link DataPoint}).
 * All combinators are index-aligned: points with the same index must have the same x value.
 */
public final class DataSetUtils {

    private static final Logger logger = LoggerFactory.getLogger(DataSetUtils.class);

    private DataSetUtils() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * Sums data sets point by point.
     *
     * @param dataSets Data sets sharing the same number of points and the same x values. Must not be empty.
     * @return A new unmodifiable data set whose y values are the sums of the inputs' y values.
     * @throws IllegalArgumentException if the data sets are empty, differ in size, or are not x-aligned.
     */
    public static List<DataPoint> sum(List<List<DataPoint>> dataSets) {
        Objects.requireNonNull(dataSets, "dataSets cannot be null");
        if (dataSets.isEmpty()) {
            throw new IllegalArgumentException("At least one data set is required.");
        }
        int pointsPerDataSet = dataSets.get(0).size();
        if (pointsPerDataSet == 0) {
            throw new IllegalArgumentException("Data sets must contain points.");
        }
        for (int j = 1; j < dataSets.size(); j++) {
            if (dataSets.get(j).size() != pointsPerDataSet) {
                throw new IllegalArgumentException("All data sets must have the same number of points. Expected "
                        + pointsPerDataSet + ", data set " + j + " has " + dataSets.get(j).size());
            }
        }

        List<DataPoint> dataSet = new ArrayList<>(pointsPerDataSet);
        for (int i = 0; i < pointsPerDataSet; i++) {
            double x = dataSets.get(0).get(i).x();
            double sum = 0;
            for (int j = 0; j < dataSets.size(); j++) {
                DataPoint point = dataSets.get(j).get(i);
                if (point.x() != x) {
                    throw new IllegalArgumentException("Points with the same index must have the same x value. Index "
                            + i + ": " + x + " vs " + point.x());
                }
                sum += point.y();
            }
            dataSet.add(new DataPoint(x, sum));
        }
        logger.trace("Summed {} data sets of {} points.", dataSets.size(), pointsPerDataSet);
        return Collections.unmodifiableList(dataSet);
    }

    /**
     * Computes the amplitude envelope sqrt(y1^2 + y2^2) of two data sets that are 90 degrees out of phase.
     *
     * @throws IllegalArgumentException if the data sets are empty, differ in size, or are not x-aligned.
     */
    public static List<DataPoint> envelope(List<DataPoint> dataSet1, List<DataPoint> dataSet2) {
        Objects.requireNonNull(dataSet1, "dataSet1 cannot be null");
        Objects.requireNonNull(dataSet2, "dataSet2 cannot be null");
        if (dataSet1.isEmpty() || dataSet1.size() != dataSet2.size()) {
            throw new IllegalArgumentException("Envelope requires two non-empty data sets of equal size. Got: "
                    + dataSet1.size() + " and " + dataSet2.size());
        }
        List<DataPoint> dataSet = new ArrayList<>(dataSet1.size());
        for (int i = 0; i < dataSet1.size(); i++) {
            DataPoint p1 = dataSet1.get(i);
            DataPoint p2 = dataSet2.get(i);
            if (p1.x() != p2.x()) {
                throw new IllegalArgumentException("Points with the same index must have the same x value. Index "
                        + i + ": " + p1.x() + " vs " + p2.x());
            }
            dataSet.add(new DataPoint(p1.x(), Math.sqrt(p1.y() * p1.y() + p2.y() * p2.y())));
        }
        return Collections.unmodifiableList(dataSet);
    }

    /**
     * @return the largest y value in a non-empty data set.
     * @throws IllegalArgumentException if the data set is empty.
     */
    public static double maxY(List<DataPoint> dataSet) {
        if (dataSet == null || dataSet.isEmpty()) {
            throw new IllegalArgumentException("Cannot find the peak of an empty data set.");
        }
        double max = Double.NEGATIVE_INFINITY;
        for (DataPoint point : dataSet) {
            max = Math.max(max, point.y());
        }
        return max;
    }

    /** @return true if x values are strictly increasing (true for empty and single-point data sets). */
    public static boolean isStrictlyIncreasing(List<DataPoint> dataSet) {
        for (int i = 1; i < dataSet.size(); i++) {
            if (!(dataSet.get(i).x() > dataSet.get(i - 1).x())) {
                return false;
            }
        }
        return true;
    }

    /** @return true if x values never decrease. Polylines with vertical edges satisfy this. */
    public static boolean isNonDecreasing(List<DataPoint> dataSet) {
        for (int i = 1; i < dataSet.size(); i++) {
            if (dataSet.get(i).x() < dataSet.get(i - 1).x()) {
                return false;
            }
        }
        return true;
    }
}
