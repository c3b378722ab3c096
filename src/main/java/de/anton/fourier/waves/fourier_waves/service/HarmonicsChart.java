package de.anton.fourier.waves.fourier_waves.service;

import de.anton.fourier.waves.fourier_waves.model.AxisDescription;
import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import de.anton.fourier.waves.fourier_waves.model.DiscreteAxisDescriptions;
import de.anton.fourier.waves.fourier_waves.model.FourierSeries;
import de.anton.fourier.waves.fourier_waves.model.Harmonic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Plots each harmonic of a Fourier series separately. Higher orders get proportionally more points, so that
 * every harmonic is drawn with the same number of points per wavelength.
 * Fires "harmonicDataSets" (List of data sets, index 0 is order 1).
 */
public class HarmonicsChart extends DomainChart {
    private static final Logger logger = LoggerFactory.getLogger(HarmonicsChart.class);

    public static final String PROPERTY_HARMONIC_DATA_SETS = "harmonicDataSets";

    private final FourierSeries fourierSeries;
    private List<List<DataPoint>> harmonicDataSets = Collections.emptyList();

    public HarmonicsChart(FourierSeries fourierSeries, ChartContext context) {
        super(fourierSeries.getL(), fourierSeries.getT());
        this.fourierSeries = Objects.requireNonNull(fourierSeries, "fourierSeries cannot be null");
        update(context);
    }

    /**
     * Number of points for a harmonic: ceil(maxPoints * order / numberOfHarmonics).
     */
    public static int getNumberOfPoints(int order, int numberOfHarmonics, int maxPointsPerDataSet) {
        if (order < 1 || order > numberOfHarmonics) {
            throw new IllegalArgumentException("Order must be in [1, " + numberOfHarmonics + "]. Got: " + order);
        }
        return (int) Math.ceil((double) maxPointsPerDataSet * order / numberOfHarmonics);
    }

    @Override
    protected void recompute() {
        ChartContext context = getContext();
        List<Harmonic> harmonics = fourierSeries.getHarmonics();
        List<List<DataPoint>> dataSets = new ArrayList<>(harmonics.size());
        for (Harmonic harmonic : harmonics) {
            int numberOfPoints = getNumberOfPoints(harmonic.getOrder(), harmonics.size(), fourierSeries.getMaxPointsPerDataSet());
            dataSets.add(harmonic.createDataSet(numberOfPoints, fourierSeries.getL(), fourierSeries.getT(),
                    context.xAxisDescription(), context.domain(), context.seriesType(), context.t()));
        }
        List<List<DataPoint>> oldDataSets = this.harmonicDataSets;
        this.harmonicDataSets = Collections.unmodifiableList(dataSets);
        logger.trace("Harmonics chart recomputed: {} data sets, {} {} t={}", dataSets.size(), context.domain(),
                context.seriesType(), context.t());
        support.firePropertyChange(PROPERTY_HARMONIC_DATA_SETS, oldDataSets, harmonicDataSets);
    }

    public List<List<DataPoint>> getHarmonicDataSets() { return harmonicDataSets; }

    public List<DataPoint> getHarmonicDataSet(int order) {
        if (order < 1 || order > harmonicDataSets.size()) {
            throw new IllegalArgumentException("Order must be in [1, " + harmonicDataSets.size() + "]. Got: " + order);
        }
        return harmonicDataSets.get(order - 1);
    }

    /** The y axis is fixed to the amplitude range. */
    public AxisDescription getYAxisDescription() {
        return DiscreteAxisDescriptions.DEFAULT_Y_AXIS_DESCRIPTION;
    }

    public FourierSeries getFourierSeries() { return fourierSeries; }
}
