package de.anton.fourier.waves.fourier_waves.service;

import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import de.anton.fourier.waves.fourier_waves.model.DiscreteAxisDescriptions;
import de.anton.fourier.waves.fourier_waves.model.Domain;
import de.anton.fourier.waves.fourier_waves.model.FourierSeries;
import de.anton.fourier.waves.fourier_waves.model.Range;
import de.anton.fourier.waves.fourier_waves.model.SeriesType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HarmonicsChartTest {

    private static ChartContext context(Domain domain) {
        return new ChartContext(domain, SeriesType.SIN, 0, DiscreteAxisDescriptions.DEFAULT_X_AXIS_DESCRIPTION);
    }

    @Test
    void pointsScaleWithOrder() {
        assertEquals(91, HarmonicsChart.getNumberOfPoints(1, 11, 1000));
        assertEquals(182, HarmonicsChart.getNumberOfPoints(2, 11, 1000));
        assertEquals(1000, HarmonicsChart.getNumberOfPoints(11, 11, 1000));
        assertThrows(IllegalArgumentException.class, () -> HarmonicsChart.getNumberOfPoints(12, 11, 1000));
    }

    @Test
    void oneDataSetPerHarmonic() {
        FourierSeries series = new FourierSeries(SynthesisConfiguration.defaults());
        HarmonicsChart chart = new HarmonicsChart(series, context(Domain.SPACE));

        assertEquals(11, chart.getHarmonicDataSets().size());
        for (int order = 1; order <= 11; order++) {
            List<DataPoint> dataSet = chart.getHarmonicDataSet(order);
            assertEquals(HarmonicsChart.getNumberOfPoints(order, 11, 1000), dataSet.size());
            assertEquals(-0.5, dataSet.get(0).x());
            assertEquals(0.5, dataSet.get(dataSet.size() - 1).x());
        }
    }

    @Test
    void timeDomainScalesXByPeriod() {
        FourierSeries series = new FourierSeries(SynthesisConfiguration.defaults());
        HarmonicsChart chart = new HarmonicsChart(series, context(Domain.TIME));
        List<DataPoint> dataSet = chart.getHarmonicDataSet(1);
        assertEquals(0.5 * series.getT(), dataSet.get(dataSet.size() - 1).x(), 1e-12);
        assertEquals(new Range(-0.5 * series.getT(), 0.5 * series.getT()),
                chart.getXRange());
    }

    @Test
    void updateFiresOnce() {
        FourierSeries series = new FourierSeries(SynthesisConfiguration.defaults());
        HarmonicsChart chart = new HarmonicsChart(series, context(Domain.SPACE));
        List<String> events = new ArrayList<>();
        chart.addPropertyChangeListener(evt -> events.add(evt.getPropertyName()));

        chart.update(context(Domain.TIME));

        assertEquals(List.of(HarmonicsChart.PROPERTY_HARMONIC_DATA_SETS), events);
    }

    @Test
    void yAxisIsAmplitudeRange() {
        FourierSeries series = new FourierSeries(SynthesisConfiguration.defaults());
        HarmonicsChart chart = new HarmonicsChart(series, context(Domain.SPACE));
        assertSame(DiscreteAxisDescriptions.DEFAULT_Y_AXIS_DESCRIPTION, chart.getYAxisDescription());
    }
}
