package de.anton.fourier.waves.fourier_waves.model;

import de.anton.fourier.waves.fourier_waves.service.ChartContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.beans.PropertyChangeEvent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiscreteModelTest {

    private DiscreteModel model;
    private final List<PropertyChangeEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        model = new DiscreteModel();
        model.addPropertyChangeListener(events::add);
    }

    private long count(String propertyName) {
        return events.stream().filter(evt -> propertyName.equals(evt.getPropertyName())).count();
    }

    private ChartContext lastChartContext() {
        for (int i = events.size() - 1; i >= 0; i--) {
            if (DiscreteModel.PROPERTY_CHARTS_UPDATED.equals(events.get(i).getPropertyName())) {
                return (ChartContext) events.get(i).getNewValue();
            }
        }
        return null;
    }

    @Test
    void defaults() {
        assertEquals(Waveform.SINUSOID, model.getWaveform());
        assertEquals(SeriesType.SIN, model.getSeriesType());
        assertEquals(Domain.SPACE, model.getDomain());
        assertEquals(EquationForm.HIDDEN, model.getEquationForm());
        assertEquals(TickLabelFormat.NUMERIC, model.getXAxisTickLabelFormat());
        assertTrue(model.isPlaying());
        assertEquals(0, model.getT());
        assertEquals(11, model.getNumberOfHarmonics());
        double[] expected = new double[11];
        expected[0] = 1;
        assertArrayEquals(expected, model.getFourierSeries().getAmplitudes());
    }

    @Test
    void setWaveformAppliesPresetAndUpdatesChartsOnce() {
        model.setWaveform(Waveform.SQUARE);

        assertEquals(1, count(DiscreteModel.PROPERTY_CHARTS_UPDATED));
        assertEquals(1, count(DiscreteModel.PROPERTY_WAVEFORM));
        assertArrayEquals(Waveform.SQUARE.getAmplitudes(11, SeriesType.SIN), model.getFourierSeries().getAmplitudes(), 1e-12);
        assertEquals(6, model.getFourierSeries().getNumberOfNonZeroHarmonics());
    }

    @Test
    void nestedBatchUpdatesChartsOnce() {
        model.applyChanges(() -> {
            model.setWaveform(Waveform.TRIANGLE);
            model.setSeriesType(SeriesType.COS);
            model.setDomain(Domain.TIME);
            model.getXZoomLevel().zoomOut();
        });

        assertEquals(1, count(DiscreteModel.PROPERTY_CHARTS_UPDATED));
        ChartContext context = lastChartContext();
        assertEquals(Domain.TIME, context.domain());
        assertEquals(SeriesType.COS, context.seriesType());
        assertSame(DiscreteAxisDescriptions.X_AXIS_DESCRIPTIONS.get(3), context.xAxisDescription());
    }

    @Test
    void unchangedValueDoesNotUpdateCharts() {
        model.setWaveform(Waveform.SINUSOID);
        model.setDomain(Domain.SPACE);
        assertEquals(0, count(DiscreteModel.PROPERTY_CHARTS_UPDATED));
    }

    @Test
    void directHarmonicChangeStillUpdatesCharts() {
        model.getFourierSeries().getHarmonic(2).setAmplitude(0.3);
        assertEquals(1, count(DiscreteModel.PROPERTY_CHARTS_UPDATED));
        assertEquals(0.3, model.getAmplitudesChart().getAmplitudesDataSet().get(1).y());
    }

    @Test
    void sawtoothWithCosinesSwitchesToSines() {
        model.setWaveform(Waveform.SAWTOOTH);
        events.clear();

        model.setSeriesType(SeriesType.COS);

        assertEquals(SeriesType.SIN, model.getSeriesType());
        assertEquals(1, count(DiscreteModel.EVENT_SAWTOOTH_WITH_COSINES_REJECTED));
        assertEquals(1, count(DiscreteModel.PROPERTY_CHARTS_UPDATED));
        assertArrayEquals(Waveform.SAWTOOTH.getAmplitudes(11, SeriesType.SIN), model.getFourierSeries().getAmplitudes(), 1e-12);
    }

    @Test
    void choosingSawtoothWhileUsingCosinesSwitchesToSines() {
        model.setSeriesType(SeriesType.COS);
        events.clear();

        model.setWaveform(Waveform.SAWTOOTH);

        assertEquals(Waveform.SAWTOOTH, model.getWaveform());
        assertEquals(SeriesType.SIN, model.getSeriesType());
        assertEquals(1, count(DiscreteModel.EVENT_SAWTOOTH_WITH_COSINES_REJECTED));
        assertEquals(SeriesType.SIN, lastChartContext().seriesType());
    }

    @Test
    void setHarmonicAmplitudeMakesWaveformCustom() {
        model.setWaveform(Waveform.SQUARE);
        events.clear();

        model.setHarmonicAmplitude(2, 0.5);

        assertEquals(Waveform.CUSTOM, model.getWaveform());
        assertEquals(0.5, model.getFourierSeries().getHarmonic(2).getAmplitude());
        assertEquals(4 / Math.PI, model.getFourierSeries().getHarmonic(1).getAmplitude(), 1e-12);
        assertEquals(1, count(DiscreteModel.PROPERTY_CHARTS_UPDATED));
        assertThrows(IllegalArgumentException.class, () -> model.setHarmonicAmplitude(12, 0.5));
    }

    @Test
    void customWaveformKeepsAmplitudesWhenSeriesTypeChanges() {
        model.setHarmonicAmplitude(3, -0.7);
        double[] before = model.getFourierSeries().getAmplitudes();

        model.setSeriesType(SeriesType.COS);

        assertArrayEquals(before, model.getFourierSeries().getAmplitudes());
    }

    @Test
    void setAmplitudesReplacesAll() {
        double[] amplitudes = new double[11];
        Arrays.fill(amplitudes, -0.2);

        model.setAmplitudes(amplitudes);

        assertEquals(Waveform.CUSTOM, model.getWaveform());
        assertArrayEquals(amplitudes, model.getFourierSeries().getAmplitudes());
        assertEquals(1, count(DiscreteModel.PROPERTY_CHARTS_UPDATED));
    }

    @Test
    void reducingHarmonicsReappliesPreset() {
        model.setWaveform(Waveform.SQUARE);

        model.setNumberOfHarmonics(3);

        double[] amplitudes = model.getFourierSeries().getAmplitudes();
        assertEquals(4 / Math.PI, amplitudes[0], 1e-12);
        assertEquals(4 / (3 * Math.PI), amplitudes[2], 1e-12);
        for (int i = 3; i < amplitudes.length; i++) {
            assertEquals(0, amplitudes[i]);
        }
        assertEquals(3, model.getAmplitudesChart().getAmplitudesDataSet().size());
        assertEquals(new Range(1, 3), model.getWavelengthTool().getOrderRange());
    }

    @Test
    void stepAdvancesTimeOnlyWhilePlayingInSpaceAndTime() {
        model.step(1);
        assertEquals(0, model.getT());

        model.setDomain(Domain.SPACE_AND_TIME);
        model.step(0.5);
        assertEquals(0.5, model.getT(), 1e-12);

        model.setPlaying(false);
        model.step(0.5);
        assertEquals(0.5, model.getT(), 1e-12);
    }

    @Test
    void stepOnceAdvancesByFixedStep() {
        model.stepOnce();
        assertEquals(DiscreteModel.STEP_DT * DiscreteModel.TIME_SCALE, model.getT(), 1e-12);
        assertEquals(1, count(DiscreteModel.PROPERTY_CHARTS_UPDATED));
    }

    @Test
    void changingDomainResetsTimeAndEquationForm() {
        model.setDomain(Domain.SPACE_AND_TIME);
        model.setEquationForm(EquationForm.WAVELENGTH_AND_PERIOD);
        model.stepOnce();
        assertTrue(model.getT() > 0);

        model.setDomain(Domain.SPACE);

        assertEquals(0, model.getT());
        assertEquals(EquationForm.HIDDEN, model.getEquationForm());
    }

    @Test
    void modeEquationSurvivesDomainChange() {
        model.setEquationForm(EquationForm.MODE);
        model.setDomain(Domain.TIME);
        assertEquals(EquationForm.MODE, model.getEquationForm());
        assertEquals(TickLabelFormat.SYMBOLIC, model.getXAxisTickLabelFormat());
    }

    @Test
    void unsupportedEquationFormIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> model.setEquationForm(EquationForm.FREQUENCY));
        assertEquals(EquationForm.HIDDEN, model.getEquationForm());
    }

    @Test
    void sumYAxisGrowsWithTheSum() {
        assertEquals(FourierConstants.MAX_AMPLITUDE, model.getSumChart().getYAxisDescription().range().max());

        double[] amplitudes = new double[11];
        Arrays.fill(amplitudes, FourierConstants.MAX_AMPLITUDE);
        model.applyChanges(() -> {
            model.setSeriesType(SeriesType.COS);
            model.setAmplitudes(amplitudes);
        });

        assertEquals(20, model.getSumChart().getYAxisDescription().range().max());
    }

    @Test
    void infiniteHarmonicsFollowWaveform() {
        model.setWaveform(Waveform.SQUARE);
        model.setInfiniteHarmonicsVisible(true);
        assertFalse(model.getSumChart().getInfiniteHarmonicsDataSet().isEmpty());

        model.setWaveform(Waveform.SINUSOID);
        assertTrue(model.getSumChart().getInfiniteHarmonicsDataSet().isEmpty());
    }

    @Test
    void measurementToolsMeasureSelectedHarmonic() {
        model.getWavelengthTool().setOrder(2);
        model.getPeriodTool().setOrder(4);
        assertEquals(0.5, model.getMeasuredWavelength(), 1e-12);
        assertEquals(1000 / 440d / 4, model.getMeasuredPeriod(), 1e-12);
    }

    @Test
    void resetRestoresInitialStateWithOneUpdate() {
        model.setWaveform(Waveform.TRIANGLE);
        model.setDomain(Domain.SPACE_AND_TIME);
        model.setEquationForm(EquationForm.WAVELENGTH_AND_PERIOD);
        model.setNumberOfHarmonics(4);
        model.setInfiniteHarmonicsVisible(true);
        model.getXZoomLevel().setZoomLevel(0);
        model.setPlaying(false);
        model.stepOnce();
        events.clear();

        model.reset();

        assertEquals(1, count(DiscreteModel.PROPERTY_CHARTS_UPDATED));
        assertEquals(Waveform.SINUSOID, model.getWaveform());
        assertEquals(Domain.SPACE, model.getDomain());
        assertEquals(EquationForm.HIDDEN, model.getEquationForm());
        assertEquals(11, model.getNumberOfHarmonics());
        assertEquals(0, model.getT());
        assertTrue(model.isPlaying());
        assertFalse(model.getSumChart().isInfiniteHarmonicsVisible());
        assertSame(DiscreteAxisDescriptions.DEFAULT_X_AXIS_DESCRIPTION, model.getXZoomLevel().getAxisDescription());
        assertEquals(1, model.getFourierSeries().getAmplitudes()[0]);
    }
}
