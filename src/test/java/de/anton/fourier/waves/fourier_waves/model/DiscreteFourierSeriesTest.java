package de.anton.fourier.waves.fourier_waves.model;

import de.anton.fourier.waves.fourier_waves.service.SynthesisConfiguration;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiscreteFourierSeriesTest {

    @Test
    void reducingHarmonicsZeroesTheRestInOneNotification() {
        DiscreteFourierSeries series = new DiscreteFourierSeries(SynthesisConfiguration.defaults());
        series.setAllAmplitudes(1);
        List<String> events = new ArrayList<>();
        series.addPropertyChangeListener(evt -> events.add(evt.getPropertyName()));

        series.setNumberOfHarmonics(3);

        assertEquals(3, series.getNumberOfHarmonics());
        assertEquals(11, series.getMaxNumberOfHarmonics());
        double[] amplitudes = series.getAmplitudes();
        for (int i = 0; i < amplitudes.length; i++) {
            assertEquals(i < 3 ? 1 : 0, amplitudes[i], "amplitude of harmonic " + (i + 1));
        }
        assertEquals(List.of(FourierSeries.PROPERTY_AMPLITUDES, DiscreteFourierSeries.PROPERTY_NUMBER_OF_HARMONICS), events);
    }

    @Test
    void numberOfHarmonicsIsBounded() {
        DiscreteFourierSeries series = new DiscreteFourierSeries(SynthesisConfiguration.defaults());
        assertThrows(IllegalArgumentException.class, () -> series.setNumberOfHarmonics(0));
        assertThrows(IllegalArgumentException.class, () -> series.setNumberOfHarmonics(12));
    }

    @Test
    void resetRestoresAllHarmonics() {
        DiscreteFourierSeries series = new DiscreteFourierSeries(SynthesisConfiguration.defaults());
        series.setNumberOfHarmonics(2);
        series.reset();
        assertEquals(11, series.getNumberOfHarmonics());
    }
}
