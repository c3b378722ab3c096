package de.anton.fourier.waves.fourier_waves.model;

import de.anton.fourier.waves.fourier_waves.algorithms.DataSetUtils;
import de.anton.fourier.waves.fourier_waves.service.SynthesisConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.beans.PropertyChangeEvent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class WaveGameLevelTest {

    private WaveGameLevel level;
    private final List<PropertyChangeEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        AmplitudesGenerator generator = new AmplitudesGenerator(11, 1.5, 0.1, new Random(42));
        level = new WaveGameLevel(3, 5, () -> 3, SynthesisConfiguration.defaults(), generator);
        level.addPropertyChangeListener(events::add);
    }

    private long count(String propertyName) {
        return events.stream().filter(evt -> propertyName.equals(evt.getPropertyName())).count();
    }

    private List<String> names() {
        List<String> names = new ArrayList<>();
        for (PropertyChangeEvent evt : events) {
            names.add(evt.getPropertyName());
        }
        return names;
    }

    private void copyAnswerIntoGuess() {
        double[] answer = level.getAnswerSeries().getAmplitudes();
        for (int i = 0; i < answer.length; i++) {
            level.setGuessAmplitude(i + 1, answer[i]);
        }
    }

    @Test
    void newLevelStartsUnsolvedWithZeroGuess() {
        assertEquals(3, level.getAnswerSeries().getNumberOfNonZeroHarmonics());
        assertEquals(0, level.getGuessSeries().getNumberOfNonZeroHarmonics());
        assertFalse(level.isMatched());
        assertFalse(level.isSolved());
        assertEquals(0, level.getScore());
        assertEquals(5, level.getNumberOfAmplitudeControls());
    }

    @Test
    void guessMatchesOnlyWhenEveryAmplitudeMatches() {
        double[] answer = level.getAnswerSeries().getAmplitudes();
        int lastNonZero = -1;
        for (int i = 0; i < answer.length; i++) {
            if (answer[i] != 0) {
                lastNonZero = i;
            }
        }
        for (int i = 0; i < lastNonZero; i++) {
            level.setGuessAmplitude(i + 1, answer[i]);
        }
        assertFalse(level.isMatched());

        level.setGuessAmplitude(lastNonZero + 1, answer[lastNonZero]);
        assertTrue(level.isMatched());
        assertEquals(1, count(WaveGameLevel.PROPERTY_MATCHED));
    }

    @Test
    void correctAnswerAwardsPointAndSolves() {
        copyAnswerIntoGuess();
        events.clear();

        level.checkAnswer();

        assertEquals(1, level.getScore());
        assertTrue(level.isSolved());
        assertEquals(List.of(WaveGameLevel.PROPERTY_SCORE, WaveGameLevel.PROPERTY_SOLVED, WaveGameLevel.EVENT_CORRECT), names());
        assertEquals(FourierConstants.POINTS_PER_CHALLENGE, events.get(2).getNewValue());
        assertThrows(IllegalStateException.class, () -> level.checkAnswer());
    }

    @Test
    void incorrectAnswerIsNotified() {
        level.setGuessAmplitude(11, 1.5);
        events.clear();

        level.checkAnswer();

        assertEquals(List.of(WaveGameLevel.EVENT_INCORRECT), names());
        assertEquals(0, level.getScore());
        assertFalse(level.isSolved());
    }

    @Test
    void showAnswerSolvesWithoutPoints() {
        level.showAnswer();

        assertTrue(level.isSolved());
        assertTrue(level.isMatched());
        assertArrayEquals(level.getAnswerSeries().getAmplitudes(), level.getGuessSeries().getAmplitudes());
        assertEquals(0, level.getScore());
        assertThrows(IllegalStateException.class, () -> level.checkAnswer());
    }

    @Test
    void newWaveformStartsFreshChallenge() {
        double[] previousAnswer = level.getAnswerSeries().getAmplitudes();
        level.showAnswer();
        events.clear();

        level.newWaveform();

        assertFalse(Arrays.equals(previousAnswer, level.getAnswerSeries().getAmplitudes()));
        assertEquals(3, level.getAnswerSeries().getNumberOfNonZeroHarmonics());
        assertEquals(0, level.getGuessSeries().getNumberOfNonZeroHarmonics());
        assertFalse(level.isSolved());
        assertFalse(level.isMatched());
        assertEquals(WaveGameLevel.EVENT_NEW_WAVEFORM, events.get(events.size() - 1).getPropertyName());
    }

    @Test
    void eraseAmplitudesZeroesGuessAndItsCharts() {
        level.setGuessAmplitude(1, 1.0);
        level.setGuessAmplitude(2, -0.5);

        level.eraseAmplitudes();

        assertEquals(0, level.getGuessSeries().getNumberOfNonZeroHarmonics());
        assertEquals(0, DataSetUtils.maxY(level.getGuessSumChart().getSumDataSet()), 1e-12);
    }

    @Test
    void chartsFollowTheSeries() {
        level.eraseAmplitudes();
        level.setGuessAmplitude(1, 1.0);

        assertEquals(1, DataSetUtils.maxY(level.getHarmonicsChart().getHarmonicDataSet(1)), 1e-2);
        assertEquals(1, DataSetUtils.maxY(level.getGuessSumChart().getSumDataSet()), 1e-2);
        assertTrue(DataSetUtils.maxY(level.getAnswerSumChart().getSumDataSet()) > 0);
    }

    @Test
    void numberOfAmplitudeControlsCoversAnswer() {
        assertThrows(IllegalArgumentException.class, () -> level.setNumberOfAmplitudeControls(2));
        assertThrows(IllegalArgumentException.class, () -> level.setNumberOfAmplitudeControls(12));

        level.setNumberOfAmplitudeControls(11);
        assertEquals(1, count(WaveGameLevel.PROPERTY_NUMBER_OF_AMPLITUDE_CONTROLS));

        level.newWaveform();
        assertEquals(11, level.getNumberOfAmplitudeControls());
    }

    @Test
    void resetClearsScore() {
        copyAnswerIntoGuess();
        level.checkAnswer();

        level.reset();

        assertEquals(0, level.getScore());
        assertFalse(level.isSolved());
        assertEquals(0, level.getGuessSeries().getNumberOfNonZeroHarmonics());
    }

    @Test
    void invalidLevelsAreRejected() {
        AmplitudesGenerator generator = new AmplitudesGenerator(11, 1.5, 0.1, new Random(1));
        SynthesisConfiguration configuration = SynthesisConfiguration.defaults();
        assertThrows(IllegalArgumentException.class, () -> new WaveGameLevel(0, 2, () -> 1, configuration, generator));
        assertThrows(IllegalArgumentException.class, () -> new WaveGameLevel(4, 3, () -> 4, configuration, generator));
        assertThrows(IllegalArgumentException.class, () -> new WaveGameLevel(1, 12, () -> 1, configuration, generator));
    }
}
