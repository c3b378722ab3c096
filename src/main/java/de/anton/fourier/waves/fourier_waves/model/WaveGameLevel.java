package de.anton.fourier.waves.fourier_waves.model;

import de.anton.fourier.waves.fourier_waves.service.ChartContext;
import de.anton.fourier.waves.fourier_waves.service.HarmonicsChart;
import de.anton.fourier.waves.fourier_waves.service.SumChart;
import de.anton.fourier.waves.fourier_waves.service.SynthesisConfiguration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.IntSupplier;

/**
 * One level of the wave game: the user adjusts the amplitudes of a guess series until its sum matches
 * the sum of a randomly generated answer series.
 * <p>
 * The Harmonics chart shows the guess; the two Sum charts show the answer and the guess. Charts are recomputed
 * whenever the series they show change. Domain, series type and t are fixed.
 */
public class WaveGameLevel {
    private static final Logger logger = LoggerFactory.getLogger(WaveGameLevel.class);

    public static final String PROPERTY_SCORE = "score";
    public static final String PROPERTY_SOLVED = "solved";
    public static final String PROPERTY_MATCHED = "matched";
    public static final String PROPERTY_NUMBER_OF_AMPLITUDE_CONTROLS = "numberOfAmplitudeControls";
    public static final String EVENT_NEW_WAVEFORM = "newWaveform";
    public static final String EVENT_CORRECT = "correct";
    public static final String EVENT_INCORRECT = "incorrect";

    /** A guess amplitude must be at least this close to the answer amplitude. */
    public static final double AMPLITUDE_THRESHOLD = 0;

    static final ChartContext CHART_CONTEXT = new ChartContext(Domain.SPACE, SeriesType.SIN, 0,
            DiscreteAxisDescriptions.DEFAULT_X_AXIS_DESCRIPTION);

    private final int levelNumber;
    private final int defaultNumberOfAmplitudeControls;
    private final IntSupplier numberOfNonZeroHarmonicsSupplier;
    private final AmplitudesGenerator amplitudesGenerator;
    private final FourierSeries answerSeries;
    private final FourierSeries guessSeries;

    private final HarmonicsChart harmonicsChart;
    private final SumChart answerSumChart;
    private final SumChart guessSumChart;

    private int score = 0;
    private boolean solved = false;
    private boolean matched;
    private int numberOfAmplitudeControls;

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    /**
     * @param levelNumber                      Numbered from 1.
     * @param defaultNumberOfAmplitudeControls Amplitude controls shown for a new challenge, in [levelNumber, maxHarmonics].
     * @param numberOfNonZeroHarmonicsSupplier Number of non-zero harmonics in each new answer.
     * @param configuration                    Numeric parameters of the answer and guess series.
     * @param amplitudesGenerator              Creates the answer amplitudes.
     */
    public WaveGameLevel(int levelNumber, int defaultNumberOfAmplitudeControls, IntSupplier numberOfNonZeroHarmonicsSupplier,
                         SynthesisConfiguration configuration, AmplitudesGenerator amplitudesGenerator) {
        Objects.requireNonNull(configuration, "configuration cannot be null");
        if (levelNumber < 1) {
            throw new IllegalArgumentException("levelNumber must be >= 1. Got: " + levelNumber);
        }
        if (defaultNumberOfAmplitudeControls < levelNumber || defaultNumberOfAmplitudeControls > configuration.maxHarmonics()) {
            throw new IllegalArgumentException("defaultNumberOfAmplitudeControls must be in [" + levelNumber + ", "
                    + configuration.maxHarmonics() + "]. Got: " + defaultNumberOfAmplitudeControls);
        }
        this.levelNumber = levelNumber;
        this.defaultNumberOfAmplitudeControls = defaultNumberOfAmplitudeControls;
        this.numberOfNonZeroHarmonicsSupplier = Objects.requireNonNull(numberOfNonZeroHarmonicsSupplier,
                "numberOfNonZeroHarmonicsSupplier cannot be null");
        this.amplitudesGenerator = Objects.requireNonNull(amplitudesGenerator, "amplitudesGenerator cannot be null");

        this.answerSeries = new FourierSeries(configuration,
                amplitudesGenerator.createAmplitudes(numberOfNonZeroHarmonicsSupplier.getAsInt(), null));
        this.guessSeries = new FourierSeries(configuration);
        this.matched = computeMatched();
        this.numberOfAmplitudeControls = Math.max(defaultNumberOfAmplitudeControls, answerSeries.getNumberOfNonZeroHarmonics());

        this.harmonicsChart = new HarmonicsChart(guessSeries, CHART_CONTEXT);
        this.answerSumChart = new SumChart(answerSeries, DiscreteAxisDescriptions.Y_AXIS_DESCRIPTIONS, () -> Waveform.CUSTOM, CHART_CONTEXT);
        this.guessSumChart = new SumChart(guessSeries, DiscreteAxisDescriptions.Y_AXIS_DESCRIPTIONS, () -> Waveform.CUSTOM, CHART_CONTEXT);

        answerSeries.addPropertyChangeListener(evt -> {
            if (FourierSeries.PROPERTY_AMPLITUDES.equals(evt.getPropertyName())) {
                answerSumChart.update(CHART_CONTEXT);
                updateMatched();
            }
        });
        guessSeries.addPropertyChangeListener(evt -> {
            if (FourierSeries.PROPERTY_AMPLITUDES.equals(evt.getPropertyName())) {
                harmonicsChart.update(CHART_CONTEXT);
                guessSumChart.update(CHART_CONTEXT);
                updateMatched();
            }
        });
        logger.info("WaveGameLevel {} created: answer {}", levelNumber, Arrays.toString(answerSeries.getAmplitudes()));
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }
    public void addPropertyChangeListener(String propertyName, PropertyChangeListener pcl) { support.addPropertyChangeListener(propertyName, pcl); }

    // --- Getters ---
    public int getLevelNumber() { return levelNumber; }
    public int getDefaultNumberOfAmplitudeControls() { return defaultNumberOfAmplitudeControls; }
    public int getScore() { return score; }
    public boolean isSolved() { return solved; }
    public boolean isMatched() { return matched; }
    public int getNumberOfAmplitudeControls() { return numberOfAmplitudeControls; }
    public FourierSeries getAnswerSeries() { return answerSeries; }
    public FourierSeries getGuessSeries() { return guessSeries; }
    public HarmonicsChart getHarmonicsChart() { return harmonicsChart; }
    public SumChart getAnswerSumChart() { return answerSumChart; }
    public SumChart getGuessSumChart() { return guessSumChart; }

    /** Sets one amplitude of the guess. */
    public void setGuessAmplitude(int order, double amplitude) {
        guessSeries.getHarmonic(order).setAmplitude(amplitude);
    }

    /**
     * Sets how many amplitude controls are shown. At least every non-zero harmonic of the answer must be adjustable.
     */
    public void setNumberOfAmplitudeControls(int numberOfAmplitudeControls) {
        int min = answerSeries.getNumberOfNonZeroHarmonics();
        int max = answerSeries.getHarmonics().size();
        if (numberOfAmplitudeControls < min || numberOfAmplitudeControls > max) {
            throw new IllegalArgumentException("numberOfAmplitudeControls must be in [" + min + ", " + max + "]. Got: "
                    + numberOfAmplitudeControls);
        }
        if (this.numberOfAmplitudeControls != numberOfAmplitudeControls) {
            int oldNumberOfAmplitudeControls = this.numberOfAmplitudeControls;
            this.numberOfAmplitudeControls = numberOfAmplitudeControls;
            support.firePropertyChange(PROPERTY_NUMBER_OF_AMPLITUDE_CONTROLS, oldNumberOfAmplitudeControls, numberOfAmplitudeControls);
        }
    }

    /** Sets every guess amplitude to 0 (eraser button). */
    public void eraseAmplitudes() {
        guessSeries.setAllAmplitudes(0);
    }

    /**
     * Checks the guess. A match awards {@link FourierConstants#POINTS_PER_CHALLENGE} points, solves the challenge and
     * fires "correct" with the points; otherwise "incorrect" is fired.
     *
     * @throws IllegalStateException if the challenge is already solved.
     */
    public void checkAnswer() {
        if (solved) {
            throw new IllegalStateException("Level " + levelNumber + ": the challenge is already solved.");
        }
        if (matched) {
            int oldScore = score;
            score += FourierConstants.POINTS_PER_CHALLENGE;
            logger.info("Level {}: correct, score {}", levelNumber, score);
            support.firePropertyChange(PROPERTY_SCORE, oldScore, score);
            setSolved(true);
            support.firePropertyChange(EVENT_CORRECT, 0, FourierConstants.POINTS_PER_CHALLENGE);
        } else {
            logger.debug("Level {}: incorrect guess {}", levelNumber, Arrays.toString(guessSeries.getAmplitudes()));
            support.firePropertyChange(EVENT_INCORRECT, false, true);
        }
    }

    /** Solves the challenge by copying the answer into the guess. No points are awarded. */
    public void showAnswer() {
        setSolved(true);
        guessSeries.setAmplitudes(answerSeries.getAmplitudes());
    }

    /**
     * Starts a new challenge: the guess is zeroed and a new answer, different from the previous one, is generated.
     * The number of amplitude controls is kept if larger than the default, and raised to fit the new answer.
     */
    public void newWaveform() {
        guessSeries.setAllAmplitudes(0);

        double[] previousAmplitudes = answerSeries.getAmplitudes();
        double[] newAmplitudes = amplitudesGenerator.createAmplitudes(numberOfNonZeroHarmonicsSupplier.getAsInt(), previousAmplitudes);
        answerSeries.setAmplitudes(newAmplitudes);
        logger.info("Level {}: new waveform {}", levelNumber, Arrays.toString(newAmplitudes));

        setSolved(false);
        setNumberOfAmplitudeControls(Math.max(Math.max(numberOfAmplitudeControls, defaultNumberOfAmplitudeControls),
                answerSeries.getNumberOfNonZeroHarmonics()));
        support.firePropertyChange(EVENT_NEW_WAVEFORM, false, true);
    }

    /** Clears the score and starts a new challenge. */
    public void reset() {
        if (score != 0) {
            int oldScore = score;
            score = 0;
            support.firePropertyChange(PROPERTY_SCORE, oldScore, score);
        }
        newWaveform();
    }

    private void setSolved(boolean solved) {
        if (this.solved != solved) {
            this.solved = solved;
            support.firePropertyChange(PROPERTY_SOLVED, !solved, solved);
        }
    }

    private void updateMatched() {
        boolean oldMatched = matched;
        matched = computeMatched();
        if (oldMatched != matched) {
            logger.trace("Level {}: matched={}", levelNumber, matched);
            support.firePropertyChange(PROPERTY_MATCHED, oldMatched, matched);
        }
    }

    private boolean computeMatched() {
        double[] guessAmplitudes = guessSeries.getAmplitudes();
        double[] answerAmplitudes = answerSeries.getAmplitudes();
        for (int i = 0; i < guessAmplitudes.length; i++) {
            if (Math.abs(guessAmplitudes[i] - answerAmplitudes[i]) > AMPLITUDE_THRESHOLD) {
                return false;
            }
        }
        return true;
    }
}
