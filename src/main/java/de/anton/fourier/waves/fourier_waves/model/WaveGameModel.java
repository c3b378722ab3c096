package de.anton.fourier.waves.fourier_waves.model;

import de.anton.fourier.waves.fourier_waves.service.SynthesisConfiguration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Top-level model of the wave game. Level n asks for n non-zero harmonics, the last level for 5 or more.
 * Fires "level" when the selected level changes; null means no level is selected.
 */
public class WaveGameModel {
    private static final Logger logger = LoggerFactory.getLogger(WaveGameModel.class);

    public static final String PROPERTY_LEVEL = "level";

    // Smallest number of non-zero harmonics on the last level.
    private static final int LAST_LEVEL_MIN_HARMONICS = 5;

    private final List<WaveGameLevel> levels;
    private final int rewardScore;
    private WaveGameLevel level; // null if none selected

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    public WaveGameModel() {
        this(SynthesisConfiguration.defaults(), new Random());
    }

    /**
     * @param configuration Numeric parameters of every level's series, with at least 6 harmonics.
     * @param random        Source of randomness for the answers, seed it for reproducible games.
     */
    public WaveGameModel(SynthesisConfiguration configuration, Random random) {
        Objects.requireNonNull(configuration, "configuration cannot be null");
        Objects.requireNonNull(random, "random cannot be null");
        int maxHarmonics = configuration.maxHarmonics();
        AmplitudesGenerator amplitudesGenerator = new AmplitudesGenerator(maxHarmonics, configuration.maxAmplitude(),
                FourierConstants.GENERATED_AMPLITUDE_STEP, random);

        this.levels = List.of(
                new WaveGameLevel(1, 2, () -> 1, configuration, amplitudesGenerator),
                new WaveGameLevel(2, 3, () -> 2, configuration, amplitudesGenerator),
                new WaveGameLevel(3, 5, () -> 3, configuration, amplitudesGenerator),
                new WaveGameLevel(4, 6, () -> 4, configuration, amplitudesGenerator),
                new WaveGameLevel(5, maxHarmonics,
                        () -> LAST_LEVEL_MIN_HARMONICS + random.nextInt(maxHarmonics - LAST_LEVEL_MIN_HARMONICS + 1),
                        configuration, amplitudesGenerator));
        if (levels.size() != FourierConstants.NUMBER_OF_GAME_LEVELS) {
            throw new IllegalStateException("Expected " + FourierConstants.NUMBER_OF_GAME_LEVELS + " levels. Got: " + levels.size());
        }
        this.rewardScore = FourierConstants.REWARD_SCORE;
        logger.info("WaveGameModel created: {} levels, reward at {} points", levels.size(), rewardScore);
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    public List<WaveGameLevel> getLevels() { return levels; }
    public WaveGameLevel getLevel() { return level; }
    public int getRewardScore() { return rewardScore; }

    /** @param levelNumber Numbered from 1. */
    public WaveGameLevel getLevel(int levelNumber) {
        if (levelNumber < 1 || levelNumber > levels.size()) {
            throw new IllegalArgumentException("levelNumber must be in [1, " + levels.size() + "]. Got: " + levelNumber);
        }
        return levels.get(levelNumber - 1);
    }

    /** Selects a level, or returns to level selection with null. */
    public void setLevel(WaveGameLevel level) {
        if (level != null && !levels.contains(level)) {
            throw new IllegalArgumentException("Level is not part of this game. Got: level " + level.getLevelNumber());
        }
        if (this.level != level) {
            WaveGameLevel oldLevel = this.level;
            this.level = level;
            logger.info("Wave game: level {} selected", (level == null) ? "none" : level.getLevelNumber());
            support.firePropertyChange(PROPERTY_LEVEL, oldLevel, level);
        }
    }

    /** True once the level's score reaches the reward score. */
    public boolean isRewardEarned(WaveGameLevel level) {
        return Objects.requireNonNull(level, "level cannot be null").getScore() >= rewardScore;
    }

    /** Resets every level and returns to level selection. */
    public void reset() {
        logger.info("WaveGameModel: Reset");
        levels.forEach(WaveGameLevel::reset);
        setLevel(null);
    }
}
