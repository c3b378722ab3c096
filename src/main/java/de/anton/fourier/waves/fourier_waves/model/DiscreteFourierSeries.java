package de.anton.fourier.waves.fourier_waves.model;

import de.anton.fourier.waves.fourier_waves.service.SynthesisConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fourier series with a number of relevant harmonics. Harmonics above that number are kept but held at
 * amplitude 0. Fires "numberOfHarmonics" (Integer) on change.
 */
public class DiscreteFourierSeries extends FourierSeries {
    private static final Logger logger = LoggerFactory.getLogger(DiscreteFourierSeries.class);

    public static final String PROPERTY_NUMBER_OF_HARMONICS = "numberOfHarmonics";

    private int numberOfHarmonics;

    public DiscreteFourierSeries(SynthesisConfiguration configuration) {
        super(configuration);
        this.numberOfHarmonics = getHarmonics().size();
    }

    public int getNumberOfHarmonics() { return numberOfHarmonics; }

    public int getMaxNumberOfHarmonics() { return getHarmonics().size(); }

    /**
     * Sets the number of relevant harmonics and zeroes the amplitudes of the others, notifying "amplitudes" once.
     *
     * @param numberOfHarmonics In [1, number of harmonics].
     */
    public void setNumberOfHarmonics(int numberOfHarmonics) {
        if (numberOfHarmonics < 1 || numberOfHarmonics > getHarmonics().size()) {
            throw new IllegalArgumentException("numberOfHarmonics must be in [1, " + getHarmonics().size()
                    + "]. Got: " + numberOfHarmonics);
        }
        if (this.numberOfHarmonics != numberOfHarmonics) {
            int oldNumberOfHarmonics = this.numberOfHarmonics;
            this.numberOfHarmonics = numberOfHarmonics;
            logger.info("Number of harmonics set to {}", numberOfHarmonics);
            zeroIrrelevantHarmonics();
            support.firePropertyChange(PROPERTY_NUMBER_OF_HARMONICS, oldNumberOfHarmonics, numberOfHarmonics);
        }
    }

    /** Resets the amplitudes and the number of harmonics. */
    @Override
    public void reset() {
        beginBatch();
        try {
            super.reset();
            setNumberOfHarmonics(getHarmonics().size());
        } finally {
            endBatch();
        }
    }

    private void zeroIrrelevantHarmonics() {
        beginBatch();
        try {
            for (int i = numberOfHarmonics; i < getHarmonics().size(); i++) {
                getHarmonics().get(i).setAmplitude(0);
            }
        } finally {
            endBatch();
        }
    }
}
