package de.anton.fourier.waves.fourier_waves.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Describes the range, grid lines and ticks of an axis at one zoom level.
 * A zoom level is an index into a table of AxisDescriptions, ordered from most zoomed-out to most zoomed-in.
 * For x axes the values are multipliers of L or T, see {@link #createRangeForDomain(Domain, double, double)}.
 *
 * @param range            Range of the axis.
 * @param gridLineSpacing  Spacing between grid lines.
 * @param tickMarkSpacing  Spacing between tick marks.
 * @param tickLabelSpacing Spacing between tick labels.
 */
public record AxisDescription(Range range, double gridLineSpacing, double tickMarkSpacing, double tickLabelSpacing) {

    private static final Logger logger = LoggerFactory.getLogger(AxisDescription.class);

    public AxisDescription {
        Objects.requireNonNull(range, "AxisDescription range cannot be null.");
        if (!(range.getLength() > 0)) {
            throw new IllegalArgumentException("AxisDescription range must have positive length. Got: " + range);
        }
        if (!(gridLineSpacing > 0) || !(tickMarkSpacing > 0) || !(tickLabelSpacing > 0)) {
            throw new IllegalArgumentException(String.format(
                    "AxisDescription spacings must be positive. Got: grid=%s, tickMark=%s, tickLabel=%s",
                    gridLineSpacing, tickMarkSpacing, tickLabelSpacing));
        }
    }

    public boolean hasSymmetricRange() {
        return range.getCenter() == 0;
    }

    /**
     * Creates the x range for a domain. The range of this description is multiplied by T for the TIME domain,
     * and by L for SPACE and SPACE_AND_TIME.
     *
     * @param domain          The domain being plotted.
     * @param spaceMultiplier L, must be positive.
     * @param timeMultiplier  T, must be positive.
     */
    public Range createRangeForDomain(Domain domain, double spaceMultiplier, double timeMultiplier) {
        Objects.requireNonNull(domain, "Domain cannot be null");
        double value = (domain == Domain.TIME) ? timeMultiplier : spaceMultiplier;
        return range.times(value);
    }

    /**
     * Gets the AxisDescription that best fits an axis range: the most zoomed-in entry whose range.max still
     * reaches range.max. Widening the requested range never selects a more zoomed-in entry.
     *
     * @param range            The range that must be visible.
     * @param axisDescriptions Table ordered from most zoomed-out to most zoomed-in.
     * @return The best fit.
     * @throws IllegalArgumentException if range.max exceeds the most zoomed-out entry.
     */
    public static AxisDescription getBestFit(Range range, List<AxisDescription> axisDescriptions) {
        Objects.requireNonNull(range, "range cannot be null");
        if (axisDescriptions == null || axisDescriptions.isEmpty()) {
            throw new IllegalArgumentException("axisDescriptions cannot be null or empty.");
        }
        for (int i = axisDescriptions.size() - 1; i >= 0; i--) {
            AxisDescription axisDescription = axisDescriptions.get(i);
            if (axisDescription.range().max() >= range.max()) {
                return axisDescription;
            }
        }
        throw new IllegalArgumentException("No AxisDescription fits range " + range
                + ", most zoomed-out max is " + axisDescriptions.get(0).range().max());
    }

    /**
     * Determines whether a table is sorted by strictly descending range length, from most zoomed-out to
     * most zoomed-in.
     */
    public static boolean isSortedDescending(List<AxisDescription> axisDescriptions) {
        for (int i = 1; i < axisDescriptions.size(); i++) {
            if (!(axisDescriptions.get(i - 1).range().getLength() > axisDescriptions.get(i).range().getLength())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Validates a static table once, at startup.
     *
     * @param name             Table name, used in error messages.
     * @param axisDescriptions The table.
     * @param requireSymmetric Whether every range must be symmetric about zero.
     * @param minRangeLength   Minimum length of every range (0 for no constraint).
     * @return The table, for use in static initializers.
     * @throws IllegalStateException if the table violates a constraint.
     */
    public static List<AxisDescription> validateTable(String name, List<AxisDescription> axisDescriptions,
                                                      boolean requireSymmetric, double minRangeLength) {
        if (axisDescriptions == null || axisDescriptions.isEmpty()) {
            throw new IllegalStateException(name + " must contain at least one AxisDescription.");
        }
        if (!isSortedDescending(axisDescriptions)) {
            throw new IllegalStateException(name + " must be sorted by descending range length, "
                    + "from most zoomed-out to most zoomed-in.");
        }
        for (AxisDescription axisDescription : axisDescriptions) {
            if (requireSymmetric && !axisDescription.hasSymmetricRange()) {
                throw new IllegalStateException("Range must be symmetric for " + name + ". Got: " + axisDescription.range());
            }
            if (axisDescription.range().getLength() < minRangeLength) {
                throw new IllegalStateException("Range length must be at least " + minRangeLength + " for " + name
                        + ". Got: " + axisDescription.range());
            }
        }
        logger.debug("Validated {} ({} zoom levels).", name, axisDescriptions.size());
        return List.copyOf(axisDescriptions);
    }
}
