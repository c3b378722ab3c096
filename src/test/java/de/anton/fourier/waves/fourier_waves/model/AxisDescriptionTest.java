package de.anton.fourier.waves.fourier_waves.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AxisDescriptionTest {

    private static final List<AxisDescription> Y_TABLE = List.of(
            new AxisDescription(Range.symmetric(20), 5, 5, 10),
            new AxisDescription(Range.symmetric(10), 5, 5, 5),
            new AxisDescription(Range.symmetric(5), 1, 5, 5),
            new AxisDescription(Range.symmetric(2), 1, 1, 1),
            new AxisDescription(Range.symmetric(1.5), 0.5, 0.5, 0.5),
            new AxisDescription(Range.symmetric(1), 0.5, 0.5, 0.5));

    private static final List<AxisDescription> AMPLITUDE_TABLE = List.of(
            new AxisDescription(Range.symmetric(2), 0.5, 0.5, 1),
            new AxisDescription(Range.symmetric(1.5), 0.5, 0.5, 0.5),
            new AxisDescription(Range.symmetric(1), 0.25, 0.5, 0.5),
            new AxisDescription(Range.symmetric(0.75), 0.25, 0.25, 0.25),
            new AxisDescription(Range.symmetric(0.5), 0.1, 0.25, 0.25),
            new AxisDescription(Range.symmetric(0.25), 0.05, 0.1, 0.1));

    @Test
    void requestBetweenEntriesSelectsNextWiderEntry() {
        assertTrue(AxisDescription.isSortedDescending(AMPLITUDE_TABLE));
        assertSame(AMPLITUDE_TABLE.get(1), AxisDescription.getBestFit(Range.symmetric(1.2), AMPLITUDE_TABLE));
    }

    @Test
    void requestEqualToAnEntrySelectsThatEntry() {
        assertSame(AMPLITUDE_TABLE.get(1), AxisDescription.getBestFit(Range.symmetric(1.5), AMPLITUDE_TABLE));
        assertSame(AMPLITUDE_TABLE.get(3), AxisDescription.getBestFit(Range.symmetric(0.75), AMPLITUDE_TABLE));
        assertSame(AMPLITUDE_TABLE.get(0), AxisDescription.getBestFit(Range.symmetric(1.5000001), AMPLITUDE_TABLE));
        assertSame(AMPLITUDE_TABLE.get(5), AxisDescription.getBestFit(Range.symmetric(0.1), AMPLITUDE_TABLE));
    }

    @Test
    void bestFitIsMostZoomedInEntryThatContainsTheRange() {
        AxisDescription bestFit = AxisDescription.getBestFit(Range.symmetric(1.2), Y_TABLE);
        assertEquals(1.5, bestFit.range().max());
    }

    @Test
    void bestFitOnExactBoundary() {
        assertEquals(1, AxisDescription.getBestFit(Range.symmetric(1), Y_TABLE).range().max());
        assertEquals(5, AxisDescription.getBestFit(Range.symmetric(5), Y_TABLE).range().max());
        assertEquals(20, AxisDescription.getBestFit(Range.symmetric(19.9), Y_TABLE).range().max());
    }

    @Test
    void widerRangeNeverSelectsMoreZoomedInEntry() {
        int previousIndex = Y_TABLE.size() - 1;
        for (int i = 1; i <= 200; i++) {
            double max = i / 10d;
            int index = Y_TABLE.indexOf(AxisDescription.getBestFit(Range.symmetric(max), Y_TABLE));
            assertTrue(index <= previousIndex, "Best fit zoomed in when the range widened to " + max);
            previousIndex = index;
        }
    }

    @Test
    void bestFitRejectsRangeBeyondTable() {
        assertThrows(IllegalArgumentException.class, () -> AxisDescription.getBestFit(Range.symmetric(25), Y_TABLE));
        assertThrows(IllegalArgumentException.class, () -> AxisDescription.getBestFit(Range.symmetric(1), List.of()));
    }

    @Test
    void createRangeForDomainScalesByWavelengthOrPeriod() {
        AxisDescription axisDescription = new AxisDescription(Range.symmetric(0.5), 1 / 8d, 1 / 4d, 1 / 4d);
        assertEquals(new Range(-1, 1), axisDescription.createRangeForDomain(Domain.SPACE, 2, 10));
        assertEquals(new Range(-1, 1), axisDescription.createRangeForDomain(Domain.SPACE_AND_TIME, 2, 10));
        assertEquals(new Range(-5, 5), axisDescription.createRangeForDomain(Domain.TIME, 2, 10));
    }

    @Test
    void constructorRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new AxisDescription(new Range(1, 1), 1, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new AxisDescription(Range.symmetric(1), 0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new AxisDescription(Range.symmetric(1), 1, -1, 1));
        assertThrows(NullPointerException.class, () -> new AxisDescription(null, 1, 1, 1));
    }

    @Test
    void validateTableAcceptsSortedTable() {
        List<AxisDescription> validated = AxisDescription.validateTable("test", Y_TABLE, true, 0);
        assertEquals(Y_TABLE, validated);
    }

    @Test
    void validateTableRejectsUnsortedTable() {
        List<AxisDescription> unsorted = List.of(Y_TABLE.get(2), Y_TABLE.get(0));
        assertThrows(IllegalStateException.class, () -> AxisDescription.validateTable("unsorted", unsorted, true, 0));
    }

    @Test
    void validateTableRejectsAsymmetricOrShortRanges() {
        List<AxisDescription> asymmetric = List.of(new AxisDescription(new Range(0, 2), 1, 1, 1));
        assertThrows(IllegalStateException.class, () -> AxisDescription.validateTable("asymmetric", asymmetric, true, 0));
        List<AxisDescription> shortRange = List.of(new AxisDescription(Range.symmetric(0.2), 0.1, 0.1, 0.1));
        assertThrows(IllegalStateException.class, () -> AxisDescription.validateTable("short", shortRange, true, 0.5));
        assertThrows(IllegalStateException.class, () -> AxisDescription.validateTable("empty", List.of(), false, 0));
    }

    @Test
    void builtInTablesAreValid() {
        assertEquals(5, DiscreteAxisDescriptions.X_AXIS_DESCRIPTIONS.size());
        assertEquals(Range.symmetric(0.5), DiscreteAxisDescriptions.DEFAULT_X_AXIS_DESCRIPTION.range());
        assertEquals(FourierConstants.MAX_AMPLITUDE, DiscreteAxisDescriptions.DEFAULT_Y_AXIS_DESCRIPTION.range().max());
        assertTrue(AxisDescription.isSortedDescending(DiscreteAxisDescriptions.Y_AXIS_DESCRIPTIONS));
        assertTrue(AxisDescription.isSortedDescending(WavePacketAxisDescriptions.X_AXIS_DESCRIPTIONS));
        assertTrue(AxisDescription.isSortedDescending(WavePacketAxisDescriptions.AMPLITUDES_Y_AXIS_DESCRIPTIONS));
    }
}
