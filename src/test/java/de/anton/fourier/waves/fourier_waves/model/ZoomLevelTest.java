package de.anton.fourier.waves.fourier_waves.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ZoomLevelTest {

    private ZoomLevel zoomLevel;
    private final List<Object> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        zoomLevel = new ZoomLevel("Test x axis", DiscreteAxisDescriptions.X_AXIS_DESCRIPTIONS,
                DiscreteAxisDescriptions.DEFAULT_X_AXIS_DESCRIPTION);
        zoomLevel.addPropertyChangeListener(evt -> events.add(evt.getNewValue()));
    }

    @Test
    void startsAtDefault() {
        assertEquals(4, zoomLevel.getZoomLevel());
        assertSame(DiscreteAxisDescriptions.DEFAULT_X_AXIS_DESCRIPTION, zoomLevel.getAxisDescription());
        assertFalse(zoomLevel.canZoomIn());
        assertTrue(zoomLevel.canZoomOut());
    }

    @Test
    void zoomOutAndInMoveOneLevel() {
        zoomLevel.zoomOut();
        zoomLevel.zoomOut();
        assertEquals(2, zoomLevel.getZoomLevel());
        zoomLevel.zoomIn();
        assertEquals(3, zoomLevel.getZoomLevel());
        assertEquals(List.of(3, 2, 3), events);
    }

    @Test
    void zoomInAtLimitIsNoOp() {
        zoomLevel.zoomIn();
        assertEquals(4, zoomLevel.getZoomLevel());
        assertTrue(events.isEmpty());
    }

    @Test
    void settingCurrentValueFiresNothing() {
        zoomLevel.setZoomLevel(4);
        zoomLevel.setAxisDescription(DiscreteAxisDescriptions.DEFAULT_X_AXIS_DESCRIPTION);
        assertTrue(events.isEmpty());
    }

    @Test
    void axisDescriptionAndIndexStayInSync() {
        AxisDescription widest = DiscreteAxisDescriptions.X_AXIS_DESCRIPTIONS.get(0);
        zoomLevel.setAxisDescription(widest);
        assertEquals(0, zoomLevel.getZoomLevel());
        assertSame(widest, zoomLevel.getAxisDescription());
    }

    @Test
    void invalidSelectionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> zoomLevel.setZoomLevel(5));
        assertThrows(IllegalArgumentException.class, () -> zoomLevel.setZoomLevel(-1));
        AxisDescription foreign = new AxisDescription(Range.symmetric(7), 1, 1, 1);
        assertThrows(IllegalArgumentException.class, () -> zoomLevel.setAxisDescription(foreign));
    }

    @Test
    void resetRestoresDefault() {
        zoomLevel.setZoomLevel(0);
        zoomLevel.reset();
        assertEquals(4, zoomLevel.getZoomLevel());
    }
}
