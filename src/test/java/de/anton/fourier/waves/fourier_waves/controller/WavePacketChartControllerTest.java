package de.anton.fourier.waves.fourier_waves.controller;

import de.anton.fourier.waves.fourier_waves.model.DataPoint;
import de.anton.fourier.waves.fourier_waves.model.Domain;
import de.anton.fourier.waves.fourier_waves.model.WavePacketModel;
import org.jfree.data.xy.XYSeries;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.swing.SwingUtilities;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WavePacketChartControllerTest {

    private WavePacketModel model;
    private WavePacketChartController controller;

    @BeforeEach
    void setUp() {
        model = new WavePacketModel();
        controller = new WavePacketChartController(model);
    }

    @AfterEach
    void tearDown() {
        controller.dispose();
    }

    private static void flushEventQueue() throws Exception {
        SwingUtilities.invokeAndWait(() -> { });
    }

    @Test
    void initialDatasetsMirrorModel() {
        assertEquals(4, controller.getAmplitudesDataset().getSeriesCount());
        assertEquals(25, controller.getComponentsSeries().getItemCount());
        assertEquals(model.getAmplitudesChart().getContinuousWaveformDataSet().size(),
                controller.getContinuousWaveformSeries().getItemCount());
        assertEquals(0, controller.getInfiniteComponentsSeries().getItemCount());
        assertEquals(0, controller.getAmplitudesWidthSeries().getItemCount());
        assertEquals(25, controller.getComponentsDataset().getSeriesCount());
        assertEquals("Component 25", controller.getComponentsDataset().getSeriesKey(24));
        assertEquals(3, controller.getSumDataset().getSeriesCount());
        assertEquals(model.getSumChart().getSumDataSet().size(), controller.getSumSeries().getItemCount());
        assertEquals(controller.getSumSeries().getItemCount(), controller.getEnvelopeSeries().getItemCount());
    }

    @Test
    void initialAxes() {
        assertEquals(24 * Math.PI, controller.getAmplitudesXAxis().getUpperBound(), 1e-12);
        assertEquals("k (rad/m)", controller.getAmplitudesXAxis().getLabel());
        assertEquals(0.5, controller.getAmplitudesYAxis().getUpperBound(), 1e-12);
        assertEquals(2, controller.getComponentsXAxis().getUpperBound(), 1e-12);
        assertEquals(1.1 * model.getComponentsChart().getMaxComponentAmplitude(),
                controller.getComponentsYAxis().getUpperBound(), 1e-12);
        assertEquals(1.1, controller.getSumYAxis().getUpperBound(), 1e-12);
        assertEquals("x (m)", controller.getSumXAxis().getLabel());
    }

    @Test
    void widthIndicatorsAppearWhenShown() throws Exception {
        model.setWidthIndicatorsVisible(true);
        flushEventQueue();

        XYSeries amplitudesWidth = controller.getAmplitudesWidthSeries();
        assertEquals(2, amplitudesWidth.getItemCount());
        assertEquals(9 * Math.PI, amplitudesWidth.getX(0).doubleValue(), 1e-12);
        assertEquals(15 * Math.PI, amplitudesWidth.getX(1).doubleValue(), 1e-12);

        XYSeries sumWidth = controller.getSumWidthSeries();
        assertEquals(2, sumWidth.getItemCount());
        double sigmaX = model.getWavePacket().getConjugateStandardDeviation();
        assertEquals(2 * sigmaX, sumWidth.getX(1).doubleValue() - sumWidth.getX(0).doubleValue(), 1e-12);

        model.setWidthIndicatorsVisible(false);
        flushEventQueue();
        assertEquals(0, controller.getAmplitudesWidthSeries().getItemCount());
        assertEquals(0, controller.getSumWidthSeries().getItemCount());
    }

    @Test
    void continuousWaveformCanBeHidden() throws Exception {
        model.setContinuousWaveformVisible(false);
        flushEventQueue();
        assertEquals(0, controller.getContinuousWaveformSeries().getItemCount());

        model.setContinuousWaveformVisible(true);
        flushEventQueue();
        assertTrue(controller.getContinuousWaveformSeries().getItemCount() > 0);
    }

    @Test
    void infiniteComponentsReplaceDiscreteOnes() throws Exception {
        model.setComponentSpacing(0);
        flushEventQueue();

        assertEquals(0, controller.getComponentsDataset().getSeriesCount());
        assertEquals(0, controller.getComponentsSeries().getItemCount());
        assertTrue(controller.getInfiniteComponentsSeries().getItemCount() > 0);
        assertEquals(1.1, controller.getComponentsYAxis().getUpperBound(), 1e-12);
    }

    @Test
    void timeDomainRelabelsAxes() throws Exception {
        model.setDomain(Domain.TIME);
        flushEventQueue();

        assertEquals("ω (rad/ms)", controller.getAmplitudesXAxis().getLabel());
        assertEquals("t (ms)", controller.getComponentsXAxis().getLabel());
        assertEquals("t (ms)", controller.getSumXAxis().getLabel());
    }

    @Test
    void zoomChangesXAxes() throws Exception {
        model.getXZoomLevel().zoomOut();
        flushEventQueue();

        assertEquals(4, controller.getComponentsXAxis().getUpperBound(), 1e-12);
        assertEquals(-4, controller.getSumXAxis().getLowerBound(), 1e-12);
    }

    @Test
    void widthIndicatorIsCenteredSegment() {
        List<DataPoint> segment = WavePacketChartController.createWidthIndicator(new DataPoint(3, 0.5), 2);
        assertEquals(List.of(new DataPoint(2, 0.5), new DataPoint(4, 0.5)), segment);
    }
}
