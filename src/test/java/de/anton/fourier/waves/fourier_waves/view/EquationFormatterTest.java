package de.anton.fourier.waves.fourier_waves.view;

import de.anton.fourier.waves.fourier_waves.model.Domain;
import de.anton.fourier.waves.fourier_waves.model.EquationForm;
import de.anton.fourier.waves.fourier_waves.model.SeriesType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EquationFormatterTest {

    @Test
    void generalFormsInSpace() {
        assertEquals("A_n sin(2πx/λ_n)", EquationFormatter.getGeneralForm(Domain.SPACE, SeriesType.SIN, EquationForm.WAVELENGTH));
        assertEquals("A_n cos(k_n x)", EquationFormatter.getGeneralForm(Domain.SPACE, SeriesType.COS, EquationForm.SPATIAL_WAVE_NUMBER));
        assertEquals("A_n sin(2πnx/L)", EquationFormatter.getGeneralForm(Domain.SPACE, SeriesType.SIN, EquationForm.MODE));
    }

    @Test
    void generalFormsInTime() {
        assertEquals("A_n sin(2πf_n t)", EquationFormatter.getGeneralForm(Domain.TIME, SeriesType.SIN, EquationForm.FREQUENCY));
        assertEquals("A_n sin(2πt/T_n)", EquationFormatter.getGeneralForm(Domain.TIME, SeriesType.SIN, EquationForm.PERIOD));
        assertEquals("A_n cos(ω_n t)", EquationFormatter.getGeneralForm(Domain.TIME, SeriesType.COS, EquationForm.ANGULAR_WAVE_NUMBER));
        assertEquals("A_n cos(2πnt/T)", EquationFormatter.getGeneralForm(Domain.TIME, SeriesType.COS, EquationForm.MODE));
    }

    @Test
    void generalFormsInSpaceAndTime() {
        assertEquals("A_n sin(2π(x/λ_n − t/T_n))",
                EquationFormatter.getGeneralForm(Domain.SPACE_AND_TIME, SeriesType.SIN, EquationForm.WAVELENGTH_AND_PERIOD));
        assertEquals("A_n sin(k_n x − ω_n t)",
                EquationFormatter.getGeneralForm(Domain.SPACE_AND_TIME, SeriesType.SIN, EquationForm.SPATIAL_WAVE_NUMBER_AND_ANGULAR_WAVE_NUMBER));
        assertEquals("A_n cos(2πn(x/L − t/T))",
                EquationFormatter.getGeneralForm(Domain.SPACE_AND_TIME, SeriesType.COS, EquationForm.MODE));
    }

    @Test
    void specificFormFillsInOrderAndAmplitude() {
        assertEquals("0.5 sin(2πx/λ_2)",
                EquationFormatter.getSpecificForm(Domain.SPACE, SeriesType.SIN, EquationForm.WAVELENGTH, 2, 0.5));
        assertEquals("1.27 sin(2π3t/T)",
                EquationFormatter.getSpecificForm(Domain.TIME, SeriesType.SIN, EquationForm.MODE, 3, 4 / Math.PI));
        assertEquals("-0.42 cos(k_3 x − ω_3 t)",
                EquationFormatter.getSpecificForm(Domain.SPACE_AND_TIME, SeriesType.COS,
                        EquationForm.SPATIAL_WAVE_NUMBER_AND_ANGULAR_WAVE_NUMBER, 3, -0.4244));
    }

    @Test
    void amplitudeFormatting() {
        assertEquals("1", EquationFormatter.formatAmplitude(1));
        assertEquals("0", EquationFormatter.formatAmplitude(-0.001));
        assertEquals("-1.5", EquationFormatter.formatAmplitude(-1.5));
    }

    @Test
    void hiddenFormIsEmpty() {
        assertEquals("", EquationFormatter.getGeneralForm(Domain.TIME, SeriesType.SIN, EquationForm.HIDDEN));
        assertEquals("", EquationFormatter.getSpecificForm(Domain.SPACE, SeriesType.COS, EquationForm.HIDDEN, 1, 1));
    }

    @Test
    void formMustSupportDomain() {
        assertThrows(IllegalArgumentException.class,
                () -> EquationFormatter.getGeneralForm(Domain.SPACE, SeriesType.SIN, EquationForm.FREQUENCY));
        assertThrows(IllegalArgumentException.class,
                () -> EquationFormatter.getGeneralForm(Domain.TIME, SeriesType.SIN, EquationForm.WAVELENGTH_AND_PERIOD));
        assertThrows(IllegalArgumentException.class,
                () -> EquationFormatter.getSpecificForm(Domain.SPACE, SeriesType.SIN, EquationForm.WAVELENGTH, 0, 1));
    }

    @Test
    void componentsEquationAndFunctionOf() {
        assertEquals("A_n sin(k_n x)", EquationFormatter.getComponentsEquation(Domain.SPACE, SeriesType.SIN));
        assertEquals("A_n cos(ω_n t)", EquationFormatter.getComponentsEquation(Domain.TIME, SeriesType.COS));
        assertThrows(IllegalArgumentException.class,
                () -> EquationFormatter.getComponentsEquation(Domain.SPACE_AND_TIME, SeriesType.SIN));
        assertEquals("F(x,t)", EquationFormatter.getFunctionOf(Domain.SPACE_AND_TIME));
    }
}
