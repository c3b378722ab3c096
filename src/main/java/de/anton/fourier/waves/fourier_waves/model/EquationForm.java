package de.anton.fourier.waves.fourier_waves.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Forms in which the equation for a harmonic (and the sum) can be written.
 * Each form is valid for a subset of {@link Domain}s; HIDDEN and MODE are valid everywhere.
 */
public enum EquationForm {
    HIDDEN(EnumSet.allOf(Domain.class)), // equations are not shown, tick labels are numeric
    MODE(EnumSet.allOf(Domain.class)),

    WAVELENGTH(EnumSet.of(Domain.SPACE)),
    SPATIAL_WAVE_NUMBER(EnumSet.of(Domain.SPACE)),

    FREQUENCY(EnumSet.of(Domain.TIME)),
    PERIOD(EnumSet.of(Domain.TIME)),
    ANGULAR_WAVE_NUMBER(EnumSet.of(Domain.TIME)),

    WAVELENGTH_AND_PERIOD(EnumSet.of(Domain.SPACE_AND_TIME)),
    SPATIAL_WAVE_NUMBER_AND_ANGULAR_WAVE_NUMBER(EnumSet.of(Domain.SPACE_AND_TIME));

    private final Set<Domain> supportedDomains;

    EquationForm(Set<Domain> supportedDomains) {
        this.supportedDomains = supportedDomains;
    }

    public boolean supports(Domain domain) {
        return supportedDomains.contains(domain);
    }
}
