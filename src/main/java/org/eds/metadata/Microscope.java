package org.eds.metadata;

/**
 * Acquisition-instrument settings. Angles are in degrees, beam energy in keV,
 * Mn-Ka resolution in eV.
 */
public record Microscope(Double beamEnergy,
                         double tiltAlpha,
                         double azimuthAngle,
                         double elevationAngle,
                         double energyResolutionMnKa) {

    public static final double DEFAULT_BEAM_ENERGY = 200.0;
    public static final double DEFAULT_ELEVATION = 22.0;
    public static final double DEFAULT_RESOLUTION_MNKA = 130.0;

    public static Microscope defaults() {
        return new Microscope(DEFAULT_BEAM_ENERGY, 0.0, 0.0, DEFAULT_ELEVATION, DEFAULT_RESOLUTION_MNKA);
    }
}
