package org.eds.physics;

import org.eds.model.EnergyAxis;
import org.eds.model.Spectrum;

/**
 * Fraction of photons of a given energy (keV) that the detector records.
 */
public interface DetectorEfficiency {

    /**
     * @return efficiency in [0, 1] at the given energy
     */
    double at(double energy);

    /**
     * Efficiency evaluated on every channel of the axis.
     */
    default Spectrum over(EnergyAxis axis) {
        double[] e = axis.energies();
        double[] out = new double[e.length];
        for (int i = 0; i < e.length; i++) {
            out[i] = at(e[i]);
        }
        return new Spectrum(out);
    }
}
