package org.eds.physics;

import org.eds.model.EnergyAxis;
import org.eds.model.Spectrum;

import java.util.Objects;

/**
 * Self-absorption of a thin film of uniform composition.
 *
 * <pre>
 *   chi(E) = mu(E) * density * thickness / sin(toa)
 *   A(E)   = (1 - exp(-chi)) / chi
 * </pre>
 */
public final class AbsorptionModel {

    private final MassAttenuation attenuation;
    private final double thickness;
    private final double density;
    private final double sinToa;

    /**
     * @param thickness     cm
     * @param density       g/cm3
     * @param takeOffAngle  degrees, in (0, 90]
     */
    public AbsorptionModel(MassAttenuation attenuation, double thickness, double density, double takeOffAngle) {
        this.attenuation = Objects.requireNonNull(attenuation, "attenuation must not be null");
        if (thickness < 0.0 || density < 0.0) {
            throw new IllegalArgumentException("thickness and density must be >= 0");
        }
        if (!(takeOffAngle > 0.0) || takeOffAngle > 90.0) {
            throw new IllegalArgumentException("take-off angle must be in (0, 90], got " + takeOffAngle);
        }
        this.thickness = thickness;
        this.density = density;
        this.sinToa = Math.sin(Math.toRadians(takeOffAngle));
    }

    public double factor(Composition composition, double energy) {
        double chi = attenuation.of(composition, energy) * density * thickness / sinToa;
        if (chi < 1e-12) {
            return 1.0;
        }
        return -Math.expm1(-chi) / chi;
    }

    public Spectrum over(Composition composition, EnergyAxis axis) {
        double[] e = axis.energies();
        double[] out = new double[e.length];
        for (int i = 0; i < e.length; i++) {
            out[i] = factor(composition, e[i]);
        }
        return new Spectrum(out);
    }

    public MassAttenuation attenuation() {
        return attenuation;
    }
}
