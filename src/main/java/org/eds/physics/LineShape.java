package org.eds.physics;

import org.apache.commons.math3.special.Erf;
import org.eds.model.EnergyAxis;

/**
 * Gaussian detector response whose width grows linearly with energy:
 * {@code sigma(E) = widthSlope * E + widthIntercept} (keV).
 */
public record LineShape(double widthSlope, double widthIntercept) {

    private static final double SQRT2 = Math.sqrt(2.0);

    public LineShape {
        if (widthSlope < 0.0 || !(widthIntercept > 0.0)) {
            throw new IllegalArgumentException("width slope must be >= 0 and width intercept > 0");
        }
    }

    public double sigma(double energy) {
        return widthSlope * energy + widthIntercept;
    }

    /**
     * Unit-area peak at {@code center} integrated over each channel of the axis.
     * Channels are centred on their energies and one {@code scale} wide.
     */
    public double[] profile(EnergyAxis axis, double center) {
        double s = sigma(center) * SQRT2;
        double half = axis.scale() / 2.0;
        double[] out = new double[axis.size()];
        for (int i = 0; i < out.length; i++) {
            double e = axis.offset() + i * axis.scale();
            double lo = (e - half - center) / s;
            double hi = (e + half - center) / s;
            out[i] = 0.5 * Erf.erf(lo, hi);
        }
        return out;
    }
}
