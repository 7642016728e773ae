package org.eds.model;

/**
 * Linear energy calibration of the spectral axis: channel i sits at {@code offset + i * scale} keV.
 */
public record EnergyAxis(double offset, double scale, int size) {

    public EnergyAxis {
        if (!(scale > 0.0)) {
            throw new IllegalArgumentException("scale must be > 0, got " + scale);
        }
        if (size <= 0) {
            throw new IllegalArgumentException("size must be >= 1");
        }
    }

    public double energyAt(int channel) {
        if (channel < 0 || channel >= size) {
            throw new IndexOutOfBoundsException("channel=" + channel + ", size=" + size);
        }
        return offset + channel * scale;
    }

    public double[] energies() {
        double[] out = new double[size];
        for (int i = 0; i < size; i++) {
            out[i] = offset + i * scale;
        }
        return out;
    }

    /**
     * Index of the channel closest to the given energy, clamped to the axis.
     */
    public int indexOf(double energy) {
        long i = Math.round((energy - offset) / scale);
        return (int) Math.max(0, Math.min(size - 1, i));
    }

    /**
     * Two-point linear recalibration. Two peaks measured at {@code measuredLow} and
     * {@code measuredHigh} on this axis are known to lie at {@code trueLow} and {@code trueHigh};
     * the returned axis rescales by the ratio of separations and anchors the higher peak.
     */
    public EnergyAxis recalibrate(double measuredLow, double measuredHigh, double trueLow, double trueHigh) {
        double lo = Math.min(measuredLow, measuredHigh);
        double hi = Math.max(measuredLow, measuredHigh);
        if (hi - lo <= 0.0) {
            throw new IllegalArgumentException("measured peaks must be distinct");
        }
        if (trueHigh - trueLow <= 0.0) {
            throw new IllegalArgumentException("trueHigh must be greater than trueLow");
        }
        int highChannel = indexOf(hi);
        double newScale = scale * (trueHigh - trueLow) / (hi - lo);
        double newOffset = trueHigh - highChannel * newScale;
        return new EnergyAxis(newOffset, newScale, size);
    }
}
