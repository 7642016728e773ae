package org.eds.model;

import java.util.Arrays;
import java.util.Collection;

/**
 * An immutable intensity-per-channel spectrum.
 */
public final class Spectrum {

    private final double[] data;

    /**
     * Constructs a Spectrum from the given array.
     * The input array is copied to keep immutability.
     *
     * @param values intensities, one per energy channel (must be non-null and non-empty)
     */
    public Spectrum(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        this.data = Arrays.copyOf(values, values.length);
    }

    /**
     * A spectrum of the given length with every channel at zero.
     */
    public static Spectrum zeros(int channels) {
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be >= 1");
        }
        return new Spectrum(new double[channels]);
    }

    /**
     * @return the number of energy channels.
     */
    public int channels() {
        return data.length;
    }

    /**
     * Returns a defensive copy of the internal data.
     */
    public double[] toArrayCopy() {
        return Arrays.copyOf(data, data.length);
    }

    /**
     * Returns the intensity at the given channel.
     *
     * @throws IndexOutOfBoundsException if the index is invalid
     */
    public double get(int channel) {
        if (channel < 0 || channel >= data.length) {
            throw new IndexOutOfBoundsException("channel=" + channel + ", channels=" + data.length);
        }
        return data[channel];
    }

    /**
     * Sum of all channel intensities.
     */
    public double sum() {
        double s = 0.0;
        for (double v : data) {
            s += v;
        }
        return s;
    }

    public Spectrum add(Spectrum other) {
        requireSameChannels(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] + other.data[i];
        }
        return new Spectrum(out);
    }

    public Spectrum scale(double alpha) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = alpha * this.data[i];
        }
        return new Spectrum(out);
    }

    /**
     * Channel-by-channel product, used to apply efficiency and absorption curves.
     */
    public Spectrum multiply(Spectrum other) {
        requireSameChannels(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] * other.data[i];
        }
        return new Spectrum(out);
    }

    /**
     * Returns this spectrum divided by its channel sum.
     *
     * @throws IllegalStateException if the spectrum sums to zero.
     */
    public Spectrum normalized() {
        double s = sum();
        if (s == 0.0) {
            throw new IllegalStateException("Cannot normalize a zero spectrum");
        }
        return scale(1.0 / s);
    }

    private void requireSameChannels(Spectrum other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
        if (this.data.length != other.data.length) {
            throw new IllegalArgumentException(
                    "Channel mismatch: " + this.data.length + " vs " + other.data.length
            );
        }
    }

    public static Spectrum sum(Collection<Spectrum> spectra) {
        if (spectra == null || spectra.isEmpty()) {
            throw new IllegalArgumentException("Cannot sum empty spectra");
        }

        int channels = spectra.iterator().next().channels();
        double[] acc = new double[channels];

        for (Spectrum s : spectra) {
            if (s.channels() != channels) {
                throw new IllegalArgumentException(
                        "Cannot sum spectra with different lengths. Expected " + channels + " but got " + s.channels()
                );
            }
            for (int i = 0; i < channels; i++) acc[i] += s.data[i];
        }
        return new Spectrum(acc);
    }

    @Override
    public String toString() {
        return "Spectrum(channels=" + data.length + ")";
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        Spectrum other = (Spectrum) obj;
        return Arrays.equals(this.data, other.data);
    }
}
