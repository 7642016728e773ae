package org.eds.model;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.eds.metadata.DatasetMetadata;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A hyperspectral EDS datacube: one spectrum per navigation pixel.
 *
 * Pixels are stored flattened in row-major order (row index first), which is also the column
 * order of the factorisation layout {@link #dataMatrix()}. Navigation is either a line scan
 * (one axis) or a map (two axes: height then width).
 */
public final class SpectrumImage {

    private final List<SpatialAxis> navigation;
    private final double[][] spectra; // [pixel][channel]
    private DatasetMetadata metadata;

    private RealMatrix cachedX;

    public SpectrumImage(double[][][] cube, SpatialAxis yAxis, SpatialAxis xAxis, DatasetMetadata metadata) {
        Objects.requireNonNull(cube, "cube must not be null");
        Objects.requireNonNull(yAxis, "yAxis must not be null");
        Objects.requireNonNull(xAxis, "xAxis must not be null");
        if (cube.length != yAxis.size() || cube[0].length != xAxis.size()) {
            throw new IllegalArgumentException("cube shape " + cube.length + "x" + cube[0].length
                    + " does not match axes " + yAxis.size() + "x" + xAxis.size());
        }
        int channels = cube[0][0].length;
        double[][] flat = new double[yAxis.size() * xAxis.size()][];
        for (int i = 0; i < yAxis.size(); i++) {
            for (int j = 0; j < xAxis.size(); j++) {
                if (cube[i][j].length != channels) {
                    throw new IllegalArgumentException("ragged cube at pixel (" + i + "," + j + ")");
                }
                flat[i * xAxis.size() + j] = Arrays.copyOf(cube[i][j], channels);
            }
        }
        this.navigation = List.of(yAxis, xAxis);
        this.spectra = flat;
        setMetadata(metadata);
    }

    public SpectrumImage(double[][] lineScan, SpatialAxis axis, DatasetMetadata metadata) {
        Objects.requireNonNull(lineScan, "lineScan must not be null");
        Objects.requireNonNull(axis, "axis must not be null");
        if (lineScan.length != axis.size()) {
            throw new IllegalArgumentException("line scan has " + lineScan.length + " pixels but axis has " + axis.size());
        }
        int channels = lineScan[0].length;
        double[][] flat = new double[lineScan.length][];
        for (int p = 0; p < lineScan.length; p++) {
            if (lineScan[p].length != channels) {
                throw new IllegalArgumentException("ragged line scan at pixel " + p);
            }
            flat[p] = Arrays.copyOf(lineScan[p], channels);
        }
        this.navigation = List.of(axis);
        this.spectra = flat;
        setMetadata(metadata);
    }

    public DatasetMetadata metadata() {
        return metadata;
    }

    /**
     * Replaces the dataset metadata. The energy axis must keep the channel count of the data.
     */
    public void setMetadata(DatasetMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        if (metadata.energyAxis() != null && metadata.energyAxis().size() != channels()) {
            throw new IllegalArgumentException("energy axis has " + metadata.energyAxis().size()
                    + " channels but data has " + channels());
        }
        this.metadata = metadata;
    }

    public int navigationDimension() {
        return navigation.size();
    }

    public List<SpatialAxis> navigationAxes() {
        return navigation;
    }

    /**
     * Spatial shape: {height, width} for maps, {length} for line scans.
     */
    public int[] shape2d() {
        if (navigation.size() == 1) {
            return new int[]{navigation.get(0).size()};
        }
        return new int[]{navigation.get(0).size(), navigation.get(1).size()};
    }

    public int pixelCount() {
        return spectra.length;
    }

    public int channels() {
        return spectra[0].length;
    }

    public Spectrum spectrumAt(int pixel) {
        return new Spectrum(spectra[pixel]);
    }

    /**
     * Sum of all pixel spectra.
     */
    public Spectrum sumSpectrum() {
        double[] acc = new double[channels()];
        for (double[] s : spectra) {
            for (int c = 0; c < s.length; c++) acc[c] += s[c];
        }
        return new Spectrum(acc);
    }

    /**
     * The data in factorisation layout: channels x pixels. Built once and cached;
     * callers receive a copy.
     */
    public RealMatrix dataMatrix() {
        if (cachedX == null) {
            double[][] x = new double[channels()][pixelCount()];
            for (int p = 0; p < spectra.length; p++) {
                for (int c = 0; c < spectra[p].length; c++) {
                    x[c][p] = spectra[p][c];
                }
            }
            cachedX = new Array2DRowRealMatrix(x, false);
        }
        return cachedX.copy();
    }
}
