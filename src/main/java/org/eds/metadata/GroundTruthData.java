package org.eds.metadata;

import org.eds.error.ShapeMismatchException;

/**
 * Reference decomposition of a simulated dataset.
 * Arrays are copied on the way in and on the way out.
 *
 * @param phases phase spectra, phases x channels
 * @param maps   phase abundances, height x width x phases
 */
public record GroundTruthData(double[][] phases, double[][][] maps) {

    public GroundTruthData {
        if (phases == null || maps == null) {
            throw new IllegalArgumentException("phases and maps must not be null");
        }
        if (phases.length == 0 || maps.length == 0 || maps[0] == null || maps[0].length == 0) {
            throw new IllegalArgumentException("ground truth must not be empty");
        }
        int nPhases = phases.length;
        int channels = rowLength(phases[0]);
        for (int k = 0; k < nPhases; k++) {
            if (rowLength(phases[k]) != channels) {
                throw new ShapeMismatchException("phase " + k + " has " + rowLength(phases[k])
                        + " channels, expected " + channels);
            }
        }
        int width = maps[0].length;
        for (int i = 0; i < maps.length; i++) {
            if (maps[i] == null || maps[i].length != width) {
                throw new ShapeMismatchException("maps row " + i + " is not " + width + " pixels wide");
            }
            for (int j = 0; j < width; j++) {
                if (rowLength(maps[i][j]) != nPhases) {
                    throw new ShapeMismatchException("maps carry " + rowLength(maps[i][j])
                            + " phases at (" + i + ", " + j + ") but phases has " + nPhases);
                }
            }
        }
        phases = copy(phases);
        maps = copy(maps);
    }

    @Override
    public double[][] phases() {
        return copy(phases);
    }

    @Override
    public double[][][] maps() {
        return copy(maps);
    }

    private static int rowLength(double[] row) {
        return row == null ? -1 : row.length;
    }

    private static double[][] copy(double[][] a) {
        double[][] out = new double[a.length][];
        for (int i = 0; i < a.length; i++) out[i] = a[i].clone();
        return out;
    }

    private static double[][][] copy(double[][][] a) {
        double[][][] out = new double[a.length][][];
        for (int i = 0; i < a.length; i++) out[i] = copy(a[i]);
        return out;
    }
}
