package org.eds.truth;

import org.apache.commons.math3.linear.RealMatrix;

import java.util.Objects;

/**
 * Reference phases and maps in one of two orientations.
 *
 * Factorisation layout ({@code reshaped}): phases is channels x phases and maps is
 * phases x pixels, so that {@code phases * maps} has the layout of the data matrix.
 * Natural layout: phases is phases x channels and maps is pixels x phases, pixels being the
 * row-major flattening of the height x width grid; {@link #spatialMaps()} folds it back.
 */
public record GroundTruth(RealMatrix phases, RealMatrix maps, int height, int width, boolean reshaped) {

    public GroundTruth {
        Objects.requireNonNull(phases, "phases must not be null");
        Objects.requireNonNull(maps, "maps must not be null");
        phases = phases.copy();
        maps = maps.copy();
    }

    @Override
    public RealMatrix phases() {
        return phases.copy();
    }

    @Override
    public RealMatrix maps() {
        return maps.copy();
    }

    public int phaseCount() {
        return reshaped ? phases.getColumnDimension() : phases.getRowDimension();
    }

    /**
     * The maps as height x width x phases.
     */
    public double[][][] spatialMaps() {
        int k = phaseCount();
        double[][][] out = new double[height][width][k];
        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                int pixel = i * width + j;
                for (int p = 0; p < k; p++) {
                    out[i][j][p] = reshaped ? maps.getEntry(p, pixel) : maps.getEntry(pixel, p);
                }
            }
        }
        return out;
    }
}
