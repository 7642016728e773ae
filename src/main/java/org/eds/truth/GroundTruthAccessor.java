package org.eds.truth;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.eds.error.NoGroundTruthException;
import org.eds.metadata.DatasetMetadata;
import org.eds.metadata.GroundTruthData;

import java.util.Objects;

/**
 * Read-only access to the reference decomposition stored with simulated datasets.
 */
public final class GroundTruthAccessor {

    private GroundTruthAccessor() {
    }

    public static boolean isPresent(DatasetMetadata metadata) {
        return metadata != null && metadata.truth() != null;
    }

    /**
     * @param reshape true for the factorisation layout, false for the natural one
     * @throws NoGroundTruthException if the dataset has no ground truth
     */
    public static GroundTruth extract(DatasetMetadata metadata, boolean reshape) {
        GroundTruthData data = require(metadata);
        double[][][] maps = data.maps();
        int height = maps.length;
        int width = maps[0].length;
        double[][] phaseRows = data.phases();
        int k = phaseRows.length;

        RealMatrix phases = new Array2DRowRealMatrix(phaseRows, false);
        double[][] flat = reshape ? new double[k][height * width] : new double[height * width][k];
        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                int pixel = i * width + j;
                for (int p = 0; p < k; p++) {
                    if (reshape) {
                        flat[p][pixel] = maps[i][j][p];
                    } else {
                        flat[pixel][p] = maps[i][j][p];
                    }
                }
            }
        }
        return new GroundTruth(reshape ? phases.transpose() : phases,
                new Array2DRowRealMatrix(flat, false), height, width, reshape);
    }

    /**
     * The noise-free data implied by the ground truth, channels x pixels.
     *
     * @throws NoGroundTruthException if the dataset has no ground truth
     */
    public static RealMatrix noiselessData(DatasetMetadata metadata) {
        GroundTruth gt = extract(metadata, true);
        return gt.phases().multiply(gt.maps());
    }

    private static GroundTruthData require(DatasetMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        if (metadata.truth() == null) {
            throw new NoGroundTruthException("There is no ground truth contained in this dataset");
        }
        return metadata.truth();
    }
}
