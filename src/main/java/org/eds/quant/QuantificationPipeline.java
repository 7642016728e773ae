package org.eds.quant;

import org.apache.commons.math3.linear.RealMatrix;
import org.eds.engine.FittedDecomposition;
import org.eds.error.MissingMetadataException;
import org.eds.error.ShapeMismatchException;
import org.eds.metadata.ModelState;
import org.eds.model.SpectrumImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts a fitted decomposition into per-pixel atomic percentages.
 *
 * For each pixel: the element rows of {@code W H} (background rows dropped) are divided by the
 * element norms, skipped elements are removed, and the rest is scaled to sum to 100.
 * A pixel whose remaining contributions sum to zero comes out as NaN.
 */
public final class QuantificationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(QuantificationPipeline.class);

    private final List<String> elements;
    private final double[] norms;
    private final int[] spatialShape;

    /**
     * @param elements     labels of the element columns of G, in column order
     * @param norms        one normalisation factor per element, or empty for none
     * @param spatialShape {height, width} or {length}
     */
    public QuantificationPipeline(List<String> elements, double[] norms, int[] spatialShape) {
        this.elements = List.copyOf(Objects.requireNonNull(elements, "elements must not be null"));
        if (this.elements.isEmpty()) {
            throw new IllegalArgumentException("elements must not be empty");
        }
        Objects.requireNonNull(spatialShape, "spatialShape must not be null");
        if (spatialShape.length != 1 && spatialShape.length != 2) {
            throw new IllegalArgumentException("spatialShape must have 1 or 2 dimensions");
        }
        this.spatialShape = Arrays.copyOf(spatialShape, spatialShape.length);
        if (norms == null || norms.length == 0) {
            this.norms = new double[this.elements.size()];
            Arrays.fill(this.norms, 1.0);
        } else if (norms.length != this.elements.size()) {
            throw new ShapeMismatchException(norms.length + " norms for " + this.elements.size() + " elements");
        } else {
            this.norms = Arrays.copyOf(norms, norms.length);
        }
    }

    /**
     * A pipeline reading element labels and norms from the model state stored by the last
     * dictionary build on this image.
     *
     * @throws MissingMetadataException if no dictionary was built
     */
    public static QuantificationPipeline forImage(SpectrumImage image) {
        Objects.requireNonNull(image, "image must not be null");
        ModelState state = image.metadata().model();
        if (state == null) {
            throw new MissingMetadataException("No dictionary model stored in metadata; build one first");
        }
        return new QuantificationPipeline(state.elements(), state.norm(), image.shape2d());
    }

    public List<String> elements() {
        return elements;
    }

    public QuantificationResult quantify(FittedDecomposition fit) {
        return quantify(fit, null, List.of());
    }

    /**
     * @param navigationMask one flag per pixel, true where the pixel is excluded; may be null
     * @param skipElements   element labels left out of the renormalisation
     * @throws ShapeMismatchException if W, H or the mask disagree with the element list or pixel count
     */
    public QuantificationResult quantify(FittedDecomposition fit, boolean[] navigationMask, Collection<String> skipElements) {
        Objects.requireNonNull(fit, "fit must not be null");
        int pixels = pixelCount();
        int n = elements.size();

        RealMatrix w = fit.w();
        int extra = w.getRowDimension() - n;
        if (extra != 0 && extra != 2) {
            throw new ShapeMismatchException("W has " + w.getRowDimension() + " rows for " + n + " elements");
        }

        RealMatrix h = fit.h();
        if (navigationMask != null) {
            if (navigationMask.length != pixels) {
                throw new ShapeMismatchException("navigation mask has " + navigationMask.length
                        + " entries for " + pixels + " pixels");
            }
            h = ModelContributions.fixMaskedH(h, navigationMask);
            LOG.debug("Quantifying with {} excluded pixels", countTrue(navigationMask));
        }
        if (h.getColumnDimension() != pixels) {
            throw new ShapeMismatchException("H has " + h.getColumnDimension() + " pixels but the image has " + pixels);
        }

        // background rows dropped
        RealMatrix wh = w.getSubMatrix(0, n - 1, 0, w.getColumnDimension() - 1).multiply(h);

        Set<String> skip = (skipElements == null) ? Set.of() : new HashSet<>(skipElements);
        List<String> kept = new ArrayList<>();
        List<Integer> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (skip.contains(elements.get(i))) continue;
            kept.add(elements.get(i));
            rows.add(i);
        }

        double[][] out = new double[rows.size()][pixels];
        for (int p = 0; p < pixels; p++) {
            double sum = 0.0;
            for (int r = 0; r < rows.size(); r++) {
                int i = rows.get(r);
                out[r][p] = wh.getEntry(i, p) / norms[i];
                sum += out[r][p];
            }
            for (int r = 0; r < rows.size(); r++) {
                out[r][p] = out[r][p] / (sum / 100.0);
            }
        }

        Map<String, Double> normTable = new LinkedHashMap<>();
        for (int i : rows) normTable.put(elements.get(i), norms[i]);
        return new QuantificationResult(kept, spatialShape, out, normTable);
    }

    private int pixelCount() {
        int count = 1;
        for (int d : spatialShape) count *= d;
        return count;
    }

    private static int countTrue(boolean[] flags) {
        int c = 0;
        for (boolean b : flags) {
            if (b) c++;
        }
        return c;
    }
}
