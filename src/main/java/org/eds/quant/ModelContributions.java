package org.eds.quant;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.eds.engine.FittedDecomposition;
import org.eds.error.ShapeMismatchException;
import org.eds.model.Spectrum;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Breaks a fitted model into per-column spectra for inspection.
 */
public final class ModelContributions {

    public static final String BACKGROUND_1 = "Background 1";
    public static final String BACKGROUND_2 = "Background 2";

    private final FittedDecomposition fit;
    private final List<String> labels;

    /**
     * @param elementLabels labels of the element columns of G
     */
    public ModelContributions(FittedDecomposition fit, List<String> elementLabels) {
        this.fit = Objects.requireNonNull(fit, "fit must not be null");
        this.labels = labels(elementLabels, fit.g().getColumnDimension());
    }

    /**
     * Display labels for every dictionary column: element labels then {@code Background 1},
     * {@code Background 2} when G has the two extra columns.
     */
    public static List<String> labels(List<String> elementLabels, int columns) {
        Objects.requireNonNull(elementLabels, "elementLabels must not be null");
        int extra = columns - elementLabels.size();
        if (extra != 0 && extra != 2) {
            throw new ShapeMismatchException(columns + " dictionary columns for "
                    + elementLabels.size() + " element labels");
        }
        List<String> out = new ArrayList<>(elementLabels);
        if (extra == 2) {
            out.add(BACKGROUND_1);
            out.add(BACKGROUND_2);
        }
        return List.copyOf(out);
    }

    public List<String> labels() {
        return labels;
    }

    /**
     * Spectra of one phase: {@code G[:,i] * W[i,k]} for every column i, and their sum.
     */
    public Breakdown componentModel(int k) {
        RealMatrix w = fit.w();
        if (k < 0 || k >= w.getColumnDimension()) {
            throw new IndexOutOfBoundsException("component=" + k + ", components=" + w.getColumnDimension());
        }
        return breakdown(w.getColumn(k));
    }

    /**
     * Spectra at one pixel: {@code G[:,i] * (W H)[i,pixel]} for every column i, and their sum.
     * A NaN abundance yields NaN spectra.
     */
    public Breakdown pixelContributions(int pixel) {
        RealMatrix h = fit.h();
        if (pixel < 0 || pixel >= h.getColumnDimension()) {
            throw new IndexOutOfBoundsException("pixel=" + pixel + ", pixels=" + h.getColumnDimension());
        }
        return breakdown(fit.w().operate(h.getColumn(pixel)));
    }

    private Breakdown breakdown(double[] weights) {
        RealMatrix g = fit.g();
        int channels = g.getRowDimension();
        List<Spectrum> parts = new ArrayList<>(weights.length);
        double[] total = new double[channels];
        for (int i = 0; i < weights.length; i++) {
            double[] col = g.getColumn(i);
            for (int c = 0; c < channels; c++) {
                col[c] *= weights[i];
                total[c] += col[c];
            }
            parts.add(new Spectrum(col));
        }
        return new Breakdown(labels, parts, new Spectrum(total));
    }

    /**
     * Expands an H fitted on unmasked pixels only to every pixel, NaN at excluded pixels.
     * An H already covering every pixel gets NaN written at excluded pixels.
     *
     * @param excluded one flag per pixel, true where the pixel was left out of the fit
     */
    public static RealMatrix fixMaskedH(RealMatrix h, boolean[] excluded) {
        Objects.requireNonNull(h, "h must not be null");
        Objects.requireNonNull(excluded, "excluded must not be null");
        int kept = 0;
        for (boolean b : excluded) {
            if (!b) kept++;
        }
        int phases = h.getRowDimension();
        boolean compact = h.getColumnDimension() == kept && kept != excluded.length;
        if (!compact && h.getColumnDimension() != excluded.length) {
            throw new ShapeMismatchException("H has " + h.getColumnDimension() + " pixels; expected "
                    + excluded.length + " or " + kept);
        }
        double[][] out = new double[phases][excluded.length];
        for (int k = 0; k < phases; k++) {
            int src = 0;
            for (int p = 0; p < excluded.length; p++) {
                if (excluded[p]) {
                    out[k][p] = Double.NaN;
                    if (!compact) src++;
                } else {
                    out[k][p] = h.getEntry(k, src++);
                }
            }
        }
        return MatrixUtils.createRealMatrix(out);
    }

    /**
     * Per-column spectra with their labels and total.
     */
    public record Breakdown(List<String> labels, List<Spectrum> contributions, Spectrum total) {

        public Breakdown {
            labels = List.copyOf(labels);
            contributions = List.copyOf(contributions);
        }

        public Spectrum contribution(String label) {
            int i = labels.indexOf(label);
            if (i < 0) {
                throw new IllegalArgumentException("No column labelled " + label + " in " + labels);
            }
            return contributions.get(i);
        }

        @Override
        public String toString() {
            return "Breakdown" + Arrays.toString(labels.toArray());
        }
    }
}
