package org.eds.quant;

import org.apache.commons.math3.linear.RealMatrix;
import org.eds.error.ShapeMismatchException;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Fixed-width per-phase concentration table from a fitted W.
 *
 * Rows are elements (dictionary order, optionally restricted to a selection), columns are
 * phases {@code p0, p1, ...}. Absolute mode prints {@code W / norm} in exponential notation.
 * Relative mode prints each phase's element weights as fractions of their sum with four
 * decimals; phases whose selected weights are all zero are omitted.
 */
public final class ConcentrationReport {

    public static final String ABSOLUTE_TITLE = "Abs. quantif. report";
    public static final String RELATIVE_TITLE = "Concentrations report";

    private final List<String> elements;
    private final double[] norms;

    public ConcentrationReport(List<String> elements, double[] norms) {
        this.elements = List.copyOf(Objects.requireNonNull(elements, "elements must not be null"));
        Objects.requireNonNull(norms, "norms must not be null");
        if (norms.length != this.elements.size()) {
            throw new ShapeMismatchException(norms.length + " norms for " + this.elements.size() + " elements");
        }
        this.norms = norms.clone();
    }

    /**
     * @param selected element labels to print; empty or null for all
     */
    public String render(RealMatrix w, boolean absolute, Collection<String> selected) {
        Objects.requireNonNull(w, "w must not be null");
        if (w.getRowDimension() < elements.size()) {
            throw new ShapeMismatchException("W has " + w.getRowDimension() + " rows for " + elements.size() + " elements");
        }

        List<Integer> rows = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            if (selected == null || selected.isEmpty() || selected.contains(elements.get(i))) rows.add(i);
        }
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("None of " + selected + " is in " + elements);
        }

        int longest = 0;
        for (int i : rows) longest = Math.max(longest, elements.get(i).length());

        int phases = w.getColumnDimension();
        StringBuilder sb = new StringBuilder();
        if (absolute) {
            sb.append(ABSOLUTE_TITLE).append('\n');
            sb.append(" ".repeat(longest));
            for (int k = 0; k < phases; k++) sb.append(String.format(Locale.ROOT, "%10s", "p" + k));
            sb.append('\n');
            for (int i : rows) {
                sb.append(rowName(elements.get(i), longest));
                for (int k = 0; k < phases; k++) {
                    sb.append(String.format(Locale.ROOT, "%.3e ", w.getEntry(i, k) / norms[i]));
                }
                sb.append('\n');
            }
            return sb.toString();
        }

        List<Integer> cols = new ArrayList<>();
        double[] sums = new double[phases];
        for (int k = 0; k < phases; k++) {
            for (int i : rows) sums[k] += w.getEntry(i, k);
            if (sums[k] != 0.0) cols.add(k);
        }
        sb.append(RELATIVE_TITLE).append('\n');
        sb.append(" ".repeat(longest));
        for (int k : cols) sb.append(String.format(Locale.ROOT, "%7s", "p" + k));
        sb.append('\n');
        for (int i : rows) {
            sb.append(rowName(elements.get(i), longest));
            for (int k : cols) {
                sb.append(String.format(Locale.ROOT, "%.4f ", w.getEntry(i, k) / sums[k]));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public void print(RealMatrix w, boolean absolute, Collection<String> selected, PrintStream out) {
        Objects.requireNonNull(out, "out must not be null");
        out.print(render(w, absolute, selected));
    }

    private static String rowName(String name, int width) {
        return String.format(Locale.ROOT, "%-" + width + "s", name) + " : ";
    }
}
