package org.eds.constraint;

import org.eds.error.ShapeMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An immutable labelled grid of {@link ConstraintEntry} cells.
 *
 * For W the rows are dictionary columns and the columns are phases; for H the rows are
 * phases and the columns are flattened pixels.
 */
public final class ConstraintMatrix {

    private final List<String> rowLabels;
    private final List<String> columnLabels; // null: columns are pixel indices
    private final int columnCount;
    private final ConstraintEntry[][] cells;

    ConstraintMatrix(List<String> rowLabels, List<String> columnLabels, ConstraintEntry[][] cells) {
        this(rowLabels, columnLabels, columnLabels.size(), cells);
    }

    private ConstraintMatrix(List<String> rowLabels, List<String> columnLabels, int columnCount, ConstraintEntry[][] cells) {
        this.rowLabels = List.copyOf(rowLabels);
        this.columnLabels = (columnLabels == null) ? null : List.copyOf(columnLabels);
        this.columnCount = columnCount;
        if (cells.length != this.rowLabels.size()) {
            throw new ShapeMismatchException("cells have " + cells.length + " rows for "
                    + this.rowLabels.size() + " row labels");
        }
        ConstraintEntry[][] copy = new ConstraintEntry[cells.length][];
        for (int r = 0; r < cells.length; r++) {
            if (cells[r].length != columnCount) {
                throw new ShapeMismatchException("row " + r + " has " + cells[r].length + " cells for "
                        + columnCount + " columns");
            }
            copy[r] = Arrays.copyOf(cells[r], cells[r].length);
        }
        this.cells = copy;
    }

    /**
     * A matrix whose columns are unlabelled pixel positions.
     */
    static ConstraintMatrix overPixels(List<String> rowLabels, int pixels, ConstraintEntry[][] cells) {
        return new ConstraintMatrix(rowLabels, null, pixels, cells);
    }

    /**
     * Reads the solver's array encoding ({@code -1} free, {@code >= 0} pinned).
     */
    public static ConstraintMatrix fromSentinelArray(List<String> rowLabels, List<String> columnLabels, double[][] raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        ConstraintEntry[][] cells = new ConstraintEntry[raw.length][];
        for (int r = 0; r < raw.length; r++) {
            cells[r] = new ConstraintEntry[raw[r].length];
            for (int c = 0; c < raw[r].length; c++) {
                cells[r][c] = ConstraintEntry.fromSentinel(raw[r][c]);
            }
        }
        return new ConstraintMatrix(rowLabels, columnLabels, cells);
    }

    public int rowCount() {
        return cells.length;
    }

    public int columnCount() {
        return columnCount;
    }

    public List<String> rowLabels() {
        return rowLabels;
    }

    /**
     * Column labels; pixel matrices label their columns by index.
     */
    public List<String> columnLabels() {
        if (columnLabels != null) return columnLabels;
        List<String> out = new ArrayList<>(columnCount);
        for (int c = 0; c < columnCount; c++) out.add(Integer.toString(c));
        return out;
    }

    public ConstraintEntry get(int row, int column) {
        return cells[row][column];
    }

    public boolean isFree(int row, int column) {
        return cells[row][column].isFree();
    }

    /**
     * The solver's encoding: free cells as {@code -1}, pinned cells as their value.
     */
    public double[][] toSentinelArray() {
        double[][] out = new double[cells.length][columnCount()];
        for (int r = 0; r < cells.length; r++) {
            for (int c = 0; c < cells[r].length; c++) {
                out[r][c] = cells[r][c].toSentinel();
            }
        }
        return out;
    }

    /**
     * One row folded back onto a {@code height x width} grid (row-major).
     */
    public double[][] rowAsGrid(int row, int height, int width) {
        if (height * width != columnCount()) {
            throw new ShapeMismatchException(height + "x" + width + " does not hold " + columnCount() + " cells");
        }
        double[][] grid = new double[height][width];
        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                grid[i][j] = cells[row][i * width + j].toSentinel();
            }
        }
        return grid;
    }

    public long pinnedCount() {
        long n = 0;
        for (ConstraintEntry[] row : cells) {
            for (ConstraintEntry e : row) {
                if (!e.isFree()) n++;
            }
        }
        return n;
    }

    /**
     * @throws ShapeMismatchException if the row count differs from {@code expected}
     */
    public ConstraintMatrix requireRowCount(int expected) {
        if (rowCount() != expected) {
            throw new ShapeMismatchException("constraint has " + rowCount() + " rows but "
                    + expected + " are required");
        }
        return this;
    }

    @Override
    public String toString() {
        return "ConstraintMatrix{" + rowCount() + "x" + columnCount() + ", rows=" + rowLabels + "}";
    }
}
