package org.eds.engine;

import org.apache.commons.math3.linear.RealMatrix;
import org.eds.error.ShapeMismatchException;

import java.util.Objects;

/**
 * A solver's output. W is dictionary columns x phases, H is phases x pixels (all pixels, or
 * only the unmasked ones when a navigation mask was used), G is channels x dictionary columns.
 */
public record FittedDecomposition(RealMatrix w, RealMatrix h, RealMatrix g) {

    public FittedDecomposition {
        Objects.requireNonNull(w, "w must not be null");
        Objects.requireNonNull(h, "h must not be null");
        Objects.requireNonNull(g, "g must not be null");
        if (g.getColumnDimension() != w.getRowDimension()) {
            throw new ShapeMismatchException("G has " + g.getColumnDimension() + " columns but W has "
                    + w.getRowDimension() + " rows");
        }
        if (w.getColumnDimension() != h.getRowDimension()) {
            throw new ShapeMismatchException("W has " + w.getColumnDimension() + " phases but H has "
                    + h.getRowDimension());
        }
        w = w.copy();
        h = h.copy();
        g = g.copy();
    }

    public int phases() {
        return w.getColumnDimension();
    }

    @Override
    public RealMatrix w() {
        return w.copy();
    }

    @Override
    public RealMatrix h() {
        return h.copy();
    }

    @Override
    public RealMatrix g() {
        return g.copy();
    }
}
